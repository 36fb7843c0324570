package shoretracker.domain.tide;

import shoretracker.domain.series.TimeGrid;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Serie de mareas de un sitio ordenada por instante, con una altura por instante.
 * <p>
 * Inmutable: {@link #merge(TideSeries)} y {@link #rounded(Duration)} devuelven copias.
 */
public final class TideSeries {

    private final String siteId;
    private final NavigableMap<Instant, Double> heights;

    private TideSeries(String siteId, NavigableMap<Instant, Double> heights) {
        this.siteId = siteId;
        this.heights = Collections.unmodifiableNavigableMap(heights);
    }

    /**
     * Si dos muestras comparten instante se conserva la primera.
     */
    public static TideSeries of(String siteId, List<TideSample> samples) {
        TreeMap<Instant, Double> map = new TreeMap<>();
        for (TideSample s : samples) {
            map.putIfAbsent(s.timestamp(), s.height());
        }
        return new TideSeries(siteId, map);
    }

    public static TideSeries empty(String siteId) {
        return new TideSeries(siteId, new TreeMap<>());
    }

    public String siteId() {
        return siteId;
    }

    public int size() {
        return heights.size();
    }

    public boolean isEmpty() {
        return heights.isEmpty();
    }

    public Optional<Double> heightAt(Instant timestamp) {
        return Optional.ofNullable(heights.get(timestamp));
    }

    public boolean contains(Instant timestamp) {
        return heights.containsKey(timestamp);
    }

    public List<TideSample> samples() {
        List<TideSample> out = new ArrayList<>(heights.size());
        for (Map.Entry<Instant, Double> e : heights.entrySet()) {
            out.add(new TideSample(e.getKey(), e.getValue()));
        }
        return out;
    }

    /**
     * Copia con los instantes redondeados a la malla indicada.
     */
    public TideSeries rounded(Duration resolution) {
        TreeMap<Instant, Double> map = new TreeMap<>();
        for (Map.Entry<Instant, Double> e : heights.entrySet()) {
            map.putIfAbsent(TimeGrid.round(e.getKey(), resolution), e.getValue());
        }
        return new TideSeries(siteId, map);
    }

    /**
     * Une otra serie a esta. En caso de coincidencia de instante prevalece la muestra existente.
     */
    public TideSeries merge(TideSeries other) {
        TreeMap<Instant, Double> map = new TreeMap<>(heights);
        for (Map.Entry<Instant, Double> e : other.heights.entrySet()) {
            map.putIfAbsent(e.getKey(), e.getValue());
        }
        return new TideSeries(siteId, map);
    }

    /**
     * Instantes solicitados (ya redondeados) que no están en la serie, sin repetir y en orden.
     */
    public List<Instant> missingFrom(Collection<Instant> requested) {
        LinkedHashSet<Instant> missing = new LinkedHashSet<>();
        for (Instant t : requested) {
            if (!heights.containsKey(t)) {
                missing.add(t);
            }
        }
        return new ArrayList<>(missing);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TideSeries other && heights.equals(other.heights);
    }

    @Override
    public int hashCode() {
        return heights.hashCode();
    }
}
