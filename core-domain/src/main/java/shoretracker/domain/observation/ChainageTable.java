package shoretracker.domain.observation;

import shoretracker.domain.series.TimePoint;
import shoretracker.domain.series.TimeSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tabla de chainage de un sitio: una fila por observación (dates, satname) y una columna
 * por transecto. Es el formato del histórico por sitio y también de la tabla corregida.
 */
public final class ChainageTable {

    private final String siteId;
    private final List<String> transectIds;
    private final List<Observation> rows;

    public ChainageTable(String siteId, List<String> transectIds, List<Observation> rows) {
        this.siteId = siteId;
        this.transectIds = List.copyOf(transectIds);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static ChainageTable empty(String siteId) {
        return new ChainageTable(siteId, List.of(), List.of());
    }

    /**
     * Construye la tabla deduciendo las columnas de las propias observaciones, en orden de aparición.
     */
    public static ChainageTable of(String siteId, List<Observation> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Observation o : rows) {
            columns.addAll(o.chainages().keySet());
        }
        return new ChainageTable(siteId, new ArrayList<>(columns), rows);
    }

    public String siteId() {
        return siteId;
    }

    public List<String> transectIds() {
        return transectIds;
    }

    public List<Observation> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Instant> timestamps() {
        List<Instant> out = new ArrayList<>(rows.size());
        for (Observation o : rows) {
            out.add(o.date());
        }
        return out;
    }

    public Optional<Instant> maxDate() {
        return rows.stream().map(Observation::date).max(Instant::compareTo);
    }

    public Optional<Instant> minDate() {
        return rows.stream().map(Observation::date).min(Instant::compareTo);
    }

    /**
     * Columna de un transecto con todas las filas de la tabla (los huecos quedan como null).
     */
    public TimeSeries column(String transectId) {
        List<TimePoint> points = new ArrayList<>(rows.size());
        for (Observation o : rows) {
            points.add(new TimePoint(o.date(), o.chainage(transectId)));
        }
        return TimeSeries.of(points);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChainageTable other
                && Objects.equals(siteId, other.siteId)
                && transectIds.equals(other.transectIds)
                && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(siteId, transectIds, rows);
    }

    @Override
    public String toString() {
        return "ChainageTable[" + siteId + ", " + rows.size() + " filas, " + transectIds.size() + " transectos]";
    }
}
