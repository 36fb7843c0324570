package shoretracker.domain.series;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serie temporal inmutable de una columna (un transecto), en el orden de la tabla de origen.
 * <p>
 * No se reordena ni se deduplica: dos muestras pueden compartir marca de tiempo.
 */
public final class TimeSeries {

    private static final TimeSeries EMPTY = new TimeSeries(List.of());

    private final List<TimePoint> points;

    private TimeSeries(List<TimePoint> points) {
        this.points = points;
    }

    public static TimeSeries of(List<TimePoint> points) {
        return points.isEmpty() ? EMPTY : new TimeSeries(Collections.unmodifiableList(new ArrayList<>(points)));
    }

    public static TimeSeries empty() {
        return EMPTY;
    }

    public List<TimePoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public TimePoint get(int index) {
        return points.get(index);
    }

    /**
     * Copia sin las muestras nulas/NaN, conservando el orden.
     */
    public TimeSeries dropMissing() {
        List<TimePoint> kept = new ArrayList<>(points.size());
        for (TimePoint p : points) {
            if (!p.isMissing()) {
                kept.add(p);
            }
        }
        return kept.size() == points.size() ? this : of(kept);
    }

    public List<Instant> timestamps() {
        List<Instant> ts = new ArrayList<>(points.size());
        for (TimePoint p : points) {
            ts.add(p.timestamp());
        }
        return ts;
    }

    /**
     * Valores como array primitivo; los huecos se devuelven como NaN.
     */
    public double[] values() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = points.get(i).value();
            out[i] = v == null ? Double.NaN : v;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TimeSeries other && points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries" + points;
    }
}
