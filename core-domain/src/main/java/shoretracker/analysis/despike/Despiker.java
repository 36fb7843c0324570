package shoretracker.analysis.despike;

import shoretracker.domain.series.TimePoint;
import shoretracker.domain.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Filtro de atípicos de una columna de chainage.
 * <p>
 * Contrato: se descartan primero los huecos y después los picos. La salida es siempre una
 * subsecuencia estricta de la entrada: mismo orden, mismas marcas de tiempo y mismos
 * valores. Una salida vacía significa "sin datos utilizables" para ese transecto.
 */
public class Despiker {

    public static final double DEFAULT_THRESHOLD = 40.0;

    private final OutlierDetector detector;

    public Despiker() {
        this(new NeighbourSpikeDetector());
    }

    public Despiker(OutlierDetector detector) {
        this.detector = detector;
    }

    public TimeSeries despike(TimeSeries series) {
        return despike(series, DEFAULT_THRESHOLD);
    }

    public TimeSeries despike(TimeSeries series, double threshold) {
        TimeSeries valid = series.dropMissing();
        if (valid.isEmpty()) {
            return TimeSeries.empty();
        }
        int[] kept = detector.retainedPositions(valid.values(), threshold);
        List<TimePoint> out = new ArrayList<>(kept.length);
        for (int position : kept) {
            out.add(valid.get(position));
        }
        return TimeSeries.of(out);
    }

    /**
     * Igual que {@link #despike(TimeSeries, double)} pero devuelve las posiciones conservadas
     * dentro de {@code series} (contando los huecos), para poder reubicar los valores en la
     * tabla original aunque haya marcas de tiempo repetidas.
     */
    public int[] retainedRowPositions(TimeSeries series, double threshold) {
        List<Integer> validRows = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            if (!series.get(i).isMissing()) {
                validRows.add(i);
            }
        }
        if (validRows.isEmpty()) {
            return new int[0];
        }
        double[] values = new double[validRows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(validRows.get(i)).value();
        }
        int[] kept = detector.retainedPositions(values, threshold);
        int[] rows = new int[kept.length];
        for (int i = 0; i < kept.length; i++) {
            rows[i] = validRows.get(kept[i]);
        }
        return rows;
    }
}
