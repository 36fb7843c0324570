package shoretracker.analysis.trend;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.series.TimePoint;
import shoretracker.domain.series.TimeSeries;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.TransectAttributes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calcula la tendencia lineal de cada transecto sobre la serie corregida y filtrada.
 * <p>
 * El eje temporal son días completos desde la primera fecha de la tabla divididos por 365.25.
 * Los huecos se descartan por columna y las columnas vacías no producen fila.
 */
@Slf4j
public class TrendFitter {

    public static final String STAGE = "trends";
    public static final double DAYS_IN_YEAR = 365.25;

    public List<TrendResult> fit(ChainageTable table) {
        List<TrendResult> results = new ArrayList<>();
        Optional<Instant> origin = table.minDate();
        if (origin.isEmpty()) {
            return results;
        }
        for (String id : table.transectIds()) {
            fitColumn(id, table.column(id), origin.get(), table.size()).ifPresent(results::add);
        }
        return results;
    }

    public ResultFragment fitFragment(ChainageTable table) {
        ResultFragment fragment = new ResultFragment(table.siteId(), STAGE);
        TransectAttributes.TREND_COLUMNS.forEach(fragment::declareColumn);
        List<TrendResult> results = fit(table);
        for (TrendResult r : results) {
            fragment.put(r.transectId(), TransectAttributes.TREND, r.trend())
                    .put(r.transectId(), TransectAttributes.INTERCEPT, r.intercept())
                    .put(r.transectId(), TransectAttributes.N_POINTS, (double) r.nPoints())
                    .put(r.transectId(), TransectAttributes.N_POINTS_NONAN, (double) r.nPointsNonan())
                    .put(r.transectId(), TransectAttributes.R2_SCORE, r.r2())
                    .put(r.transectId(), TransectAttributes.MAE, r.mae())
                    .put(r.transectId(), TransectAttributes.MSE, r.mse())
                    .put(r.transectId(), TransectAttributes.RMSE, r.rmse());
        }
        log.info("[{}] Tendencias calculadas para {} de {} transectos.",
                table.siteId(), results.size(), table.transectIds().size());
        return fragment;
    }

    static double yearsSince(Instant origin, Instant date) {
        return Duration.between(origin, date).toDays() / DAYS_IN_YEAR;
    }

    private Optional<TrendResult> fitColumn(String id, TimeSeries column, Instant origin, int rowCount) {
        TimeSeries valid = column.dropMissing();
        int n = valid.size();
        if (n == 0) {
            return Optional.empty();
        }

        double[] x = new double[n];
        double[] y = new double[n];
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            TimePoint p = valid.get(i);
            x[i] = yearsSince(origin, p.timestamp());
            y[i] = p.value();
            regression.addData(x[i], y[i]);
        }

        double slope;
        double intercept;
        if (n == 1 || regression.getXSumSquares() == 0) {
            slope = 0;
            intercept = regression.getN() > 0 ? mean(y) : Double.NaN;
        } else {
            slope = regression.getSlope();
            intercept = regression.getIntercept();
        }

        double yMean = mean(y);
        double ssRes = 0;
        double ssTot = 0;
        double absErr = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * x[i]);
            ssRes += residual * residual;
            absErr += Math.abs(residual);
            ssTot += (y[i] - yMean) * (y[i] - yMean);
        }
        double r2;
        if (n < 2) {
            r2 = Double.NaN;
        } else if (ssTot == 0) {
            r2 = ssRes == 0 ? 1.0 : 0.0;
        } else {
            r2 = 1 - ssRes / ssTot;
        }
        double mse = ssRes / n;

        return Optional.of(new TrendResult(id, slope, intercept, rowCount, n, r2, absErr / n, mse, Math.sqrt(mse)));
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
