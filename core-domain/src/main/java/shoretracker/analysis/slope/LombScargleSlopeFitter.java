package shoretracker.analysis.slope;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import shoretracker.config.SlopeEstimationConfig;
import shoretracker.domain.exception.NumericalFailureException;

import java.time.Instant;
import java.util.List;

/**
 * Estimación espectral de la pendiente con Lomb-Scargle.
 * <p>
 * Cada pendiente de prueba genera una serie corregida; la energía que le queda en la banda
 * {@code [fpico - Δf, fpico + Δf]} se integra por trapecios. La pendiente elegida es la de
 * energía mínima; la banda de confianza se obtiene interpolando la curva de energía en una
 * malla fina (paso 1e-4) y tomando las pendientes con {@code E <= Emin · (1 + prc)}.
 */
public class LombScargleSlopeFitter implements SlopeFitter {

    static final double FINE_STEP = 0.0001;

    @Override
    public double findTidePeak(List<Instant> dates, double[] tide, SlopeEstimationConfig config) {
        double[] t = toSeconds(dates);
        double[] freqs = LombScargle.frequencyGrid(t, config.samplingPeriodSeconds(), config.nyquistFactor());
        if (freqs.length == 0) {
            throw new NumericalFailureException(null,
                    "Malla de frecuencias vacía para " + dates.size() + " instantes");
        }
        double[] power = LombScargle.power(t, tide, freqs);

        int best = -1;
        for (int i = 0; i < freqs.length; i++) {
            if (freqs[i] < config.frequencyCutoff()) {
                continue;
            }
            if (best < 0 || power[i] > power[best]) {
                best = i;
            }
        }
        // Todo por debajo del corte: equivale a un espectro anulado, argmax = 0
        return best < 0 ? freqs[0] : freqs[best];
    }

    @Override
    public SlopeFit integratePowerSpectrum(List<Instant> dates, List<double[]> trialSeries, double[] slopes,
                                           SlopeEstimationConfig config, double peakFrequency) {
        if (dates.size() < 2) {
            throw new NumericalFailureException(null, "Se necesitan al menos 2 instantes, hay " + dates.size());
        }
        if (trialSeries.size() != slopes.length) {
            throw new IllegalArgumentException("Una serie por pendiente: " + trialSeries.size() + " vs " + slopes.length);
        }
        double[] t = toSeconds(dates);
        double[] freqs = LombScargle.frequencyGrid(t, config.samplingPeriodSeconds(), config.nyquistFactor());

        int from = -1;
        int to = -1;
        for (int i = 0; i < freqs.length; i++) {
            if (freqs[i] >= peakFrequency - config.peakBandwidth() && freqs[i] <= peakFrequency + config.peakBandwidth()) {
                if (from < 0) {
                    from = i;
                }
                to = i;
            }
        }
        if (from < 0 || to == from) {
            throw new NumericalFailureException(null, String.format(
                    "Menos de 2 frecuencias en la banda mareal %.3e ± %.1e Hz", peakFrequency, config.peakBandwidth()));
        }

        double[] band = new double[to - from + 1];
        System.arraycopy(freqs, from, band, 0, band.length);

        double[] energy = new double[slopes.length];
        int minIdx = 0;
        for (int s = 0; s < slopes.length; s++) {
            double[] power = LombScargle.power(t, trialSeries.get(s), band);
            energy[s] = trapezoid(band, power);
            if (!Double.isFinite(energy[s])) {
                throw new NumericalFailureException(null, "Energía no finita para la pendiente " + slopes[s]);
            }
            if (energy[s] < energy[minIdx]) {
                minIdx = s;
            }
        }
        double slope = slopes[minIdx];

        if (slopes.length < 2) {
            return new SlopeFit(slope, slope, slope);
        }
        return confidenceBand(slopes, energy, slope, config);
    }

    private SlopeFit confidenceBand(double[] slopes, double[] energy, double slope, SlopeEstimationConfig config) {
        PolynomialSplineFunction curve = new LinearInterpolator().interpolate(slopes, energy);
        double[] fine = SlopeGrid.range(config.slopeMin(), config.slopeMax() - 0.001, FINE_STEP, 4);

        double[] fineEnergy = new double[fine.length];
        double minEnergy = Double.POSITIVE_INFINITY;
        for (int i = 0; i < fine.length; i++) {
            fineEnergy[i] = curve.isValidPoint(fine[i]) ? curve.value(fine[i]) : Double.NaN;
            if (fineEnergy[i] < minEnergy) {
                minEnergy = fineEnergy[i];
            }
        }

        double threshold = minEnergy * (1 + config.confidencePercent());
        double low = Double.NaN;
        double high = Double.NaN;
        for (int i = 0; i < fine.length; i++) {
            if (fineEnergy[i] <= threshold) {
                if (Double.isNaN(low)) {
                    low = fine[i];
                }
                high = fine[i];
            }
        }
        if (Double.isNaN(low) || low == high) {
            return new SlopeFit(slope, slope, slope);
        }
        return new SlopeFit(slope, low, high);
    }

    static double trapezoid(double[] x, double[] y) {
        double area = 0;
        for (int i = 1; i < x.length; i++) {
            area += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        }
        return area;
    }

    private static double[] toSeconds(List<Instant> dates) {
        double[] t = new double[dates.size()];
        for (int i = 0; i < t.length; i++) {
            t[i] = dates.get(i).toEpochMilli() / 1000.0;
        }
        return t;
    }
}
