package shoretracker.analysis.slope;

/**
 * Periodograma de Lomb-Scargle para series con muestreo irregular.
 * <p>
 * Versión de media flotante (el ajuste sinusoidal incluye un término constante) con los datos
 * centrados y normalización PSD: {@code P(f) = n/2 · (YC²/CC + YS²/SS)} con pesos uniformes.
 */
public final class LombScargle {

    private LombScargle() {
    }

    /**
     * Malla de frecuencias (Hz) para unos instantes dados.
     * <pre>
     *   T    = max(t) - min(t)
     *   fmin = 1 / T
     *   fmax = 1 / (2 · Δt)          (Nyquist del periodo de muestreo)
     *   df   = 1 / (n0 · T)
     *   N    = ceil((fmax - fmin) / df)
     * </pre>
     *
     * @param times      Instantes en segundos.
     * @param timeStep   Periodo de muestreo en segundos.
     * @param n0         Factor de sobremuestreo.
     */
    public static double[] frequencyGrid(double[] times, double timeStep, int n0) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double t : times) {
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        double span = max - min;
        if (!(span > 0)) {
            return new double[0];
        }
        double fmin = 1.0 / span;
        double fmax = 1.0 / (2 * timeStep);
        double df = 1.0 / (n0 * span);
        int n = (int) Math.ceil((fmax - fmin) / df);
        if (n <= 0) {
            return new double[0];
        }
        double[] freqs = new double[n];
        for (int i = 0; i < n; i++) {
            freqs[i] = fmin + df * i;
        }
        return freqs;
    }

    public static double[] power(double[] times, double[] values, double[] freqs) {
        int n = times.length;
        if (values.length != n) {
            throw new IllegalArgumentException("Tiempos y valores con distinta longitud: " + n + " vs " + values.length);
        }
        double w = 1.0 / n;

        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = values[i] - mean;
        }

        double[] power = new double[freqs.length];
        for (int k = 0; k < freqs.length; k++) {
            double omega = 2 * Math.PI * freqs[k];

            double s2 = 0, c2 = 0, s = 0, c = 0;
            for (int i = 0; i < n; i++) {
                s2 += w * Math.sin(2 * omega * times[i]);
                c2 += w * Math.cos(2 * omega * times[i]);
                s += w * Math.sin(omega * times[i]);
                c += w * Math.cos(omega * times[i]);
            }
            s2 -= 2 * s * c;
            c2 -= c * c - s * s;
            double tau = Math.atan2(s2, c2) / (2 * omega);

            double yMean = 0, yc = 0, ys = 0, cc = 0, ss = 0, cTau = 0, sTau = 0;
            for (int i = 0; i < n; i++) {
                double arg = omega * (times[i] - tau);
                double cos = Math.cos(arg);
                double sin = Math.sin(arg);
                yMean += w * y[i];
                yc += w * y[i] * cos;
                ys += w * y[i] * sin;
                cc += w * cos * cos;
                ss += w * sin * sin;
                cTau += w * cos;
                sTau += w * sin;
            }
            yc -= yMean * cTau;
            ys -= yMean * sTau;
            cc -= cTau * cTau;
            ss -= sTau * sTau;

            double p = 0;
            if (cc > 0) {
                p += yc * yc / cc;
            }
            if (ss > 0) {
                p += ys * ys / ss;
            }
            power[k] = 0.5 * n * p;
        }
        return power;
    }
}
