package shoretracker.analysis.tide;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rellena los huecos de pendiente de los transectos de un sitio.
 * <p>
 * Orden de relleno: interpolación lineal sobre la posición del transecto (los huecos finales
 * toman el último valor conocido), después relleno hacia atrás (huecos iniciales) y por
 * último hacia delante. Si el sitio no tiene ninguna pendiente, todo queda en null.
 * <p>
 * Pendientes no positivas o NaN cuentan como hueco: dividirían la marea por cero.
 */
public final class SlopeGapFiller {

    private SlopeGapFiller() {
    }

    public static Map<String, Double> fill(List<String> transectOrder, Map<String, Double> slopes) {
        int n = transectOrder.size();
        double[] values = new double[n];
        boolean[] known = new boolean[n];
        for (int i = 0; i < n; i++) {
            Double s = slopes.get(transectOrder.get(i));
            known[i] = s != null && !s.isNaN() && s > 0;
            values[i] = known[i] ? s : Double.NaN;
        }

        int first = -1;
        int last = -1;
        for (int i = 0; i < n; i++) {
            if (known[i]) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }

        Map<String, Double> filled = new LinkedHashMap<>();
        if (first < 0) {
            for (String id : transectOrder) {
                filled.put(id, null);
            }
            return filled;
        }

        // 1. Interpolación interior
        if (last > first) {
            PolynomialSplineFunction line = interiorLine(values, known, first, last);
            for (int i = first + 1; i < last; i++) {
                if (!known[i]) {
                    values[i] = line.value(i);
                }
            }
        }
        // 2. Huecos finales: último valor conocido
        for (int i = last + 1; i < n; i++) {
            values[i] = values[last];
        }
        // 3. Huecos iniciales: primer valor conocido (bfill)
        for (int i = 0; i < first; i++) {
            values[i] = values[first];
        }

        for (int i = 0; i < n; i++) {
            filled.put(transectOrder.get(i), values[i]);
        }
        return filled;
    }

    private static PolynomialSplineFunction interiorLine(double[] values, boolean[] known, int first, int last) {
        int count = 0;
        for (int i = first; i <= last; i++) {
            if (known[i]) {
                count++;
            }
        }
        double[] x = new double[count];
        double[] y = new double[count];
        int j = 0;
        for (int i = first; i <= last; i++) {
            if (known[i]) {
                x[j] = i;
                y[j] = values[i];
                j++;
            }
        }
        return new LinearInterpolator().interpolate(x, y);
    }
}
