package shoretracker.analysis.slope;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Mallas de pendientes de prueba.
 * <p>
 * Se avanza desde el mínimo con el paso dado mientras no se alcance el máximo y se añade
 * el siguiente valor, de modo que el máximo siempre queda cubierto. Los valores se redondean
 * para evitar la deriva acumulada de la suma en coma flotante.
 */
public final class SlopeGrid {

    private SlopeGrid() {
    }

    public static double[] range(double min, double max, double step) {
        return range(min, max, step, 3);
    }

    public static double[] range(double min, double max, double step, int decimals) {
        if (step <= 0) {
            throw new IllegalArgumentException("El paso de la malla debe ser positivo: " + step);
        }
        List<Double> values = new ArrayList<>();
        double slope = min;
        while (slope < max) {
            values.add(slope);
            slope += step;
        }
        values.add(slope);

        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = BigDecimal.valueOf(values.get(i)).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
        }
        return out;
    }
}
