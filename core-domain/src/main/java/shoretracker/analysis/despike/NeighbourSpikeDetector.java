package shoretracker.analysis.despike;

import java.util.ArrayList;
import java.util.List;

/**
 * Detector de picos por comparación con los vecinos inmediatos.
 * <p>
 * Una muestra interior es un pico si se separa más de {@code threshold} de ambos vecinos y en
 * el mismo sentido (salta y vuelve). En cada pasada se elimina el pico más pronunciado y se
 * repite con la serie restante hasta que no quede ninguno.
 * <p>
 * Limitaciones: la primera y la última muestra nunca se marcan (les falta un vecino), y una
 * racha de dos o más muestras anómalas consecutivas no se detecta, porque cada una tiene un
 * vecino próximo dentro de la racha.
 */
public class NeighbourSpikeDetector implements OutlierDetector {

    @Override
    public int[] retainedPositions(double[] values, double threshold) {
        List<Integer> kept = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            kept.add(i);
        }

        while (kept.size() >= 3) {
            int worst = -1;
            double worstMagnitude = 0.0;
            for (int k = 1; k < kept.size() - 1; k++) {
                double current = values[kept.get(k)];
                double toPrevious = current - values[kept.get(k - 1)];
                double toNext = current - values[kept.get(k + 1)];
                boolean spike = Math.abs(toPrevious) > threshold
                        && Math.abs(toNext) > threshold
                        && Math.signum(toPrevious) == Math.signum(toNext);
                if (spike) {
                    double magnitude = Math.min(Math.abs(toPrevious), Math.abs(toNext));
                    // Empate: gana el primero (determinista).
                    if (magnitude > worstMagnitude) {
                        worstMagnitude = magnitude;
                        worst = k;
                    }
                }
            }
            if (worst < 0) {
                break;
            }
            kept.remove(worst);
        }

        int[] out = new int[kept.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = kept.get(i);
        }
        return out;
    }
}
