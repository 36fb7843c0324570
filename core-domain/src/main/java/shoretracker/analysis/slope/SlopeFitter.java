package shoretracker.analysis.slope;

import shoretracker.config.SlopeEstimationConfig;

import java.time.Instant;
import java.util.List;

/**
 * Núcleo espectral de la estimación de pendientes. Separado del orquestador para poder
 * sustituirlo en pruebas.
 */
public interface SlopeFitter {

    /**
     * Frecuencia (Hz) del pico mareal dominante, ignorando las frecuencias por debajo del corte.
     */
    double findTidePeak(List<Instant> dates, double[] tide, SlopeEstimationConfig config);

    /**
     * Elige la pendiente cuya serie corregida tiene menos energía en la banda del pico mareal.
     *
     * @param dates        Instantes comunes a todas las series de prueba.
     * @param trialSeries  Una serie corregida por cada pendiente de prueba (mismo orden que {@code slopes}).
     * @param slopes       Pendientes de prueba, crecientes.
     * @param peakFrequency Pico mareal devuelto por {@link #findTidePeak}.
     * @throws shoretracker.domain.exception.NumericalFailureException si la banda tiene menos de dos frecuencias
     *         o hay menos de dos instantes.
     */
    SlopeFit integratePowerSpectrum(List<Instant> dates, List<double[]> trialSeries, double[] slopes,
                                    SlopeEstimationConfig config, double peakFrequency);
}
