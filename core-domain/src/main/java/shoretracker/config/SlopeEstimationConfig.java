package shoretracker.config;

import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Parámetros del análisis espectral de la pendiente de la playa (Lomb-Scargle).
 * <p>
 * La pendiente se busca en una malla de pendientes de prueba: para cada una se corrige la
 * serie con la marea y se mide cuánta energía queda en la banda de frecuencia mareal. La
 * pendiente correcta es la que elimina la señal de marea.
 *
 * @param slopeMin           Pendiente mínima de prueba (adimensional).
 * @param slopeMax           Pendiente máxima de prueba.
 * @param deltaSlope         Incremento de la malla de pendientes.
 * @param samplingPeriodDays Periodo de muestreo en días; fija la frecuencia de Nyquist (1 / 2Δt).
 * @param nyquistFactor      Sobremuestreo (n0) de la malla de frecuencias: df = 1 / (n0 · T).
 * @param frequencyCutoff    Frecuencia mínima (Hz) considerada al buscar el pico mareal.
 * @param peakBandwidth      Semiancho (Hz) de la banda integrada alrededor del pico mareal.
 * @param confidencePercent  Fracción sobre el mínimo de energía que define la banda de confianza.
 * @param analysisStart      Inicio opcional de la ventana de análisis (null = sin límite).
 * @param analysisEnd        Fin opcional de la ventana de análisis (null = sin límite).
 * @param recompute          Si es true se recalculan también los transectos que ya tienen pendiente.
 */
@Builder
@With
public record SlopeEstimationConfig(
        double slopeMin,
        double slopeMax,
        double deltaSlope,
        double samplingPeriodDays,
        int nyquistFactor,
        double frequencyCutoff,
        double peakBandwidth,
        double confidencePercent,
        Instant analysisStart,
        Instant analysisEnd,
        boolean recompute
) {
    public static final double SECONDS_IN_DAY = 24 * 3600;

    public SlopeEstimationConfig {
        if (slopeMin <= 0 || slopeMax <= slopeMin || deltaSlope <= 0) {
            throw new IllegalArgumentException(
                    "Malla de pendientes inválida: [" + slopeMin + ", " + slopeMax + "] paso " + deltaSlope);
        }
        if (nyquistFactor <= 0 || samplingPeriodDays <= 0) {
            throw new IllegalArgumentException("n0 y el periodo de muestreo deben ser positivos");
        }
    }

    public double samplingPeriodSeconds() {
        return samplingPeriodDays * SECONDS_IN_DAY;
    }

    public boolean inAnalysisWindow(Instant date) {
        return (analysisStart == null || !date.isBefore(analysisStart))
                && (analysisEnd == null || !date.isAfter(analysisEnd));
    }

    /**
     * Valores de referencia del análisis de pendientes para costas micromareales.
     */
    public static SlopeEstimationConfig defaults() {
        return SlopeEstimationConfig.builder()
                .slopeMin(0.01)
                .slopeMax(0.2)
                .deltaSlope(0.005)
                .samplingPeriodDays(7)
                .nyquistFactor(50)
                .frequencyCutoff(1.0 / (SECONDS_IN_DAY * 30))
                .peakBandwidth(100 * 1e-10)
                .confidencePercent(0.05)
                .recompute(false)
                .build();
    }
}
