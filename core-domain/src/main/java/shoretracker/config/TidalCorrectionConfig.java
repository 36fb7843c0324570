package shoretracker.config;

import lombok.Builder;
import lombok.With;

import java.time.Duration;

/**
 * Configuración de la corrección mareal y del filtrado de picos posterior.
 *
 * @param despikeThreshold    Desviación máxima (m) respecto a los vecinos antes de marcar un pico.
 * @param alignmentResolution Resolución de la malla temporal usada para casar observaciones y mareas.
 */
@Builder
@With
public record TidalCorrectionConfig(
        double despikeThreshold,
        Duration alignmentResolution
) {
    public TidalCorrectionConfig {
        if (despikeThreshold <= 0) {
            throw new IllegalArgumentException("El umbral de despike debe ser positivo: " + despikeThreshold);
        }
        if (alignmentResolution == null || alignmentResolution.isZero() || alignmentResolution.isNegative()) {
            throw new IllegalArgumentException("Resolución de alineación inválida: " + alignmentResolution);
        }
    }

    public static TidalCorrectionConfig defaults() {
        return new TidalCorrectionConfig(40.0, Duration.ofMinutes(10));
    }
}
