package shoretracker.config;

import lombok.Builder;
import lombok.With;
import shoretracker.domain.exception.TideProviderException;

import java.time.Duration;

/**
 * Política explícita de reintentos para llamadas bloqueantes a servicios externos.
 * <p>
 * Número de intentos acotado y esperas fijas según la clase de fallo: una espera larga tras
 * la señal de límite de peticiones y una corta tras cualquier otro error (timeouts incluidos).
 *
 * @param maxAttempts    Número máximo de intentos por petición (incluye el primero).
 * @param rateLimitDelay Espera tras una respuesta de límite de peticiones.
 * @param errorDelay     Espera tras cualquier otro error.
 */
@Builder
@With
public record RetryPolicy(
        int maxAttempts,
        Duration rateLimitDelay,
        Duration errorDelay
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts debe ser >= 1: " + maxAttempts);
        }
    }

    public Duration delayAfter(Throwable failure) {
        if (failure instanceof TideProviderException tpe && tpe.isRateLimited()) {
            return rateLimitDelay;
        }
        return errorDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(30), Duration.ofSeconds(5));
    }
}
