package shoretracker.compute.client;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import shoretracker.config.RetryPolicy;
import shoretracker.domain.exception.TideProviderException;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorador con reintentos acotados: 30 s tras un límite de tasa, 5 s tras cualquier otro error
 * (valores por defecto de {@link RetryPolicy}). Agotar los intentos es fatal sólo para esa consulta.
 */
@Slf4j
public class RetryingTideProvider implements TideProvider {

    private static final String SITE_ATTR = "siteId";
    private static final String TIMESTAMP_ATTR = "timestamp";

    private final TideProvider delegate;
    private final RetryPolicy policy;
    private final RetryTemplate retryTemplate;

    public RetryingTideProvider(TideProvider delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = delegate;
        this.policy = policy;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(policy.maxAttempts())
                .customBackoff(new FailureClassBackOff(policy, sleeper))
                .build();
    }

    @Override
    public double tideAt(String siteId, Coordinate point, Instant timestamp) {
        try {
            return retryTemplate.execute(ctx -> {
                ctx.setAttribute(SITE_ATTR, siteId);
                ctx.setAttribute(TIMESTAMP_ATTR, timestamp);
                return delegate.tideAt(siteId, point, timestamp);
            });
        } catch (BackOffInterruptedException e) {
            throw new TideProviderException(siteId, "Espera de reintento interrumpida", e);
        } catch (RuntimeException e) {
            throw new TideProviderException(siteId,
                    "Sin marea para " + timestamp + " tras " + policy.maxAttempts() + " intentos", e);
        }
    }

    /**
     * Espera según la clase del último fallo registrado en el contexto de reintento.
     */
    private static final class FailureClassBackOff implements BackOffPolicy {

        private final RetryPolicy policy;
        private final Sleeper sleeper;

        FailureClassBackOff(RetryPolicy policy, Sleeper sleeper) {
            this.policy = policy;
            this.sleeper = sleeper;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new AttemptContext(context);
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            RetryContext retry = ((AttemptContext) backOffContext).retry();
            Throwable failure = retry.getLastThrowable();
            Duration delay = policy.delayAfter(failure);
            log.warn("[{}] Marea {} intento {}/{} fallido ({}). Reintento en {} s.",
                    retry.getAttribute(SITE_ATTR), retry.getAttribute(TIMESTAMP_ATTR), retry.getRetryCount(),
                    policy.maxAttempts(), failure == null ? "?" : failure.getMessage(), delay.toSeconds());
            try {
                sleeper.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Espera de reintento interrumpida", e);
            }
        }
    }

    private record AttemptContext(RetryContext retry) implements BackOffContext {
    }
}
