package shoretracker.domain.tide;

import java.time.Instant;

/**
 * Altura de marea (m, sobre el nivel medio) en un instante, en el centroide del sitio.
 */
public record TideSample(Instant timestamp, double height) {
}
