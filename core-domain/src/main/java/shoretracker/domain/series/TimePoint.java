package shoretracker.domain.series;

import java.time.Instant;

/**
 * Muestra de una serie temporal. {@code value} es null (o NaN) cuando no hay dato.
 */
public record TimePoint(Instant timestamp, Double value) {

    public boolean isMissing() {
        return value == null || value.isNaN();
    }
}
