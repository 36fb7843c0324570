package shoretracker.domain.series;

import java.time.Duration;
import java.time.Instant;

/**
 * Redondeo de instantes a una malla temporal regular (p.ej. 10 minutos).
 * <p>
 * Se redondea al punto de malla más cercano; los empates exactos van al múltiplo par,
 * igual que el redondeo bancario que usan las tablas de mareas cacheadas.
 */
public final class TimeGrid {

    private TimeGrid() {
    }

    public static Instant round(Instant instant, Duration resolution) {
        long step = resolution.toMillis();
        if (step <= 0) {
            throw new IllegalArgumentException("Resolución de malla inválida: " + resolution);
        }
        long millis = instant.toEpochMilli();
        long floor = Math.floorDiv(millis, step);
        long remainder = millis - floor * step;
        long twice = remainder * 2;
        if (twice > step || (twice == step && (floor & 1L) == 1L)) {
            floor++;
        }
        return Instant.ofEpochMilli(floor * step);
    }
}
