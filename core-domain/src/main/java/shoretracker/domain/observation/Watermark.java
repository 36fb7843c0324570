package shoretracker.domain.observation;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Última fecha procesada de un sitio. Marca el punto de reanudación de la descarga incremental.
 *
 * @param siteId            Sitio.
 * @param lastProcessedDate Fecha (UTC) de la observación más reciente; null si no hay histórico.
 */
public record Watermark(String siteId, LocalDate lastProcessedDate) {

    public static Watermark of(ChainageTable table) {
        return new Watermark(table.siteId(),
                table.maxDate().map(d -> d.atZone(ZoneOffset.UTC).toLocalDate()).orElse(null));
    }

    public Optional<LocalDate> last() {
        return Optional.ofNullable(lastProcessedDate);
    }

    /**
     * Fecha inicial de la siguiente petición: el día siguiente a la última observación,
     * nunca antes de {@code globalStart}.
     */
    public LocalDate nextStartDate(LocalDate globalStart) {
        if (lastProcessedDate == null) {
            return globalStart;
        }
        LocalDate next = lastProcessedDate.plusDays(1);
        return next.isBefore(globalStart) ? globalStart : next;
    }
}
