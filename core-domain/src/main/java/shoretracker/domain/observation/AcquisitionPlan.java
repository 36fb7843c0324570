package shoretracker.domain.observation;

import java.time.LocalDate;
import java.util.List;

/**
 * Petición planificada al origen de observaciones para un sitio.
 *
 * @param siteId     Sitio.
 * @param startDate  Primer día solicitado (incluido).
 * @param endDate    Último día solicitado (incluido).
 * @param satellites Misiones solicitadas.
 * @param freshStart true si se descarta el histórico previo (arranque forzado).
 */
public record AcquisitionPlan(
        String siteId,
        LocalDate startDate,
        LocalDate endDate,
        List<String> satellites,
        boolean freshStart
) {
    public AcquisitionPlan {
        satellites = List.copyOf(satellites);
    }
}
