package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.tide.CorrectionResult;
import shoretracker.analysis.tide.TidalCorrector;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.domain.exception.MissingInputException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.tide.TideSeries;

import java.io.IOException;
import java.util.Map;

/**
 * Etapa de aplicación de mareas: corrige el histórico bruto de un sitio con las pendientes
 * del sitio y guarda la serie corregida y depurada.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TidalCorrectionService {

    private final SiteDataRepository siteData;
    private final TideService tideService;
    private final TidalCorrector corrector;

    /**
     * @param beachSlopes Pendientes por transecto en el orden de la tabla de transectos.
     */
    public CorrectionResult apply(String siteId, Map<String, Double> beachSlopes) throws IOException {
        // 1. Entradas
        ChainageTable raw = siteData.readRaw(siteId)
                .filter(t -> !t.isEmpty())
                .orElseThrow(() -> new MissingInputException(siteId, "Sin histórico de observaciones"));
        return apply(raw, tideService.ensureCoverage(siteId, raw), beachSlopes);
    }

    /**
     * Corrige con mareas ya completadas por el llamador, sin nuevas consultas al proveedor.
     */
    public CorrectionResult apply(ChainageTable raw, TideSeries tides, Map<String, Double> beachSlopes)
            throws IOException {
        String siteId = raw.siteId();
        if (raw.isEmpty()) {
            throw new MissingInputException(siteId, "Sin histórico de observaciones");
        }
        if (tides.isEmpty()) {
            throw new MissingInputException(siteId, "Sin mareas para corregir");
        }

        // 2. Corrección y depuración
        CorrectionResult result = corrector.correct(raw, tides, beachSlopes);
        if (!result.uncorrectedTransects().isEmpty()) {
            log.warn("[{}] {} transectos sin pendiente: corrección 0.", siteId, result.uncorrectedTransects().size());
        }

        // 3. Persistencia
        if (result.despiked().isEmpty()) {
            log.warn("[{}] La serie corregida queda vacía; no se escribe.", siteId);
        } else {
            siteData.writeCorrected(result.despiked());
            log.info("[{}] Serie corregida: {} filas ({} con marea).", siteId,
                    result.despiked().size(), result.matchedRows());
        }
        return result;
    }
}
