package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.slope.SlopeEstimator;
import shoretracker.compute.config.EngineProperties;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.config.SlopeEstimationConfig;
import shoretracker.domain.exception.MissingInputException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.tide.TideSeries;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectAttributes;

import java.io.IOException;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SlopeEstimationService {

    private final SiteDataRepository siteData;
    private final SlopeEstimator estimator;
    private final EngineProperties properties;

    /**
     * Estima las pendientes que faltan en los transectos del sitio.
     *
     * @param siteTransects Copia de los transectos del sitio tomada de la tabla compartida.
     * @param recompute     Recalcula también los transectos que ya tienen pendiente.
     * @return Fragmento con beach_slope, cil y ciu; vacío si no hay nada que estimar.
     */
    public ResultFragment estimate(String siteId, List<Transect> siteTransects, boolean recompute) throws IOException {
        SlopeEstimationConfig config = properties.toSlopeConfig(recompute);
        List<String> candidates = SlopeEstimator.candidates(siteTransects, config);
        if (candidates.isEmpty()) {
            log.info("[{}] Sin transectos pendientes de pendiente.", siteId);
            ResultFragment empty = new ResultFragment(siteId, SlopeEstimator.STAGE);
            TransectAttributes.SLOPE_COLUMNS.forEach(empty::declareColumn);
            return empty;
        }

        ChainageTable raw = siteData.readRaw(siteId)
                .orElseThrow(() -> new MissingInputException(siteId, "Sin histórico de observaciones"));
        TideSeries tides = siteData.readTides(siteId)
                .orElseThrow(() -> new MissingInputException(siteId, "Sin caché de mareas"));
        log.info("[{}] Estimando pendiente de {} transectos.", siteId, candidates.size());
        return estimator.estimate(raw, tides, candidates, config);
    }
}
