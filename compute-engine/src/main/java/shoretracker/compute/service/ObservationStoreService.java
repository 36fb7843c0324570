package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.store.ObservationLog;
import shoretracker.compute.client.ObservationSource;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.config.AcquisitionConfig;
import shoretracker.domain.observation.AcquisitionPlan;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;

import java.io.IOException;
import java.util.List;

/**
 * Etapa de descarga: amplía el histórico de un sitio con las observaciones posteriores a su
 * marca de agua.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObservationStoreService {

    private final SiteDataRepository siteData;
    private final ObservationSource observationSource;
    private final ObservationLog observationLog;
    private final AcquisitionConfig acquisitionConfig;

    /**
     * @return Número de observaciones añadidas; 0 significa "sin datos nuevos" y el histórico
     *         no se toca.
     */
    public int download(String siteId) throws IOException {
        ChainageTable existing = siteData.readRaw(siteId).orElse(ChainageTable.empty(siteId));
        AcquisitionPlan plan = observationLog.plan(existing, acquisitionConfig);
        if (plan.startDate().isAfter(plan.endDate())) {
            log.info("[{}] Histórico al día (desde {} > hasta {}).", siteId, plan.startDate(), plan.endDate());
            return 0;
        }
        log.info("[{}] Descargando {} → {} ({}).", siteId, plan.startDate(), plan.endDate(), plan.satellites());

        List<Observation> fresh = observationSource.fetch(siteId, plan);
        if (fresh.isEmpty()) {
            log.info("[{}] Sin datos nuevos.", siteId);
            return 0;
        }
        ChainageTable merged = observationLog.append(observationLog.baseFor(plan, existing), fresh);
        siteData.writeRaw(merged);
        log.info("[{}] Histórico actualizado: {} filas (+{}).", siteId, merged.size(), fresh.size());
        return fresh.size();
    }
}
