package shoretracker.analysis.store;

import lombok.extern.slf4j.Slf4j;
import shoretracker.config.AcquisitionConfig;
import shoretracker.domain.observation.AcquisitionPlan;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;
import shoretracker.domain.observation.Watermark;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Registro incremental (append-only) de observaciones de un sitio.
 * <p>
 * Reglas:
 * <ul>
 * <li>Las observaciones nuevas se concatenan al histórico y el resultado se ordena por fecha
 * de forma estable: los empates conservan el orden de entrada.</li>
 * <li>No se deduplican pares (fecha, satélite): si dos ejecuciones traen la misma observación,
 * ambas filas se conservan.</li>
 * <li>Nada se borra: la cobertura temporal nunca disminuye tras un append.</li>
 * </ul>
 */
@Slf4j
public class ObservationLog {

    private static final Comparator<Observation> BY_DATE = Comparator.comparing(Observation::date);

    /**
     * Concatena y reordena. Si no hay observaciones nuevas devuelve {@code existing} tal cual.
     */
    public ChainageTable append(ChainageTable existing, List<Observation> newObservations) {
        if (newObservations == null || newObservations.isEmpty()) {
            log.info("[{}] Sin datos nuevos; el histórico no cambia ({} filas).", existing.siteId(), existing.size());
            return existing;
        }

        List<Observation> merged = new ArrayList<>(existing.size() + newObservations.size());
        merged.addAll(existing.rows());
        merged.addAll(newObservations);
        // List.sort es un mergesort estable
        merged.sort(BY_DATE);

        Set<String> columns = new LinkedHashSet<>(existing.transectIds());
        for (Observation o : newObservations) {
            columns.addAll(o.chainages().keySet());
        }

        log.debug("[{}] Append: {} + {} observaciones.", existing.siteId(), existing.size(), newObservations.size());
        return new ChainageTable(existing.siteId(), new ArrayList<>(columns), merged);
    }

    /**
     * Planifica la siguiente petición a partir de la marca de agua del histórico.
     * <p>
     * Con fecha de arranque forzada el histórico se trata como vacío y la fecha se usa tal
     * cual; si no, se empieza el día siguiente a la última observación sin bajar nunca de la
     * fecha global mínima.
     */
    public AcquisitionPlan plan(ChainageTable existing, AcquisitionConfig config) {
        String siteId = existing.siteId();
        if (config.forceStart().isPresent()) {
            LocalDate forced = config.forceStart().get();
            log.info("[{}] Arranque forzado desde {} (se ignora el histórico).", siteId, forced);
            return new AcquisitionPlan(siteId, forced, config.endDate(), config.satellites(), true);
        }
        Watermark watermark = Watermark.of(existing);
        LocalDate start = watermark.nextStartDate(config.globalStartDate());
        return new AcquisitionPlan(siteId, start, config.endDate(), config.satellites(), false);
    }

    /**
     * Histórico sobre el que se aplica el append según el plan.
     */
    public ChainageTable baseFor(AcquisitionPlan plan, ChainageTable existing) {
        return plan.freshStart() ? ChainageTable.empty(existing.siteId()) : existing;
    }
}
