package shoretracker.compute.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.merge.MergeReport;
import shoretracker.analysis.tide.CorrectionResult;
import shoretracker.compute.config.EngineProperties;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.compute.repository.SiteRepository;
import shoretracker.compute.repository.TransectRepository;
import shoretracker.compute.service.ObservationStoreService;
import shoretracker.compute.service.SlopeEstimationService;
import shoretracker.compute.service.TidalCorrectionService;
import shoretracker.compute.service.TideService;
import shoretracker.compute.service.TransectAggregationService;
import shoretracker.compute.service.TrendService;
import shoretracker.domain.exception.AlignmentFailureException;
import shoretracker.domain.exception.MissingInputException;
import shoretracker.domain.exception.NumericalFailureException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.tide.TideSeries;
import shoretracker.domain.transect.ResultFragment;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orquestador de una ejecución: selecciona los sitios, lanza la etapa en el pool y gestiona
 * la tabla compartida de transectos.
 * <p>
 * Los errores de un sitio quedan en el {@link RunSummary}. Sólo son fatales los de la tabla
 * compartida (lectura o escritura), que se propagan como {@link IOException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    private final EngineProperties properties;
    private final SiteRepository sites;
    private final SiteDataRepository siteData;
    private final TransectRepository transectRepository;
    private final ObservationStoreService observationStore;
    private final TideService tideService;
    private final SlopeEstimationService slopeService;
    private final TidalCorrectionService correctionService;
    private final TrendService trendService;
    private final TransectAggregationService aggregation;
    private final SitePipelineRunner runner;

    public RunSummary run(PipelineRequest request) throws IOException {
        Stage stage = request.stage();
        Instant startedAt = Instant.now();
        log.info(">>> Etapa '{}'", stage.cliName());
        if (stage == Stage.AGGREGATE) {
            return aggregate(request, startedAt);
        }

        // 1. Tabla compartida
        Path tablePath = transectRepository.defaultPath();
        if (stage.readsTransectTable()) {
            aggregation.load(tablePath);
        }

        // 2. Sitios
        List<String> siteIds = selectSites(stage, request.sites());
        log.info("{} sitios seleccionados.", siteIds.size());

        // 3. Ejecución por sitio
        Set<String> updated = ConcurrentHashMap.newKeySet();
        List<SiteOutcome> outcomes = runner.run(stage, siteIds, taskFor(request, updated));

        // 4. Persistencia
        if (stage.writesTransectTable()) {
            aggregation.save(request.output() != null ? request.output() : tablePath);
        }
        RunSummary summary = RunSummary.of(stage, startedAt, outcomes, updated.size());
        log.info(">>> '{}' terminada: {} correctos, {} fallidos, {} omitidos, {} transectos actualizados.",
                stage.cliName(), summary.succeeded().size(), summary.failed().size(),
                summary.skipped().size(), summary.transectsUpdated());
        return summary;
    }

    /**
     * Descarga recorre los polígonos de sitio; el resto de etapas, los sitios que ya tienen
     * histórico.
     */
    List<String> selectSites(Stage stage, List<String> filter) throws IOException {
        String prefix = properties.getSitePrefix();
        List<String> candidates = stage == Stage.DOWNLOAD || stage == Stage.ALL
                ? sites.siteIds(prefix)
                : siteData.sitesWithData(prefix);
        if (filter.isEmpty()) {
            return candidates;
        }
        List<String> selected = new ArrayList<>();
        for (String id : candidates) {
            if (filter.contains(id)) {
                selected.add(id);
            }
        }
        for (String id : filter) {
            if (!candidates.contains(id)) {
                log.warn("Sitio {} pedido pero no disponible para '{}'.", id, stage.cliName());
            }
        }
        return selected;
    }

    private SiteTask taskFor(PipelineRequest request, Set<String> updated) {
        return switch (request.stage()) {
            case DOWNLOAD -> siteId -> describeDownload(observationStore.download(siteId));
            case TIDES_FETCH -> siteId -> tideService.fetchCache(siteId) + " mareas guardadas";
            case TIDES_APPLY -> this::correct;
            case SLOPE -> siteId -> estimateSlopes(siteId, request.recomputeSlopes(), updated);
            case TRENDS -> siteId -> fitTrends(siteId, updated);
            case ALL -> siteId -> runAll(siteId, request.recomputeSlopes(), updated);
            case AGGREGATE -> throw new IllegalArgumentException("La agregación no es una etapa por sitio");
        };
    }

    private String runAll(String siteId, boolean recompute, Set<String> updated) throws IOException {
        List<String> steps = new ArrayList<>();
        steps.add(describeDownload(observationStore.download(siteId)));

        ChainageTable raw = siteData.readRaw(siteId)
                .orElseThrow(() -> new MissingInputException(siteId, "Sin histórico de observaciones"));
        TideSeries tides = tideService.ensureCoverage(siteId, raw);
        steps.add(tides.size() + " mareas en caché");

        try {
            steps.add(estimateSlopes(siteId, recompute, updated));
        } catch (AlignmentFailureException | NumericalFailureException e) {
            log.warn("[{}] Pendiente no estimada, se corrige con las existentes: {}", siteId, e.getMessage());
            steps.add("pendiente no estimada");
        }
        steps.add(correct(siteId, raw, tides));
        steps.add(fitTrends(siteId, updated));
        return String.join("; ", steps);
    }

    private String correct(String siteId) throws IOException {
        CorrectionResult result = correctionService.apply(siteId, requireSlopes(siteId));
        return result.despiked().size() + " filas corregidas";
    }

    private String correct(String siteId, ChainageTable raw, TideSeries tides) throws IOException {
        CorrectionResult result = correctionService.apply(raw, tides, requireSlopes(siteId));
        return result.despiked().size() + " filas corregidas";
    }

    private Map<String, Double> requireSlopes(String siteId) {
        Map<String, Double> slopes = aggregation.siteSlopes(siteId);
        if (slopes.isEmpty()) {
            throw new MissingInputException(siteId, "Sin transectos en la tabla");
        }
        return slopes;
    }

    private String estimateSlopes(String siteId, boolean recompute, Set<String> updated) throws IOException {
        ResultFragment fragment = slopeService.estimate(siteId, aggregation.siteTransects(siteId), recompute);
        return merge(fragment, updated) + " pendientes";
    }

    private String fitTrends(String siteId, Set<String> updated) throws IOException {
        return merge(trendService.fit(siteId), updated) + " tendencias";
    }

    private int merge(ResultFragment fragment, Set<String> updated) {
        if (fragment.isEmpty()) {
            return 0;
        }
        MergeReport report = aggregation.apply(fragment);
        updated.addAll(report.updatedIds());
        return report.updatedIds().size();
    }

    private RunSummary aggregate(PipelineRequest request, Instant startedAt) throws IOException {
        Path base = request.base() != null ? request.base() : transectRepository.defaultPath();
        Path output = request.output() != null ? request.output() : base;
        MergeReport report = aggregation.aggregateFiles(base, request.fragments(), output, request.updateColumns());
        return RunSummary.of(Stage.AGGREGATE, startedAt, List.of(), report.updatedIds().size());
    }

    private static String describeDownload(int added) {
        return added == 0 ? "sin datos nuevos" : added + " observaciones nuevas";
    }
}
