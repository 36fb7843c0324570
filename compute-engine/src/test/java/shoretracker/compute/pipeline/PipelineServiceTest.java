package shoretracker.compute.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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
import shoretracker.domain.exception.NumericalFailureException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;
import shoretracker.domain.tide.TideSample;
import shoretracker.domain.tide.TideSeries;
import shoretracker.domain.transect.ResultFragment;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    private static final Path TABLE = Path.of("inputs", "transects_extended.geojson");

    @Mock private SiteRepository sites;
    @Mock private SiteDataRepository siteData;
    @Mock private TransectRepository transectRepository;
    @Mock private ObservationStoreService observationStore;
    @Mock private TideService tideService;
    @Mock private SlopeEstimationService slopeService;
    @Mock private TidalCorrectionService correctionService;
    @Mock private TrendService trendService;
    @Mock private TransectAggregationService aggregation;

    private PipelineService pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new PipelineService(new EngineProperties(), sites, siteData, transectRepository, observationStore,
                tideService, slopeService, correctionService, trendService, aggregation, new SitePipelineRunner(2));
    }

    private static ResultFragment trends(String siteId) {
        return new ResultFragment(siteId, "trends").put(siteId + "-0000", "trend", 0.3);
    }

    private static MergeReport updated(String... ids) {
        return new MergeReport(Set.of(ids), Set.of(), 0);
    }

    @Test
    @DisplayName("Tendencias: carga la tabla, fusiona cada sitio y guarda en la ruta de entrada")
    void run_trendsShouldMergeAndSaveTable() throws IOException {
        // ARRANGE
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        when(siteData.sitesWithData("nzd")).thenReturn(List.of("nzd0001", "nzd0002"));
        when(trendService.fit("nzd0001")).thenReturn(trends("nzd0001"));
        when(trendService.fit("nzd0002")).thenReturn(trends("nzd0002"));
        when(aggregation.apply(any())).thenAnswer(inv -> updated(((ResultFragment) inv.getArgument(0)).rowIds().get(0)));

        // ACT
        RunSummary summary = pipeline.run(PipelineRequest.of(Stage.TRENDS));

        // ASSERT
        verify(aggregation).load(TABLE);
        verify(aggregation).save(TABLE);
        assertThat(summary.stage()).isEqualTo("trends");
        assertThat(summary.succeeded()).containsExactlyInAnyOrder("nzd0001", "nzd0002");
        assertThat(summary.transectsUpdated()).isEqualTo(2);
    }

    @Test
    @DisplayName("El filtro de sitios se aplica y la salida alternativa recibe la tabla")
    void run_shouldFilterSitesAndHonourOutput() throws IOException {
        // ARRANGE
        Path output = Path.of("out.geojson");
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        when(siteData.sitesWithData("nzd")).thenReturn(List.of("nzd0001", "nzd0002"));
        when(trendService.fit("nzd0002")).thenReturn(trends("nzd0002"));
        when(aggregation.apply(any())).thenReturn(updated("nzd0002-0000"));
        PipelineRequest request = new PipelineRequest(Stage.TRENDS, List.of("nzd0002", "nzd0404"),
                output, null, List.of(), null, false);

        // ACT
        RunSummary summary = pipeline.run(request);

        // ASSERT
        assertThat(summary.succeeded()).containsExactly("nzd0002");
        verify(trendService, never()).fit("nzd0001");
        verify(aggregation).save(output);
    }

    @Test
    @DisplayName("La descarga recorre los polígonos y no toca la tabla de transectos")
    void run_downloadShouldNotTouchTransectTable() throws IOException {
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        when(sites.siteIds("nzd")).thenReturn(List.of("nzd0001"));
        when(observationStore.download("nzd0001")).thenReturn(0);

        RunSummary summary = pipeline.run(PipelineRequest.of(Stage.DOWNLOAD));

        assertThat(summary.succeeded()).containsExactly("nzd0001");
        verifyNoInteractions(aggregation);
    }

    @Test
    @DisplayName("Corrección: usa las pendientes del sitio tomadas de la tabla compartida")
    void run_tidesApplyShouldUseSiteSlopes() throws IOException {
        // ARRANGE
        Map<String, Double> slopes = Map.of("nzd0001-0000", 0.1);
        ChainageTable empty = ChainageTable.empty("nzd0001");
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        when(siteData.sitesWithData("nzd")).thenReturn(List.of("nzd0001", "nzd0002"));
        when(aggregation.siteSlopes("nzd0001")).thenReturn(slopes);
        when(aggregation.siteSlopes("nzd0002")).thenReturn(Map.of());
        when(correctionService.apply("nzd0001", slopes))
                .thenReturn(new CorrectionResult(empty, empty, 0, Set.of(), Set.of()));

        // ACT
        RunSummary summary = pipeline.run(PipelineRequest.of(Stage.TIDES_APPLY));

        // ASSERT
        assertThat(summary.succeeded()).containsExactly("nzd0001");
        assertThat(summary.skipped()).containsOnlyKeys("nzd0002");
        verify(aggregation, never()).save(any());
    }

    @Test
    @DisplayName("Todo: descarga, mareas, pendiente, corrección y tendencias; un fallo de pendiente no corta el sitio")
    void run_allShouldChainStagesInOrder() throws IOException {
        // ARRANGE
        ChainageTable raw = ChainageTable.of("nzd0001", List.of(
                new Observation(Instant.parse("2020-01-01T22:05:00Z"), "L8", Map.of("nzd0001-0000", 100.0))));
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        when(sites.siteIds("nzd")).thenReturn(List.of("nzd0001"));
        when(observationStore.download("nzd0001")).thenReturn(1);
        when(siteData.readRaw("nzd0001")).thenReturn(Optional.of(raw));
        TideSeries tides = TideSeries.of("nzd0001", List.of(new TideSample(Instant.parse("2020-01-01T22:10:00Z"), 0.3)));
        when(tideService.ensureCoverage("nzd0001", raw)).thenReturn(tides);
        when(aggregation.siteTransects("nzd0001")).thenReturn(List.of());
        when(slopeService.estimate(eq("nzd0001"), anyList(), anyBoolean()))
                .thenThrow(new NumericalFailureException("nzd0001", "banda vacía"));
        when(aggregation.siteSlopes("nzd0001")).thenReturn(Map.of("nzd0001-0000", 0.1));
        when(correctionService.apply(eq(raw), eq(tides), any()))
                .thenReturn(new CorrectionResult(raw, raw, 1, Set.of(), Set.of()));
        when(trendService.fit("nzd0001")).thenReturn(trends("nzd0001"));
        when(aggregation.apply(any())).thenReturn(updated("nzd0001-0000"));

        // ACT
        RunSummary summary = pipeline.run(PipelineRequest.of(Stage.ALL));

        // ASSERT
        assertThat(summary.succeeded()).containsExactly("nzd0001");
        assertThat(summary.transectsUpdated()).isEqualTo(1);
        InOrder order = inOrder(observationStore, tideService, slopeService, correctionService, trendService);
        order.verify(observationStore).download("nzd0001");
        order.verify(tideService).ensureCoverage("nzd0001", raw);
        order.verify(slopeService).estimate(eq("nzd0001"), anyList(), anyBoolean());
        order.verify(correctionService).apply(eq(raw), eq(tides), any());
        order.verify(trendService).fit("nzd0001");
        verify(tideService, times(1)).ensureCoverage(any(), any());
        verify(correctionService, never()).apply(any(String.class), any());
        verify(aggregation).save(TABLE);
    }

    @Test
    @DisplayName("Agregación: base configurada por defecto y salida sobre la base")
    void run_aggregateShouldDefaultBaseAndOutput() throws IOException {
        when(transectRepository.defaultPath()).thenReturn(TABLE);
        List<Path> fragments = List.of(Path.of("a.geojson"));
        when(aggregation.aggregateFiles(TABLE, fragments, TABLE, null)).thenReturn(updated("x", "y"));

        RunSummary summary = pipeline.run(new PipelineRequest(Stage.AGGREGATE, List.of(), null, null, fragments, null, false));

        assertThat(summary.stage()).isEqualTo("aggregate");
        assertThat(summary.transectsUpdated()).isEqualTo(2);
        assertThat(summary.total()).isZero();
    }
}
