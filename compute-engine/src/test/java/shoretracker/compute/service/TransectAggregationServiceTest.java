package shoretracker.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.GeometryFactory;
import shoretracker.analysis.merge.MergeReport;
import shoretracker.analysis.merge.TransectMerger;
import shoretracker.compute.io.GeoJsonFileHandler;
import shoretracker.compute.repository.TransectRepository;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TransectAggregationServiceTest {

    private static final String BASE = """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "beach_slope": 0.085, "cil": 0.07, "ciu": 0.10}, "geometry": null},
              {"type": "Feature", "properties": {"id": "nzd0001-0001", "site_id": "nzd0001", "beach_slope": null, "cil": null, "ciu": null}, "geometry": null},
              {"type": "Feature", "properties": {"id": "nzd0002-0000", "site_id": "nzd0002", "beach_slope": 0.05, "cil": null, "ciu": null}, "geometry": null}
            ]}
            """;

    @TempDir
    Path tempDir;

    private Path basePath;
    private TransectRepository repository;
    private TransectAggregationService service;

    @BeforeEach
    void setUp() throws IOException {
        basePath = tempDir.resolve("transects_extended.geojson");
        Files.writeString(basePath, BASE);
        repository = new TransectRepository(basePath, new GeoJsonFileHandler(new GeometryFactory()));
        service = new TransectAggregationService(repository, new TransectMerger());
    }

    @Test
    @DisplayName("Pendientes del sitio en el orden de la tabla, con huecos como null")
    void siteSlopes_shouldFollowTableOrder() throws IOException {
        service.load(basePath);

        Map<String, Double> slopes = service.siteSlopes("nzd0001");

        assertThat(slopes.keySet()).containsExactly("nzd0001-0000", "nzd0001-0001");
        assertThat(slopes.get("nzd0001-0000")).isEqualTo(0.085);
        assertThat(slopes.get("nzd0001-0001")).isNull();
        assertThat(service.siteTransects("nzd0002")).extracting(Transect::getId).containsExactly("nzd0002-0000");
    }

    @Test
    @DisplayName("Los fragmentos aplicados se guardan; los nulos del fragmento no borran valores")
    void applyAndSave_shouldPersistMergedValues() throws IOException {
        // ARRANGE
        service.load(basePath);
        ResultFragment fragment = new ResultFragment("nzd0001", "slope")
                .put("nzd0001-0000", "beach_slope", null)
                .put("nzd0001-0001", "beach_slope", 0.12)
                .put("nzd0001-0001", "cil", 0.11)
                .put("nzd0001-0001", "ciu", 0.13);
        Path output = tempDir.resolve("out.geojson");

        // ACT
        MergeReport report = service.apply(fragment);
        service.save(output);

        // ASSERT
        assertThat(report.updatedIds()).containsExactly("nzd0001-0001");
        TransectTable saved = repository.load(output);
        assertThat(saved.value("nzd0001-0000", "beach_slope")).isEqualTo(0.085);
        assertThat(saved.value("nzd0001-0001", "beach_slope")).isEqualTo(0.12);
        assertThat(saved.value("nzd0001-0001", "ciu")).isEqualTo(0.13);
    }

    @Test
    @DisplayName("Fragmentos aplicados desde varios hilos no pierden actualizaciones")
    void apply_shouldSerializeConcurrentWriters() throws Exception {
        service.load(basePath);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<ResultFragment> fragments = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            fragments.add(new ResultFragment("nzd0001", "trends").put("nzd0001-0000", "trend_" + i, (double) i));
        }

        for (ResultFragment f : fragments) {
            pool.submit(() -> service.apply(f));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        Path output = tempDir.resolve("concurrent.geojson");
        service.save(output);
        TransectTable saved = repository.load(output);
        for (int i = 0; i < 50; i++) {
            assertThat(saved.value("nzd0001-0000", "trend_" + i)).isEqualTo((double) i);
        }
    }

    @Test
    @DisplayName("Sin cargar la tabla no se puede aplicar un fragmento")
    void apply_shouldRequireLoadedTable() {
        assertThrows(IllegalStateException.class,
                () -> service.apply(new ResultFragment("nzd0001", "slope").put("nzd0001-0000", "beach_slope", 0.1)));
    }

    @Test
    @DisplayName("Agrega ficheros de fragmentos, omite los que no existen y limita columnas")
    void aggregateFiles_shouldMergeExistingFragments() throws IOException {
        // ARRANGE
        Path trends = tempDir.resolve("nzd0001_trends.geojson");
        Files.writeString(trends, """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "trend": 0.4, "r2_score": 0.8}, "geometry": null},
                  {"type": "Feature", "properties": {"id": "zzz9999-0000", "site_id": "nzd0001", "trend": 9.9, "r2_score": 0.1}, "geometry": null}
                ]}
                """);
        Path output = tempDir.resolve("aggregated.geojson");

        // ACT
        MergeReport report = service.aggregateFiles(basePath,
                List.of(trends, tempDir.resolve("missing.geojson")), output, Set.of("trend"));

        // ASSERT
        assertThat(report.updatedIds()).containsExactly("nzd0001-0000");
        TransectTable aggregated = repository.load(output);
        assertThat(aggregated.value("nzd0001-0000", "trend")).isEqualTo(0.4);
        assertThat(aggregated.hasColumn("r2_score")).isFalse();
        assertThat(aggregated.contains("zzz9999-0000")).isFalse();
    }

    @Test
    @DisplayName("Sin fragmentos la salida es una copia de la base")
    void aggregateFiles_shouldCopyBaseWithoutFragments() throws IOException {
        Path output = tempDir.resolve("copy.geojson");

        MergeReport report = service.aggregateFiles(basePath, List.of(), output, null);

        assertThat(report.updatedIds()).isEmpty();
        TransectTable copy = repository.load(output);
        assertThat(copy.ids()).containsExactly("nzd0001-0000", "nzd0001-0001", "nzd0002-0000");
        assertThat(copy.value("nzd0002-0000", "beach_slope")).isEqualTo(0.05);
    }

    @Test
    @DisplayName("Las filas que ningún fragmento toca se reescriben intactas, con sus propiedades de texto y el crs")
    void aggregateFiles_shouldLeaveUntouchedRowsIntact() throws IOException {
        // ARRANGE
        Path base = tempDir.resolve("base_with_text.geojson");
        Files.writeString(base, """
                {"type": "FeatureCollection",
                 "crs": {"type": "name", "properties": {"name": "urn:ogc:def:crs:OGC:1.3:CRS84"}},
                 "features": [
                  {"type": "Feature", "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "beach_slope": null}, "geometry": null},
                  {"type": "Feature", "properties": {"id": "nzd0002-0000", "site_id": "nzd0002", "name": "south", "valid": false, "beach_slope": 0.04},
                   "geometry": {"type": "Point", "coordinates": [174.5, -36.5]}}
                ]}
                """);
        Path slopes = tempDir.resolve("nzd0001_slopes.geojson");
        Files.writeString(slopes, """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "beach_slope": 0.09}, "geometry": null}
                ]}
                """);
        Path output = tempDir.resolve("merged.geojson");

        // ACT
        service.aggregateFiles(base, List.of(slopes), output, null);

        // ASSERT
        String content = Files.readString(output);
        assertThat(content).contains("urn:ogc:def:crs:OGC:1.3:CRS84").contains("\"Point\"");
        Transect untouched = repository.load(output).get("nzd0002-0000");
        assertThat(untouched.getPassthroughProperties())
                .containsEntry("name", "south")
                .containsEntry("valid", false);
        assertThat(untouched.getAttribute("beach_slope")).isEqualTo(0.04);
        assertThat(repository.load(output).value("nzd0001-0000", "beach_slope")).isEqualTo(0.09);
    }
}
