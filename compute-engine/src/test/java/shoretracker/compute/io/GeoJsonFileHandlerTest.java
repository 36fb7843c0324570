package shoretracker.compute.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.TransectTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de lectura/escritura GeoJSON con ficheros temporales.
 */
class GeoJsonFileHandlerTest {

    private static final String TRANSECTS = """
            {
              "type": "FeatureCollection",
              "features": [
                {"type": "Feature",
                 "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "beach_slope": 0.085, "cil": null, "orientation": 120.5, "name": "norte"},
                 "geometry": {"type": "LineString", "coordinates": [[174.1, -36.1], [174.2, -36.2]]}},
                {"type": "Feature",
                 "properties": {"id": "nzd0002-0000", "site_id": "nzd0002", "beach_slope": null},
                 "geometry": null}
              ]
            }
            """;

    private GeoJsonFileHandler geoJson;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        geoJson = new GeoJsonFileHandler(new GeometryFactory());
    }

    @Test
    @DisplayName("Las numéricas son columnas; el resto de propiedades se conserva tal cual al reescribir")
    void writeTransects_shouldPreserveNonNumericProperties() throws IOException {
        // ARRANGE
        Path in = tempDir.resolve("in.geojson");
        Files.writeString(in, TRANSECTS);
        Path out = tempDir.resolve("roundtrip.geojson");

        // ACT
        TransectTable table = geoJson.readTransects(in);
        geoJson.writeTransects(table, out);
        TransectTable back = geoJson.readTransects(out);

        // ASSERT
        assertThat(table.ids()).containsExactly("nzd0001-0000", "nzd0002-0000");
        assertThat(table.columns()).contains("beach_slope", "cil", "orientation").doesNotContain("name");
        assertThat(table.value("nzd0001-0000", "beach_slope")).isEqualTo(0.085);
        assertThat(table.value("nzd0001-0000", "cil")).isNull();
        assertThat(table.get("nzd0001-0000").getGeometry().getNumPoints()).isEqualTo(2);
        assertThat(table.get("nzd0002-0000").getGeometry()).isNull();
        assertThat(table.get("nzd0002-0000").getSiteId()).isEqualTo("nzd0002");
        assertThat(back.get("nzd0001-0000").getPassthroughProperties()).containsExactly(Map.entry("name", "norte"));
        assertThat(back.get("nzd0001-0000").getGeometry().getCoordinateN(0).x).isCloseTo(174.1, within(1e-12));
        assertThat(back.collectionMembers()).isEmpty();
        assertThat(Files.readString(out)).contains("\"name\" : \"norte\"");
    }

    @Test
    @DisplayName("Escribe NaN como null y vuelve a leer la misma tabla")
    void writeTransects_shouldWriteNonFiniteAsNull() throws IOException {
        // ARRANGE
        Path in = tempDir.resolve("in.geojson");
        Files.writeString(in, TRANSECTS);
        TransectTable table = geoJson.readTransects(in);
        table.setValue("nzd0002-0000", "beach_slope", Double.NaN);
        Path out = tempDir.resolve("out").resolve("transects.geojson");

        // ACT
        geoJson.writeTransects(table, out);

        // ASSERT
        String content = Files.readString(out);
        assertThat(content).doesNotContain("NaN");
        TransectTable back = geoJson.readTransects(out);
        assertThat(back.value("nzd0001-0000", "orientation")).isEqualTo(120.5);
        assertThat(back.value("nzd0002-0000", "beach_slope")).isNull();
        assertThat(back.get("nzd0001-0000").getGeometry().getCoordinateN(1).x).isCloseTo(174.2, within(1e-12));
    }

    @Test
    @DisplayName("Un fichero de un solo sitio se lee como fragmento de ese sitio")
    void readFragment_shouldDetectSingleSite() throws IOException {
        Path file = tempDir.resolve("fragment.geojson");
        Files.writeString(file, """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {"id": "nzd0001-0000", "site_id": "nzd0001", "trend": 0.4, "r2_score": null}, "geometry": null},
                  {"type": "Feature", "properties": {"id": "nzd0001-0001", "site_id": "nzd0001", "trend": -1.2}, "geometry": null}
                ]}
                """);

        ResultFragment fragment = geoJson.readFragment(file, "aggregate");

        assertThat(fragment.siteId()).isEqualTo("nzd0001");
        assertThat(fragment.rowIds()).containsExactly("nzd0001-0000", "nzd0001-0001");
        assertThat(fragment.columns()).containsExactly("trend", "r2_score");
        assertThat(fragment.value("nzd0001-0001", "trend")).isEqualTo(-1.2);
        assertThat(fragment.value("nzd0001-0000", "r2_score")).isNull();
    }

    @Test
    @DisplayName("Lee polígonos y multipolígonos de sitio por id")
    void readSitePolygons_shouldSupportPolygonAndMultiPolygon() throws IOException {
        Path file = tempDir.resolve("polygons.geojson");
        Files.writeString(file, """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {"id": "nzd0001"},
                   "geometry": {"type": "Polygon", "coordinates": [[[0,0],[2,0],[2,2],[0,2],[0,0]]]}},
                  {"type": "Feature", "properties": {"id": "nzd0002"},
                   "geometry": {"type": "MultiPolygon", "coordinates": [[[[10,10],[11,10],[11,11],[10,11],[10,10]]]]}}
                ]}
                """);

        Map<String, Geometry> polygons = geoJson.readSitePolygons(file);

        assertThat(polygons).containsOnlyKeys("nzd0001", "nzd0002");
        assertThat(polygons.get("nzd0001").getCentroid().getCoordinate()).isEqualTo(new Coordinate(1, 1));
        assertThat(polygons.get("nzd0002").getGeometryType()).isEqualTo("MultiPolygon");
    }

    @Test
    @DisplayName("Rechaza un JSON que no es FeatureCollection")
    void readTransects_shouldRejectNonFeatureCollection() throws IOException {
        Path file = tempDir.resolve("bad.geojson");
        Files.writeString(file, "{\"type\": \"Feature\"}");

        assertThrows(IOException.class, () -> geoJson.readTransects(file));
    }
}
