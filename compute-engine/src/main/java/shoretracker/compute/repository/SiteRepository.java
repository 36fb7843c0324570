package shoretracker.compute.repository;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import shoretracker.compute.config.EngineProperties;
import shoretracker.compute.io.GeoJsonFileHandler;
import shoretracker.domain.exception.MissingInputException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Polígonos de los sitios ({@code polygons.geojson}). El centroide de cada polígono es el punto
 * de consulta de mareas. Se cargan una vez, en el primer uso.
 */
@Slf4j
@Repository
public class SiteRepository {

    private final Path polygonsFile;
    private final GeoJsonFileHandler geoJson;
    private volatile Map<String, Geometry> polygons;

    @Autowired
    public SiteRepository(EngineProperties properties, GeoJsonFileHandler geoJson) {
        this(Path.of(properties.getPolygonsFile()), geoJson);
    }

    public SiteRepository(Path polygonsFile, GeoJsonFileHandler geoJson) {
        this.polygonsFile = polygonsFile;
        this.geoJson = geoJson;
    }

    public List<String> siteIds(String prefix) {
        List<String> ids = new ArrayList<>();
        for (String id : polygons().keySet()) {
            if (id.startsWith(prefix)) {
                ids.add(id);
            }
        }
        return ids;
    }

    public Coordinate centroid(String siteId) {
        Geometry polygon = polygons().get(siteId);
        if (polygon == null) {
            throw new MissingInputException(siteId, "Sin polígono para el sitio en " + polygonsFile);
        }
        return polygon.getCentroid().getCoordinate();
    }

    private Map<String, Geometry> polygons() {
        Map<String, Geometry> loaded = polygons;
        if (loaded == null) {
            synchronized (this) {
                if (polygons == null) {
                    try {
                        polygons = geoJson.readSitePolygons(polygonsFile);
                    } catch (IOException e) {
                        throw new UncheckedIOException("No se pudieron leer los polígonos " + polygonsFile, e);
                    }
                }
                loaded = polygons;
            }
        }
        return loaded;
    }
}
