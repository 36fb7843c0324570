package shoretracker.compute.repository;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import shoretracker.compute.config.EngineProperties;
import shoretracker.compute.io.GeoJsonFileHandler;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.TransectTable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Tabla compartida de transectos ({@code transects_extended.geojson}) y ficheros de fragmentos.
 */
@Repository
public class TransectRepository {

    private final Path defaultPath;
    private final GeoJsonFileHandler geoJson;

    @Autowired
    public TransectRepository(EngineProperties properties, GeoJsonFileHandler geoJson) {
        this(Path.of(properties.getTransectsFile()), geoJson);
    }

    public TransectRepository(Path defaultPath, GeoJsonFileHandler geoJson) {
        this.defaultPath = defaultPath;
        this.geoJson = geoJson;
    }

    public Path defaultPath() {
        return defaultPath;
    }

    public TransectTable load() throws IOException {
        return load(defaultPath);
    }

    public TransectTable load(Path path) throws IOException {
        return geoJson.readTransects(path);
    }

    public void save(TransectTable table, Path path) throws IOException {
        geoJson.writeTransects(table, path);
    }

    public ResultFragment loadFragment(Path path) throws IOException {
        return geoJson.readFragment(path, "aggregate");
    }
}
