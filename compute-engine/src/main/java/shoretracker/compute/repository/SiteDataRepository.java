package shoretracker.compute.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import shoretracker.compute.config.EngineProperties;
import shoretracker.compute.io.CsvTableHandler;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.tide.TideSeries;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Estado persistido por sitio bajo {@code <dataDir>/<sitio>/}:
 * histórico bruto, caché de mareas y tabla corregida.
 * <p>
 * Cada sitio sólo lo escribe su propio worker, así que no hace falta sincronización.
 */
@Slf4j
@Repository
public class SiteDataRepository {

    public static final String RAW_FILE = "transect_time_series.csv";
    public static final String TIDES_FILE = "tides.csv";
    public static final String CORRECTED_FILE = "transect_time_series_tidally_corrected.csv";

    private final Path dataDir;
    private final CsvTableHandler csv;

    @Autowired
    public SiteDataRepository(EngineProperties properties, CsvTableHandler csv) {
        this(Path.of(properties.getDataDir()), csv);
    }

    public SiteDataRepository(Path dataDir, CsvTableHandler csv) {
        this.dataDir = dataDir;
        this.csv = csv;
    }

    public Path siteDir(String siteId) {
        return dataDir.resolve(siteId);
    }

    public boolean hasRaw(String siteId) {
        return Files.isRegularFile(siteDir(siteId).resolve(RAW_FILE));
    }

    public boolean hasTides(String siteId) {
        return Files.isRegularFile(siteDir(siteId).resolve(TIDES_FILE));
    }

    public boolean hasCorrected(String siteId) {
        return Files.isRegularFile(siteDir(siteId).resolve(CORRECTED_FILE));
    }

    public Optional<ChainageTable> readRaw(String siteId) throws IOException {
        return hasRaw(siteId) ? Optional.of(csv.readChainage(siteDir(siteId).resolve(RAW_FILE), siteId)) : Optional.empty();
    }

    public void writeRaw(ChainageTable table) throws IOException {
        csv.writeChainage(siteDir(table.siteId()).resolve(RAW_FILE), table);
    }

    public Optional<TideSeries> readTides(String siteId) throws IOException {
        return hasTides(siteId) ? Optional.of(csv.readTides(siteDir(siteId).resolve(TIDES_FILE), siteId)) : Optional.empty();
    }

    public void writeTides(TideSeries tides) throws IOException {
        csv.writeTides(siteDir(tides.siteId()).resolve(TIDES_FILE), tides);
    }

    public Optional<ChainageTable> readCorrected(String siteId) throws IOException {
        return hasCorrected(siteId)
                ? Optional.of(csv.readChainage(siteDir(siteId).resolve(CORRECTED_FILE), siteId))
                : Optional.empty();
    }

    public void writeCorrected(ChainageTable table) throws IOException {
        csv.writeChainage(siteDir(table.siteId()).resolve(CORRECTED_FILE), table);
    }

    /**
     * Sitios con histórico bruto cuyo id empieza por {@code prefix}, ordenados.
     */
    public List<String> sitesWithData(String prefix) throws IOException {
        List<String> sites = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            log.warn("El directorio de datos {} no existe.", dataDir.toAbsolutePath());
            return sites;
        }
        try (Stream<Path> dirs = Files.list(dataDir)) {
            dirs.filter(Files::isDirectory)
                    .map(d -> d.getFileName().toString())
                    .filter(name -> name.startsWith(prefix))
                    .filter(this::hasRaw)
                    .sorted()
                    .forEach(sites::add);
        }
        return sites;
    }
}
