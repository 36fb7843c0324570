package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Service;
import shoretracker.compute.client.TideProvider;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.compute.repository.SiteRepository;
import shoretracker.config.TidalCorrectionConfig;
import shoretracker.domain.exception.MissingInputException;
import shoretracker.domain.exception.TideProviderException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.series.TimeGrid;
import shoretracker.domain.tide.TideSample;
import shoretracker.domain.tide.TideSeries;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Caché de mareas por sitio.
 * <ul>
 *   <li>{@link #fetchCache}: crea la caché de los sitios que no la tienen (una consulta por
 *   instante de observación redondeado).</li>
 *   <li>{@link #ensureCoverage}: antes de corregir, completa los instantes que faltan y
 *   persiste la caché ampliada.</li>
 * </ul>
 * Un instante que no se consigue tras los reintentos se registra y se omite.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TideService {

    private final SiteDataRepository siteData;
    private final SiteRepository sites;
    private final TideProvider tideProvider;
    private final TidalCorrectionConfig correctionConfig;

    /**
     * @return Mareas guardadas; 0 si el sitio ya tenía caché o no se obtuvo ninguna.
     */
    public int fetchCache(String siteId) throws IOException {
        if (siteData.hasTides(siteId)) {
            log.info("[{}] Ya tiene caché de mareas.", siteId);
            return 0;
        }
        ChainageTable raw = siteData.readRaw(siteId)
                .orElseThrow(() -> new MissingInputException(siteId, "Sin histórico de observaciones"));

        List<TideSample> samples = fetchAll(siteId, roundedTimestamps(raw));
        if (samples.isEmpty()) {
            log.warn("[{}] No se obtuvo ninguna marea; no se crea la caché.", siteId);
            return 0;
        }
        siteData.writeTides(TideSeries.of(siteId, samples));
        return samples.size();
    }

    public TideSeries ensureCoverage(String siteId, ChainageTable raw) throws IOException {
        TideSeries cache = siteData.readTides(siteId).orElse(TideSeries.empty(siteId));
        List<Instant> missing = cache.missingFrom(roundedTimestamps(raw));
        if (missing.isEmpty()) {
            return cache;
        }
        log.info("[{}] Faltan {} mareas en la caché, consultando.", siteId, missing.size());
        List<TideSample> fetched = fetchAll(siteId, missing);
        if (fetched.isEmpty()) {
            return cache;
        }
        TideSeries merged = cache.merge(TideSeries.of(siteId, fetched));
        siteData.writeTides(merged);
        return merged;
    }

    private Set<Instant> roundedTimestamps(ChainageTable raw) {
        Set<Instant> rounded = new LinkedHashSet<>();
        for (Instant t : raw.timestamps()) {
            rounded.add(TimeGrid.round(t, correctionConfig.alignmentResolution()));
        }
        return rounded;
    }

    private List<TideSample> fetchAll(String siteId, Collection<Instant> timestamps) {
        Coordinate point = sites.centroid(siteId);
        List<TideSample> samples = new ArrayList<>(timestamps.size());
        for (Instant t : timestamps) {
            try {
                samples.add(new TideSample(t, tideProvider.tideAt(siteId, point, t)));
            } catch (TideProviderException e) {
                log.warn("[{}] Marea de {} no disponible: {}", siteId, t, e.getMessage());
            }
        }
        log.info("[{}] {} de {} mareas obtenidas.", siteId, samples.size(), timestamps.size());
        return samples;
    }
}
