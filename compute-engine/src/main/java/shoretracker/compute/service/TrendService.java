package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.trend.TrendFitter;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.domain.exception.MissingInputException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.transect.ResultFragment;

import java.io.IOException;

/**
 * Etapa de tendencias: ajusta una recta por transecto sobre la serie corregida del sitio.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrendService {

    private final SiteDataRepository siteData;
    private final TrendFitter trendFitter;

    public ResultFragment fit(String siteId) throws IOException {
        ChainageTable corrected = siteData.readCorrected(siteId)
                .orElseThrow(() -> new MissingInputException(siteId, "Sin serie corregida"));
        ResultFragment fragment = trendFitter.fitFragment(corrected);
        log.info("[{}] Tendencias ajustadas en {} transectos.", siteId, fragment.size());
        return fragment;
    }
}
