package shoretracker.analysis.slope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shoretracker.config.SlopeEstimationConfig;
import shoretracker.domain.exception.AlignmentFailureException;
import shoretracker.domain.exception.NumericalFailureException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;
import shoretracker.domain.series.TimeGrid;
import shoretracker.domain.tide.TideSeries;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectAttributes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Estima la pendiente de la playa de los transectos de un sitio a partir de la serie bruta
 * de chainage y la serie de mareas.
 * <p>
 * Flujo por sitio:
 * <ol>
 *   <li>Alinear observaciones y mareas en la malla de 10 min y quedarse con los instantes comunes.</li>
 *   <li>Buscar el pico mareal una sola vez con la marea alineada.</li>
 *   <li>Para cada transecto: descartar huecos, generar una serie corregida por pendiente de prueba
 *   e integrar el espectro.</li>
 * </ol>
 * Un fallo numérico en un transecto se registra y el transecto se omite: no aborta el sitio.
 */
@Slf4j
@RequiredArgsConstructor
public class SlopeEstimator {

    public static final String STAGE = "slope";

    private final SlopeFitter fitter;
    private final Duration alignmentResolution;

    /**
     * Transectos del sitio que necesitan pendiente: los que no la tienen, o todos si se pide recalcular.
     */
    public static List<String> candidates(Collection<Transect> siteTransects, SlopeEstimationConfig config) {
        List<String> ids = new ArrayList<>();
        for (Transect t : siteTransects) {
            if (config.recompute() || !t.hasValue(TransectAttributes.BEACH_SLOPE)) {
                ids.add(t.getId());
            }
        }
        return ids;
    }

    public ResultFragment estimate(ChainageTable raw, TideSeries tides, Collection<String> transectIds,
                                   SlopeEstimationConfig config) {
        String siteId = raw.siteId();
        ResultFragment fragment = new ResultFragment(siteId, STAGE);
        TransectAttributes.SLOPE_COLUMNS.forEach(fragment::declareColumn);
        if (transectIds.isEmpty()) {
            log.info("[{}] Todos los transectos tienen ya pendiente.", siteId);
            return fragment;
        }

        // 1. Instantes comunes
        TideSeries alignedTides = tides.rounded(alignmentResolution);
        List<Instant> dates = new ArrayList<>();
        List<Observation> rows = new ArrayList<>();
        List<Double> tideValues = new ArrayList<>();
        for (Observation o : raw.rows()) {
            Instant rounded = TimeGrid.round(o.date(), alignmentResolution);
            if (!config.inAnalysisWindow(rounded)) {
                continue;
            }
            alignedTides.heightAt(rounded).ifPresent(h -> {
                dates.add(rounded);
                rows.add(o);
                tideValues.add(h);
            });
        }
        if (dates.isEmpty()) {
            throw new AlignmentFailureException(siteId, String.format(
                    "Sin instantes comunes entre %d observaciones y %d mareas", raw.size(), tides.size()));
        }
        if (dates.size() < raw.size()) {
            log.warn("[{}] Fechas desalineadas: se usan {} de {} observaciones.", siteId, dates.size(), raw.size());
        }

        // 2. Pico mareal
        double[] tide = tideValues.stream().mapToDouble(Double::doubleValue).toArray();
        double peak;
        try {
            peak = fitter.findTidePeak(dates, tide, config);
        } catch (NumericalFailureException e) {
            throw new NumericalFailureException(siteId, "No se pudo localizar el pico mareal: " + e.getMessage(), e);
        }
        log.debug("[{}] Pico mareal en {} Hz ({} días).", siteId, peak, 1.0 / peak / SlopeEstimationConfig.SECONDS_IN_DAY);

        double[] slopes = SlopeGrid.range(config.slopeMin(), config.slopeMax(), config.deltaSlope());

        // 3. Transecto a transecto
        int estimated = 0;
        for (String id : transectIds) {
            if (!raw.transectIds().contains(id)) {
                log.debug("[{}] {} sin columna en la serie temporal.", siteId, id);
                continue;
            }
            List<Instant> tDates = new ArrayList<>();
            List<double[]> pairs = new ArrayList<>();
            for (int r = 0; r < rows.size(); r++) {
                Double chainage = rows.get(r).chainage(id);
                if (chainage != null && !chainage.isNaN()) {
                    tDates.add(dates.get(r));
                    pairs.add(new double[]{chainage, tide[r]});
                }
            }
            if (tDates.isEmpty()) {
                log.warn("[{}] {} sin datos válidos, se omite.", siteId, id);
                continue;
            }

            List<double[]> trials = new ArrayList<>(slopes.length);
            for (double slope : slopes) {
                double[] corrected = new double[pairs.size()];
                for (int i = 0; i < corrected.length; i++) {
                    corrected[i] = pairs.get(i)[0] + pairs.get(i)[1] / slope;
                }
                trials.add(corrected);
            }

            try {
                SlopeFit fit = fitter.integratePowerSpectrum(tDates, trials, slopes, config, peak);
                fragment.put(id, TransectAttributes.BEACH_SLOPE, fit.slope())
                        .put(id, TransectAttributes.CIL, fit.ciLow())
                        .put(id, TransectAttributes.CIU, fit.ciHigh());
                estimated++;
                log.debug("[{}] Pendiente en {}: {}", siteId, id, String.format("%.3f", fit.slope()));
            } catch (NumericalFailureException e) {
                log.warn("[{}] No se pudo estimar la pendiente de {}: {}", siteId, id, e.getMessage());
            }
        }
        log.info("[{}] Pendiente estimada en {} de {} transectos.", siteId, estimated, transectIds.size());
        return fragment;
    }
}
