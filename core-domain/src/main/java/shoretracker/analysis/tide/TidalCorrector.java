package shoretracker.analysis.tide;

import lombok.extern.slf4j.Slf4j;
import shoretracker.analysis.despike.Despiker;
import shoretracker.config.TidalCorrectionConfig;
import shoretracker.domain.exception.AlignmentFailureException;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;
import shoretracker.domain.series.TimeGrid;
import shoretracker.domain.tide.TideSeries;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Alinea la serie de mareas con las observaciones y corrige el chainage de cada transecto.
 * <p>
 * Para el transecto t en el instante T: {@code corregido = bruto + marea(T) / pendiente(t)}.
 * La marea dividida por la pendiente aproxima el desplazamiento horizontal de la orilla
 * debido al nivel de marea.
 * <ul>
 * <li>Ambos ejes se redondean a la malla de alineación (10 min por defecto).</li>
 * <li>Una fila sin marea casada recibe corrección cero: no se elimina.</li>
 * <li>Si ninguna fila casa con la marea, la corrección no tiene sentido y se lanza
 * {@link AlignmentFailureException}.</li>
 * <li>Tras corregir se aplica el despike columna a columna; el satélite no se corrige ni se
 * filtra.</li>
 * </ul>
 * Es determinista: mismas entradas, misma salida bit a bit.
 */
@Slf4j
public class TidalCorrector {

    private final Despiker despiker;
    private final TidalCorrectionConfig config;

    public TidalCorrector(Despiker despiker, TidalCorrectionConfig config) {
        this.despiker = despiker;
        this.config = config;
    }

    /**
     * @param raw         Tabla bruta del sitio.
     * @param tides       Mareas del sitio (se redondean aquí).
     * @param beachSlopes Pendiente por transecto, en el orden de los transectos a lo largo de la costa;
     *                    puede tener huecos.
     */
    public CorrectionResult correct(ChainageTable raw, TideSeries tides, Map<String, Double> beachSlopes) {
        String siteId = raw.siteId();
        if (raw.isEmpty()) {
            return new CorrectionResult(raw, raw, 0, Set.of(), Set.copyOf(raw.transectIds()));
        }

        TideSeries alignedTides = tides.rounded(config.alignmentResolution());

        // 1. Marea casada por fila (null = sin marea)
        List<Double> tidePerRow = new ArrayList<>(raw.size());
        int matched = 0;
        for (Observation o : raw.rows()) {
            Double h = alignedTides.heightAt(TimeGrid.round(o.date(), config.alignmentResolution())).orElse(null);
            tidePerRow.add(h);
            if (h != null) {
                matched++;
            }
        }
        if (matched == 0) {
            throw new AlignmentFailureException(siteId, String.format(
                    "Ninguna de las %d observaciones casa con las %d mareas disponibles", raw.size(), tides.size()));
        }
        if (matched < raw.size()) {
            log.warn("[{}] {} de {} observaciones sin marea: corrección cero.", siteId, raw.size() - matched, raw.size());
        }

        // 2. Pendientes sin huecos
        List<String> order = new ArrayList<>(beachSlopes.keySet());
        for (String id : raw.transectIds()) {
            if (!beachSlopes.containsKey(id)) {
                order.add(id);
            }
        }
        Map<String, Double> slopes = SlopeGapFiller.fill(order, beachSlopes);
        Set<String> uncorrected = new LinkedHashSet<>();
        for (String id : raw.transectIds()) {
            if (slopes.get(id) == null) {
                uncorrected.add(id);
            }
        }
        if (!uncorrected.isEmpty()) {
            log.warn("[{}] {} transectos sin pendiente en todo el sitio: se dejan sin corregir.", siteId, uncorrected.size());
        }

        // 3. Corrección
        List<Observation> correctedRows = new ArrayList<>(raw.size());
        for (int r = 0; r < raw.size(); r++) {
            Observation o = raw.rows().get(r);
            Double tide = tidePerRow.get(r);
            Map<String, Double> values = new LinkedHashMap<>();
            for (String id : raw.transectIds()) {
                Double chainage = o.chainage(id);
                Double slope = slopes.get(id);
                if (chainage == null || chainage.isNaN()) {
                    values.put(id, null);
                } else if (tide == null || slope == null) {
                    values.put(id, chainage);
                } else {
                    values.put(id, chainage + tide / slope);
                }
            }
            correctedRows.add(o.withChainages(values));
        }
        ChainageTable corrected = new ChainageTable(siteId, raw.transectIds(), correctedRows);

        // 4. Despike por columna
        Set<String> empty = new LinkedHashSet<>();
        ChainageTable despiked = despikeColumns(corrected, empty);
        if (!empty.isEmpty()) {
            log.warn("[{}] Sin datos utilizables tras el despike en {} transectos.", siteId, empty.size());
        }

        return new CorrectionResult(corrected, despiked, matched, uncorrected, empty);
    }

    /**
     * Aplica el despike a cada columna y reconstruye la tabla conservando sólo las filas con
     * algún valor superviviente. El satélite de cada fila superviviente es el de la fila bruta,
     * por lo que el número de filas con satélite puede no coincidir con el de cada columna.
     */
    private ChainageTable despikeColumns(ChainageTable corrected, Set<String> emptyTransects) {
        int rowCount = corrected.size();
        Map<String, boolean[]> keptByColumn = new HashMap<>();
        for (String id : corrected.transectIds()) {
            int[] kept = despiker.retainedRowPositions(corrected.column(id), config.despikeThreshold());
            boolean[] mask = new boolean[rowCount];
            for (int r : kept) {
                mask[r] = true;
            }
            keptByColumn.put(id, mask);
            if (kept.length == 0) {
                emptyTransects.add(id);
            }
        }

        List<Observation> rows = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            Observation o = corrected.rows().get(r);
            Map<String, Double> values = new LinkedHashMap<>();
            boolean any = false;
            for (String id : corrected.transectIds()) {
                if (keptByColumn.get(id)[r]) {
                    values.put(id, o.chainage(id));
                    any = true;
                } else {
                    values.put(id, null);
                }
            }
            if (any) {
                rows.add(o.withChainages(values));
            }
        }
        return new ChainageTable(corrected.siteId(), corrected.transectIds(), rows);
    }
}
