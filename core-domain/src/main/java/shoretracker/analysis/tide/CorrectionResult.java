package shoretracker.analysis.tide;

import shoretracker.domain.observation.ChainageTable;

import java.util.Set;

/**
 * Resultado de la corrección mareal de un sitio.
 *
 * @param corrected             Tabla corregida antes del despike (mismas filas que la bruta).
 * @param despiked              Tabla corregida y filtrada: sólo filas con algún valor superviviente;
 *                              el satélite de cada fila es el de la fila bruta de origen.
 * @param matchedRows           Filas con marea casada (las demás tienen corrección cero).
 * @param uncorrectedTransects  Transectos sin ninguna pendiente utilizable en el sitio (corrección cero).
 * @param emptyTransects        Transectos sin datos utilizables tras el despike.
 */
public record CorrectionResult(
        ChainageTable corrected,
        ChainageTable despiked,
        int matchedRows,
        Set<String> uncorrectedTransects,
        Set<String> emptyTransects
) {
    public CorrectionResult {
        uncorrectedTransects = Set.copyOf(uncorrectedTransects);
        emptyTransects = Set.copyOf(emptyTransects);
    }
}
