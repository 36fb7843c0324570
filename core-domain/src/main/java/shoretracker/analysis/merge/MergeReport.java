package shoretracker.analysis.merge;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resumen de la aplicación de uno o varios fragmentos sobre la tabla base.
 *
 * @param updatedIds     Transectos con al menos una celda modificada.
 * @param addedColumns   Columnas que no existían en la base.
 * @param ignoredRows    Filas del fragmento sin transecto en la base o de otro sitio.
 */
public record MergeReport(Set<String> updatedIds, Set<String> addedColumns, int ignoredRows) {

    public MergeReport {
        updatedIds = Collections.unmodifiableSet(new LinkedHashSet<>(updatedIds));
        addedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(addedColumns));
    }

    public static MergeReport empty() {
        return new MergeReport(Set.of(), Set.of(), 0);
    }
}
