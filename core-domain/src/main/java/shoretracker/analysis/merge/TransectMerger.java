package shoretracker.analysis.merge;

import lombok.extern.slf4j.Slf4j;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectAttributes;
import shoretracker.domain.transect.TransectTable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aplica fragmentos de resultados sobre la tabla compartida de transectos.
 * <p>
 * Reglas:
 * <ul>
 *   <li>La base manda en la existencia: no se crean ni se borran filas; las filas del
 *   fragmento sin transecto en la base se ignoran.</li>
 *   <li>Sólo se tocan las celdas de las filas presentes en el fragmento.</li>
 *   <li>En {@link MergeMode#SKIP_NULLS} un nulo o NaN del fragmento nunca borra un valor.</li>
 *   <li>Las columnas nuevas se añaden a la base; el resto de filas las leen como null.</li>
 *   <li>Los fragmentos se aplican en orden: a igual celda gana el último.</li>
 * </ul>
 * Muta la tabla recibida; el llamante debe serializar las escrituras.
 */
@Slf4j
public class TransectMerger {

    public MergeReport merge(TransectTable base, ResultFragment fragment) {
        return merge(base, fragment, MergeMode.SKIP_NULLS, null);
    }

    /**
     * @param columns Columnas a copiar; null = todas las del fragmento.
     */
    public MergeReport merge(TransectTable base, ResultFragment fragment, MergeMode mode, Set<String> columns) {
        Set<String> updated = new LinkedHashSet<>();
        Set<String> added = new LinkedHashSet<>();
        int ignored = 0;

        Set<String> toCopy = new LinkedHashSet<>();
        for (String c : fragment.columns()) {
            if (columns == null || columns.contains(c)) {
                toCopy.add(c);
            }
        }
        if (toCopy.isEmpty()) {
            log.warn("{}: ninguna columna que actualizar.", fragment);
            return MergeReport.empty();
        }
        for (String c : toCopy) {
            if (!base.hasColumn(c)) {
                base.addColumn(c);
                added.add(c);
            }
        }

        for (String id : fragment.rowIds()) {
            Transect target = base.get(id);
            if (target == null) {
                ignored++;
                continue;
            }
            if (fragment.siteId() != null && target.getSiteId() != null && !fragment.siteId().equals(target.getSiteId())) {
                log.warn("{}: el transecto {} pertenece al sitio {}, se ignora.", fragment, id, target.getSiteId());
                ignored++;
                continue;
            }
            for (String c : toCopy) {
                Double value = fragment.value(id, c);
                if (mode == MergeMode.SKIP_NULLS && TransectAttributes.isMissing(value)) {
                    continue;
                }
                base.setValue(id, c, value);
                updated.add(id);
            }
        }
        if (ignored > 0) {
            log.warn("{}: {} filas sin transecto correspondiente en la base.", fragment, ignored);
        }
        log.debug("{}: {} transectos actualizados, columnas nuevas {}.", fragment, updated.size(), added);
        return new MergeReport(updated, added, ignored);
    }

    /**
     * Aplica varios fragmentos en orden y acumula el resumen.
     */
    public MergeReport mergeAll(TransectTable base, List<ResultFragment> fragments, MergeMode mode, Set<String> columns) {
        Set<String> updated = new LinkedHashSet<>();
        Set<String> added = new LinkedHashSet<>();
        int ignored = 0;
        for (ResultFragment f : fragments) {
            MergeReport r = merge(base, f, mode, columns);
            updated.addAll(r.updatedIds());
            added.addAll(r.addedColumns());
            ignored += r.ignoredRows();
        }
        return new MergeReport(updated, added, ignored);
    }
}
