package shoretracker.domain.transect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabla parcial producida por una etapa para un sitio, indexada por id de transecto y con
 * sólo las columnas que calcula esa etapa. Es transitoria: la consume el agregador.
 * <p>
 * {@code siteId} puede ser null para fragmentos multi-sitio (salidas recombinadas).
 */
public final class ResultFragment {

    private final String siteId;
    private final String stage;
    private final Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
    private final Set<String> columns = new LinkedHashSet<>();

    public ResultFragment(String siteId, String stage) {
        this.siteId = siteId;
        this.stage = stage;
    }

    public String siteId() {
        return siteId;
    }

    public String stage() {
        return stage;
    }

    public ResultFragment put(String transectId, String column, Double value) {
        rows.computeIfAbsent(transectId, k -> new LinkedHashMap<>()).put(column, value);
        columns.add(column);
        return this;
    }

    /**
     * Declara una columna aunque ninguna fila tenga valor (p.ej. al leer un fichero).
     */
    public ResultFragment declareColumn(String column) {
        columns.add(column);
        return this;
    }

    public List<String> rowIds() {
        return new ArrayList<>(rows.keySet());
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(columns);
    }

    public boolean hasRow(String transectId) {
        return rows.containsKey(transectId);
    }

    public Double value(String transectId, String column) {
        Map<String, Double> row = rows.get(transectId);
        return row == null ? null : row.get(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public String toString() {
        return "ResultFragment[" + stage + "@" + siteId + ", " + rows.size() + " filas, columnas " + columns + "]";
    }
}
