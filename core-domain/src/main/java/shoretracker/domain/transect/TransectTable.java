package shoretracker.domain.transect;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Colección compartida de transectos de todos los sitios, indexada por id de transecto.
 * <p>
 * Es un recurso mutable: no es thread-safe y sus escrituras deben serializarse (un único
 * escritor aplica los fragmentos). El conjunto de ids es la fuente de verdad de existencia:
 * nunca se eliminan filas y sólo se añaden al cargar la tabla.
 */
@Slf4j
public class TransectTable {

    private final Map<String, Transect> rows = new LinkedHashMap<>();
    private final Set<String> columns = new LinkedHashSet<>();
    // Miembros de la colección distintos de type/features (name, crs...), sin interpretar.
    private final Map<String, Object> collectionMembers = new LinkedHashMap<>();

    public TransectTable() {
    }

    public TransectTable(Collection<Transect> transects) {
        transects.forEach(this::add);
    }

    /**
     * Añade un transecto. Los ids duplicados se descartan conservando el primero.
     */
    public boolean add(Transect transect) {
        if (rows.containsKey(transect.getId())) {
            log.debug("Transecto duplicado {} descartado.", transect.getId());
            return false;
        }
        rows.put(transect.getId(), transect);
        columns.addAll(transect.getAttributes().keySet());
        return true;
    }

    public Transect get(String id) {
        return rows.get(id);
    }

    public boolean contains(String id) {
        return rows.containsKey(id);
    }

    public int size() {
        return rows.size();
    }

    public List<String> ids() {
        return new ArrayList<>(rows.keySet());
    }

    public Collection<Transect> transects() {
        return Collections.unmodifiableCollection(rows.values());
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Registra una columna nueva; las filas que no la tienen la leen como null.
     */
    public void addColumn(String column) {
        columns.add(column);
    }

    public Double value(String id, String column) {
        Transect t = rows.get(id);
        return t == null ? null : t.getAttribute(column);
    }

    public void setValue(String id, String column, Double value) {
        Transect t = rows.get(id);
        if (t == null) {
            throw new IllegalArgumentException("Transecto inexistente: " + id);
        }
        columns.add(column);
        t.setAttribute(column, value);
    }

    /**
     * Transectos de un sitio en el orden de la tabla (el orden a lo largo de la costa).
     */
    public List<Transect> forSite(String siteId) {
        List<Transect> out = new ArrayList<>();
        for (Transect t : rows.values()) {
            if (siteId.equals(t.getSiteId())) {
                out.add(t);
            }
        }
        return out;
    }

    public Set<String> siteIds() {
        Set<String> sites = new LinkedHashSet<>();
        for (Transect t : rows.values()) {
            if (t.getSiteId() != null) {
                sites.add(t.getSiteId());
            }
        }
        return sites;
    }

    public Map<String, Object> collectionMembers() {
        return Collections.unmodifiableMap(collectionMembers);
    }

    public void putCollectionMember(String name, Object value) {
        collectionMembers.put(name, value);
    }

    /**
     * Copia profunda, para lecturas fuera del cerrojo del escritor.
     */
    public TransectTable copy() {
        TransectTable copy = new TransectTable();
        for (Transect t : rows.values()) {
            copy.add(t.copy());
        }
        copy.columns.addAll(columns);
        copy.collectionMembers.putAll(collectionMembers);
        return copy;
    }
}
