package shoretracker.domain.transect;

import lombok.Getter;
import org.locationtech.jts.geom.LineString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Línea de referencia fija, de tierra a mar, sobre la que se mide el chainage.
 * <p>
 * La geometría se crea una vez (levantamiento externo). Los atributos numéricos los
 * modifican las etapas de pendiente y tendencia y persisten hasta la siguiente ejecución.
 */
@Getter
public class Transect {

    private final String id;
    private final String siteId;
    private final LineString geometry;
    private final Map<String, Double> attributes;
    /** Propiedades no numéricas tal como se leyeron (texto, booleanos, listas, objetos). */
    private final Map<String, Object> passthroughProperties;
    /** Geometría original sin interpretar; null si el transecto no viene de fichero. */
    private final Object sourceGeometry;

    public Transect(String id, String siteId, LineString geometry) {
        this(id, siteId, geometry, Map.of());
    }

    public Transect(String id, String siteId, LineString geometry, Map<String, Double> attributes) {
        this(id, siteId, geometry, attributes, Map.of(), null);
    }

    public Transect(String id, String siteId, LineString geometry, Map<String, Double> attributes,
                    Map<String, Object> passthroughProperties, Object sourceGeometry) {
        this.id = Objects.requireNonNull(id, "id");
        this.siteId = siteId;
        this.geometry = geometry;
        this.attributes = new LinkedHashMap<>(attributes);
        this.passthroughProperties = Collections.unmodifiableMap(new LinkedHashMap<>(passthroughProperties));
        this.sourceGeometry = sourceGeometry;
    }

    public Double getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasValue(String name) {
        return !TransectAttributes.isMissing(attributes.get(name));
    }

    void setAttribute(String name, Double value) {
        attributes.put(name, value);
    }

    public Map<String, Double> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Transect copy() {
        return new Transect(id, siteId, geometry, attributes, passthroughProperties, sourceGeometry);
    }

    @Override
    public String toString() {
        return "Transect[" + id + " @ " + siteId + " " + attributes + "]";
    }
}
