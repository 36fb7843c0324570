package shoretracker.compute.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lectura y escritura de FeatureCollections GeoJSON: tabla de transectos, fragmentos por sitio
 * y polígonos de los sitios.
 * <p>
 * Las propiedades numéricas (y las nulas) forman las columnas de la tabla; el resto de
 * propiedades, la geometría original y los miembros de la colección ({@code name}, {@code crs})
 * se guardan sin interpretar y se reescriben tal cual. Un valor no finito se escribe como null.
 */
@Slf4j
public class GeoJsonFileHandler {

    public static final String ID = "id";
    public static final String SITE_ID = "site_id";

    // Reutilizable y thread-safe.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private final GeometryFactory geometryFactory;

    public GeoJsonFileHandler(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Carga la tabla compartida. Los ids repetidos conservan la primera aparición.
     */
    public TransectTable readTransects(Path path) throws IOException {
        TransectTable table = new TransectTable();
        Set<String> columns = new LinkedHashSet<>();
        JsonNode root = readCollection(path);
        Iterator<Map.Entry<String, JsonNode>> members = root.fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            if (!"type".equals(member.getKey()) && !"features".equals(member.getKey())) {
                table.putCollectionMember(member.getKey(), objectMapper.convertValue(member.getValue(), Object.class));
            }
        }
        for (JsonNode feature : root.path("features")) {
            JsonNode props = feature.path("properties");
            String id = text(props, ID);
            if (id == null) {
                log.warn("Feature sin '{}' en {}, se ignora.", ID, path);
                continue;
            }
            Map<String, Double> attributes = numericProperties(props, columns);
            JsonNode geometryNode = feature.path("geometry");
            Geometry geometry = toGeometry(geometryNode);
            LineString line = geometry instanceof LineString ls ? ls : null;
            Object sourceGeometry = geometryNode.isMissingNode() || geometryNode.isNull()
                    ? null : objectMapper.convertValue(geometryNode, Object.class);
            table.add(new Transect(id, text(props, SITE_ID), line, attributes,
                    passthroughProperties(props), sourceGeometry));
        }
        columns.forEach(table::addColumn);
        log.info("Cargados {} transectos de {}", table.size(), path);
        return table;
    }

    public void writeTransects(TransectTable table, Path path) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "FeatureCollection");
        table.collectionMembers().forEach((name, value) -> root.set(name, objectMapper.valueToTree(value)));
        ArrayNode features = root.putArray("features");
        for (Transect t : table.transects()) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            ObjectNode props = feature.putObject("properties");
            props.put(ID, t.getId());
            if (t.getSiteId() != null) {
                props.put(SITE_ID, t.getSiteId());
            } else {
                props.putNull(SITE_ID);
            }
            t.getPassthroughProperties().forEach((name, value) -> props.set(name, objectMapper.valueToTree(value)));
            for (String column : table.columns()) {
                Double v = t.getAttribute(column);
                if (v == null || !Double.isFinite(v)) {
                    props.putNull(column);
                } else {
                    props.put(column, v);
                }
            }
            if (t.getSourceGeometry() != null) {
                feature.set("geometry", objectMapper.valueToTree(t.getSourceGeometry()));
            } else if (t.getGeometry() != null) {
                ObjectNode geometry = feature.putObject("geometry");
                geometry.put("type", "LineString");
                writeCoordinates(geometry.putArray("coordinates"), t.getGeometry().getCoordinates());
            } else {
                feature.putNull("geometry");
            }
        }

        log.info("Escribiendo {} transectos en {}", table.size(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), root);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Error fatal al escribir el GeoJSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee un fichero de transectos como fragmento: filas por id y sus columnas numéricas.
     * Si todas las filas comparten sitio el fragmento queda asociado a él.
     */
    public ResultFragment readFragment(Path path, String stage) throws IOException {
        Set<String> sites = new LinkedHashSet<>();
        List<String> ids = new ArrayList<>();
        List<Map<String, Double>> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode feature : features(path)) {
            JsonNode props = feature.path("properties");
            String id = text(props, ID);
            if (id == null) {
                continue;
            }
            sites.add(text(props, SITE_ID));
            ids.add(id);
            rows.add(numericProperties(props, columns));
        }
        String siteId = sites.size() == 1 ? sites.iterator().next() : null;
        ResultFragment fragment = new ResultFragment(siteId, stage);
        columns.forEach(fragment::declareColumn);
        for (int i = 0; i < ids.size(); i++) {
            for (Map.Entry<String, Double> cell : rows.get(i).entrySet()) {
                fragment.put(ids.get(i), cell.getKey(), cell.getValue());
            }
        }
        return fragment;
    }

    /**
     * Polígonos de los sitios por id (Polygon o MultiPolygon).
     */
    public Map<String, Geometry> readSitePolygons(Path path) throws IOException {
        Map<String, Geometry> polygons = new LinkedHashMap<>();
        for (JsonNode feature : features(path)) {
            String id = text(feature.path("properties"), ID);
            Geometry geometry = toGeometry(feature.path("geometry"));
            if (id != null && geometry != null) {
                polygons.putIfAbsent(id, geometry);
            }
        }
        log.info("Cargados {} polígonos de sitio de {}", polygons.size(), path);
        return polygons;
    }

    private List<JsonNode> features(Path path) throws IOException {
        List<JsonNode> out = new ArrayList<>();
        readCollection(path).path("features").forEach(out::add);
        return out;
    }

    private JsonNode readCollection(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el GeoJSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new IOException("No es una FeatureCollection GeoJSON: " + path);
        }
        return root;
    }

    private static Map<String, Double> numericProperties(JsonNode props, Set<String> columns) {
        Map<String, Double> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (ID.equals(name) || SITE_ID.equals(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isNumber()) {
                attributes.put(name, value.asDouble());
                columns.add(name);
            } else if (value.isNull()) {
                attributes.put(name, null);
                columns.add(name);
            }
        }
        return attributes;
    }

    private static Map<String, Object> passthroughProperties(JsonNode props) {
        Map<String, Object> passthrough = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (ID.equals(name) || SITE_ID.equals(name) || value.isNumber() || value.isNull()) {
                continue;
            }
            passthrough.put(name, objectMapper.convertValue(value, Object.class));
        }
        return passthrough;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private Geometry toGeometry(JsonNode geometry) {
        if (geometry == null || geometry.isMissingNode() || geometry.isNull()) {
            return null;
        }
        JsonNode coords = geometry.path("coordinates");
        switch (geometry.path("type").asText()) {
            case "LineString":
                return geometryFactory.createLineString(coordinates(coords));
            case "Polygon":
                return polygon(coords);
            case "MultiPolygon":
                List<Polygon> parts = new ArrayList<>();
                coords.forEach(p -> parts.add(polygon(p)));
                return geometryFactory.createMultiPolygon(parts.toArray(new Polygon[0]));
            default:
                log.debug("Geometría {} no soportada, se ignora.", geometry.path("type").asText());
                return null;
        }
    }

    private Polygon polygon(JsonNode rings) {
        LinearRing shell = geometryFactory.createLinearRing(coordinates(rings.get(0)));
        LinearRing[] holes = new LinearRing[Math.max(rings.size() - 1, 0)];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = geometryFactory.createLinearRing(coordinates(rings.get(i)));
        }
        return geometryFactory.createPolygon(shell, holes);
    }

    private static Coordinate[] coordinates(JsonNode array) {
        Coordinate[] out = new Coordinate[array.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode c = array.get(i);
            out[i] = new Coordinate(c.get(0).asDouble(), c.get(1).asDouble());
        }
        return out;
    }

    private static void writeCoordinates(ArrayNode target, Coordinate[] coordinates) {
        for (Coordinate c : coordinates) {
            ArrayNode pair = target.addArray();
            pair.add(c.getX());
            pair.add(c.getY());
        }
    }
}
