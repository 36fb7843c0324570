package shoretracker.domain.observation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Observación fechada de un satélite: distancia (chainage) por transecto.
 * <p>
 * La identidad es (date, satellite). El chainage de un transecto puede ser null cuando la
 * línea de costa no cortó ese transecto en la imagen.
 */
public record Observation(Instant date, String satellite, Map<String, Double> chainages) {

    public Observation {
        Objects.requireNonNull(date, "date");
        // LinkedHashMap: conserva el orden de columnas y admite nulos (Map.copyOf no).
        chainages = Collections.unmodifiableMap(new LinkedHashMap<>(chainages));
    }

    public Double chainage(String transectId) {
        return chainages.get(transectId);
    }

    public Observation withChainages(Map<String, Double> replacement) {
        return new Observation(date, satellite, replacement);
    }
}
