package shoretracker.compute.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resumen agregado de una ejecución; se imprime como JSON en la salida estándar.
 * Los instantes de inicio y fin se serializan en ISO-8601 (UTC).
 */
public record RunSummary(
        String stage,
        Instant startedAt,
        Instant finishedAt,
        List<String> succeeded,
        Map<String, String> failed,
        Map<String, String> skipped,
        int transectsUpdated
) {

    public RunSummary {
        succeeded = List.copyOf(succeeded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }

    public static RunSummary of(Stage stage, Instant startedAt, Collection<SiteOutcome> outcomes, int transectsUpdated) {
        List<String> ok = new ArrayList<>();
        Map<String, String> ko = new LinkedHashMap<>();
        Map<String, String> omitted = new LinkedHashMap<>();
        for (SiteOutcome o : outcomes) {
            switch (o.status()) {
                case SUCCEEDED -> ok.add(o.siteId());
                case FAILED -> ko.put(o.siteId(), o.detail());
                case SKIPPED -> omitted.put(o.siteId(), o.detail());
            }
        }
        return new RunSummary(stage.cliName(), startedAt, Instant.now(), ok, ko, omitted, transectsUpdated);
    }

    public int total() {
        return succeeded.size() + failed.size() + skipped.size();
    }
}
