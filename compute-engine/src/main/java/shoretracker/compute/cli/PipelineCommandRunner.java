package shoretracker.compute.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import shoretracker.compute.pipeline.PipelineRequest;
import shoretracker.compute.pipeline.PipelineService;
import shoretracker.compute.pipeline.RunSummary;
import shoretracker.compute.pipeline.Stage;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Interfaz de línea de comandos.
 * <pre>
 *   --stage=download|tides-fetch|tides-apply|slope|trends|aggregate|all
 *   --sites=nzd0001,nzd0002      (opcional)
 *   --output=ruta.geojson        (opcional, por defecto sobrescribe la tabla de entrada)
 *   --recompute-slopes           (opcional)
 *   --base=ruta --fragments=a.geojson,b.geojson --update-columns=trend,r2_score   (agregación)
 * </pre>
 * El {@link RunSummary} se imprime como JSON en la salida estándar; el log va a stderr.
 * Códigos de salida: 0 ejecución completada, 1 error irrecuperable, 2 argumentos inválidos.
 */
@Slf4j
@Component
@Order(1)
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PipelineService pipeline;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile int exitCode = EXIT_OK;

    @Autowired
    public PipelineCommandRunner(PipelineService pipeline, ObjectMapper objectMapper) {
        this(pipeline, objectMapper, System.out);
    }

    public PipelineCommandRunner(PipelineService pipeline, ObjectMapper objectMapper, PrintStream out) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineRequest request;
        try {
            request = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Argumentos inválidos: {}", e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            RunSummary summary = pipeline.run(request);
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary));
            exitCode = EXIT_OK;
        } catch (JsonProcessingException e) {
            log.error("No se pudo serializar el resumen.", e);
            exitCode = EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Error irrecuperable en la etapa '{}'.", request.stage().cliName(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static PipelineRequest parse(ApplicationArguments args) {
        String stageName = single(args, "stage");
        if (stageName == null) {
            throw new IllegalArgumentException("Falta --stage");
        }
        Stage stage = Stage.fromCli(stageName);

        List<Path> fragments = new ArrayList<>();
        for (String f : list(args, "fragments")) {
            fragments.add(Path.of(f));
        }
        List<String> columns = list(args, "update-columns");
        Set<String> updateColumns = columns.isEmpty() ? null : new LinkedHashSet<>(columns);
        String output = single(args, "output");
        String base = single(args, "base");

        if (stage != Stage.AGGREGATE && (!fragments.isEmpty() || base != null || updateColumns != null)) {
            throw new IllegalArgumentException("--base, --fragments y --update-columns sólo valen con --stage=aggregate");
        }
        return new PipelineRequest(
                stage,
                list(args, "sites"),
                output == null ? null : Path.of(output),
                base == null ? null : Path.of(base),
                fragments,
                updateColumns,
                args.containsOption("recompute-slopes"));
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " sólo admite un valor");
        }
        String value = values.get(0);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " sin valor");
        }
        return value.trim();
    }

    /**
     * Admite la opción repetida y valores separados por comas.
     */
    private static List<String> list(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String v : values) {
            for (String part : v.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
