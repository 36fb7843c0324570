package shoretracker.compute.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Argumentos ya validados de una ejecución.
 *
 * @param sites         Filtro de sitios; vacío para todos.
 * @param output        Destino de la tabla de transectos; {@code null} para sobrescribir la de entrada.
 * @param base          Tabla base de la etapa de agregación; {@code null} para la configurada.
 * @param updateColumns Columnas a fusionar en la agregación; {@code null} para todas.
 */
public record PipelineRequest(
        Stage stage,
        List<String> sites,
        Path output,
        Path base,
        List<Path> fragments,
        Set<String> updateColumns,
        boolean recomputeSlopes
) {

    public PipelineRequest {
        sites = sites == null ? List.of() : List.copyOf(sites);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        updateColumns = updateColumns == null ? null : Set.copyOf(updateColumns);
    }

    public static PipelineRequest of(Stage stage) {
        return new PipelineRequest(stage, List.of(), null, null, List.of(), null, false);
    }
}
