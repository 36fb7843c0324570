package shoretracker.compute;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.Order;
import shoretracker.compute.config.EngineProperties;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Punto de entrada del motor de seguimiento de costa (proceso batch, sin servidor web).
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot con la configuración {@code shoretracker.*}.
 * 2. Verificar las rutas de entrada antes de lanzar la etapa pedida por línea de comandos.
 * 3. Devolver el código de salida calculado por {@link shoretracker.compute.cli.PipelineCommandRunner}.
 */
@Slf4j
@SpringBootApplication
public class ShorelineEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ShorelineEngineApplication.class, args)));
    }

    /**
     * Chequeo de arranque: sólo informa, la etapa decide si una ruta ausente es fatal.
     */
    @Bean
    @Order(0)
    public CommandLineRunner bootstrapCheck(EngineProperties properties) {
        return args -> {
            log.info(">>> BOOTSTRAP: datos en {}, transectos en {}", properties.getDataDir(), properties.getTransectsFile());
            if (!Files.isDirectory(Path.of(properties.getDataDir()))) {
                log.warn(">>> El directorio de datos {} no existe todavía.", properties.getDataDir());
            }
            if (!Files.isRegularFile(Path.of(properties.getTransectsFile()))) {
                log.warn(">>> No se encuentra la tabla de transectos {}.", properties.getTransectsFile());
            }
            if (properties.getTide().getApiKey() == null || properties.getTide().getApiKey().isBlank()) {
                log.warn(">>> NIWA_TIDE_API_KEY no definida: las consultas de marea fallarán.");
            }
            log.info(">>> BOOTSTRAP: {} workers{}", properties.effectiveWorkers(),
                    properties.isValidation() ? " (modo validación, secuencial)" : "");
        };
    }
}
