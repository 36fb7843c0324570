package shoretracker.compute.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import shoretracker.compute.config.EngineProperties;
import shoretracker.domain.exception.MissingInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reparte una etapa entre sitios con un pool fijo de hilos.
 * <p>
 * Cada sitio es independiente: una entrada ausente lo omite, cualquier otro error lo marca
 * como fallido, y en ningún caso se detienen los demás.
 */
@Slf4j
@Component
public class SitePipelineRunner {

    private final int workers;

    @Autowired
    public SitePipelineRunner(EngineProperties properties) {
        this(properties.effectiveWorkers());
    }

    public SitePipelineRunner(int workers) {
        this.workers = Math.max(workers, 1);
    }

    public List<SiteOutcome> run(Stage stage, List<String> siteIds, SiteTask task) {
        if (siteIds.isEmpty()) {
            log.info("[{}] Ningún sitio que procesar.", stage.cliName());
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        ExecutorService threadPool = Executors.newFixedThreadPool(Math.min(workers, siteIds.size()));
        try {
            List<Callable<SiteOutcome>> tasks = new ArrayList<>(siteIds.size());
            for (String siteId : siteIds) {
                tasks.add(() -> runSite(stage, siteId, task));
            }

            List<Future<SiteOutcome>> futures;
            try {
                futures = threadPool.invokeAll(tasks);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Ejecución de la etapa " + stage.cliName() + " interrumpida.", e);
            }

            List<SiteOutcome> outcomes = new ArrayList<>(siteIds.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(SiteOutcome.failed(siteIds.get(i), describe(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Ejecución de la etapa " + stage.cliName() + " interrumpida.", e);
                }
            }
            log.info("[{}] {} sitios procesados en {} ms.", stage.cliName(), outcomes.size(),
                    System.currentTimeMillis() - startTime);
            return outcomes;
        } finally {
            threadPool.shutdownNow();
        }
    }

    private SiteOutcome runSite(Stage stage, String siteId, SiteTask task) {
        log.info("[{}] Inicio de '{}'.", siteId, stage.cliName());
        try {
            String detail = task.run(siteId);
            log.info("[{}] '{}' completada: {}", siteId, stage.cliName(), detail);
            return SiteOutcome.succeeded(siteId, detail);
        } catch (MissingInputException e) {
            log.warn("[{}] Se omite '{}': {}", siteId, stage.cliName(), e.getMessage());
            return SiteOutcome.skipped(siteId, e.getMessage());
        } catch (Exception e) {
            log.error("[{}] Fallo en '{}'.", siteId, stage.cliName(), e);
            return SiteOutcome.failed(siteId, describe(e));
        }
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
