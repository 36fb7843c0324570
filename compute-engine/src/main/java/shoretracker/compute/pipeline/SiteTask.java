package shoretracker.compute.pipeline;

/**
 * Trabajo de una etapa sobre un sitio. Devuelve un resumen para el log.
 */
@FunctionalInterface
public interface SiteTask {

    String run(String siteId) throws Exception;
}
