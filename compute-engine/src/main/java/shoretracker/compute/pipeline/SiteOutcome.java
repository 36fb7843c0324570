package shoretracker.compute.pipeline;

/**
 * Resultado de una etapa en un sitio.
 *
 * @param detail Resumen legible o motivo del fallo/omisión.
 */
public record SiteOutcome(String siteId, Status status, String detail) {

    public enum Status {
        SUCCEEDED, FAILED, SKIPPED
    }

    public static SiteOutcome succeeded(String siteId, String detail) {
        return new SiteOutcome(siteId, Status.SUCCEEDED, detail);
    }

    public static SiteOutcome failed(String siteId, String reason) {
        return new SiteOutcome(siteId, Status.FAILED, reason);
    }

    public static SiteOutcome skipped(String siteId, String reason) {
        return new SiteOutcome(siteId, Status.SKIPPED, reason);
    }
}
