package shoretracker.domain.exception;

/**
 * Dos series temporales que deben unirse no comparten ninguna marca de tiempo.
 * Es fatal para la etapa del sitio, nunca para la ejecución completa.
 */
public class AlignmentFailureException extends ShorelineProcessingException {

    public AlignmentFailureException(String siteId, String message) {
        super(siteId, message);
    }
}
