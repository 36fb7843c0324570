package shoretracker.domain.exception;

/**
 * El ajuste numérico (pendiente espectral, regresión) no está definido para la entrada.
 */
public class NumericalFailureException extends ShorelineProcessingException {

    public NumericalFailureException(String siteId, String message) {
        super(siteId, message);
    }

    public NumericalFailureException(String siteId, String message, Throwable cause) {
        super(siteId, message, cause);
    }
}
