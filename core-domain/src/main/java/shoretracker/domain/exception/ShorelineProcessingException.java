package shoretracker.domain.exception;

import lombok.Getter;

/**
 * Raíz de la taxonomía de errores del procesado de línea de costa.
 * <p>
 * Todas las excepciones de la cadena son unchecked y llevan el sitio afectado,
 * de modo que el orquestador pueda registrar el fallo y continuar con los demás.
 */
@Getter
public class ShorelineProcessingException extends RuntimeException {

    private final String siteId;

    public ShorelineProcessingException(String siteId, String message) {
        super(message);
        this.siteId = siteId;
    }

    public ShorelineProcessingException(String siteId, String message, Throwable cause) {
        super(message, cause);
        this.siteId = siteId;
    }
}
