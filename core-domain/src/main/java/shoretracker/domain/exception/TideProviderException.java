package shoretracker.domain.exception;

import lombok.Getter;

/**
 * Fallo al consultar el proveedor de mareas.
 * <p>
 * {@code rateLimited} distingue la señal de límite de peticiones (HTTP 429) del resto de
 * errores, porque la política de reintentos aplica esperas distintas a cada clase.
 */
@Getter
public class TideProviderException extends ShorelineProcessingException {

    private final boolean rateLimited;

    public TideProviderException(String siteId, String message, boolean rateLimited) {
        super(siteId, message);
        this.rateLimited = rateLimited;
    }

    public TideProviderException(String siteId, String message, Throwable cause) {
        super(siteId, message, cause);
        this.rateLimited = false;
    }

    public static TideProviderException rateLimited(String siteId, String message) {
        return new TideProviderException(siteId, message, true);
    }
}
