package shoretracker.domain.exception;

/**
 * Falta una entrada obligatoria (serie de transectos, caché de mareas, transectos del sitio...).
 * La etapa se omite para ese sitio; el resto de sitios continúa.
 */
public class MissingInputException extends ShorelineProcessingException {

    public MissingInputException(String siteId, String message) {
        super(siteId, message);
    }
}
