package ai.nda.redline.finding;

/**
 * Raised for malformed findings or selections before any document is touched.
 */
public class InvalidFindingException extends IllegalArgumentException {

    public InvalidFindingException(String message) {
        super(message);
    }

    public InvalidFindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
