package ai.nda.redline.document;

/**
 * Raised when a document cannot be read or parsed. Aborts the whole batch.
 */
public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
