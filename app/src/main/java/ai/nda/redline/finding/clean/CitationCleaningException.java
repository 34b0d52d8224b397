package ai.nda.redline.finding.clean;

/**
 * Runtime exception used to report a citation that could not be cleaned.
 */
public class CitationCleaningException extends RuntimeException {

    public CitationCleaningException(String message) {
        super(message);
    }

    public CitationCleaningException(String message, Throwable cause) {
        super(message, cause);
    }
}
