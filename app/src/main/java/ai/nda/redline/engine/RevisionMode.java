package ai.nda.redline.engine;

import java.util.Locale;

/**
 * Output variant produced from a batch of findings.
 */
public enum RevisionMode {
    /** Word revisions: deletions and insertions attributed to an author. */
    TRACKED,
    /** Text replaced in place without markup. */
    CLEAN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RevisionMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Revision mode must be provided");
        }
        return RevisionMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
