package ai.nda.redline.engine;

import java.util.Locale;

/**
 * What to do when a citation matches several places equally well.
 */
public enum MatchPolicy {
    /** Take the leftmost occurrence in document order. */
    FIRST,
    /** Skip the finding and report it as ambiguous. */
    REJECT_AMBIGUOUS;

    public static MatchPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIRST;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "first" -> FIRST;
            case "reject-ambiguous" -> REJECT_AMBIGUOUS;
            default -> throw new IllegalArgumentException("Unsupported match policy: " + raw);
        };
    }
}
