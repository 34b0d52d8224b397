package ai.nda.redline.engine;

import java.util.Objects;

/**
 * Matching and editing rules for one batch.
 */
public record EditPolicy(boolean ignoreCase,
                         boolean skipIfSame,
                         String author,
                         double fuzzyThreshold,
                         MatchPolicy matchPolicy) {

    public static final String DEFAULT_AUTHOR = "AI Compliance Reviewer";

    public EditPolicy {
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        if (fuzzyThreshold <= 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be in (0, 1]");
        }
        matchPolicy = Objects.requireNonNullElse(matchPolicy, MatchPolicy.FIRST);
    }

    public static EditPolicy defaults() {
        return new EditPolicy(false, true, DEFAULT_AUTHOR, SpanResolver.DEFAULT_FUZZY_THRESHOLD, MatchPolicy.FIRST);
    }

    public EditPolicy withAuthor(String value) {
        return new EditPolicy(ignoreCase, skipIfSame, value, fuzzyThreshold, matchPolicy);
    }

    public EditPolicy withIgnoreCase(boolean value) {
        return new EditPolicy(value, skipIfSame, author, fuzzyThreshold, matchPolicy);
    }

    public EditPolicy withSkipIfSame(boolean value) {
        return new EditPolicy(ignoreCase, value, author, fuzzyThreshold, matchPolicy);
    }

    public EditPolicy withMatchPolicy(MatchPolicy value) {
        return new EditPolicy(ignoreCase, skipIfSame, author, fuzzyThreshold, value);
    }

    /**
     * Tracked output always falls back to case-insensitive matching; clean output only when asked to.
     */
    public boolean caseFallback(RevisionMode mode) {
        return mode == RevisionMode.TRACKED || ignoreCase;
    }
}
