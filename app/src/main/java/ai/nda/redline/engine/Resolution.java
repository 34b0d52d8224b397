package ai.nda.redline.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of resolving a citation against a whole document.
 */
public record Resolution(Kind kind, Optional<MatchSpan> span) {

    public enum Kind {
        FOUND,
        NOT_FOUND,
        AMBIGUOUS
    }

    public Resolution {
        Objects.requireNonNull(kind, "kind");
        span = span == null ? Optional.empty() : span;
        if (kind == Kind.FOUND && span.isEmpty()) {
            throw new IllegalArgumentException("found resolution requires a span");
        }
    }

    public static Resolution found(MatchSpan span) {
        return new Resolution(Kind.FOUND, Optional.of(span));
    }

    public static Resolution notFound() {
        return new Resolution(Kind.NOT_FOUND, Optional.empty());
    }

    public static Resolution ambiguous() {
        return new Resolution(Kind.AMBIGUOUS, Optional.empty());
    }
}
