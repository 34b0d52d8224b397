package ai.nda.redline.engine;

import java.util.Objects;

/**
 * A located citation: raw text offsets {@code [start, end)} within the paragraph with the given ordinal.
 */
public record MatchSpan(int paragraph, int start, int end, MatchConfidence confidence, double score) {

    public MatchSpan {
        if (paragraph < 0) {
            throw new IllegalArgumentException("paragraph must not be negative");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
        Objects.requireNonNull(confidence, "confidence");
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(MatchSpan other) {
        return paragraph == other.paragraph && start < other.end && other.start < end;
    }
}
