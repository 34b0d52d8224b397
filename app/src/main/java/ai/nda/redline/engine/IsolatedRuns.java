package ai.nda.redline.engine;

import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.document.TextRun;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs that exactly cover {@code [start, end)} of a paragraph after splitting, together with the
 * rebuilt flat text. An empty span has no covered runs and is addressed through its neighbours.
 */
public record IsolatedRuns(ParagraphBlock paragraph, FlatText flat, List<TextRun> runs, int start, int end) {

    public IsolatedRuns {
        Objects.requireNonNull(paragraph, "paragraph");
        Objects.requireNonNull(flat, "flat");
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public String text() {
        return flat.substring(start, end);
    }

    /**
     * Last non-empty run ending at or before the span start.
     */
    public Optional<TextRun> precedingRun() {
        TextRun found = null;
        for (TextRun run : flat.runs()) {
            if (run.length() > 0 && flat.runEnd(run.index()) <= start) {
                found = run;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * First non-empty run starting at or after the span end.
     */
    public Optional<TextRun> followingRun() {
        for (TextRun run : flat.runs()) {
            if (run.length() > 0 && flat.runStart(run.index()) >= end) {
                return Optional.of(run);
            }
        }
        return Optional.empty();
    }
}
