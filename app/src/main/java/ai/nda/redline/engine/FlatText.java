package ai.nda.redline.engine;

import ai.nda.redline.document.TextRun;
import ai.nda.redline.text.TextNormalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Flattened text of one paragraph with the reverse index from text offsets to runs.
 *
 * <p>{@link #searchText()} is the matching view of the same text: characters folded by
 * {@link TextNormalizer#foldChar(char)}, invisible characters dropped and whitespace runs collapsed.
 * Offsets in the search view translate back to raw offsets through {@link #toTextStart(int)} and
 * {@link #toTextEnd(int)}.
 */
public final class FlatText {

    private final int paragraph;
    private final String text;
    private final List<TextRun> runs;
    private final int[] runStarts;
    private final String searchText;
    private final int[] searchOffsets;

    FlatText(int paragraph, List<TextRun> runs) {
        this.paragraph = paragraph;
        this.runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
        this.runStarts = new int[this.runs.size()];
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < this.runs.size(); i++) {
            runStarts[i] = builder.length();
            builder.append(this.runs.get(i).text());
        }
        this.text = builder.toString();

        StringBuilder search = new StringBuilder(text.length());
        int[] offsets = new int[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (TextNormalizer.isInvisible(ch)) {
                continue;
            }
            char folded = TextNormalizer.foldChar(ch);
            if (folded == ' ' && search.length() > 0 && search.charAt(search.length() - 1) == ' ') {
                continue;
            }
            offsets[search.length()] = i;
            search.append(folded);
        }
        this.searchText = search.toString();
        this.searchOffsets = Arrays.copyOf(offsets, search.length());
    }

    public int paragraph() {
        return paragraph;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public List<TextRun> runs() {
        return runs;
    }

    public String searchText() {
        return searchText;
    }

    public String substring(int start, int end) {
        return text.substring(start, end);
    }

    public int runStart(int runIndex) {
        return runStarts[runIndex];
    }

    public int runEnd(int runIndex) {
        return runStarts[runIndex] + runs.get(runIndex).length();
    }

    /**
     * Index of the run owning the character at {@code offset}.
     */
    public int runAt(int offset) {
        if (offset < 0 || offset >= text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside paragraph of length " + text.length());
        }
        for (int i = runs.size() - 1; i >= 0; i--) {
            if (runStarts[i] <= offset && runs.get(i).length() > 0) {
                return i;
            }
        }
        throw new IllegalStateException("No run covers offset " + offset);
    }

    public int offsetInRun(int offset) {
        return offset - runStarts[runAt(offset)];
    }

    public int toTextStart(int searchOffset) {
        if (searchOffset >= searchOffsets.length) {
            return text.length();
        }
        return searchOffsets[searchOffset];
    }

    public int toTextEnd(int searchEnd) {
        if (searchEnd <= 0) {
            return 0;
        }
        return searchOffsets[searchEnd - 1] + 1;
    }
}
