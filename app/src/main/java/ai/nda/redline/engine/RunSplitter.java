package ai.nda.redline.engine;

import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.document.TextRun;
import ai.nda.redline.document.WordXml;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.xmlbeans.XmlObject;

/**
 * Splits formatting runs so that a span of a paragraph is covered by whole runs.
 *
 * <p>A split leaves the original run in place holding the text before the cut and adds a sibling
 * run after it with a copy of the run properties and everything after the cut. Splitting never
 * changes paragraph text; a violation raises {@link IllegalStateException}.
 */
public class RunSplitter {

    private final DocumentFlattener flattener;

    public RunSplitter(DocumentFlattener flattener) {
        this.flattener = Objects.requireNonNull(flattener, "flattener");
    }

    public IsolatedRuns isolate(ParagraphBlock paragraph, MatchSpan span) {
        return isolate(paragraph, span.start(), span.end());
    }

    public IsolatedRuns isolate(ParagraphBlock paragraph, int start, int end) {
        FlatText before = flattener.flatten(paragraph);
        if (start < 0 || end < start || end > before.length()) {
            throw new IllegalArgumentException("Span [" + start + ", " + end + ") outside paragraph of length " + before.length());
        }
        splitAt(before, end);
        splitAt(flattener.flatten(paragraph), start);
        FlatText after = flattener.flatten(paragraph);
        if (!after.text().equals(before.text())) {
            throw new IllegalStateException("Run split altered text of paragraph " + paragraph.ordinal());
        }
        List<TextRun> covered = new ArrayList<>();
        for (TextRun run : after.runs()) {
            if (run.length() > 0 && after.runStart(run.index()) >= start && after.runEnd(run.index()) <= end) {
                covered.add(run);
            }
        }
        return new IsolatedRuns(paragraph, after, covered, start, end);
    }

    /**
     * Ensures a run boundary at {@code offset}. Returns whether a run had to be split.
     */
    public boolean splitAt(ParagraphBlock paragraph, int offset) {
        return splitAt(flattener.flatten(paragraph), offset);
    }

    private boolean splitAt(FlatText flat, int offset) {
        if (offset <= 0 || offset >= flat.length()) {
            return false;
        }
        int runIndex = flat.runAt(offset);
        int cut = offset - flat.runStart(runIndex);
        if (cut == 0) {
            return false;
        }
        splitRun(flat.runs().get(runIndex).element(), cut);
        return true;
    }

    private void splitRun(XmlObject run, int cut) {
        XmlObject tail = WordXml.insertAfter(run, WordXml.R);
        WordXml.firstChild(run, WordXml.RPR).ifPresent(properties -> WordXml.copyInto(properties, tail));
        int position = 0;
        for (XmlObject child : WordXml.children(run)) {
            if (WordXml.is(child, WordXml.RPR)) {
                continue;
            }
            int length = DocumentFlattener.contribution(child).length();
            if (position >= cut) {
                WordXml.moveInto(child, tail);
            } else if (position + length > cut) {
                // only w:t can straddle the cut
                String value = WordXml.text(child);
                int local = cut - position;
                WordXml.setText(child, value.substring(0, local));
                WordXml.appendRunText(tail, value.substring(local), WordXml.T);
            }
            position += length;
        }
    }
}
