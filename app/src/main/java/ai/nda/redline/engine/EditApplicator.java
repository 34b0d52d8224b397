package ai.nda.redline.engine;

import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.document.TextRun;
import ai.nda.redline.document.WordXml;
import ai.nda.redline.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.xml.namespace.QName;
import org.apache.xmlbeans.XmlObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one edit into a paragraph, either as a tracked revision or as a direct replacement.
 *
 * <p>Only the runs covering the edited span are touched. In clean mode the first covered run keeps
 * its properties and receives the replacement while the other covered runs are removed. In tracked
 * mode the covered runs move into {@code w:del} wrappers, one per parent element, and a single
 * {@code w:ins} run with the first deleted run's properties follows the last deletion.
 */
public class EditApplicator {

    private static final Logger LOGGER = LoggerFactory.getLogger(EditApplicator.class);

    private final DocumentFlattener flattener;
    private final RunSplitter splitter;

    public EditApplicator(DocumentFlattener flattener, RunSplitter splitter) {
        this.flattener = Objects.requireNonNull(flattener, "flattener");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
    }

    public EditStatus apply(ParagraphBlock paragraph,
                            MatchSpan span,
                            String replacement,
                            RevisionMode mode,
                            EditPolicy policy,
                            RevisionStamp stamp) {
        FlatText flat = flattener.flatten(paragraph);
        String matched = flat.substring(span.start(), span.end());
        if (policy.skipIfSame() && (TextNormalizer.sameText(matched, replacement) || alreadyApplied(flat, span, replacement))) {
            return EditStatus.SKIPPED_UNCHANGED;
        }
        ReplacementFitter.Fit fit = ReplacementFitter.fit(flat.text(), span.start(), span.end(), replacement);
        if (mode == RevisionMode.CLEAN) {
            replace(splitter.isolate(paragraph, fit.start(), fit.end()), fit.text());
        } else {
            TrackedDiff.Change change = TrackedDiff.narrow(flat.substring(fit.start(), fit.end()), fit.text());
            IsolatedRuns isolated = splitter.isolate(paragraph, fit.start() + change.start(), fit.start() + change.end());
            LOGGER.debug("Tracking {} in paragraph {}: deleting '{}', inserting '{}'",
                    kindOf(change), paragraph.ordinal(), isolated.text(), change.insertion());
            track(isolated, change, stamp);
        }
        return EditStatus.APPLIED;
    }

    /**
     * True when the replacement already surrounds the matched span, as after an earlier application.
     */
    private boolean alreadyApplied(FlatText flat, MatchSpan span, String replacement) {
        String target = TextNormalizer.normalize(replacement);
        if (target.isEmpty()) {
            return false;
        }
        String search = flat.searchText();
        int from = 0;
        int index;
        while ((index = search.indexOf(target, from)) >= 0) {
            int start = flat.toTextStart(index);
            int end = flat.toTextEnd(index + target.length());
            if (start <= span.start() && span.end() <= end) {
                return true;
            }
            from = index + 1;
        }
        return false;
    }

    private void replace(IsolatedRuns isolated, String text) {
        List<TextRun> runs = isolated.runs();
        if (runs.isEmpty()) {
            if (!text.isEmpty()) {
                XmlObject run = newRunAt(isolated, WordXml.R);
                template(isolated).ifPresent(properties -> WordXml.copyInto(properties, run));
                WordXml.appendRunText(run, text, WordXml.T);
            }
            return;
        }
        if (text.isEmpty()) {
            runs.forEach(run -> WordXml.remove(run.element()));
            return;
        }
        XmlObject first = runs.get(0).element();
        for (XmlObject child : WordXml.children(first)) {
            if (!WordXml.is(child, WordXml.RPR)) {
                WordXml.remove(child);
            }
        }
        WordXml.appendRunText(first, text, WordXml.T);
        for (TextRun run : runs.subList(1, runs.size())) {
            WordXml.remove(run.element());
        }
    }

    private static String kindOf(TrackedDiff.Change change) {
        if (change.isPureInsertion()) {
            return "insertion";
        }
        return change.isPureDeletion() ? "deletion" : "replacement";
    }

    private void track(IsolatedRuns isolated, TrackedDiff.Change change, RevisionStamp stamp) {
        Optional<XmlObject> neighbourProperties = template(isolated);
        XmlObject firstDeletion = null;
        XmlObject lastDeletion = null;
        for (List<XmlObject> group : groupByParent(isolated.runs())) {
            XmlObject deletion = WordXml.insertBefore(group.get(0), WordXml.DEL);
            stamp.mark(deletion);
            for (XmlObject run : group) {
                WordXml.moveInto(run, deletion);
            }
            markDeleted(deletion);
            if (firstDeletion == null) {
                firstDeletion = deletion;
            }
            lastDeletion = deletion;
        }
        if (change.isPureDeletion()) {
            return;
        }
        XmlObject inserted;
        Optional<XmlObject> properties;
        if (lastDeletion == null) {
            inserted = newRunAt(isolated, WordXml.INS);
            properties = neighbourProperties;
        } else {
            inserted = WordXml.insertAfter(lastDeletion, WordXml.INS);
            properties = WordXml.firstChild(firstDeletion, WordXml.R)
                    .flatMap(run -> WordXml.firstChild(run, WordXml.RPR));
        }
        stamp.mark(inserted);
        XmlObject run = WordXml.append(inserted, WordXml.R);
        properties.ifPresent(value -> WordXml.copyInto(value, run));
        WordXml.appendRunText(run, change.insertion(), WordXml.T);
    }

    private XmlObject newRunAt(IsolatedRuns isolated, QName name) {
        Optional<TextRun> preceding = isolated.precedingRun();
        if (preceding.isPresent()) {
            return WordXml.insertAfter(preceding.get().element(), name);
        }
        Optional<TextRun> following = isolated.followingRun();
        if (following.isPresent()) {
            return WordXml.insertBefore(following.get().element(), name);
        }
        return WordXml.append(isolated.paragraph().xml(), name);
    }

    private Optional<XmlObject> template(IsolatedRuns isolated) {
        return isolated.precedingRun()
                .or(isolated::followingRun)
                .flatMap(run -> WordXml.firstChild(run.element(), WordXml.RPR));
    }

    private static void markDeleted(XmlObject deletion) {
        for (XmlObject run : WordXml.children(deletion)) {
            for (XmlObject child : WordXml.children(run)) {
                if (WordXml.is(child, WordXml.T)) {
                    WordXml.rename(child, WordXml.DEL_TEXT);
                } else if (WordXml.is(child, WordXml.INSTR_TEXT)) {
                    WordXml.rename(child, WordXml.DEL_INSTR_TEXT);
                }
            }
        }
    }

    private static List<List<XmlObject>> groupByParent(List<TextRun> runs) {
        List<List<XmlObject>> groups = new ArrayList<>();
        XmlObject currentParent = null;
        for (TextRun run : runs) {
            XmlObject parent = WordXml.parent(run.element())
                    .orElseThrow(() -> new IllegalStateException("Run without parent element"));
            if (currentParent == null || !WordXml.sameElement(currentParent, parent)) {
                groups.add(new ArrayList<>());
                currentParent = parent;
            }
            groups.get(groups.size() - 1).add(run.element());
        }
        return groups;
    }
}
