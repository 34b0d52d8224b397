package ai.nda.redline.engine;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.ParagraphBlock;
import ai.nda.redline.finding.Finding;
import ai.nda.redline.finding.FindingValidator;
import ai.nda.redline.finding.NormalizedFinding;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives a batch of findings through resolution, run splitting and editing for one document.
 *
 * <p>All findings are first resolved against the untouched document, then applied in document
 * order (paragraph, then offset) so that earlier edits never move text a later finding still
 * needs. Each paragraph is flattened again before every edit. Per-finding problems are recorded
 * in the ledger and never abort the batch.
 */
public class BatchOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);
    static final String MDC_FINDING_ID = "findingId";
    static final String MDC_MODE = "mode";

    private final DocumentFlattener flattener;
    private final EditApplicator applicator;
    private final Clock clock;

    public BatchOrchestrator() {
        this(new DocumentFlattener(), Clock.systemUTC());
    }

    public BatchOrchestrator(DocumentFlattener flattener, Clock clock) {
        this(flattener, new EditApplicator(flattener, new RunSplitter(flattener)), clock);
    }

    public BatchOrchestrator(DocumentFlattener flattener, EditApplicator applicator, Clock clock) {
        this.flattener = Objects.requireNonNull(flattener, "flattener");
        this.applicator = Objects.requireNonNull(applicator, "applicator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchResult process(DocumentModel document, List<Finding> findings, RevisionMode mode, EditPolicy policy) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(policy, "policy");
        FindingValidator.validate(findings);

        SpanResolver resolver = new SpanResolver(policy.fuzzyThreshold());
        boolean caseFallback = policy.caseFallback(mode);
        EditOutcome[] outcomes = new EditOutcome[findings.size()];
        List<PendingEdit> pending = new ArrayList<>();

        List<FlatText> pristine = flattener.flattenAll(document);
        for (int i = 0; i < findings.size(); i++) {
            NormalizedFinding finding = NormalizedFinding.of(findings.get(i));
            if (finding.unlocatable()) {
                outcomes[i] = EditOutcome.skipped(finding.id(), EditStatus.SKIPPED_NOT_FOUND);
                continue;
            }
            Resolution resolution = resolver.resolveInDocument(pristine, finding.citation(), caseFallback, policy.matchPolicy());
            switch (resolution.kind()) {
                case FOUND -> pending.add(new PendingEdit(i, finding, resolution.span().orElseThrow()));
                case NOT_FOUND -> outcomes[i] = EditOutcome.skipped(finding.id(), EditStatus.SKIPPED_NOT_FOUND);
                case AMBIGUOUS -> outcomes[i] = EditOutcome.skipped(finding.id(), EditStatus.SKIPPED_AMBIGUOUS);
            }
        }

        pending.sort(Comparator.comparingInt((PendingEdit edit) -> edit.span().paragraph())
                .thenComparingInt(edit -> edit.span().start()));

        RevisionStamp stamp = RevisionStamp.forDocument(document, policy.author(), clock);
        MDC.put(MDC_MODE, mode.wireName());
        try {
            for (PendingEdit edit : pending) {
                MDC.put(MDC_FINDING_ID, Integer.toString(edit.finding().id()));
                try {
                    outcomes[edit.position()] = apply(document, edit, resolver, caseFallback, mode, policy, stamp);
                } finally {
                    MDC.remove(MDC_FINDING_ID);
                }
            }
        } finally {
            MDC.remove(MDC_MODE);
        }

        List<EditOutcome> ledger = List.of(outcomes);
        LOGGER.info("Processed {} findings in {} mode: {} applied", ledger.size(), mode.wireName(),
                ledger.stream().filter(EditOutcome::isApplied).count());
        return new BatchResult(document, ledger);
    }

    private EditOutcome apply(DocumentModel document,
                              PendingEdit edit,
                              SpanResolver resolver,
                              boolean caseFallback,
                              RevisionMode mode,
                              EditPolicy policy,
                              RevisionStamp stamp) {
        NormalizedFinding finding = edit.finding();
        ParagraphBlock paragraph = document.paragraph(edit.span().paragraph());
        Optional<MatchSpan> current = resolver.resolve(flattener.flatten(paragraph), finding.citation(), caseFallback);
        if (current.isEmpty()) {
            LOGGER.info("Finding {} no longer matches paragraph {} after earlier edits", finding.id(), paragraph.ordinal());
            return EditOutcome.skipped(finding.id(), EditStatus.SKIPPED_NOT_FOUND);
        }
        MatchSpan span = current.get();
        EditStatus status = applicator.apply(paragraph, span, finding.replacementText(), mode, policy, stamp);
        LOGGER.debug("Finding {} {} at paragraph {} [{}, {}) ({})", finding.id(), status.wireName(),
                span.paragraph(), span.start(), span.end(), span.confidence().wireName());
        return status == EditStatus.APPLIED
                ? EditOutcome.applied(finding.id(), span)
                : EditOutcome.skipped(finding.id(), status);
    }

    private record PendingEdit(int position, NormalizedFinding finding, MatchSpan span) {
    }
}
