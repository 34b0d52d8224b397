package ai.nda.redline.review;

import ai.nda.redline.engine.EditOutcome;
import ai.nda.redline.engine.EditStatus;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-status counts of a ledger, as reported to reviewers.
 */
public record ReviewSummary(long applied, long notFound, long unchanged, long ambiguous) {

    public static ReviewSummary of(List<EditOutcome> outcomes) {
        Map<EditStatus, Long> counts = new EnumMap<>(EditStatus.class);
        for (EditOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1L, Long::sum);
        }
        return new ReviewSummary(
                counts.getOrDefault(EditStatus.APPLIED, 0L),
                counts.getOrDefault(EditStatus.SKIPPED_NOT_FOUND, 0L),
                counts.getOrDefault(EditStatus.SKIPPED_UNCHANGED, 0L),
                counts.getOrDefault(EditStatus.SKIPPED_AMBIGUOUS, 0L));
    }

    public long total() {
        return applied + notFound + unchanged + ambiguous;
    }

    public String describe() {
        return "%d applied, %d not found, %d unchanged, %d ambiguous".formatted(applied, notFound, unchanged, ambiguous);
    }
}
