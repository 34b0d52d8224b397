package ai.nda.redline.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Ledger entry for one finding. {@code appliedSpan} is present only for applied edits.
 */
public record EditOutcome(int findingId, EditStatus status, Optional<MatchSpan> appliedSpan) {

    public EditOutcome {
        Objects.requireNonNull(status, "status");
        appliedSpan = appliedSpan == null ? Optional.empty() : appliedSpan;
        if (status == EditStatus.APPLIED && appliedSpan.isEmpty()) {
            throw new IllegalArgumentException("applied outcome requires the applied span");
        }
    }

    public static EditOutcome applied(int findingId, MatchSpan span) {
        return new EditOutcome(findingId, EditStatus.APPLIED, Optional.of(span));
    }

    public static EditOutcome skipped(int findingId, EditStatus status) {
        return new EditOutcome(findingId, status, Optional.empty());
    }

    public boolean isApplied() {
        return status == EditStatus.APPLIED;
    }
}
