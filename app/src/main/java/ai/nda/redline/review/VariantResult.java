package ai.nda.redline.review;

import ai.nda.redline.engine.EditOutcome;
import ai.nda.redline.engine.RevisionMode;
import java.util.List;
import java.util.Objects;

/**
 * Serialized output document of one variant with its outcome ledger.
 */
public record VariantResult(RevisionMode mode, byte[] document, List<EditOutcome> outcomes) {

    public VariantResult {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(document, "document");
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
    }

    public ReviewSummary summary() {
        return ReviewSummary.of(outcomes);
    }
}
