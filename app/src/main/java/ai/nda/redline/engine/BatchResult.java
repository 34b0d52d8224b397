package ai.nda.redline.engine;

import ai.nda.redline.document.DocumentModel;
import java.util.List;
import java.util.Objects;

/**
 * The mutated document and one outcome per finding, in the order the findings were given.
 */
public record BatchResult(DocumentModel document, List<EditOutcome> outcomes) {

    public BatchResult {
        Objects.requireNonNull(document, "document");
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
    }

    public long count(EditStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }
}
