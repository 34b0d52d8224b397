package ai.nda.redline.finding;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Batch-level checks applied before any finding reaches the matching pipeline.
 */
public final class FindingValidator {

    private FindingValidator() {
    }

    public static void validate(List<Finding> findings) {
        if (findings == null) {
            throw new InvalidFindingException("Findings must be provided");
        }
        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < findings.size(); i++) {
            Finding finding = findings.get(i);
            if (finding == null) {
                throw new InvalidFindingException("Finding at position " + i + " is missing");
            }
            if (!ids.add(finding.id())) {
                throw new InvalidFindingException("Duplicate finding id " + finding.id());
            }
        }
    }
}
