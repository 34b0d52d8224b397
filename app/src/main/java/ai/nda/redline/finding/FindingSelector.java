package ai.nda.redline.finding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an {@link EditSelection} to a batch: drops discarded findings and folds overrides in.
 */
public class FindingSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FindingSelector.class);

    public List<Finding> select(List<Finding> findings, EditSelection selection) {
        Objects.requireNonNull(findings, "findings");
        Objects.requireNonNull(selection, "selection");
        warnAboutUnknownIds(findings, selection);
        List<Finding> selected = new ArrayList<>();
        for (Finding finding : findings) {
            if (!selection.keeps(finding.id())) {
                continue;
            }
            Finding adjusted = finding;
            EditSelection.Adjustment adjustment = selection.overrideFor(finding.id()).orElse(null);
            if (adjustment != null) {
                adjusted = adjustment.suggestedReplacement()
                        .map(adjusted::withSuggestedReplacement)
                        .orElse(adjusted);
                adjusted = adjustment.citationHint()
                        .filter(hint -> !hint.isBlank())
                        .map(adjusted::withCitation)
                        .orElse(adjusted);
            }
            selected.add(adjusted);
        }
        LOGGER.info("Selected {} of {} findings", selected.size(), findings.size());
        return List.copyOf(selected);
    }

    private void warnAboutUnknownIds(List<Finding> findings, EditSelection selection) {
        Set<Integer> known = new HashSet<>();
        findings.forEach(finding -> known.add(finding.id()));
        Set<Integer> referenced = new HashSet<>(selection.accept());
        referenced.addAll(selection.discard());
        referenced.addAll(selection.overrides().keySet());
        referenced.removeAll(known);
        if (!referenced.isEmpty()) {
            LOGGER.warn("Selection refers to unknown finding ids {}", referenced);
        }
    }
}
