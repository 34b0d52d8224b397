package ai.nda.redline.finding;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A reviewer's decisions on a batch of findings: which to apply and which replacements or
 * citations to adjust first.
 */
public record EditSelection(boolean acceptAllByDefault,
                            Set<Integer> accept,
                            Set<Integer> discard,
                            Map<Integer, Adjustment> overrides) {

    public EditSelection {
        accept = Set.copyOf(Objects.requireNonNullElse(accept, Set.of()));
        discard = Set.copyOf(Objects.requireNonNullElse(discard, Set.of()));
        overrides = Map.copyOf(Objects.requireNonNullElse(overrides, Map.of()));
    }

    public static EditSelection acceptAll() {
        return new EditSelection(true, Set.of(), Set.of(), Map.of());
    }

    /**
     * A finding with an override is always applied.
     */
    public boolean keeps(int findingId) {
        if (overrides.containsKey(findingId)) {
            return true;
        }
        if (discard.contains(findingId)) {
            return false;
        }
        return acceptAllByDefault || accept.contains(findingId);
    }

    public Optional<Adjustment> overrideFor(int findingId) {
        return Optional.ofNullable(overrides.get(findingId));
    }

    public record Adjustment(Optional<String> suggestedReplacement, Optional<String> citationHint) {

        public Adjustment {
            suggestedReplacement = suggestedReplacement == null ? Optional.empty() : suggestedReplacement;
            citationHint = citationHint == null ? Optional.empty() : citationHint;
        }
    }
}
