package ai.nda.redline.finding;

import ai.nda.redline.text.TextNormalizer;
import java.util.Objects;

/**
 * A finding prepared for matching. {@code citation} and {@code replacement} are in normalized form;
 * {@code replacementText} is the cleaned replacement that gets written into the document.
 */
public record NormalizedFinding(Finding source, String citation, String replacement, String replacementText) {

    public NormalizedFinding {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(citation, "citation");
        Objects.requireNonNull(replacement, "replacement");
        Objects.requireNonNull(replacementText, "replacementText");
    }

    public static NormalizedFinding of(Finding finding) {
        return new NormalizedFinding(finding,
                TextNormalizer.normalize(finding.citation()),
                TextNormalizer.normalize(finding.suggestedReplacement()),
                TextNormalizer.clean(finding.suggestedReplacement()));
    }

    public int id() {
        return source.id();
    }

    /**
     * A citation that can never be located: the "Not Found" marker or nothing left after normalization.
     */
    public boolean unlocatable() {
        return source.citationNotFound() || citation.isEmpty();
    }
}
