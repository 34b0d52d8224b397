package ai.nda.redline.review;

import ai.nda.redline.engine.RevisionMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Variants produced from one document and one finalized batch of findings.
 */
public record ReviewResult(Map<RevisionMode, VariantResult> variants) {

    public ReviewResult {
        Objects.requireNonNull(variants, "variants");
        Map<RevisionMode, VariantResult> copy = new EnumMap<>(RevisionMode.class);
        copy.putAll(variants);
        variants = Collections.unmodifiableMap(copy);
    }

    public Optional<VariantResult> variant(RevisionMode mode) {
        return Optional.ofNullable(variants.get(mode));
    }
}
