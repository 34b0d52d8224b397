package ai.nda.redline.config;

import ai.nda.redline.engine.EditPolicy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path input,
        Path findings,
        Optional<Path> selection,
        Path outputDirectory,
        OutputVariant variant,
        EditPolicy editPolicy,
        boolean cleanCitations,
        LogFormat logFormat,
        CleanerConfig cleanerConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(findings, "findings");
        selection = selection == null ? Optional.empty() : selection;
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        variant = Objects.requireNonNullElse(variant, OutputVariant.BOTH);
        Objects.requireNonNull(editPolicy, "editPolicy");
        logFormat = Objects.requireNonNullElse(logFormat, LogFormat.TEXT);
        Objects.requireNonNull(cleanerConfig, "cleanerConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
    }
}
