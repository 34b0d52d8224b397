package ai.nda.redline.cli;

import ai.nda.redline.config.LogFormat;
import ai.nda.redline.config.OutputVariant;
import ai.nda.redline.engine.MatchPolicy;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "nda-redline", mixinStandardHelpOptions = true,
        description = "Applies reviewer findings to a Word document as tracked changes and as a clean copy")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "Word document (.docx) to revise", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--findings", description = "Reviewer findings as JSON", paramLabel = "FILE")
    private Path findings;

    @CommandLine.Option(names = "--selection", description = "Accept/discard decisions and overrides as JSON", paramLabel = "FILE")
    private Path selection;

    @CommandLine.Option(names = "--output-dir", description = "Directory for the revised documents (default: next to the input)", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--variant", converter = OutputVariantConverter.class, description = "Variants to write: tracked, clean or both")
    private OutputVariant variant;

    @CommandLine.Option(names = "--author", description = "Author recorded on tracked revisions", paramLabel = "NAME")
    private String author;

    @CommandLine.Option(names = "--ignore-case", description = "Match citations case-insensitively in the clean variant too")
    private boolean ignoreCase;

    @CommandLine.Option(names = "--keep-same", description = "Apply edits even when the replacement equals the cited text")
    private boolean keepSame;

    @CommandLine.Option(names = "--fuzzy-threshold", description = "Minimum similarity for approximate matches, greater than 0 and at most 1", paramLabel = "SCORE")
    private Double fuzzyThreshold;

    @CommandLine.Option(names = "--match-policy", converter = MatchPolicyConverter.class, description = "Handling of repeated citations: first or reject-ambiguous")
    private MatchPolicy matchPolicy;

    @CommandLine.Option(names = "--clean-citations", description = "Ask the configured language model to turn citations into verbatim quotes first")
    private boolean cleanCitations;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path findings() {
        return findings;
    }

    public Path selection() {
        return selection;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public OutputVariant variant() {
        return variant;
    }

    public String author() {
        return author;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    public boolean keepSame() {
        return keepSame;
    }

    public Double fuzzyThreshold() {
        return fuzzyThreshold;
    }

    public MatchPolicy matchPolicy() {
        return matchPolicy;
    }

    public boolean cleanCitations() {
        return cleanCitations;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
