package ai.nda.redline.config;

import ai.nda.redline.cli.CliArguments;
import ai.nda.redline.engine.EditPolicy;
import ai.nda.redline.engine.MatchPolicy;
import ai.nda.redline.engine.SpanResolver;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_AUTHOR = "REDLINE_AUTHOR";
    static final String ENV_IGNORE_CASE = "REDLINE_IGNORE_CASE";
    static final String ENV_SKIP_IF_SAME = "REDLINE_SKIP_IF_SAME";
    static final String ENV_FUZZY_THRESHOLD = "REDLINE_FUZZY_THRESHOLD";
    static final String ENV_MATCH_POLICY = "REDLINE_MATCH_POLICY";
    static final String ENV_OUTPUT_DIR = "REDLINE_OUTPUT_DIR";
    static final String ENV_CLEAN_CITATIONS = "REDLINE_CLEAN_CITATIONS";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path input = require(arguments.input(), "--input must be provided");
        Path findings = require(arguments.findings(), "--findings must be provided");
        Optional<Path> selection = Optional.ofNullable(arguments.selection());
        Path outputDirectory = resolveOutputDirectory(arguments, input);
        OutputVariant variant = Objects.requireNonNullElse(arguments.variant(), OutputVariant.BOTH);
        LogFormat logFormat = resolveLogFormat(arguments);

        String author = firstNonBlank(arguments.author(), ENV_AUTHOR, EditPolicy.DEFAULT_AUTHOR);
        boolean ignoreCase = arguments.ignoreCase() || resolveFlag(ENV_IGNORE_CASE, false);
        boolean skipIfSame = !arguments.keepSame() && resolveFlag(ENV_SKIP_IF_SAME, true);
        double fuzzyThreshold = resolveFuzzyThreshold(arguments);
        MatchPolicy matchPolicy = resolveMatchPolicy(arguments);
        EditPolicy editPolicy = new EditPolicy(ignoreCase, skipIfSame, author, fuzzyThreshold, matchPolicy);

        boolean cleanCitations = arguments.cleanCitations() || resolveFlag(ENV_CLEAN_CITATIONS, false);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultModelFor(provider));

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            String value = environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .orElse(DEFAULT_OLLAMA_BASE_URL);
            baseUrl = Optional.of(value);
        }

        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);
        if (cleanCitations && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when cleaning citations with LLM_PROVIDER=gemini");
        }

        CleanerConfig cleanerConfig = new CleanerConfig(provider, modelName, baseUrl);
        return new Config(input, findings, selection, outputDirectory, variant, editPolicy, cleanCitations,
                logFormat, cleanerConfig, new Secrets(geminiApiKey));
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-2.5-flash";
            case OLLAMA -> "llama3.1:8b";
        };
    }

    private Path resolveOutputDirectory(CliArguments arguments, Path input) {
        if (arguments.outputDirectory() != null) {
            return arguments.outputDirectory();
        }
        return environmentReader.get(ENV_OUTPUT_DIR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of)
                .orElseGet(() -> {
                    Path parent = input.toAbsolutePath().getParent();
                    return parent == null ? Path.of(".") : parent;
                });
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private double resolveFuzzyThreshold(CliArguments arguments) {
        Double cliValue = arguments.fuzzyThreshold();
        double value = cliValue != null
                ? cliValue
                : environmentReader.get(ENV_FUZZY_THRESHOLD)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseDouble)
                .orElse(SpanResolver.DEFAULT_FUZZY_THRESHOLD);
        if (value <= 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Fuzzy threshold must be greater than 0 and at most 1 but was " + value);
        }
        return value;
    }

    private MatchPolicy resolveMatchPolicy(CliArguments arguments) {
        MatchPolicy cliPolicy = arguments.matchPolicy();
        if (cliPolicy != null) {
            return cliPolicy;
        }
        return environmentReader.get(ENV_MATCH_POLICY)
                .filter(ConfigLoader::isNotBlank)
                .map(MatchPolicy::from)
                .orElse(MatchPolicy.FIRST);
    }

    private boolean resolveFlag(String envKey, boolean defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static <T> T require(T value, String errorMessage) {
        if (value == null) {
            throw new IllegalArgumentException(errorMessage);
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
