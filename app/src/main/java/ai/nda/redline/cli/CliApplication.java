package ai.nda.redline.cli;

import ai.nda.redline.config.CleanerConfig;
import ai.nda.redline.config.Config;
import ai.nda.redline.config.ConfigLoader;
import ai.nda.redline.config.Secrets;
import ai.nda.redline.config.SystemEnvironmentReader;
import ai.nda.redline.document.DocumentLoadException;
import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.DocxDocumentLoader;
import ai.nda.redline.engine.DocumentFlattener;
import ai.nda.redline.finding.Finding;
import ai.nda.redline.finding.FindingSelector;
import ai.nda.redline.finding.FindingsReader;
import ai.nda.redline.finding.InvalidFindingException;
import ai.nda.redline.finding.clean.ChatModelCitationCleaner;
import ai.nda.redline.finding.clean.CitationCleaner;
import ai.nda.redline.finding.clean.PassThroughCitationCleaner;
import ai.nda.redline.logging.LoggingConfigurator;
import ai.nda.redline.review.ReviewOutputWriter;
import ai.nda.redline.review.ReviewResult;
import ai.nda.redline.review.ReviewService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and review pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final ReviewService reviewService;
    private final Function<Config, CitationCleaner> cleanerFactory;
    private final DocxDocumentLoader documentLoader = new DocxDocumentLoader();
    private final DocumentFlattener flattener = new DocumentFlattener();
    private final FindingsReader findingsReader = new FindingsReader();
    private final FindingSelector findingSelector = new FindingSelector();
    private final ReviewOutputWriter outputWriter = new ReviewOutputWriter();

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ReviewService(), CliApplication::createCitationCleaner);
    }

    CliApplication(ConfigLoader configLoader, ReviewService reviewService, Function<Config, CitationCleaner> cleanerFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.reviewService = Objects.requireNonNull(reviewService, "reviewService");
        this.cleanerFactory = Objects.requireNonNull(cleanerFactory, "cleanerFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        } catch (IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Revising {} with findings from {} ({} output, author '{}')",
                config.input(), config.findings(), config.variant().name().toLowerCase(Locale.ROOT), config.editPolicy().author());

        try {
            List<Path> written = review(config);
            written.forEach(path -> LOGGER.info("Wrote {}", path));
            return 0;
        } catch (DocumentLoadException | InvalidFindingException | UncheckedIOException | IllegalStateException ex) {
            LOGGER.error("Review failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private List<Path> review(Config config) {
        byte[] source = documentLoader.readBytes(config.input());
        List<Finding> findings = findingsReader.read(config.findings());
        LOGGER.info("Read {} findings", findings.size());
        if (config.selection().isPresent()) {
            findings = findingSelector.select(findings, findingsReader.readSelection(config.selection().get()));
        }
        if (config.cleanCitations()) {
            CitationCleaner cleaner = cleanerFactory.apply(config);
            findings = cleaner.clean(documentText(source), findings);
        }
        ReviewResult result = reviewService.review(source, findings, config.variant().modes(), config.editPolicy());
        return outputWriter.write(config.outputDirectory(), ReviewOutputWriter.stemOf(config.input()), result);
    }

    private String documentText(byte[] source) {
        try (DocumentModel document = documentLoader.load(source)) {
            return flattener.documentText(document);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to release document copy", ex);
        }
    }

    static CitationCleaner createCitationCleaner(Config config) {
        if (!config.cleanCitations()) {
            return new PassThroughCitationCleaner();
        }
        CleanerConfig cleanerConfig = config.cleanerConfig();
        ChatModel chatModel = switch (cleanerConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(cleanerConfig);
            case GEMINI -> createGeminiChatModel(cleanerConfig, config.secrets());
        };
        return new ChatModelCitationCleaner(chatModel, cleanerConfig.provider().name(), cleanerConfig.modelName());
    }

    private static ChatModel createOllamaChatModel(CleanerConfig cleanerConfig) {
        try {
            String baseUrl = cleanerConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", cleanerConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(cleanerConfig.modelName())
                    .temperature(0.0)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(CleanerConfig cleanerConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", cleanerConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(cleanerConfig.modelName())
                    .temperature(0.0)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
