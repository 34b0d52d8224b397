package ai.nda.redline.review;

import ai.nda.redline.document.DocumentModel;
import ai.nda.redline.document.DocxDocumentLoader;
import ai.nda.redline.engine.BatchOrchestrator;
import ai.nda.redline.engine.BatchResult;
import ai.nda.redline.engine.EditPolicy;
import ai.nda.redline.engine.RevisionMode;
import ai.nda.redline.finding.Finding;
import ai.nda.redline.finding.FindingValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the requested output variants of a document.
 *
 * <p>Every variant works on its own copy parsed from the same source bytes, so the variants run
 * concurrently without sharing any mutable state. A copy is opened, edited, serialized and closed
 * within one task. If any variant fails the whole review fails and nothing is returned.
 */
public class ReviewService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewService.class);

    private final DocxDocumentLoader loader;
    private final BatchOrchestrator orchestrator;
    private final Executor executor;

    public ReviewService() {
        this(new DocxDocumentLoader(), new BatchOrchestrator(), ForkJoinPool.commonPool());
    }

    public ReviewService(DocxDocumentLoader loader, BatchOrchestrator orchestrator, Executor executor) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public ReviewResult review(byte[] source, List<Finding> findings, Set<RevisionMode> modes, EditPolicy policy) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(policy, "policy");
        if (modes == null || modes.isEmpty()) {
            throw new IllegalArgumentException("At least one revision mode must be requested");
        }
        FindingValidator.validate(findings);
        List<Finding> batch = List.copyOf(findings);

        Map<RevisionMode, CompletableFuture<VariantResult>> tasks = new EnumMap<>(RevisionMode.class);
        for (RevisionMode mode : modes) {
            tasks.put(mode, CompletableFuture.supplyAsync(() -> produce(source, batch, mode, policy), executor));
        }
        Map<RevisionMode, VariantResult> variants = new EnumMap<>(RevisionMode.class);
        try {
            CompletableFuture.allOf(tasks.values().toArray(CompletableFuture[]::new)).join();
            tasks.forEach((mode, task) -> variants.put(mode, task.join()));
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
        return new ReviewResult(variants);
    }

    private VariantResult produce(byte[] source, List<Finding> findings, RevisionMode mode, EditPolicy policy) {
        try (DocumentModel document = loader.load(source)) {
            BatchResult result = orchestrator.process(document, findings, mode, policy);
            byte[] output = document.toBytes();
            VariantResult variant = new VariantResult(mode, output, result.outcomes());
            LOGGER.info("{} variant: {}", mode.wireName(), variant.summary().describe());
            return variant;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to release " + mode.wireName() + " document copy", ex);
        }
    }
}
