package ai.nda.redline.review;

import ai.nda.redline.engine.EditOutcome;
import ai.nda.redline.engine.RevisionMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes review variants and the outcome summary next to each other.
 *
 * <p>Files are written to a temporary name in the target directory and moved into place, so a
 * reader never observes a partially written document.
 */
public class ReviewOutputWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewOutputWriter.class);
    private static final String DOCX_SUFFIX = ".docx";

    private final ObjectMapper objectMapper;

    public ReviewOutputWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReviewOutputWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<Path> write(Path outputDirectory, String stem, ReviewResult result) {
        if (outputDirectory == null || stem == null || stem.isBlank() || result == null) {
            throw new IllegalArgumentException("outputDirectory, stem and result must be provided");
        }
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDirectory);
            for (RevisionMode mode : RevisionMode.values()) {
                Optional<VariantResult> variant = result.variant(mode);
                if (variant.isPresent()) {
                    Path target = outputDirectory.resolve(stem + "_" + mode.wireName() + DOCX_SUFFIX);
                    writeAtomically(target, variant.get().document());
                    written.add(target);
                }
            }
            Path summary = outputDirectory.resolve(stem + "_summary.json");
            writeAtomically(summary, objectMapper.writeValueAsBytes(summaryJson(result)));
            written.add(summary);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write review output to " + outputDirectory, ex);
        }
        LOGGER.info("Wrote {} files to {}", written.size(), outputDirectory);
        return written;
    }

    /**
     * Output stem for a source document: its file name without the {@code .docx} suffix.
     */
    public static String stemOf(Path source) {
        String name = source.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(DOCX_SUFFIX) ? name.substring(0, name.length() - DOCX_SUFFIX.length()) : name;
    }

    private ObjectNode summaryJson(ReviewResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        for (Map.Entry<RevisionMode, VariantResult> entry : result.variants().entrySet()) {
            ObjectNode variant = root.putObject(entry.getKey().wireName());
            ReviewSummary summary = entry.getValue().summary();
            ObjectNode counts = variant.putObject("counts");
            counts.put("applied", summary.applied());
            counts.put("skipped-not-found", summary.notFound());
            counts.put("skipped-unchanged", summary.unchanged());
            counts.put("skipped-ambiguous", summary.ambiguous());
            variant.put("summary", summary.describe());
            ArrayNode ledger = variant.putArray("outcomes");
            for (EditOutcome outcome : entry.getValue().outcomes()) {
                ObjectNode node = ledger.addObject();
                node.put("finding_id", outcome.findingId());
                node.put("status", outcome.status().wireName());
                outcome.appliedSpan().ifPresent(span -> {
                    node.put("paragraph", span.paragraph());
                    node.put("start", span.start());
                    node.put("end", span.end());
                    node.put("confidence", span.confidence().wireName());
                    node.put("score", span.score());
                });
            }
        }
        return root;
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.debug("Atomic move unsupported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
