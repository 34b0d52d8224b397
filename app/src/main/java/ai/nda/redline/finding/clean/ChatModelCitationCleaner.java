package ai.nda.redline.finding.clean;

import ai.nda.redline.finding.Finding;
import ai.nda.redline.text.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleaner backed by a LangChain4j {@link ChatModel}. The model is asked for the shortest verbatim
 * excerpt of the document that the citation refers to; an answer is only accepted when that excerpt
 * really occurs in the document. Otherwise the raw finding is kept.
 */
public class ChatModelCitationCleaner implements CitationCleaner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelCitationCleaner.class);

    private final ChatModel model;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final String modelName;

    public ChatModelCitationCleaner(ChatModel model, String providerName, String modelName) {
        this(model, new ObjectMapper(), providerName, modelName);
    }

    public ChatModelCitationCleaner(ChatModel model, ObjectMapper objectMapper, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public List<Finding> clean(String documentText, List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return List.of();
        }
        String searchableDocument = TextNormalizer.foldCase(TextNormalizer.normalize(documentText));
        List<Finding> cleaned = new ArrayList<>(findings.size());
        int accepted = 0;
        for (Finding finding : findings) {
            if (finding.citationNotFound()) {
                cleaned.add(finding);
                continue;
            }
            try {
                cleaned.add(cleanOne(documentText, searchableDocument, finding));
                accepted++;
            } catch (CitationCleaningException ex) {
                LOGGER.warn("Keeping raw citation for finding {}: {}", finding.id(), ex.getMessage());
                cleaned.add(finding);
            }
        }
        LOGGER.info("Cleaned {} of {} citations with {} model '{}'", accepted, findings.size(), providerName, modelName);
        return List.copyOf(cleaned);
    }

    private Finding cleanOne(String documentText, String searchableDocument, Finding finding) {
        String response = ask(buildPrompt(documentText, finding));
        JsonNode answer = parseAnswer(response);
        JsonNode idNode = answer.get("id");
        if (idNode != null && idNode.canConvertToInt() && idNode.asInt() != finding.id()) {
            throw new CitationCleaningException("model answered for finding " + idNode.asInt());
        }
        String citation = textField(answer, "citation_clean");
        if (citation == null || citation.isBlank()) {
            throw new CitationCleaningException("model returned no citation_clean");
        }
        String normalized = TextNormalizer.foldCase(TextNormalizer.normalize(citation));
        if (normalized.isEmpty() || !searchableDocument.contains(normalized)) {
            throw new CitationCleaningException("cleaned citation does not occur in the document");
        }
        Finding result = finding.withCitation(citation);
        String replacement = textField(answer, "suggested_replacement_clean");
        if (replacement != null) {
            result = result.withSuggestedReplacement(replacement);
        }
        return result;
    }

    private String ask(String prompt) {
        try {
            String response = model.chat(prompt);
            if (response == null || response.isBlank()) {
                throw new CitationCleaningException("model returned an empty response");
            }
            return response;
        } catch (CitationCleaningException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new IllegalStateException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new CitationCleaningException("LangChain request failed", ex);
        }
    }

    private JsonNode parseAnswer(String response) {
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new CitationCleaningException("model response contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(response.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new CitationCleaningException("model response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new CitationCleaningException("model response is not valid JSON", ex);
        }
    }

    private String buildPrompt(String documentText, Finding finding) {
        return """
You are preparing edits to a contract. The reviewer quoted the passage below, but the quote may be
paraphrased, abbreviated with ellipses, or decorated with formatting.
Rules:
- Find the passage of the document that the quote refers to.
- Return citation_clean as the shortest excerpt copied character for character from the document that covers it.
- Never add text that is not in the document and never join separate passages.
- Return suggested_replacement_clean as the suggested replacement with formatting markup removed, otherwise unchanged.
- Answer with a single JSON object and nothing else:
  {"id": %d, "citation_clean": "...", "suggested_replacement_clean": "..."}

<citation>
%s
</citation>

<suggested_replacement>
%s
</suggested_replacement>

<document>
%s
</document>
""".formatted(finding.id(), finding.citation(), finding.suggestedReplacement(), documentText);
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
