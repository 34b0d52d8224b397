package ai.nda.redline.finding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads findings and reviewer selections from JSON.
 *
 * <p>Findings come either as a reviewer report object keyed by priority ({@code "High Priority"},
 * {@code "Medium Priority"}, {@code "Low Priority"}), whose entries are numbered from 1 in that order,
 * or as an array of finding objects. Entries produced by the citation cleaning pass carry
 * {@code citation_clean} and {@code suggested_replacement_clean}, which take precedence over the raw
 * fields.
 */
public class FindingsReader {

    private final ObjectMapper objectMapper;

    public FindingsReader() {
        this(new ObjectMapper());
    }

    public FindingsReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<Finding> read(Path path) {
        return parseFindings(readTree(path));
    }

    public List<Finding> read(String json) {
        return parseFindings(readTree(json));
    }

    public EditSelection readSelection(Path path) {
        return parseSelection(readTree(path));
    }

    public EditSelection readSelection(String json) {
        return parseSelection(readTree(json));
    }

    private JsonNode readTree(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new InvalidFindingException("Failed to read JSON from " + path, ex);
        }
    }

    private JsonNode readTree(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return objectMapper.readTree(json);
        } catch (IOException ex) {
            throw new InvalidFindingException("Malformed findings JSON", ex);
        }
    }

    List<Finding> parseFindings(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new InvalidFindingException("Findings document is empty");
        }
        List<Finding> findings = new ArrayList<>();
        if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                findings.add(toFinding(root.get(i), i + 1, Priority.MEDIUM));
            }
        } else if (root.isObject() && root.has("findings")) {
            return parseFindings(root.get("findings"));
        } else if (root.isObject() && isReviewerReport(root)) {
            int nextId = 1;
            for (Priority priority : Priority.values()) {
                JsonNode group = root.path(priority.reportKey());
                if (group.isMissingNode() || group.isNull()) {
                    continue;
                }
                if (!group.isArray()) {
                    throw new InvalidFindingException("'" + priority.reportKey() + "' must be an array");
                }
                for (JsonNode entry : group) {
                    findings.add(toFinding(entry, nextId++, priority));
                }
            }
        } else {
            throw new InvalidFindingException("Unrecognized findings document: expected an array or a reviewer report");
        }
        FindingValidator.validate(findings);
        return List.copyOf(findings);
    }

    private boolean isReviewerReport(JsonNode root) {
        for (Priority priority : Priority.values()) {
            if (root.has(priority.reportKey())) {
                return true;
            }
        }
        return false;
    }

    private Finding toFinding(JsonNode node, int defaultId, Priority defaultPriority) {
        if (node == null || !node.isObject()) {
            throw new InvalidFindingException("Finding " + defaultId + " must be a JSON object");
        }
        int id = defaultId;
        JsonNode idNode = node.get("id");
        if (idNode != null && !idNode.isNull()) {
            if (idNode.isTextual()) {
                id = parseId(idNode.asText());
            } else if (idNode.isIntegralNumber() && idNode.canConvertToInt()) {
                id = idNode.asInt();
            } else {
                throw new InvalidFindingException("Finding id must be an integer but was " + idNode);
            }
        }
        Priority priority = text(node, "priority").map(raw -> priority(raw, defaultId)).orElse(defaultPriority);
        String citation = text(node, "citation_clean").or(() -> text(node, "citation"))
                .orElseThrow(() -> new InvalidFindingException("Finding " + defaultId + " is missing 'citation'"));
        String replacement = text(node, "suggested_replacement_clean")
                .or(() -> text(node, "suggested_replacement"))
                .orElseThrow(() -> new InvalidFindingException("Finding " + defaultId + " is missing 'suggested_replacement'"));
        return new Finding(id, priority,
                text(node, "section").orElse(""),
                text(node, "issue").orElse(""),
                text(node, "problem").orElse(""),
                citation,
                replacement);
    }

    private EditSelection parseSelection(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidFindingException("Selection must be a JSON object");
        }
        boolean acceptAll = root.path("accept_all_by_default").asBoolean(false);
        Set<Integer> accept = ids(root.path("accept"), "accept");
        Set<Integer> discard = ids(root.path("discard"), "discard");
        Map<Integer, EditSelection.Adjustment> overrides = new HashMap<>();
        JsonNode overridesNode = root.path("overrides");
        if (overridesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = overridesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                overrides.put(parseId(field.getKey()), new EditSelection.Adjustment(
                        text(value, "suggested_replacement"),
                        text(value, "citation_hint")));
            }
        } else if (!overridesNode.isMissingNode() && !overridesNode.isNull()) {
            throw new InvalidFindingException("'overrides' must be an object keyed by finding id");
        }
        return new EditSelection(acceptAll, accept, discard, overrides);
    }

    private Set<Integer> ids(JsonNode node, String field) {
        Set<Integer> ids = new HashSet<>();
        if (node.isMissingNode() || node.isNull()) {
            return ids;
        }
        if (!node.isArray()) {
            throw new InvalidFindingException("'" + field + "' must be an array of finding ids");
        }
        for (JsonNode value : node) {
            ids.add(value.isTextual() ? parseId(value.asText()) : value.asInt());
        }
        return ids;
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    private static Priority priority(String raw, int position) {
        try {
            return Priority.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new InvalidFindingException("Finding " + position + " has unsupported priority '" + raw + "'", ex);
        }
    }

    private static int parseId(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidFindingException("Finding id must be an integer but was '" + raw + "'", ex);
        }
    }
}
