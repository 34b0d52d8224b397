package ai.nda.redline.finding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FindingsReaderTest {

    private final FindingsReader reader = new FindingsReader();

    @Test
    void readsReviewerReportNumberingHighThenMediumThenLow() {
        String json = """
                {
                  "Low Priority": [
                    {"section": "9", "issue": "Style", "citation": "shall", "suggested_replacement": "will"}
                  ],
                  "High Priority": [
                    {"section": "4", "issue": "Penalty", "problem": "Unenforceable",
                     "citation": "pay $50,000 per breach", "suggested_replacement": "pay proven damages"},
                    {"section": "7", "issue": "Term", "citation": "perpetual", "suggested_replacement": "five years"}
                  ],
                  "Medium Priority": [
                    {"section": "2", "issue": "Scope", "citation": "Not Found", "suggested_replacement": "Add a clause"}
                  ]
                }
                """;

        List<Finding> findings = reader.read(json);

        assertThat(findings).extracting(Finding::id).containsExactly(1, 2, 3, 4);
        assertThat(findings).extracting(Finding::priority)
                .containsExactly(Priority.HIGH, Priority.HIGH, Priority.MEDIUM, Priority.LOW);
        assertThat(findings.get(0).problem()).isEqualTo("Unenforceable");
        assertThat(findings.get(2).citationNotFound()).isTrue();
    }

    @Test
    void readsArrayWithDefaultsForMissingIdAndPriority() {
        String json = """
                [
                  {"citation": "perpetual", "suggested_replacement": "five years"},
                  {"id": "12", "priority": "high", "citation": "England", "suggested_replacement": "Wales"}
                ]
                """;

        List<Finding> findings = reader.read(json);

        assertThat(findings.get(0).id()).isEqualTo(1);
        assertThat(findings.get(0).priority()).isEqualTo(Priority.MEDIUM);
        assertThat(findings.get(0).section()).isEmpty();
        assertThat(findings.get(1).id()).isEqualTo(12);
        assertThat(findings.get(1).priority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void readsWrappedFindingsArray() {
        List<Finding> findings = reader.read("""
                {"findings": [{"id": 3, "citation": "a", "suggested_replacement": "b"}]}
                """);

        assertThat(findings).singleElement().extracting(Finding::id).isEqualTo(3);
    }

    @Test
    void prefersCleanedCitationAndReplacement() {
        List<Finding> findings = reader.read("""
                [{"id": 1,
                  "citation": "**pay** $50,000 ...", "citation_clean": "pay $50,000",
                  "suggested_replacement": "raw", "suggested_replacement_clean": "pay proven damages"}]
                """);

        assertThat(findings.get(0).citation()).isEqualTo("pay $50,000");
        assertThat(findings.get(0).suggestedReplacement()).isEqualTo("pay proven damages");
    }

    @Test
    void readsFindingsFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("findings.json");
        Files.writeString(file, "[{\"id\": 5, \"citation\": \"x\", \"suggested_replacement\": \"y\"}]");

        assertThat(reader.read(file)).extracting(Finding::id).containsExactly(5);
    }

    @Test
    void rejectsMissingCitation() {
        assertThatThrownBy(() -> reader.read("[{\"id\": 1, \"suggested_replacement\": \"y\"}]"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("missing 'citation'");
    }

    @Test
    void rejectsDuplicateIds() {
        String json = """
                [{"id": 2, "citation": "a", "suggested_replacement": "b"},
                 {"id": 2, "citation": "c", "suggested_replacement": "d"}]
                """;

        assertThatThrownBy(() -> reader.read(json))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("Duplicate finding id 2");
    }

    @Test
    void rejectsNonIntegerIdAndUnknownPriority() {
        assertThatThrownBy(() -> reader.read("[{\"id\": 1.5, \"citation\": \"a\", \"suggested_replacement\": \"b\"}]"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("integer");
        assertThatThrownBy(() -> reader.read("[{\"id\": \"one\", \"citation\": \"a\", \"suggested_replacement\": \"b\"}]"))
                .isInstanceOf(InvalidFindingException.class);
        assertThatThrownBy(() -> reader.read("[{\"priority\": \"urgent\", \"citation\": \"a\", \"suggested_replacement\": \"b\"}]"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("unsupported priority");
    }

    @Test
    void rejectsMalformedAndUnrecognizedDocuments(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read("{not json"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> reader.read("{\"comments\": []}"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("Unrecognized");
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.json")))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("Failed to read JSON");
    }

    @Test
    void readsSelection() {
        EditSelection selection = reader.readSelection("""
                {
                  "accept_all_by_default": true,
                  "discard": [2, "3"],
                  "overrides": {"4": {"suggested_replacement": "three years", "citation_hint": "five years"}}
                }
                """);

        assertThat(selection.acceptAllByDefault()).isTrue();
        assertThat(selection.discard()).containsExactlyInAnyOrder(2, 3);
        assertThat(selection.overrideFor(4)).hasValueSatisfying(adjustment -> {
            assertThat(adjustment.suggestedReplacement()).contains("three years");
            assertThat(adjustment.citationHint()).contains("five years");
        });
        assertThat(selection.keeps(1)).isTrue();
        assertThat(selection.keeps(2)).isFalse();
    }

    @Test
    void rejectsMalformedSelection() {
        assertThatThrownBy(() -> reader.readSelection("[1, 2]"))
                .isInstanceOf(InvalidFindingException.class);
        assertThatThrownBy(() -> reader.readSelection("{\"accept\": 1}"))
                .isInstanceOf(InvalidFindingException.class)
                .hasMessageContaining("'accept'");
    }
}
