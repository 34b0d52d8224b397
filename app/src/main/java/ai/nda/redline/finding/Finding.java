package ai.nda.redline.finding;

import java.util.Objects;

/**
 * A reviewer finding: the cited text of the document and what it should say instead.
 */
public record Finding(int id,
                      Priority priority,
                      String section,
                      String issue,
                      String problem,
                      String citation,
                      String suggestedReplacement) {

    public static final String NOT_FOUND = "Not Found";

    public Finding {
        if (id <= 0) {
            throw new InvalidFindingException("Finding id must be positive but was " + id);
        }
        priority = Objects.requireNonNullElse(priority, Priority.MEDIUM);
        section = Objects.requireNonNullElse(section, "");
        issue = Objects.requireNonNullElse(issue, "");
        problem = Objects.requireNonNullElse(problem, "");
        if (citation == null) {
            throw new InvalidFindingException("Finding " + id + " has no citation");
        }
        if (suggestedReplacement == null) {
            throw new InvalidFindingException("Finding " + id + " has no suggested replacement");
        }
    }

    /**
     * True when the reviewer could not quote the document for this finding.
     */
    public boolean citationNotFound() {
        return NOT_FOUND.equalsIgnoreCase(citation.strip());
    }

    public Finding withCitation(String value) {
        return new Finding(id, priority, section, issue, problem, value, suggestedReplacement);
    }

    public Finding withSuggestedReplacement(String value) {
        return new Finding(id, priority, section, issue, problem, citation, value);
    }
}
