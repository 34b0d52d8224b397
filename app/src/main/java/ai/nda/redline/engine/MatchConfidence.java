package ai.nda.redline.engine;

/**
 * How a citation was located, in decreasing order of strictness.
 */
public enum MatchConfidence {
    EXACT("exact"),
    CASE_INSENSITIVE("case-insensitive"),
    FUZZY("fuzzy");

    private final String wireName;

    MatchConfidence(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
