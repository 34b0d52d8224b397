package ai.nda.redline.engine;

public enum EditStatus {
    APPLIED("applied"),
    SKIPPED_NOT_FOUND("skipped-not-found"),
    SKIPPED_UNCHANGED("skipped-unchanged"),
    SKIPPED_AMBIGUOUS("skipped-ambiguous");

    private final String wireName;

    EditStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
