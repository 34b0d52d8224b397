package ai.nda.redline.finding;

import java.util.Locale;

/**
 * Reviewer-assigned priority of a finding.
 */
public enum Priority {
    HIGH("High Priority"),
    MEDIUM("Medium Priority"),
    LOW("Low Priority");

    private final String reportKey;

    Priority(String reportKey) {
        this.reportKey = reportKey;
    }

    /**
     * Key under which a reviewer report groups findings of this priority.
     */
    public String reportKey() {
        return reportKey;
    }

    public static Priority from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Priority must be provided");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith(" priority")) {
            value = value.substring(0, value.length() - " priority".length()).trim();
        }
        return switch (value) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            case "low" -> LOW;
            default -> throw new IllegalArgumentException("Unsupported priority: " + raw);
        };
    }
}
