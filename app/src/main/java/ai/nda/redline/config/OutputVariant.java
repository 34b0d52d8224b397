package ai.nda.redline.config;

import ai.nda.redline.engine.RevisionMode;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which document variants a run writes.
 */
public enum OutputVariant {
    TRACKED,
    CLEAN,
    BOTH;

    public static OutputVariant from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output variant must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "tracked" -> TRACKED;
            case "clean" -> CLEAN;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException("Unsupported output variant: " + raw);
        };
    }

    public Set<RevisionMode> modes() {
        return switch (this) {
            case TRACKED -> EnumSet.of(RevisionMode.TRACKED);
            case CLEAN -> EnumSet.of(RevisionMode.CLEAN);
            case BOTH -> EnumSet.allOf(RevisionMode.class);
        };
    }
}
