package ai.nda.redline.engine;

import ai.nda.redline.text.TextNormalizer;

/**
 * Narrows a replacement to the words that actually differ, so a tracked revision does not strike
 * through and re-insert text shared by both versions.
 */
final class TrackedDiff {

    private TrackedDiff() {
    }

    /**
     * Returns the part of {@code original} to delete, in offsets relative to {@code original}, and the
     * text to insert in its place. Cuts fall on word boundaries only.
     */
    static Change narrow(String original, String replacement) {
        int limit = Math.min(original.length(), replacement.length());
        int prefix = 0;
        while (prefix < limit && original.charAt(prefix) == replacement.charAt(prefix)) {
            prefix++;
        }
        while (prefix > 0 && !(isBoundary(original, prefix) && isBoundary(replacement, prefix))) {
            prefix--;
        }
        int suffix = 0;
        while (suffix < limit - prefix
                && original.charAt(original.length() - 1 - suffix) == replacement.charAt(replacement.length() - 1 - suffix)) {
            suffix++;
        }
        while (suffix > 0 && !(isBoundary(original, original.length() - suffix)
                && isBoundary(replacement, replacement.length() - suffix))) {
            suffix--;
        }
        int end = original.length() - suffix;
        String insertion = replacement.substring(prefix, replacement.length() - suffix);
        if (prefix == end && insertion.isEmpty()) {
            return new Change(0, original.length(), replacement);
        }
        return new Change(prefix, end, insertion);
    }

    private static boolean isBoundary(String text, int index) {
        return index == 0
                || index == text.length()
                || TextNormalizer.isSpace(text.charAt(index - 1))
                || TextNormalizer.isSpace(text.charAt(index));
    }

    record Change(int start, int end, String insertion) {

        boolean isPureInsertion() {
            return start == end;
        }

        boolean isPureDeletion() {
            return insertion.isEmpty();
        }
    }
}
