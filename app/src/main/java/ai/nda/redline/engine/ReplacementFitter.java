package ai.nda.redline.engine;

import ai.nda.redline.text.TextNormalizer;

/**
 * Adjusts a replacement and its span to the surrounding text so edits leave no doubled or stray spaces.
 */
final class ReplacementFitter {

    private static final String CLOSING = ",.;:!?)]}%\u00BB\u201D\u2019";
    private static final String OPENING = "([{\u00AB\u201C\u2018";

    private ReplacementFitter() {
    }

    static Fit fit(String paragraph, int start, int end, String replacement) {
        if (replacement.isEmpty()) {
            return fitDeletion(paragraph, start, end);
        }
        String text = replacement;
        if (text.startsWith(" ") && (start == 0 || isSpace(paragraph.charAt(start - 1)) || isOpening(paragraph.charAt(start - 1)))) {
            text = text.stripLeading();
        }
        if (text.endsWith(" ") && (end == paragraph.length() || isSpace(paragraph.charAt(end)) || isClosing(paragraph.charAt(end)))) {
            text = text.stripTrailing();
        }
        return new Fit(start, end, text);
    }

    private static Fit fitDeletion(String paragraph, int start, int end) {
        boolean spaceBefore = start > 0 && isSpace(paragraph.charAt(start - 1));
        boolean spaceAfter = end < paragraph.length() && isSpace(paragraph.charAt(end));
        if (spaceAfter && (spaceBefore || start == 0)) {
            return new Fit(start, end + 1, "");
        }
        if (spaceBefore && (end == paragraph.length() || isClosing(paragraph.charAt(end)))) {
            return new Fit(start - 1, end, "");
        }
        return new Fit(start, end, "");
    }

    private static boolean isSpace(char ch) {
        return TextNormalizer.isSpace(ch);
    }

    private static boolean isClosing(char ch) {
        return CLOSING.indexOf(ch) >= 0;
    }

    private static boolean isOpening(char ch) {
        return OPENING.indexOf(ch) >= 0;
    }

    record Fit(int start, int end, String text) {
    }
}
