package ai.nda.redline.text;

import java.util.regex.Pattern;

/**
 * Canonicalizes citation and replacement strings before they are matched against document text.
 *
 * <p>{@link #normalize(String)} is the matching form: typographic quotes, dashes and exotic spaces
 * are folded to ASCII, stray markup is removed and whitespace is collapsed. {@link #clean(String)}
 * applies the same markup and whitespace cleanup but keeps the reviewer's characters, and is what
 * gets written into a document. Both are pure and never fail.
 */
public final class TextNormalizer {

    private static final Pattern TAG = Pattern.compile("</?[A-Za-z][A-Za-z0-9]*(?:\\s[^<>]*)?/?>");
    private static final Pattern STRONG = Pattern.compile("\\*\\*");
    private static final Pattern UNDERSCORE_EMPHASIS = Pattern.compile("__(?=\\S)(.+?)(?<=\\S)__");
    private static final Pattern BACKTICK = Pattern.compile("`");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String ELLIPSIS = "...";
    private static final char ELLIPSIS_CHAR = '\u2026';

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = stripMarkup(text);
        StringBuilder folded = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char ch = stripped.charAt(i);
            if (!isInvisible(ch)) {
                folded.append(foldChar(ch));
            }
        }
        return trimDecorations(collapse(folded.toString()));
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = stripMarkup(text);
        StringBuilder visible = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char ch = stripped.charAt(i);
            if (!isInvisible(ch)) {
                visible.append(isSpace(ch) ? ' ' : ch);
            }
        }
        return trimDecorations(collapse(visible.toString()));
    }

    /**
     * Length-preserving fold of a single character, used to build searchable paragraph text whose
     * offsets line up with the raw run text.
     */
    public static char foldChar(char ch) {
        return switch (ch) {
            case '\u201C', '\u201D', '\u201E', '\u201F', '\u2033', '\u00AB', '\u00BB' -> '"';
            case '\u2018', '\u2019', '\u201A', '\u201B', '\u2032' -> '\'';
            case '\u2010', '\u2011', '\u2012', '\u2013', '\u2014', '\u2015', '\u2212' -> '-';
            default -> isSpace(ch) ? ' ' : ch;
        };
    }

    /**
     * Length-preserving lower-casing used for case-insensitive matching.
     */
    public static String foldCase(String text) {
        StringBuilder lowered = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            lowered.append(Character.toLowerCase(text.charAt(i)));
        }
        return lowered.toString();
    }

    public static boolean isSpace(char ch) {
        return Character.isWhitespace(ch)
                || ch == '\u00A0'
                || ch == '\u2007'
                || ch == '\u2009'
                || ch == '\u200A'
                || ch == '\u202F'
                || ch == '\u3000';
    }

    public static boolean sameText(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    public static boolean isInvisible(char ch) {
        return ch == '\u200B' || ch == '\u200C' || ch == '\u200D' || ch == '\u2060' || ch == '\uFEFF' || ch == '\u00AD';
    }

    private static String stripMarkup(String text) {
        String result = TAG.matcher(text).replaceAll("");
        result = UNDERSCORE_EMPHASIS.matcher(result).replaceAll("$1");
        result = STRONG.matcher(result).replaceAll("");
        return BACKTICK.matcher(result).replaceAll("");
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    private static String trimDecorations(String text) {
        String result = text;
        String previous;
        do {
            previous = result;
            result = trimEllipses(result);
            if (result.length() >= 2 && isWrappingQuotePair(result)) {
                result = result.substring(1, result.length() - 1).strip();
            }
        } while (!result.equals(previous));
        return result;
    }

    private static String trimEllipses(String text) {
        String result = text;
        if (result.startsWith(ELLIPSIS)) {
            result = result.substring(ELLIPSIS.length()).strip();
        } else if (!result.isEmpty() && result.charAt(0) == ELLIPSIS_CHAR) {
            result = result.substring(1).strip();
        }
        if (result.endsWith(ELLIPSIS)) {
            result = result.substring(0, result.length() - ELLIPSIS.length()).strip();
        } else if (!result.isEmpty() && result.charAt(result.length() - 1) == ELLIPSIS_CHAR) {
            result = result.substring(0, result.length() - 1).strip();
        }
        return result;
    }

    /**
     * Quotes around the whole text, with no further quote of the same kind inside.
     */
    private static boolean isWrappingQuotePair(String text) {
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        String inner = text.substring(1, text.length() - 1);
        if (first == '"' && last == '"') {
            return inner.indexOf('"') < 0;
        }
        if (first == '\u201C' && last == '\u201D') {
            return inner.indexOf('\u201C') < 0 && inner.indexOf('\u201D') < 0;
        }
        return false;
    }
}
