package ai.nda.redline.engine;

import ai.nda.redline.text.TextNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates citations in flattened paragraph text.
 *
 * <p>Matching is tiered: an exact match on the folded search text, then a case-insensitive match when
 * the caller allows it, then a fuzzy match. The fuzzy tier slides windows of {@code n-1}, {@code n}
 * and {@code n+1} word tokens over the paragraph, where {@code n} is the citation's token count, and
 * scores each window with the Dice coefficient of the two token multisets. Fuzzy tokens fold case only
 * when the case-insensitive tier is allowed. A window is accepted when
 * its score reaches the configured floor. Equal candidates resolve to the leftmost one, then to the
 * shorter window, so resolution is deterministic.
 */
public class SpanResolver {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private final double fuzzyThreshold;

    public SpanResolver() {
        this(DEFAULT_FUZZY_THRESHOLD);
    }

    public SpanResolver(double fuzzyThreshold) {
        if (fuzzyThreshold <= 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be in (0, 1]");
        }
        this.fuzzyThreshold = fuzzyThreshold;
    }

    public double fuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Best span for {@code citation} within one paragraph.
     */
    public Optional<MatchSpan> resolve(FlatText flat, String citation, boolean caseFallback) {
        String needle = TextNormalizer.normalize(citation);
        if (needle.isEmpty()) {
            return Optional.empty();
        }
        List<MatchSpan> exact = occurrences(flat, flat.searchText(), needle, MatchConfidence.EXACT);
        if (!exact.isEmpty()) {
            return Optional.of(exact.get(0));
        }
        if (caseFallback) {
            List<MatchSpan> folded = occurrences(flat, TextNormalizer.foldCase(flat.searchText()),
                    TextNormalizer.foldCase(needle), MatchConfidence.CASE_INSENSITIVE);
            if (!folded.isEmpty()) {
                return Optional.of(folded.get(0));
            }
        }
        List<MatchSpan> fuzzy = fuzzyCandidates(flat, tokenize(needle, caseFallback), caseFallback);
        return fuzzy.isEmpty() ? Optional.empty() : Optional.of(fuzzy.get(0));
    }

    /**
     * Resolves {@code citation} across every paragraph of a document. A stricter tier anywhere in the
     * document beats a looser one; within a tier the earliest paragraph wins, except that fuzzy
     * candidates are ranked by score first.
     */
    public Resolution resolveInDocument(List<FlatText> paragraphs, String citation, boolean caseFallback, MatchPolicy policy) {
        String needle = TextNormalizer.normalize(citation);
        if (needle.isEmpty()) {
            return Resolution.notFound();
        }
        List<MatchSpan> exact = new ArrayList<>();
        for (FlatText flat : paragraphs) {
            exact.addAll(occurrences(flat, flat.searchText(), needle, MatchConfidence.EXACT));
        }
        if (!exact.isEmpty()) {
            return decide(exact, policy);
        }
        if (caseFallback) {
            String foldedNeedle = TextNormalizer.foldCase(needle);
            List<MatchSpan> folded = new ArrayList<>();
            for (FlatText flat : paragraphs) {
                folded.addAll(occurrences(flat, TextNormalizer.foldCase(flat.searchText()), foldedNeedle,
                        MatchConfidence.CASE_INSENSITIVE));
            }
            if (!folded.isEmpty()) {
                return decide(folded, policy);
            }
        }
        List<String> citationTokens = tokenize(needle, caseFallback);
        List<MatchSpan> fuzzy = new ArrayList<>();
        double best = 0.0;
        for (FlatText flat : paragraphs) {
            List<MatchSpan> candidates = fuzzyCandidates(flat, citationTokens, caseFallback);
            if (candidates.isEmpty()) {
                continue;
            }
            double score = candidates.get(0).score();
            if (score > best) {
                best = score;
                fuzzy.clear();
            }
            if (score == best) {
                fuzzy.addAll(candidates);
            }
        }
        return fuzzy.isEmpty() ? Resolution.notFound() : decide(fuzzy, policy);
    }

    private Resolution decide(List<MatchSpan> candidates, MatchPolicy policy) {
        MatchSpan first = candidates.get(0);
        if (policy == MatchPolicy.REJECT_AMBIGUOUS
                && candidates.stream().anyMatch(candidate -> !candidate.overlaps(first))) {
            return Resolution.ambiguous();
        }
        return Resolution.found(first);
    }

    private List<MatchSpan> occurrences(FlatText flat, String haystack, String needle, MatchConfidence confidence) {
        List<MatchSpan> spans = new ArrayList<>();
        int from = 0;
        int index;
        while ((index = haystack.indexOf(needle, from)) >= 0) {
            spans.add(new MatchSpan(flat.paragraph(), flat.toTextStart(index),
                    flat.toTextEnd(index + needle.length()), confidence, 1.0));
            from = index + 1;
        }
        return spans;
    }

    /**
     * Windows sharing this paragraph's best fuzzy score, leftmost and shortest first. Tokens are
     * compared case-sensitively unless {@code foldCase} is set.
     */
    private List<MatchSpan> fuzzyCandidates(FlatText flat, List<String> citationTokens, boolean foldCase) {
        int size = citationTokens.size();
        if (size == 0) {
            return List.of();
        }
        List<Token> tokens = tokens(flat.searchText(), foldCase);
        Map<String, Integer> citationCounts = counts(citationTokens);
        List<MatchSpan> best = new ArrayList<>();
        double bestScore = fuzzyThreshold;
        for (int from = 0; from < tokens.size(); from++) {
            for (int width = Math.max(1, size - 1); width <= size + 1; width++) {
                int to = from + width;
                if (to > tokens.size()) {
                    break;
                }
                double score = dice(citationCounts, size, tokens, from, to);
                if (score < bestScore) {
                    continue;
                }
                if (score > bestScore) {
                    bestScore = score;
                    best.clear();
                }
                int start = flat.toTextStart(tokens.get(from).start());
                int end = flat.toTextEnd(tokens.get(to - 1).end());
                best.add(new MatchSpan(flat.paragraph(), start, end, MatchConfidence.FUZZY, score));
            }
        }
        return best;
    }

    private static double dice(Map<String, Integer> citationCounts, int citationSize, List<Token> tokens, int from, int to) {
        Map<String, Integer> window = new HashMap<>();
        for (int i = from; i < to; i++) {
            window.merge(tokens.get(i).value(), 1, Integer::sum);
        }
        int common = 0;
        for (Map.Entry<String, Integer> entry : window.entrySet()) {
            common += Math.min(entry.getValue(), citationCounts.getOrDefault(entry.getKey(), 0));
        }
        return 2.0 * common / (citationSize + (to - from));
    }

    private static Map<String, Integer> counts(List<String> values) {
        Map<String, Integer> counts = new HashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        return counts;
    }

    static List<String> tokenize(String text, boolean foldCase) {
        List<String> values = new ArrayList<>();
        for (Token token : tokens(text, foldCase)) {
            values.add(token.value());
        }
        return values;
    }

    private static List<Token> tokens(String text, boolean foldCase) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String value = foldCase ? TextNormalizer.foldCase(matcher.group()) : matcher.group();
            tokens.add(new Token(value, matcher.start(), matcher.end()));
        }
        return tokens;
    }

    private record Token(String value, int start, int end) {
    }
}
