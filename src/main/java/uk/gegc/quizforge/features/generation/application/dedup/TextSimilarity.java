package uk.gegc.quizforge.features.generation.application.dedup;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical similarity of short texts on a 0-100 scale.
 *
 * <p>Combined score: 40% normalized Levenshtein similarity, 30% Jaccard over word sets,
 * 30% cosine over word counts. All three are computed on normalized text.
 */
public final class TextSimilarity {

    static final double LEVENSHTEIN_WEIGHT = 0.4;
    static final double JACCARD_WEIGHT = 0.3;
    static final double COSINE_WEIGHT = 0.3;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> ARTICLES = Set.of("a", "an", "the");

    private TextSimilarity() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Lower-cases, strips punctuation, drops articles and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        StringBuilder normalized = new StringBuilder(cleaned.length());
        for (String word : WHITESPACE.split(cleaned.trim())) {
            if (word.isEmpty() || ARTICLES.contains(word)) {
                continue;
            }
            if (normalized.length() > 0) {
                normalized.append(' ');
            }
            normalized.append(word);
        }
        return normalized.toString();
    }

    public static double similarity(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        if (a.equals(b)) {
            return 100.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        List<String> wordsA = Arrays.asList(a.split(" "));
        List<String> wordsB = Arrays.asList(b.split(" "));
        double combined = LEVENSHTEIN_WEIGHT * levenshteinSimilarity(a, b)
                + JACCARD_WEIGHT * jaccard(wordsA, wordsB)
                + COSINE_WEIGHT * cosine(wordsA, wordsB);
        return combined * 100.0;
    }

    /**
     * 1 - distance / longer length, on the given strings as is
     */
    static double levenshteinSimilarity(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longer;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    static double jaccard(List<String> a, List<String> b) {
        Set<String> setA = new HashSet<>(a);
        Set<String> setB = new HashSet<>(b);
        Set<String> union = new HashSet<>(setA);
        union.addAll(setB);
        if (union.isEmpty()) {
            return 1.0;
        }
        setA.retainAll(setB);
        return (double) setA.size() / union.size();
    }

    static double cosine(List<String> a, List<String> b) {
        Map<String, Integer> countsA = counts(a);
        Map<String, Integer> countsB = counts(b);
        double dot = 0;
        for (Map.Entry<String, Integer> entry : countsA.entrySet()) {
            dot += entry.getValue() * countsB.getOrDefault(entry.getKey(), 0);
        }
        double normA = norm(countsA);
        double normB = norm(countsB);
        return normA == 0 || normB == 0 ? 0.0 : dot / (normA * normB);
    }

    private static Map<String, Integer> counts(List<String> words) {
        Map<String, Integer> counts = new HashMap<>();
        for (String word : words) {
            counts.merge(word, 1, Integer::sum);
        }
        return counts;
    }

    private static double norm(Map<String, Integer> counts) {
        double sum = 0;
        for (int count : counts.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
