package com.company.correlation.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public class SimilarityUtils {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final double SEQUENCE_WEIGHT = 0.4;
    private static final double JACCARD_WEIGHT = 0.6;

    /**
     * Lowercase, replace anything outside [a-z0-9] and whitespace with a space, collapse whitespace
     */
    public static String normalize(String text) {
        if (text == null) return "";
        String lowered = text.toLowerCase(Locale.ROOT);
        String cleaned = NON_ALPHANUMERIC.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    public static Set<String> words(String normalized) {
        if (normalized == null || normalized.isEmpty()) return new HashSet<>();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    /**
     * Similarity of two free-text fields in [0, 1].
     * Blank input on either side scores 0; inputs that normalise to no words at all score 1.
     */
    public static double textSimilarity(String text1, String text2) {
        if (isBlank(text1) || isBlank(text2)) return 0.0;

        String norm1 = normalize(text1);
        String norm2 = normalize(text2);

        Set<String> words1 = words(norm1);
        Set<String> words2 = words(norm2);
        if (words1.isEmpty() && words2.isEmpty()) return 1.0;
        if (words1.isEmpty() || words2.isEmpty()) return 0.0;

        double sequence = sequenceRatio(norm1, norm2);
        double jaccard = jaccard(words1, words2);
        return sequence * SEQUENCE_WEIGHT + jaccard * JACCARD_WEIGHT;
    }

    public static double jaccard(Set<String> words1, Set<String> words2) {
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        if (union.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        return (double) intersection.size() / union.size();
    }

    /**
     * 2*M/T where M is the number of characters in matching blocks, found by taking the
     * longest common substring and recursing on the unmatched text to either side of it.
     */
    public static double sequenceRatio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) return 0;

        int[] match = longestMatch(a, aLo, aHi, b, bLo, bHi);
        int size = match[2];
        if (size == 0) return 0;

        int i = match[0];
        int j = match[1];
        return size
                + matchingCharacters(a, aLo, i, b, bLo, j)
                + matchingCharacters(a, i + size, aHi, b, j + size, bHi);
    }

    // Earliest longest block wins: lowest i, then lowest j
    private static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];

        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    int start = i - current[k] + 1;
                    int startJ = j - current[k] + 1;
                    if (current[k] > bestSize
                            || (current[k] == bestSize && start < bestI)) {
                        bestSize = current[k];
                        bestI = start;
                        bestJ = startJ;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
            Arrays.fill(current, 0);
        }
        return new int[]{bestI, bestJ, bestSize};
    }

    /**
     * Non-overlapping occurrences of a keyword anywhere in the text
     */
    public static int countOccurrences(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword.isEmpty()) return 0;
        int count = 0;
        int from = text.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = text.indexOf(keyword, from + keyword.length());
        }
        return count;
    }

    public static int wordCount(String text) {
        if (isBlank(text)) return 0;
        return WHITESPACE.split(text.trim()).length;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
