package br.edu.ifba.scholargraph.core;

import java.util.HashSet;
import java.util.Set;

/**
 * Similarity between entity names, used to rank fuzzy search candidates.
 *
 * Combines two metrics on canonical names:
 * - trigram Jaccard (each word padded with two leading and one trailing blank)
 * - normalized Levenshtein similarity
 *
 * Scores are in [0, 1]; identical canonical names score 1.0.
 */
public final class NameSimilarity {

    private static final double TRIGRAM_WEIGHT = 0.7;
    private static final double EDIT_WEIGHT = 0.3;

    private NameSimilarity() {
    }

    public static double score(String first, String second) {
        String a = Canonicalizer.normalize(first);
        String b = Canonicalizer.normalize(second);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        return TRIGRAM_WEIGHT * trigramSimilarity(a, b) + EDIT_WEIGHT * levenshteinSimilarity(a, b);
    }

    /**
     * |intersection| / |union| of the trigram sets.
     */
    static double trigramSimilarity(String a, String b) {
        Set<String> trigramsA = trigrams(a);
        Set<String> trigramsB = trigrams(b);
        if (trigramsA.isEmpty() || trigramsB.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(trigramsA);
        intersection.retainAll(trigramsB);

        Set<String> union = new HashSet<>(trigramsA);
        union.addAll(trigramsB);

        return (double) intersection.size() / union.size();
    }

    /**
     * 1 - (editDistance / maxLength)
     */
    static double levenshteinSimilarity(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshteinDistance(a, b) / maxLength);
    }

    private static Set<String> trigrams(String canonical) {
        Set<String> result = new HashSet<>();
        for (String word : canonical.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                result.add(padded.substring(i, i + 3));
            }
        }
        return result;
    }

    private static int levenshteinDistance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }
}
