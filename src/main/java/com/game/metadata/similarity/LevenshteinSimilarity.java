package com.game.metadata.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / maxLength}.
 * Two empty strings are identical and score 1.0.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        if (first.equals(second)) {
            return 1.0;
        }
        int maxLength = Math.max(first.length(), second.length());
        return 1.0 - ((double) distance(first, second) / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer edit distance keeping only two rows, sized to the shorter input.
     */
    public int distance(String first, String second) {
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i <= shorter.length(); i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
