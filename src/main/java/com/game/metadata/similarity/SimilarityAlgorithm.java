package com.game.metadata.similarity;

/**
 * A title similarity measure. Scores run from 0.0 for unrelated titles to 1.0 for
 * identical ones; callers normalize titles before comparing.
 */
public interface SimilarityAlgorithm {

    double compute(String first, String second);

    /** Short identifier used in log lines, e.g. {@code "Levenshtein"}. */
    String getName();
}
