package com.sportsync.resolution.similarity;

/**
 * A string similarity metric over already-normalized names.
 * Scores are in [0,1]; identical inputs score 1.0 and null inputs score 0.0.
 */
public interface SimilarityAlgorithm {

    double compute(String a, String b);

    String getName();
}
