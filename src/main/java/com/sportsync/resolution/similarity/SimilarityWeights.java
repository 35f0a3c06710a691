package com.sportsync.resolution.similarity;

/**
 * Weights of each metric inside {@link NameSimilarity}. Must be non-negative and sum to 1.
 */
public record SimilarityWeights(double editDistanceWeight, double jaroWinklerWeight, double tokenSetWeight) {

    public SimilarityWeights {
        if (editDistanceWeight < 0 || jaroWinklerWeight < 0 || tokenSetWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = editDistanceWeight + jaroWinklerWeight + tokenSetWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Person names: typos and nicknames matter more than word overlap.
     */
    public static SimilarityWeights forPlayerNames() {
        return new SimilarityWeights(0.4, 0.4, 0.2);
    }

    /**
     * Team names: word overlap ("la clippers" / "los angeles clippers") carries more signal.
     */
    public static SimilarityWeights forTeamNames() {
        return new SimilarityWeights(0.3, 0.3, 0.4);
    }
}
