package com.sportsync.resolution.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted blend of edit distance, Jaro-Winkler and token overlap.
 * The blend is computed on the names as given and on their token-sorted forms, and the
 * higher value wins, so reordered names ("Hardaway Tim") are not penalized.
 */
public class NameSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(NameSimilarity.class);

    private final EditDistance editDistance = new EditDistance();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final TokenSetSimilarity tokenSet = new TokenSetSimilarity();
    private final SimilarityWeights weights;

    public NameSimilarity() {
        this(SimilarityWeights.forPlayerNames());
    }

    public NameSimilarity(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        double direct = blend(a, b);
        double reordered = blend(TokenSetSimilarity.sortedTokens(a), TokenSetSimilarity.sortedTokens(b));
        double score = Math.max(direct, reordered);
        log.debug("similarity.name a='{}' b='{}' direct={} reordered={}", a, b, direct, reordered);
        return Math.min(1.0, Math.max(0.0, score));
    }

    @Override
    public String getName() {
        return "NameSimilarity";
    }

    private double blend(String a, String b) {
        return weights.editDistanceWeight() * editDistance.compute(a, b)
                + weights.jaroWinklerWeight() * jaroWinkler.compute(a, b)
                + weights.tokenSetWeight() * tokenSet.compute(a, b);
    }
}
