package com.sportsync.resolution.matching;

import com.sportsync.resolution.review.ReviewCandidate;
import com.sportsync.resolution.scoring.ConfidenceScore;

/**
 * A canonical entity considered for a source record, with the score it received.
 *
 * @param canonicalId candidate id
 * @param label       human-readable summary shown to reviewers
 * @param score       combined confidence, tier and signals
 */
public record ScoredCandidate(String canonicalId, String label, ConfidenceScore score) {

    public double confidence() {
        return score.confidence();
    }

    public ReviewCandidate toReviewCandidate() {
        return new ReviewCandidate(canonicalId, label, score.confidence(), score.details());
    }
}
