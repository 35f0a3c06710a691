package com.sportsync.resolution.scoring;

/**
 * Decision tier for a match score.
 */
public enum ConfidenceTier {
    /** At or above the auto-accept threshold: write the match without a human. */
    AUTO_ACCEPT,
    /** Between the review and auto-accept thresholds: a human decides. */
    MANUAL_REVIEW,
    /** Below the review threshold: not a match. */
    REJECT
}
