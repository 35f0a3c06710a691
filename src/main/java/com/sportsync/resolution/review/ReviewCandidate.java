package com.sportsync.resolution.review;

import java.util.Map;
import java.util.Objects;

/**
 * One candidate canonical entity offered to a reviewer, with the score it got and the signals behind it.
 *
 * @param canonicalId id of the candidate canonical entity
 * @param label       human-readable summary, e.g. {@code "CHI @ LAL 2026-01-27T19:00:00Z"}
 * @param confidence  combined confidence in [0,1]
 * @param signals     individual scorer inputs
 */
public record ReviewCandidate(String canonicalId, String label, double confidence, Map<String, Object> signals) {

    public ReviewCandidate {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        signals = signals != null ? Map.copyOf(signals) : Map.of();
    }
}
