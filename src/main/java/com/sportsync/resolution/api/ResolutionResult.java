package com.sportsync.resolution.api;

import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;

import java.util.Objects;

/**
 * Outcome of resolving one source record.
 *
 * <p>An uncertain outcome is always explicit: {@code MANUAL_REVIEW} carries the review item id and
 * no canonical id, {@code FAILED} means the record is known to be unmatched.</p>
 *
 * @param canonicalId  resolved canonical entity, null unless matched
 * @param confidence   confidence of the decision in [0,1]
 * @param status       mapping status the record ended in
 * @param created      whether this call created the canonical entity
 * @param method       which pipeline step decided
 * @param reviewItemId review item holding the record, when in manual review
 */
public record ResolutionResult(
        String canonicalId,
        double confidence,
        MappingStatus status,
        boolean created,
        MatchMethod method,
        String reviewItemId
) {
    public ResolutionResult {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(method, "method is required");
        if (status == MappingStatus.MATCHED && canonicalId == null) {
            throw new IllegalArgumentException("matched result requires a canonicalId");
        }
    }

    public static ResolutionResult matched(String canonicalId, double confidence, MatchMethod method) {
        return new ResolutionResult(canonicalId, confidence, MappingStatus.MATCHED, false, method, null);
    }

    public static ResolutionResult created(String canonicalId) {
        return new ResolutionResult(canonicalId, 1.0, MappingStatus.MATCHED, true, MatchMethod.CREATED, null);
    }

    /**
     * Result of a reviewer's approval, linking to an existing entity or creating one.
     */
    public static ResolutionResult approved(String canonicalId, boolean created) {
        return new ResolutionResult(canonicalId, 1.0, MappingStatus.MATCHED, created, MatchMethod.MANUAL, null);
    }

    public static ResolutionResult manualReview(String reviewItemId, double bestConfidence) {
        return new ResolutionResult(null, bestConfidence, MappingStatus.MANUAL_REVIEW, false, MatchMethod.NONE,
                reviewItemId);
    }

    public static ResolutionResult unmatched(double confidence) {
        return new ResolutionResult(null, confidence, MappingStatus.FAILED, false, MatchMethod.NONE, null);
    }

    public boolean isMatched() {
        return status == MappingStatus.MATCHED;
    }

    public boolean isManualReview() {
        return status == MappingStatus.MANUAL_REVIEW;
    }
}
