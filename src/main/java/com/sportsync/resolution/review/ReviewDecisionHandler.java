package com.sportsync.resolution.review;

import com.sportsync.resolution.api.ResolutionResult;

/**
 * Applies a reviewer's decision to the canonical store for one entity kind.
 */
public interface ReviewDecisionHandler {

    /**
     * Performs the same write path as an automatic match.
     *
     * @param item        the approved item
     * @param candidateId the chosen canonical entity, or null to create a new one
     * @param reviewerId  who decided
     * @return the resulting resolution, always matched
     */
    ResolutionResult applyApproval(ReviewItem item, String candidateId, String reviewerId);

    /**
     * Marks the item's source record as explicitly unmatched.
     */
    void applyRejection(ReviewItem item, String reviewerId);
}
