package com.sportsync.resolution.review;

import com.sportsync.resolution.core.IdentityResolutionException;

/**
 * A decision lost the compare-and-swap on a review item's status: someone else decided it first.
 */
public class ReviewConflictException extends IdentityResolutionException {

    private final String reviewItemId;
    private final ReviewStatus actualStatus;

    public ReviewConflictException(String reviewItemId, ReviewStatus actualStatus) {
        super("Review item " + reviewItemId + " is not pending (status " + actualStatus + ")");
        this.reviewItemId = reviewItemId;
        this.actualStatus = actualStatus;
    }

    public String getReviewItemId() {
        return reviewItemId;
    }

    public ReviewStatus getActualStatus() {
        return actualStatus;
    }
}
