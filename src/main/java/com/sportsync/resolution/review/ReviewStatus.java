package com.sportsync.resolution.review;

/**
 * Status of an item in the manual review queue.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
