package com.sportsync.resolution.review;

import com.sportsync.resolution.api.Page;
import com.sportsync.resolution.api.PageRequest;
import com.sportsync.resolution.core.model.EntityKind;

import java.util.Optional;

/**
 * Holds records awaiting a human decision. At most one item exists per source record
 * (kind, sport, source, record key). Status changes are compare-and-swap so two reviewers
 * can never both decide the same item.
 */
public interface ReviewQueue {

    /**
     * Adds the item, or returns the item already queued for the same source record.
     */
    ReviewItem submit(ReviewItem item);

    /**
     * @return the review item, or null if not found
     */
    ReviewItem get(String reviewId);

    Optional<ReviewItem> findByRecord(EntityKind kind, String sport, String source, String recordKey);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByKind(EntityKind kind, PageRequest page);

    /**
     * Moves the item from {@code expected} to {@code decided.getStatus()} atomically.
     *
     * @param reviewId the item to change
     * @param expected the status the caller believes the item has
     * @param decided  the new state of the item
     * @return the stored item after the change
     * @throws IllegalArgumentException if the item does not exist
     * @throws ReviewConflictException  if the item's status is not {@code expected}
     */
    ReviewItem compareAndSet(String reviewId, ReviewStatus expected, ReviewItem decided);

    long countPending();
}
