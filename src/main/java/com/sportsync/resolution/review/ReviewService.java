package com.sportsync.resolution.review;

import com.sportsync.resolution.api.Page;
import com.sportsync.resolution.api.PageRequest;
import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.audit.AuditAction;
import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.logging.LogContext;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coordinates the review queue with the matchers and the audit log.
 *
 * <p>Approval and rejection first move the item out of PENDING with a compare-and-swap, so two
 * reviewers can never both act on it. If the store write that follows an approval fails, the item
 * is put back to PENDING and the failure is rethrown.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final AuditLogger auditLogger;
    private final MetricsService metricsService;
    private final Map<EntityKind, ReviewDecisionHandler> handlers = new EnumMap<>(EntityKind.class);

    public ReviewService(ReviewQueue reviewQueue, AuditLogger auditLogger) {
        this(reviewQueue, auditLogger, new NoOpMetricsService());
    }

    public ReviewService(ReviewQueue reviewQueue, AuditLogger auditLogger, MetricsService metricsService) {
        this.reviewQueue = reviewQueue;
        this.auditLogger = auditLogger;
        this.metricsService = metricsService;
    }

    /**
     * Registers the handler that applies decisions for one entity kind.
     */
    public void registerHandler(EntityKind kind, ReviewDecisionHandler handler) {
        handlers.put(kind, handler);
    }

    /**
     * Queues an item. A record that is already queued keeps its existing item, and nothing new is audited.
     *
     * @param item the review item to submit
     * @return the queued item, which may be an earlier one for the same source record
     */
    public ReviewItem submitForReview(ReviewItem item) {
        ReviewItem submitted = reviewQueue.submit(item);
        if (!submitted.getId().equals(item.getId())) {
            log.debug("review.already_queued reviewItemId={} recordKey={}", submitted.getId(), item.getRecordKey());
            return submitted;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reviewItemId", submitted.getId());
        details.put("source", item.getSource());
        details.put("recordKey", item.getRecordKey());
        details.put("sourceRecordId", item.getSourceRecordId());
        details.put("candidates", item.getCandidates().size());
        details.put("bestScore", item.getBestScore());
        details.put("reason", item.getReason());
        auditLogger.record(AuditAction.REVIEW_REQUESTED, item.getKind(), submitted.getId(), "SYSTEM",
                null, null, details);
        metricsService.incrementReviewEnqueued(item.getKind());

        log.info("review.submitted reviewItemId={} kind={} source={} recordKey={} bestScore={}",
                submitted.getId(), item.getKind().wireName(), item.getSource(), item.getRecordKey(),
                item.getBestScore());
        return submitted;
    }

    /**
     * Approves an item against its best candidate, or creates a new entity when it has none.
     */
    public ResolutionResult approve(String reviewId, String reviewerId, String notes) {
        return approve(reviewId, null, reviewerId, notes);
    }

    /**
     * Approves an item against a chosen candidate.
     *
     * @param reviewId    the review item ID
     * @param candidateId the canonical id to link to; null picks the best candidate, or creates a new
     *                    entity when the item has no candidates
     * @param reviewerId  the reviewer's identifier
     * @param notes       optional notes about the decision
     * @return the resulting match
     * @throws IllegalArgumentException if the item does not exist
     * @throws ReviewConflictException  if the item was already decided
     */
    public ResolutionResult approve(String reviewId, String candidateId, String reviewerId, String notes) {
        try (LogContext ignored = LogContext.forReview(reviewId, reviewerId)) {
            ReviewItem item = requirePending(reviewId);
            String chosen = candidateId != null
                    ? candidateId
                    : item.getBestCandidate().map(ReviewCandidate::canonicalId).orElse(null);
            ReviewDecisionHandler handler = handlerFor(item.getKind());

            ReviewItem approved = reviewQueue.compareAndSet(reviewId, ReviewStatus.PENDING,
                    item.decided(ReviewStatus.APPROVED, reviewerId, notes, chosen));

            ResolutionResult result;
            try {
                result = handler.applyApproval(approved, chosen, reviewerId);
            } catch (RuntimeException e) {
                reopen(approved, e);
                throw e;
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reviewItemId", reviewId);
            details.put("decision", ReviewStatus.APPROVED.name());
            details.put("candidateId", chosen);
            details.put("canonicalId", result.canonicalId());
            details.put("created", result.created());
            details.put("notes", notes);
            auditLogger.record(AuditAction.REVIEW_APPROVED, item.getKind(), result.canonicalId(), reviewerId,
                    null, null, details);

            log.info("review.approved reviewItemId={} canonicalId={} created={}",
                    reviewId, result.canonicalId(), result.created());
            return result;
        }
    }

    /**
     * Rejects an item: its source record becomes explicitly unmatched.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws ReviewConflictException  if the item was already decided
     */
    public void reject(String reviewId, String reviewerId, String notes) {
        try (LogContext ignored = LogContext.forReview(reviewId, reviewerId)) {
            ReviewItem item = requirePending(reviewId);
            ReviewDecisionHandler handler = handlerFor(item.getKind());

            ReviewItem rejected = reviewQueue.compareAndSet(reviewId, ReviewStatus.PENDING,
                    item.decided(ReviewStatus.REJECTED, reviewerId, notes, null));
            try {
                handler.applyRejection(rejected, reviewerId);
            } catch (RuntimeException e) {
                reopen(rejected, e);
                throw e;
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reviewItemId", reviewId);
            details.put("decision", ReviewStatus.REJECTED.name());
            details.put("source", item.getSource());
            details.put("recordKey", item.getRecordKey());
            details.put("notes", notes);
            auditLogger.record(AuditAction.REVIEW_REJECTED, item.getKind(), reviewId, reviewerId,
                    null, null, details);

            log.info("review.rejected reviewItemId={} source={} recordKey={}",
                    reviewId, item.getSource(), item.getRecordKey());
        }
    }

    public Page<ReviewItem> listPending(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> listPending(EntityKind kind, PageRequest page) {
        return reviewQueue.getPendingByKind(kind, page);
    }

    /**
     * @return the review item, or null if not found
     */
    public ReviewItem get(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long countPending() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new ReviewConflictException(reviewId, item.getStatus());
        }
        return item;
    }

    private ReviewDecisionHandler handlerFor(EntityKind kind) {
        ReviewDecisionHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No review handler registered for " + kind);
        }
        return handler;
    }

    private void reopen(ReviewItem decided, RuntimeException failure) {
        log.warn("review.apply_failed reviewItemId={} status={} error={}",
                decided.getId(), decided.getStatus(), failure.getMessage());
        try {
            reviewQueue.compareAndSet(decided.getId(), decided.getStatus(), decided.reopened());
        } catch (RuntimeException revertFailure) {
            failure.addSuppressed(revertFailure);
        }
    }
}
