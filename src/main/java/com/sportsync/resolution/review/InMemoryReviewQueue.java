package com.sportsync.resolution.review;

import com.sportsync.resolution.api.Page;
import com.sportsync.resolution.api.PageRequest;
import com.sportsync.resolution.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idsByRecord = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        String recordKey = recordKey(item.getKind(), item.getSport(), item.getSource(), item.getRecordKey());
        String winner = idsByRecord.computeIfAbsent(recordKey, k -> {
            items.put(item.getId(), item);
            return item.getId();
        });
        if (!winner.equals(item.getId())) {
            log.debug("review.duplicate recordKey={} existingItemId={}", recordKey, winner);
            return items.get(winner);
        }
        log.debug("review.queued reviewItemId={} kind={} recordKey={} bestScore={}",
                item.getId(), item.getKind(), item.getRecordKey(), item.getBestScore());
        return item;
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public Optional<ReviewItem> findByRecord(EntityKind kind, String sport, String source, String recordKey) {
        String id = idsByRecord.get(recordKey(kind, sport, source, recordKey));
        return id != null ? Optional.ofNullable(items.get(id)) : Optional.empty();
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        List<ReviewItem> pending = items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
        return Page.slice(pending, page);
    }

    @Override
    public Page<ReviewItem> getPendingByKind(EntityKind kind, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getKind() == kind)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
        return Page.slice(filtered, page);
    }

    @Override
    public ReviewItem compareAndSet(String reviewId, ReviewStatus expected, ReviewItem decided) {
        ReviewStatus[] observed = new ReviewStatus[1];
        ReviewItem result = items.computeIfPresent(reviewId, (id, current) -> {
            observed[0] = current.getStatus();
            return current.getStatus() == expected ? decided : current;
        });
        if (result == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (observed[0] != expected) {
            throw new ReviewConflictException(reviewId, observed[0]);
        }
        return result;
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private static String recordKey(EntityKind kind, String sport, String source, String key) {
        return kind + "|" + sport + "|" + source + "|" + key;
    }
}
