package com.sportsync.resolution.health;

import com.sportsync.resolution.review.ReviewQueue;

/**
 * DEGRADED once the pending review count exceeds the configured backlog.
 */
public class ReviewBacklogHealthCheck implements HealthCheck {

    private final ReviewQueue reviewQueue;
    private final long maxBacklog;

    public ReviewBacklogHealthCheck(ReviewQueue reviewQueue, long maxBacklog) {
        if (maxBacklog < 0) {
            throw new IllegalArgumentException("maxBacklog must be non-negative");
        }
        this.reviewQueue = reviewQueue;
        this.maxBacklog = maxBacklog;
    }

    @Override
    public String getName() {
        return "reviewBacklog";
    }

    @Override
    public HealthStatus check() {
        long pending = reviewQueue.countPending();
        HealthStatus base = pending > maxBacklog
                ? HealthStatus.degraded("Review backlog above " + maxBacklog + ": " + pending + " pending")
                : HealthStatus.up();
        return base
                .withDetail("pending", pending)
                .withDetail("maxBacklog", maxBacklog);
    }
}
