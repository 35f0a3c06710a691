package com.sportsync.resolution.metrics;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.sync.SyncOutcome;

import java.time.Duration;

/**
 * Interface for recording resolution and sync metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordResolution(EntityKind kind, MappingStatus status, MatchMethod method, Duration duration);

    void incrementEntityCreated(EntityKind kind);

    void incrementEntityMerged(EntityKind kind);

    void incrementReviewEnqueued(EntityKind kind);

    void recordCandidateScore(EntityKind kind, double score);

    void recordSyncRun(String source, String dataType, SyncOutcome outcome, Duration duration);

    /**
     * Counts records a sync run finished with, tagged {@code matched}, {@code queued} or {@code failed}.
     */
    void incrementRecords(String source, String dataType, String outcome, int count);

    void recordCacheHit();

    void recordCacheMiss();
}
