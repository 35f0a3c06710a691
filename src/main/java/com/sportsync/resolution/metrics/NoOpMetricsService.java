package com.sportsync.resolution.metrics;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.sync.SyncOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(EntityKind kind, MappingStatus status, MatchMethod method, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
    }

    @Override
    public void incrementReviewEnqueued(EntityKind kind) {
    }

    @Override
    public void recordCandidateScore(EntityKind kind, double score) {
    }

    @Override
    public void recordSyncRun(String source, String dataType, SyncOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementRecords(String source, String dataType, String outcome, int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
