package com.sportsync.resolution.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Last known state and counts of one (source, data type) job. One row per job, rewritten on every
 * state transition.
 *
 * @param lastOutcome outcome of the last finished run, null if the job never finished one
 * @param duration    duration of the last finished run, null while none finished
 */
public record SyncMetadata(
        String id,
        String source,
        String dataType,
        SyncState state,
        SyncOutcome lastOutcome,
        Instant lastSyncStartedAt,
        Instant lastSyncCompletedAt,
        int recordsProcessed,
        int recordsMatched,
        int recordsQueued,
        int recordsFailed,
        String errorMessage,
        Duration duration,
        Instant updatedAt
) {
    public SyncMetadata {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(state, "state is required");
        id = id != null ? id : UUID.randomUUID().toString();
        updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    public static SyncMetadata initial(String source, String dataType) {
        return new SyncMetadata(null, source, dataType, SyncState.IDLE, null, null, null, 0, 0, 0, 0, null,
                null, null);
    }

    public String jobKey() {
        return jobKey(source, dataType);
    }

    public static String jobKey(String source, String dataType) {
        return source + "/" + dataType;
    }

    public boolean hasRun() {
        return lastOutcome != null;
    }

    public SyncMetadata withState(SyncState newState) {
        return new SyncMetadata(id, source, dataType, newState, lastOutcome, lastSyncStartedAt, lastSyncCompletedAt,
                recordsProcessed, recordsMatched, recordsQueued, recordsFailed, errorMessage, duration, Instant.now());
    }

    public SyncMetadata started(Instant at) {
        return new SyncMetadata(id, source, dataType, SyncState.SYNCING, lastOutcome, at, lastSyncCompletedAt,
                0, 0, 0, 0, null, duration, Instant.now());
    }

    public SyncMetadata withCounts(int processed, int matched, int queued, int failed) {
        return new SyncMetadata(id, source, dataType, state, lastOutcome, lastSyncStartedAt, lastSyncCompletedAt,
                processed, matched, queued, failed, errorMessage, duration, Instant.now());
    }

    public SyncMetadata finished(SyncOutcome outcome, Instant at, String error) {
        Duration took = lastSyncStartedAt != null ? Duration.between(lastSyncStartedAt, at) : Duration.ZERO;
        return new SyncMetadata(id, source, dataType, state, outcome, lastSyncStartedAt, at,
                recordsProcessed, recordsMatched, recordsQueued, recordsFailed, error, took, Instant.now());
    }
}
