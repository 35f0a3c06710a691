package com.sportsync.resolution.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one sync run.
 *
 * @param outcome null when the run was skipped because the job was already running
 */
public record SyncRunResult(
        String runId,
        String source,
        String dataType,
        SyncOutcome outcome,
        Instant startedAt,
        Duration duration,
        int processed,
        int matched,
        int queued,
        int failed,
        String errorMessage
) {
    public static SyncRunResult skipped(String source, String dataType) {
        return new SyncRunResult(null, source, dataType, null, Instant.now(), Duration.ZERO, 0, 0, 0, 0,
                "job already running");
    }

    public boolean isSkipped() {
        return outcome == null;
    }
}
