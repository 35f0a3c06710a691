package com.sportsync.resolution.sync;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Point-in-time view of every sync job plus the review and mapping backlog.
 */
public record SyncStatusReport(
        List<SyncMetadata> jobs,
        Health health,
        long pendingReviews,
        long unmatchedMappings,
        long lowConfidenceMappings,
        Instant generatedAt
) {

    public enum Health {
        HEALTHY, DEGRADED, UNHEALTHY;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public SyncStatusReport {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
    }

    public static SyncStatusReport of(List<SyncMetadata> jobs, long pendingReviews, long unmatchedMappings,
                                      long lowConfidenceMappings) {
        return new SyncStatusReport(jobs, healthOf(jobs), pendingReviews, unmatchedMappings,
                lowConfidenceMappings, Instant.now());
    }

    /**
     * Healthy when every job that has run last succeeded, unhealthy when none did.
     * Jobs that never ran are ignored; with none at all the report is healthy.
     */
    public static Health healthOf(List<SyncMetadata> jobs) {
        long ran = 0;
        long succeeded = 0;
        for (SyncMetadata job : jobs) {
            if (!job.hasRun()) {
                continue;
            }
            ran++;
            if (job.lastOutcome() == SyncOutcome.SUCCESS) {
                succeeded++;
            }
        }
        if (succeeded == ran) {
            return Health.HEALTHY;
        }
        return succeeded == 0 ? Health.UNHEALTHY : Health.DEGRADED;
    }
}
