package com.sportsync.resolution.health;

import com.sportsync.resolution.sync.SyncMetadata;
import com.sportsync.resolution.sync.SyncOrchestrator;
import com.sportsync.resolution.sync.SyncOutcome;
import com.sportsync.resolution.sync.SyncStatusReport;

import java.util.List;

/**
 * Maps the sync report's overall health onto UP / DEGRADED / DOWN.
 */
public class SyncJobsHealthCheck implements HealthCheck {

    private final SyncOrchestrator orchestrator;

    public SyncJobsHealthCheck(SyncOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public String getName() {
        return "syncJobs";
    }

    @Override
    public HealthStatus check() {
        List<SyncMetadata> jobs = orchestrator.jobMetadata();
        SyncStatusReport.Health health = SyncStatusReport.healthOf(jobs);

        String message = switch (health) {
            case HEALTHY -> "OK";
            case DEGRADED -> "Some sync jobs did not succeed on their last run";
            case UNHEALTHY -> "No sync job succeeded on its last run";
        };
        HealthStatus base = HealthStatus.of(HealthStatus.Status.of(health), message);
        for (SyncMetadata job : jobs) {
            SyncOutcome outcome = job.lastOutcome();
            base = base.withDetail(job.jobKey(), outcome != null ? outcome.wireName() : "never_run");
        }
        return base.withDetail("health", health.wireName());
    }
}
