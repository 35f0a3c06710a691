package com.sportsync.resolution.reconcile;

import com.sportsync.resolution.store.MergeOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of one reconciliation sweep.
 *
 * @param startedAt       when the sweep began
 * @param duration        how long it took
 * @param groupsFound     duplicate groups detected
 * @param merges          merges applied in this sweep
 * @param aborted         merges rolled back on an integrity violation; both rows were kept
 * @param alreadyMerged   merges that found the loser already gone
 * @param skipped         true when another sweep was already running and this one did nothing
 */
public record ReconciliationReport(
        Instant startedAt,
        Duration duration,
        int groupsFound,
        List<MergeOutcome> merges,
        int aborted,
        int alreadyMerged,
        boolean skipped
) {
    public ReconciliationReport {
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public static ReconciliationReport skipped(Instant startedAt) {
        return new ReconciliationReport(startedAt, Duration.ZERO, 0, List.of(), 0, 0, true);
    }

    public int merged() {
        return merges.size();
    }
}
