package com.sportsync.resolution.sync;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * State of one (source, data type) sync job.
 *
 * <pre>
 * IDLE --trigger--> SYNCING --success--> MATCHING --done--> IDLE
 * SYNCING --error/timeout--> FAILED --> IDLE
 * MATCHING --partial--> PARTIAL --> IDLE
 * </pre>
 *
 * MATCHING may also fail on a timeout.
 */
public enum SyncState {
    IDLE,
    SYNCING,
    MATCHING,
    PARTIAL,
    FAILED;

    /**
     * States reachable from this one in a single step.
     */
    public Set<SyncState> successors() {
        switch (this) {
            case IDLE:
                return EnumSet.of(SYNCING);
            case SYNCING:
                return EnumSet.of(MATCHING, FAILED);
            case MATCHING:
                return EnumSet.of(IDLE, PARTIAL, FAILED);
            case PARTIAL:
            case FAILED:
                return EnumSet.of(IDLE);
            default:
                throw new IllegalStateException("Unknown state " + this);
        }
    }

    public boolean canTransitionTo(SyncState next) {
        return successors().contains(next);
    }

    public boolean isRunning() {
        return this == SYNCING || this == MATCHING;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
