package com.sportsync.resolution.sync;

import java.util.Locale;

/**
 * How a finished sync run ended.
 */
public enum SyncOutcome {
    /** Every fetched record resolved to a canonical entity. */
    SUCCESS,
    /** Some records were queued for review or rejected; not an error. */
    PARTIAL,
    /** The run could not complete: source unreachable after retries, timeout, or store failure. */
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
