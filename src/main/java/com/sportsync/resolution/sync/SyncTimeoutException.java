package com.sportsync.resolution.sync;

import com.sportsync.resolution.core.IdentityResolutionException;

import java.time.Duration;

/**
 * A sync run exceeded its timeout. Records already resolved stay committed.
 */
public class SyncTimeoutException extends IdentityResolutionException {

    public SyncTimeoutException(String jobKey, Duration timeout) {
        super("Sync job " + jobKey + " timed out after " + timeout);
    }
}
