package com.sportsync.resolution.sync;

import com.sportsync.resolution.core.IdentityResolutionException;

/**
 * A source could not be reached or answered with a retryable error. Sync jobs retry it with backoff.
 */
public class TransientSourceException extends IdentityResolutionException {

    public TransientSourceException(String message) {
        super(message);
    }

    public TransientSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
