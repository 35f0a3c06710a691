package com.sportsync.resolution.store;

import com.sportsync.resolution.core.IdentityResolutionException;

/**
 * Unexpected storage failure (connectivity, SQL error) that is neither a conflict nor an integrity violation.
 */
public class StoreException extends IdentityResolutionException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
