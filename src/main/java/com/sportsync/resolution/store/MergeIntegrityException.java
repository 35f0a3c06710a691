package com.sportsync.resolution.store;

import com.sportsync.resolution.core.IdentityResolutionException;

/**
 * A merge would orphan a reference or combine incompatible rows. The merge is rolled back in full.
 */
public class MergeIntegrityException extends IdentityResolutionException {

    public MergeIntegrityException(String message) {
        super(message);
    }

    public MergeIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
