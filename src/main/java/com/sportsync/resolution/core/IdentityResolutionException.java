package com.sportsync.resolution.core;

/**
 * Base type for every error raised by the identity resolution engine.
 */
public class IdentityResolutionException extends RuntimeException {

    public IdentityResolutionException(String message) {
        super(message);
    }

    public IdentityResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
