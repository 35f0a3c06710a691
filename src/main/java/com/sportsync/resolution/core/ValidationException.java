package com.sportsync.resolution.core;

/**
 * Raised when a raw source record is malformed or missing a required field.
 * The record is rejected and counted as failed; the surrounding job keeps running.
 */
public class ValidationException extends IdentityResolutionException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(field != null ? field + ": " + message : message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
