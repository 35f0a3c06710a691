package com.sportsync.resolution.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a link between a source id and a canonical entity.
 */
public enum MappingStatus {
    PENDING,
    MATCHED,
    FAILED,
    MANUAL_REVIEW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
