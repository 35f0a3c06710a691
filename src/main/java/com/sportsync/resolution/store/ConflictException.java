package com.sportsync.resolution.store;

import com.sportsync.resolution.core.IdentityResolutionException;

/**
 * A write hit a unique constraint because a concurrent writer got there first.
 * Callers treat this as a signal to re-fetch the winning row and continue, never as a failure.
 */
public class ConflictException extends IdentityResolutionException {

    public static final String GAME_NATURAL_KEY = "uq_games_natural_key";
    public static final String GAME_SOURCE_ID = "uq_game_mappings_source_id";
    public static final String GAME_CANONICAL_SOURCE = "uq_game_mappings_canonical_source";
    public static final String PLAYER_SOURCE_ID = "uq_player_mappings_source_id";
    public static final String PLAYER_CANONICAL_SOURCE = "uq_player_mappings_canonical_source";
    public static final String PLAYER_ALIAS = "uq_player_aliases_key";
    public static final String UNKNOWN = "unknown";

    private final String constraint;

    public ConflictException(String constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public ConflictException(String constraint, String message, Throwable cause) {
        super(message, cause);
        this.constraint = constraint;
    }

    public String getConstraint() {
        return constraint;
    }

    public boolean isNaturalKey() {
        return GAME_NATURAL_KEY.equals(constraint);
    }

    public boolean isSourceId() {
        return GAME_SOURCE_ID.equals(constraint) || PLAYER_SOURCE_ID.equals(constraint);
    }

    public boolean isCanonicalSource() {
        return GAME_CANONICAL_SOURCE.equals(constraint) || PLAYER_CANONICAL_SOURCE.equals(constraint);
    }
}
