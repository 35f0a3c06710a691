package com.sportsync.resolution.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A per-game statistic for a player. Like {@link Prediction}, it is a dependent row whose references
 * the engine re-points when canonical entities merge.
 */
public record StatLine(String id, String playerId, String gameId, String statType, double value) {

    public StatLine {
        Objects.requireNonNull(playerId, "playerId is required");
        Objects.requireNonNull(gameId, "gameId is required");
        Objects.requireNonNull(statType, "statType is required");
        id = id != null ? id : UUID.randomUUID().toString();
    }

    public static StatLine of(String playerId, String gameId, String statType, double value) {
        return new StatLine(null, playerId, gameId, statType, value);
    }
}
