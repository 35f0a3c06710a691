package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A downstream row that references a canonical game and optionally a player.
 * The engine never computes these; it only keeps their references valid across merges.
 */
public record Prediction(String id, String gameId, String playerId, String market, Instant createdAt) {

    public Prediction {
        Objects.requireNonNull(gameId, "gameId is required");
        Objects.requireNonNull(market, "market is required");
        id = id != null ? id : UUID.randomUUID().toString();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static Prediction of(String gameId, String playerId, String market) {
        return new Prediction(null, gameId, playerId, market, null);
    }
}
