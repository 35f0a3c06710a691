package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An alternate spelling of a canonical player's name as observed from one source.
 * {@code aliasKey} is the normalized name with its generational suffix appended, the lookup key.
 */
public record PlayerAlias(
        String id,
        String canonicalId,
        String sport,
        String aliasName,
        String aliasKey,
        String aliasSource,
        double confidence,
        boolean verified,
        Instant createdAt
) {
    public PlayerAlias {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(sport, "sport is required");
        Objects.requireNonNull(aliasName, "aliasName is required");
        Objects.requireNonNull(aliasKey, "aliasKey is required");
        Objects.requireNonNull(aliasSource, "aliasSource is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        id = id != null ? id : UUID.randomUUID().toString();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static PlayerAlias of(String canonicalId, String sport, String aliasName, String aliasKey,
                                 String aliasSource, double confidence, boolean verified) {
        return new PlayerAlias(null, canonicalId, sport, aliasName, aliasKey, aliasSource, confidence, verified, null);
    }

    public PlayerAlias repointedTo(String survivorId) {
        return new PlayerAlias(id, survivorId, sport, aliasName, aliasKey, aliasSource, confidence, verified, createdAt);
    }

    public PlayerAlias asVerified() {
        return new PlayerAlias(id, canonicalId, sport, aliasName, aliasKey, aliasSource, confidence, true, createdAt);
    }
}
