package com.sportsync.resolution.audit;

import com.sportsync.resolution.core.model.EntityKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one decision: what changed on which entity, and the match details behind it.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        EntityKind entityKind,
        String entityId,
        String actorId,
        Map<String, Object> previousState,
        Map<String, Object> newState,
        Map<String, Object> matchDetails,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        previousState = copy(previousState);
        newState = copy(newState);
        matchDetails = copy(matchDetails);
    }

    // Map.copyOf rejects null values, which state snapshots legitimately contain
    private static Map<String, Object> copy(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private EntityKind entityKind;
        private String entityId;
        private String actorId;
        private Map<String, Object> previousState;
        private Map<String, Object> newState;
        private Map<String, Object> matchDetails;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder previousState(Map<String, Object> previousState) {
            this.previousState = previousState;
            return this;
        }

        public Builder newState(Map<String, Object> newState) {
            this.newState = newState;
            return this;
        }

        public Builder matchDetails(Map<String, Object> matchDetails) {
            this.matchDetails = matchDetails;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, entityKind, entityId, actorId, previousState, newState,
                    matchDetails, timestamp);
        }
    }
}
