package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A raw record as delivered by a source adapter, before any resolution.
 * Immutable once built. Field values are kept as delivered; typed access goes through
 * {@link GameObservation#from(SourceRecord)} and {@link PlayerObservation#from(SourceRecord, PlayerContext)}.
 */
public record SourceRecord(
        String id,
        EntityKind kind,
        String sport,
        String source,
        String sourceId,
        Map<String, Object> fields,
        Instant ingestedAt
) {
    public static final String HOME_TEAM = "home_team";
    public static final String AWAY_TEAM = "away_team";
    public static final String HOME_TEAM_ID = "home_team_id";
    public static final String AWAY_TEAM_ID = "away_team_id";
    public static final String SCHEDULED_AT = "scheduled_at";
    public static final String NAME = "name";
    public static final String TEAM = "team";
    public static final String POSITION = "position";

    public SourceRecord {
        Objects.requireNonNull(kind, "kind is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (ingestedAt == null) {
            ingestedAt = Instant.now();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the field as a trimmed string, or null when absent or blank.
     */
    public String text(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder game() {
        return new Builder().kind(EntityKind.GAME);
    }

    public static Builder player() {
        return new Builder().kind(EntityKind.PLAYER);
    }

    public static class Builder {
        private String id;
        private EntityKind kind;
        private String sport;
        private String source;
        private String sourceId;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private Instant ingestedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sport(String sport) {
            this.sport = sport;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder field(String name, Object value) {
            this.fields.put(name, value);
            return this;
        }

        public Builder fields(Map<String, Object> fields) {
            this.fields.putAll(fields);
            return this;
        }

        public Builder ingestedAt(Instant ingestedAt) {
            this.ingestedAt = ingestedAt;
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(id, kind, sport, source, sourceId, fields, ingestedAt);
        }
    }
}
