package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The single authoritative record for one real-world player.
 *
 * <p>{@code normalizedName} excludes the generational suffix, which is kept separately in
 * {@code suffix} (empty string when none) so that father and son never collapse onto one key.</p>
 */
public record CanonicalPlayer(
        String id,
        String sport,
        String canonicalName,
        String normalizedName,
        String suffix,
        String team,
        String position,
        String primarySource,
        Instant createdAt,
        Instant updatedAt,
        Map<String, String> sourceIds
) {
    public CanonicalPlayer {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sport, "sport is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        Objects.requireNonNull(normalizedName, "normalizedName is required");
        suffix = suffix != null ? suffix : "";
        sourceIds = sourceIds != null ? Map.copyOf(sourceIds) : Map.of();
    }

    public CanonicalPlayer withSourceIds(Map<String, String> ids) {
        return toBuilder().sourceIds(ids).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).sport(sport).canonicalName(canonicalName).normalizedName(normalizedName)
                .suffix(suffix).team(team).position(position).primarySource(primarySource)
                .createdAt(createdAt).updatedAt(updatedAt).sourceIds(sourceIds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sport;
        private String canonicalName;
        private String normalizedName;
        private String suffix = "";
        private String team;
        private String position;
        private String primarySource;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;
        private Map<String, String> sourceIds;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sport(String sport) {
            this.sport = sport;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = suffix;
            return this;
        }

        public Builder team(String team) {
            this.team = team;
            return this;
        }

        public Builder position(String position) {
            this.position = position;
            return this;
        }

        public Builder primarySource(String primarySource) {
            this.primarySource = primarySource;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder sourceIds(Map<String, String> sourceIds) {
            this.sourceIds = sourceIds;
            return this;
        }

        public CanonicalPlayer build() {
            Instant updated = updatedAt != null ? updatedAt : createdAt;
            return new CanonicalPlayer(id, sport, canonicalName, normalizedName, suffix, team, position,
                    primarySource, createdAt, updated, sourceIds);
        }
    }
}
