package com.sportsync.resolution.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The single authoritative record for one real-world game.
 * {@code sourceIds} is a read view (source name to external id) assembled from matched mappings.
 */
public record CanonicalGame(
        String id,
        String sport,
        String homeTeam,
        String awayTeam,
        Instant scheduledAt,
        LocalDate gameDay,
        String primarySource,
        Instant createdAt,
        Instant updatedAt,
        Map<String, String> sourceIds
) {
    public CanonicalGame {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sport, "sport is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        Objects.requireNonNull(scheduledAt, "scheduledAt is required");
        Objects.requireNonNull(gameDay, "gameDay is required");
        if (homeTeam.equals(awayTeam)) {
            throw new IllegalArgumentException("homeTeam and awayTeam must differ: " + homeTeam);
        }
        sourceIds = sourceIds != null ? Map.copyOf(sourceIds) : Map.of();
    }

    public GameKey naturalKey() {
        return new GameKey(sport, homeTeam, awayTeam, gameDay);
    }

    public CanonicalGame withSourceIds(Map<String, String> ids) {
        return new CanonicalGame(id, sport, homeTeam, awayTeam, scheduledAt, gameDay, primarySource,
                createdAt, updatedAt, ids);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).sport(sport).homeTeam(homeTeam).awayTeam(awayTeam)
                .scheduledAt(scheduledAt).gameDay(gameDay).primarySource(primarySource)
                .createdAt(createdAt).updatedAt(updatedAt).sourceIds(sourceIds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sport;
        private String homeTeam;
        private String awayTeam;
        private Instant scheduledAt;
        private LocalDate gameDay;
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

        public Builder homeTeam(String homeTeam) {
            this.homeTeam = homeTeam;
            return this;
        }

        public Builder awayTeam(String awayTeam) {
            this.awayTeam = awayTeam;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder gameDay(LocalDate gameDay) {
            this.gameDay = gameDay;
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

        public CanonicalGame build() {
            Instant updated = updatedAt != null ? updatedAt : createdAt;
            return new CanonicalGame(id, sport, homeTeam, awayTeam, scheduledAt, gameDay, primarySource,
                    createdAt, updated, sourceIds);
        }
    }
}
