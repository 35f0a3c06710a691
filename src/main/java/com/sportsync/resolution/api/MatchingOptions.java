package com.sportsync.resolution.api;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.SourceProfile;
import com.sportsync.resolution.scoring.ConfidenceScorer;
import com.sportsync.resolution.scoring.ScoringProfile;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Options for game and player matching: thresholds, fixed step confidences, time tolerances,
 * game-day zones and per-source profiles.
 *
 * <p>The cross-timezone tolerance exists because some providers publish local start times with a
 * wrong offset. Whether ±6h is safe against back-to-back games is unresolved, so both tolerances
 * are configurable and chosen per source through {@link SourceProfile#crossTimezone()}.</p>
 */
public class MatchingOptions {

    private static final double DEFAULT_TIME_WINDOW_CONFIDENCE = 0.95;
    private static final double DEFAULT_FUZZY_TEAM_CONFIDENCE = 0.85;
    private static final double DEFAULT_NAME_AND_TEAM_CONFIDENCE = 0.90;
    private static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.90;
    private static final Duration DEFAULT_TIME_TOLERANCE = Duration.ofHours(2);
    private static final Duration DEFAULT_CROSS_TIMEZONE_TOLERANCE = Duration.ofHours(6);
    private static final int DEFAULT_MAX_TEAM_EDIT_DISTANCE = 2;
    private static final ZoneId DEFAULT_GAME_DAY_ZONE = ZoneId.of("America/New_York");

    private final double autoAcceptThreshold;
    private final double reviewThreshold;
    private final double timeWindowConfidence;
    private final double fuzzyTeamConfidence;
    private final double nameAndTeamConfidence;
    private final double lowConfidenceThreshold;
    private final Duration timeTolerance;
    private final Duration crossTimezoneTolerance;
    private final int maxTeamEditDistance;
    private final ZoneId defaultGameDayZone;
    private final Map<String, ZoneId> gameDayZones;
    private final Map<EntityKind, ScoringProfile> scoringProfiles;
    private final Map<String, SourceProfile> sources;
    private final String systemActor;

    private MatchingOptions(Builder builder) {
        this.autoAcceptThreshold = builder.autoAcceptThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.timeWindowConfidence = builder.timeWindowConfidence;
        this.fuzzyTeamConfidence = builder.fuzzyTeamConfidence;
        this.nameAndTeamConfidence = builder.nameAndTeamConfidence;
        this.lowConfidenceThreshold = builder.lowConfidenceThreshold;
        this.timeTolerance = builder.timeTolerance;
        this.crossTimezoneTolerance = builder.crossTimezoneTolerance;
        this.maxTeamEditDistance = builder.maxTeamEditDistance;
        this.defaultGameDayZone = builder.defaultGameDayZone;
        this.gameDayZones = Map.copyOf(builder.gameDayZones);
        Map<EntityKind, ScoringProfile> profiles = new EnumMap<>(EntityKind.class);
        builder.scoringProfiles.forEach((kind, profile) ->
                profiles.put(kind, profile.withThresholds(autoAcceptThreshold, reviewThreshold)));
        this.scoringProfiles = profiles;
        this.sources = Map.copyOf(builder.sources);
        this.systemActor = builder.systemActor;
    }

    public double getAutoAcceptThreshold() {
        return autoAcceptThreshold;
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    public double getTimeWindowConfidence() {
        return timeWindowConfidence;
    }

    public double getFuzzyTeamConfidence() {
        return fuzzyTeamConfidence;
    }

    public double getNameAndTeamConfidence() {
        return nameAndTeamConfidence;
    }

    /**
     * Matched mappings below this confidence are reported as low-confidence in the sync status report.
     */
    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public Duration getTimeTolerance() {
        return timeTolerance;
    }

    public Duration getCrossTimezoneTolerance() {
        return crossTimezoneTolerance;
    }

    public int getMaxTeamEditDistance() {
        return maxTeamEditDistance;
    }

    public String getSystemActor() {
        return systemActor;
    }

    public Map<EntityKind, ScoringProfile> getScoringProfiles() {
        return Map.copyOf(scoringProfiles);
    }

    public Map<String, SourceProfile> getSources() {
        return sources;
    }

    /**
     * Builds the scorer for these options; thresholds are applied to every profile.
     */
    public ConfidenceScorer scorer() {
        return new ConfidenceScorer(scoringProfiles);
    }

    /**
     * Profile for a source; unconfigured sources get {@link SourceProfile#unknown(String)}.
     */
    public SourceProfile sourceProfile(String source) {
        SourceProfile profile = sources.get(source);
        return profile != null ? profile : SourceProfile.unknown(source);
    }

    /**
     * Start-time tolerance for records coming from {@code source}.
     */
    public Duration toleranceFor(String source) {
        return sourceProfile(source).crossTimezone() ? crossTimezoneTolerance : timeTolerance;
    }

    public ZoneId gameDayZone(String sport) {
        ZoneId zone = gameDayZones.get(sport.toLowerCase(Locale.ROOT));
        return zone != null ? zone : defaultGameDayZone;
    }

    /**
     * The natural-key bucket of a start time: its calendar date in the sport's zone.
     */
    public LocalDate gameDay(String sport, Instant scheduledAt) {
        return scheduledAt.atZone(gameDayZone(sport)).toLocalDate();
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double autoAcceptThreshold = ScoringProfile.DEFAULT_AUTO_ACCEPT;
        private double reviewThreshold = ScoringProfile.DEFAULT_REVIEW;
        private double timeWindowConfidence = DEFAULT_TIME_WINDOW_CONFIDENCE;
        private double fuzzyTeamConfidence = DEFAULT_FUZZY_TEAM_CONFIDENCE;
        private double nameAndTeamConfidence = DEFAULT_NAME_AND_TEAM_CONFIDENCE;
        private double lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;
        private Duration timeTolerance = DEFAULT_TIME_TOLERANCE;
        private Duration crossTimezoneTolerance = DEFAULT_CROSS_TIMEZONE_TOLERANCE;
        private int maxTeamEditDistance = DEFAULT_MAX_TEAM_EDIT_DISTANCE;
        private ZoneId defaultGameDayZone = DEFAULT_GAME_DAY_ZONE;
        private final Map<String, ZoneId> gameDayZones = new HashMap<>();
        private final Map<EntityKind, ScoringProfile> scoringProfiles = new EnumMap<>(Map.of(
                EntityKind.GAME, ScoringProfile.forGames(),
                EntityKind.PLAYER, ScoringProfile.forPlayers()));
        private final Map<String, SourceProfile> sources = new HashMap<>();
        private String systemActor = "SYSTEM";

        public Builder autoAcceptThreshold(double autoAcceptThreshold) {
            this.autoAcceptThreshold = autoAcceptThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder timeWindowConfidence(double timeWindowConfidence) {
            this.timeWindowConfidence = timeWindowConfidence;
            return this;
        }

        public Builder fuzzyTeamConfidence(double fuzzyTeamConfidence) {
            this.fuzzyTeamConfidence = fuzzyTeamConfidence;
            return this;
        }

        public Builder nameAndTeamConfidence(double nameAndTeamConfidence) {
            this.nameAndTeamConfidence = nameAndTeamConfidence;
            return this;
        }

        public Builder lowConfidenceThreshold(double lowConfidenceThreshold) {
            this.lowConfidenceThreshold = lowConfidenceThreshold;
            return this;
        }

        public Builder timeTolerance(Duration timeTolerance) {
            this.timeTolerance = timeTolerance;
            return this;
        }

        public Builder crossTimezoneTolerance(Duration crossTimezoneTolerance) {
            this.crossTimezoneTolerance = crossTimezoneTolerance;
            return this;
        }

        public Builder maxTeamEditDistance(int maxTeamEditDistance) {
            this.maxTeamEditDistance = maxTeamEditDistance;
            return this;
        }

        public Builder defaultGameDayZone(ZoneId zone) {
            this.defaultGameDayZone = zone;
            return this;
        }

        public Builder gameDayZone(String sport, ZoneId zone) {
            this.gameDayZones.put(sport.toLowerCase(Locale.ROOT), zone);
            return this;
        }

        public Builder scoringProfile(EntityKind kind, ScoringProfile profile) {
            this.scoringProfiles.put(kind, profile);
            return this;
        }

        public Builder source(SourceProfile profile) {
            this.sources.put(profile.name(), profile);
            return this;
        }

        public Builder systemActor(String systemActor) {
            this.systemActor = systemActor;
            return this;
        }

        public MatchingOptions build() {
            checkUnit(autoAcceptThreshold, "autoAcceptThreshold");
            checkUnit(reviewThreshold, "reviewThreshold");
            checkUnit(timeWindowConfidence, "timeWindowConfidence");
            checkUnit(fuzzyTeamConfidence, "fuzzyTeamConfidence");
            checkUnit(nameAndTeamConfidence, "nameAndTeamConfidence");
            checkUnit(lowConfidenceThreshold, "lowConfidenceThreshold");
            if (reviewThreshold > autoAcceptThreshold) {
                throw new IllegalArgumentException("reviewThreshold must not exceed autoAcceptThreshold");
            }
            if (timeTolerance == null || timeTolerance.isNegative()
                    || crossTimezoneTolerance == null || crossTimezoneTolerance.isNegative()) {
                throw new IllegalArgumentException("time tolerances must be non-negative");
            }
            if (crossTimezoneTolerance.compareTo(timeTolerance) < 0) {
                throw new IllegalArgumentException("crossTimezoneTolerance must be >= timeTolerance");
            }
            if (maxTeamEditDistance < 0) {
                throw new IllegalArgumentException("maxTeamEditDistance must be >= 0");
            }
            return new MatchingOptions(this);
        }

        private static void checkUnit(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
            }
        }
    }
}
