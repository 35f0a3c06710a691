package com.sportsync.resolution.scoring;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Combines match signals into a confidence value and a tier.
 * A pure function of its inputs and the per-kind {@link ScoringProfile}s it was built with.
 */
public class ConfidenceScorer {

    private final Map<EntityKind, ScoringProfile> profiles;

    public ConfidenceScorer() {
        this(Map.of(EntityKind.GAME, ScoringProfile.forGames(), EntityKind.PLAYER, ScoringProfile.forPlayers()));
    }

    public ConfidenceScorer(Map<EntityKind, ScoringProfile> profiles) {
        Objects.requireNonNull(profiles, "profiles is required");
        this.profiles = new EnumMap<>(EntityKind.class);
        this.profiles.putAll(profiles);
    }

    public ConfidenceScore score(EntityKind kind, MatchSignals signals) {
        ScoringProfile profile = profile(kind);
        double confidence = combine(profile, signals);
        return new ConfidenceScore(confidence, profile.tierOf(confidence), signals);
    }

    public ScoringProfile profile(EntityKind kind) {
        ScoringProfile profile = profiles.get(kind);
        if (profile == null) {
            throw new IllegalArgumentException("No scoring profile configured for " + kind);
        }
        return profile;
    }

    static double combine(ScoringProfile profile, MatchSignals signals) {
        if (signals.exactIdMatch()) {
            return 1.0;
        }
        double weighted = 0.0;
        double totalWeight = 0.0;
        if (signals.nameSimilarity() != null && profile.nameWeight() > 0) {
            weighted += profile.nameWeight() * signals.nameSimilarity();
            totalWeight += profile.nameWeight();
        }
        if (signals.timeProximity() != null && profile.timeWeight() > 0) {
            weighted += profile.timeWeight() * signals.timeProximity();
            totalWeight += profile.timeWeight();
        }
        if (signals.teamMatch() != null && profile.teamWeight() > 0) {
            weighted += profile.teamWeight() * (signals.teamMatch() ? 1.0 : 0.0);
            totalWeight += profile.teamWeight();
        }
        double base = totalWeight > 0 ? weighted / totalWeight : 0.0;
        if (Boolean.TRUE.equals(signals.positionMatch())) {
            base += profile.positionBoost();
        }
        return Math.max(0.0, Math.min(1.0, base));
    }
}
