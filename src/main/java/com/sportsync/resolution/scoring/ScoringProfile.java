package com.sportsync.resolution.scoring;

/**
 * Weights and thresholds for one entity kind.
 *
 * <p>Name, time and team signals form a weighted mean over whichever of them are present.
 * A position match adds {@code positionBoost} on top. All weights are non-negative so the
 * score never decreases when a signal improves.</p>
 */
public record ScoringProfile(
        double nameWeight,
        double timeWeight,
        double teamWeight,
        double positionBoost,
        double autoAcceptThreshold,
        double reviewThreshold
) {
    public static final double DEFAULT_AUTO_ACCEPT = 0.85;
    public static final double DEFAULT_REVIEW = 0.70;

    public ScoringProfile {
        if (nameWeight < 0 || timeWeight < 0 || teamWeight < 0 || positionBoost < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (nameWeight + timeWeight + teamWeight == 0) {
            throw new IllegalArgumentException("At least one of name, time or team weight must be positive");
        }
        if (positionBoost > 0.5) {
            throw new IllegalArgumentException("positionBoost must be <= 0.5, got " + positionBoost);
        }
        if (reviewThreshold < 0 || autoAcceptThreshold > 1.0 || reviewThreshold > autoAcceptThreshold) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= review <= autoAccept <= 1, got review=" + reviewThreshold
                            + " autoAccept=" + autoAcceptThreshold);
        }
    }

    public static ScoringProfile forGames() {
        return new ScoringProfile(0.5, 0.3, 0.2, 0.0, DEFAULT_AUTO_ACCEPT, DEFAULT_REVIEW);
    }

    public static ScoringProfile forPlayers() {
        return new ScoringProfile(0.85, 0.0, 0.15, 0.03, DEFAULT_AUTO_ACCEPT, DEFAULT_REVIEW);
    }

    public ScoringProfile withThresholds(double autoAccept, double review) {
        return new ScoringProfile(nameWeight, timeWeight, teamWeight, positionBoost, autoAccept, review);
    }

    public ConfidenceTier tierOf(double confidence) {
        if (confidence >= autoAcceptThreshold) {
            return ConfidenceTier.AUTO_ACCEPT;
        }
        if (confidence >= reviewThreshold) {
            return ConfidenceTier.MANUAL_REVIEW;
        }
        return ConfidenceTier.REJECT;
    }
}
