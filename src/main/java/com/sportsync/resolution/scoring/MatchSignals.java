package com.sportsync.resolution.scoring;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inputs for one candidate pair. A null signal means "not applicable" and is left out of the score,
 * which is different from a signal that is present and false.
 *
 * @param exactIdMatch   the candidate already carries this source id
 * @param nameSimilarity normalized-name similarity in [0,1]
 * @param teamMatch      both sides resolve to the same team
 * @param positionMatch  both sides report the same position
 * @param timeProximity  closeness of start times in [0,1], 1.0 meaning identical
 */
public record MatchSignals(
        boolean exactIdMatch,
        Double nameSimilarity,
        Boolean teamMatch,
        Boolean positionMatch,
        Double timeProximity
) {
    public MatchSignals {
        checkUnit(nameSimilarity, "nameSimilarity");
        checkUnit(timeProximity, "timeProximity");
    }

    private static void checkUnit(Double value, String name) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
    }

    /**
     * Signals as a flat map for audit match details.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("exactIdMatch", exactIdMatch);
        if (nameSimilarity != null) map.put("nameSimilarity", nameSimilarity);
        if (teamMatch != null) map.put("teamMatch", teamMatch);
        if (positionMatch != null) map.put("positionMatch", positionMatch);
        if (timeProximity != null) map.put("timeProximity", timeProximity);
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean exactIdMatch;
        private Double nameSimilarity;
        private Boolean teamMatch;
        private Boolean positionMatch;
        private Double timeProximity;

        public Builder exactIdMatch(boolean exactIdMatch) {
            this.exactIdMatch = exactIdMatch;
            return this;
        }

        public Builder nameSimilarity(Double nameSimilarity) {
            this.nameSimilarity = nameSimilarity;
            return this;
        }

        public Builder teamMatch(Boolean teamMatch) {
            this.teamMatch = teamMatch;
            return this;
        }

        public Builder positionMatch(Boolean positionMatch) {
            this.positionMatch = positionMatch;
            return this;
        }

        public Builder timeProximity(Double timeProximity) {
            this.timeProximity = timeProximity;
            return this;
        }

        public MatchSignals build() {
            return new MatchSignals(exactIdMatch, nameSimilarity, teamMatch, positionMatch, timeProximity);
        }
    }
}
