package com.sportsync.resolution.core.model;

/**
 * How a source record was tied to its canonical entity.
 */
public enum MatchMethod {
    EXACT_ID("Exact source id match"),
    NATURAL_KEY("Natural key already present (concurrent insert)"),
    TIME_WINDOW("Team codes and start time within tolerance"),
    FUZZY_TEAM_NAME("Team names within edit distance on the same date"),
    ALIAS("Known alias for this source"),
    NAME_AND_TEAM("Normalized name and team match"),
    FUZZY_NAME("Fuzzy name match on the same team"),
    CREATED("New canonical entity created"),
    MANUAL("Manually approved by a reviewer"),
    MERGED("Re-pointed by duplicate reconciliation"),
    NONE("No match");

    private final String description;

    MatchMethod(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
