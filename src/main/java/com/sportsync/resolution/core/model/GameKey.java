package com.sportsync.resolution.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Natural key of a canonical game: one matchup per sport per game day.
 */
public record GameKey(String sport, String homeTeam, String awayTeam, LocalDate gameDay) {

    public GameKey {
        Objects.requireNonNull(sport, "sport is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        Objects.requireNonNull(gameDay, "gameDay is required");
    }

    @Override
    public String toString() {
        return sport + ":" + awayTeam + "@" + homeTeam + ":" + gameDay;
    }
}
