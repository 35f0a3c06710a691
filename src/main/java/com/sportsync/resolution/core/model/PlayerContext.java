package com.sportsync.resolution.core.model;

/**
 * Hints from the surrounding game record used while resolving a player.
 *
 * @param teamCode canonical team code the player appeared for, if known
 * @param position position reported alongside the player, if known
 * @param gameId   canonical game the record belongs to, if known
 */
public record PlayerContext(String teamCode, String position, String gameId) {

    public static PlayerContext empty() {
        return new PlayerContext(null, null, null);
    }

    public static PlayerContext ofTeam(String teamCode) {
        return new PlayerContext(teamCode, null, null);
    }
}
