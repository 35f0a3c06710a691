package com.sportsync.resolution.core.model;

import java.util.Objects;

/**
 * Static facts about one data provider.
 *
 * @param name           source name as it appears on records
 * @param authority      higher wins when choosing a reconciliation survivor
 * @param crossTimezone  start times from this source may be off by a timezone shift
 * @param createsPlayers whether a player miss from this source may create a new canonical player
 */
public record SourceProfile(String name, int authority, boolean crossTimezone, boolean createsPlayers) {

    public SourceProfile {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /**
     * Profile used for sources nobody configured: lowest authority, same-timezone, cannot create players.
     */
    public static SourceProfile unknown(String name) {
        return new SourceProfile(name, 0, false, false);
    }
}
