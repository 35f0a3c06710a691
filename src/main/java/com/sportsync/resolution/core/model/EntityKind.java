package com.sportsync.resolution.core.model;

import java.util.Locale;

/**
 * Kinds of canonical entity tracked by the engine.
 */
public enum EntityKind {
    GAME,
    PLAYER,
    TEAM;

    /**
     * Parses a kind from its wire form ({@code game}, {@code player}, {@code team}), case-insensitive.
     */
    public static EntityKind fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("kind is required");
        }
        return EntityKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
