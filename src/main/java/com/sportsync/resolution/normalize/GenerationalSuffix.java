package com.sportsync.resolution.normalize;

import java.util.Locale;

/**
 * Generational suffix carried by a person's name.
 */
public enum GenerationalSuffix {
    NONE(""),
    JR("jr"),
    SR("sr"),
    II("ii"),
    III("iii"),
    IV("iv");

    private final String token;

    GenerationalSuffix(String token) {
        this.token = token;
    }

    /**
     * The lowercase token as it appears in normalized names, empty for {@link #NONE}.
     */
    public String token() {
        return token;
    }

    /**
     * Two suffixes conflict when both are present and differ ("jr" vs "sr").
     * A missing suffix on either side never conflicts.
     */
    public boolean conflictsWith(GenerationalSuffix other) {
        return this != NONE && other != NONE && this != other;
    }

    public static GenerationalSuffix fromToken(String token) {
        if (token == null || token.isBlank()) {
            return NONE;
        }
        String t = token.trim().toLowerCase(Locale.ROOT).replace(".", "");
        for (GenerationalSuffix suffix : values()) {
            if (suffix != NONE && suffix.token.equals(t)) {
                return suffix;
            }
        }
        return NONE;
    }
}
