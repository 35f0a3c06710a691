package com.sportsync.resolution.normalize;

import java.util.Objects;

/**
 * Output of {@link NameNormalizer}: the comparable name without its suffix, plus the suffix.
 */
public record NormalizedName(String value, GenerationalSuffix suffix) {

    public NormalizedName {
        Objects.requireNonNull(value, "value is required");
        suffix = suffix != null ? suffix : GenerationalSuffix.NONE;
    }

    /**
     * Lookup key that keeps father and son apart: {@code "tim hardaway jr"}.
     */
    public String key() {
        return suffix == GenerationalSuffix.NONE ? value : value + " " + suffix.token();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
