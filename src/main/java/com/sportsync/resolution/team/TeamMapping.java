package com.sportsync.resolution.team;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Seeded description of one team and how each source refers to it.
 *
 * @param code           canonical team code ("LAL")
 * @param fullName       canonical display name ("Los Angeles Lakers")
 * @param city           home city
 * @param nickname       team nickname ("Lakers")
 * @param sourceIds      per-source external team id, keyed by source name
 * @param sourceNames    per-source display name when it differs from the canonical one
 * @param alternateNames other spellings seen in the wild ("LA Lakers")
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamMapping(
        @JsonProperty("code") String code,
        @JsonProperty("fullName") String fullName,
        @JsonProperty("city") String city,
        @JsonProperty("nickname") String nickname,
        @JsonProperty("sourceIds") Map<String, String> sourceIds,
        @JsonProperty("sourceNames") Map<String, String> sourceNames,
        @JsonProperty("alternateNames") List<String> alternateNames
) {
    public TeamMapping {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(fullName, "fullName is required");
        sourceIds = sourceIds != null ? Map.copyOf(sourceIds) : Map.of();
        sourceNames = sourceNames != null ? Map.copyOf(sourceNames) : Map.of();
        alternateNames = alternateNames != null ? List.copyOf(alternateNames) : List.of();
    }
}
