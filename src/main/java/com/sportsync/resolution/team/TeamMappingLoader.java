package com.sportsync.resolution.team;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Reads team seed files ({@code teams/<sport>.json}) from the classpath.
 */
public class TeamMappingLoader {
    private static final Logger log = LoggerFactory.getLogger(TeamMappingLoader.class);

    private final ObjectMapper objectMapper;

    public TeamMappingLoader() {
        this(new ObjectMapper());
    }

    public TeamMappingLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads every listed sport into one registry.
     *
     * @throws IllegalArgumentException if a seed resource is missing
     * @throws UncheckedIOException     if a seed resource cannot be parsed
     */
    public TeamMappingRegistry loadRegistry(String... sports) {
        TeamMappingRegistry.Builder builder = TeamMappingRegistry.builder();
        for (String sport : sports) {
            SeedFile seed = load(sport);
            builder.addAll(seed.sport() != null ? seed.sport() : sport, seed.teams());
        }
        return builder.build();
    }

    SeedFile load(String sport) {
        String resource = "teams/" + sport.toLowerCase(Locale.ROOT) + ".json";
        ClassLoader cl = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : TeamMappingLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Team seed not found on classpath: " + resource);
            }
            SeedFile seed = objectMapper.readValue(in, SeedFile.class);
            log.info("teams.loaded sport={} count={} resource={}", sport, seed.teams().size(), resource);
            return seed;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read team seed " + resource, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedFile(@JsonProperty("sport") String sport, @JsonProperty("teams") List<TeamMapping> teams) {
        SeedFile {
            teams = teams != null ? List.copyOf(teams) : List.of();
        }
    }
}
