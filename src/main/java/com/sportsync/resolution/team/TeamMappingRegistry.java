package com.sportsync.resolution.team;

import com.sportsync.resolution.normalize.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates each source's team identifiers and spellings into canonical team codes.
 * Read-only after {@link Builder#build()}, so it is safe to share across sync jobs.
 *
 * <p>Lookup order for {@link #resolve}: the source's own team id, the source's own display name,
 * then any known name (full name, nickname, code, alternate names). A name that would point at
 * two different teams of the same sport is dropped from the index and never resolves.</p>
 */
public class TeamMappingRegistry {
    private static final Logger log = LoggerFactory.getLogger(TeamMappingRegistry.class);

    private final Map<String, Map<String, TeamMapping>> byCode;
    private final Map<String, Map<String, String>> bySourceId;
    private final Map<String, Map<String, String>> byName;
    private final Map<String, Map<String, Set<String>>> namesByCode;
    private final NameNormalizer normalizer;

    private TeamMappingRegistry(Builder builder) {
        this.normalizer = builder.normalizer;
        Map<String, Map<String, TeamMapping>> codes = new HashMap<>();
        Map<String, Map<String, String>> sourceIds = new HashMap<>();
        Map<String, Map<String, String>> names = new HashMap<>();
        Map<String, Map<String, Set<String>>> reverse = new HashMap<>();
        Map<String, Set<String>> ambiguous = new HashMap<>();

        for (Map.Entry<String, List<TeamMapping>> entry : builder.teams.entrySet()) {
            String sport = entry.getKey();
            for (TeamMapping team : entry.getValue()) {
                String code = team.code().toUpperCase(Locale.ROOT);
                if (codes.computeIfAbsent(sport, s -> new HashMap<>()).putIfAbsent(code, team) != null) {
                    throw new IllegalArgumentException("Duplicate team code " + code + " for sport " + sport);
                }
                team.sourceIds().forEach((source, id) ->
                        sourceIds.computeIfAbsent(sourceKey(sport, source), k -> new HashMap<>()).put(id.trim(), code));

                Set<String> teamNames = new LinkedHashSet<>();
                teamNames.add(normalizer.normalizeTeam(team.fullName()));
                teamNames.add(normalizer.normalizeTeam(code));
                if (team.nickname() != null) {
                    teamNames.add(normalizer.normalizeTeam(team.nickname()));
                    if (team.city() != null) {
                        teamNames.add(normalizer.normalizeTeam(team.city() + " " + team.nickname()));
                    }
                }
                team.sourceNames().values().forEach(n -> teamNames.add(normalizer.normalizeTeam(n)));
                team.alternateNames().forEach(n -> teamNames.add(normalizer.normalizeTeam(n)));
                teamNames.remove("");
                reverse.computeIfAbsent(sport, s -> new HashMap<>()).put(code, Collections.unmodifiableSet(teamNames));

                Map<String, String> sportNames = names.computeIfAbsent(sport, s -> new HashMap<>());
                for (String name : teamNames) {
                    String previous = sportNames.putIfAbsent(name, code);
                    if (previous != null && !previous.equals(code)) {
                        ambiguous.computeIfAbsent(sport, s -> new HashSet<>()).add(name);
                    }
                }
            }
        }
        ambiguous.forEach((sport, ambiguousNames) -> {
            ambiguousNames.forEach(names.get(sport)::remove);
            log.warn("teams.ambiguous sport={} names={}", sport, ambiguousNames);
        });

        this.byCode = freeze(codes);
        this.bySourceId = freeze(sourceIds);
        this.byName = freeze(names);
        this.namesByCode = freeze(reverse);
    }

    /**
     * Resolves a team as reported by a source.
     *
     * @param sport        sport code
     * @param source       source name
     * @param rawName      display name or abbreviation as delivered, may be null
     * @param sourceTeamId the source's own team id, may be null
     * @return canonical team code, or empty if nothing matches unambiguously
     */
    public Optional<String> resolve(String sport, String source, String rawName, String sourceTeamId) {
        String key = sport.toLowerCase(Locale.ROOT);
        if (sourceTeamId != null) {
            String code = bySourceId.getOrDefault(sourceKey(key, source), Map.of()).get(sourceTeamId.trim());
            if (code != null) {
                return Optional.of(code);
            }
        }
        if (rawName != null) {
            String bySourceAbbrev = bySourceId.getOrDefault(sourceKey(key, source), Map.of()).get(rawName.trim());
            if (bySourceAbbrev != null) {
                return Optional.of(bySourceAbbrev);
            }
            return Optional.ofNullable(byName.getOrDefault(key, Map.of()).get(normalizer.normalizeTeam(rawName)));
        }
        return Optional.empty();
    }

    public Optional<String> resolve(String sport, String source, String rawName) {
        return resolve(sport, source, rawName, null);
    }

    public Optional<TeamMapping> find(String sport, String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.getOrDefault(sport.toLowerCase(Locale.ROOT), Map.of())
                .get(code.toUpperCase(Locale.ROOT)));
    }

    /**
     * Every normalized name the team is known by, used for fuzzy comparison.
     */
    public Set<String> knownNames(String sport, String code) {
        if (code == null) {
            return Set.of();
        }
        return namesByCode.getOrDefault(sport.toLowerCase(Locale.ROOT), Map.of())
                .getOrDefault(code.toUpperCase(Locale.ROOT), Set.of());
    }

    public List<TeamMapping> teams(String sport) {
        return new ArrayList<>(byCode.getOrDefault(sport.toLowerCase(Locale.ROOT), Map.of()).values());
    }

    public int size() {
        return byCode.values().stream().mapToInt(Map::size).sum();
    }

    private static String sourceKey(String sport, String source) {
        return sport + "|" + source;
    }

    private static <K, V> Map<String, Map<K, V>> freeze(Map<String, Map<K, V>> map) {
        Map<String, Map<K, V>> copy = new HashMap<>();
        map.forEach((k, v) -> copy.put(k, Map.copyOf(v)));
        return Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<TeamMapping>> teams = new HashMap<>();
        private NameNormalizer normalizer = new NameNormalizer();

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder add(String sport, TeamMapping team) {
            teams.computeIfAbsent(sport.toLowerCase(Locale.ROOT), s -> new ArrayList<>()).add(team);
            return this;
        }

        public Builder addAll(String sport, List<TeamMapping> mappings) {
            mappings.forEach(t -> add(sport, t));
            return this;
        }

        public TeamMappingRegistry build() {
            return new TeamMappingRegistry(this);
        }
    }
}
