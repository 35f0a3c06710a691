package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.GameKey;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.PlayerAlias;
import com.sportsync.resolution.core.model.Prediction;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.StatLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CanonicalStore}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>Reads go straight to concurrent maps. Writes are serialized under one lock and check every
 * unique constraint the SQL schema declares before touching any map, so a write either applies
 * completely or not at all.</p>
 */
public class InMemoryCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    private final ReentrantLock writeLock = new ReentrantLock();

    private final ConcurrentMap<String, CanonicalGame> games = new ConcurrentHashMap<>();
    private final ConcurrentMap<GameKey, String> gameKeys = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CanonicalPlayer> players = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SourceMapping> mappings = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> mappingBySourceId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> mappingByCanonicalSource = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PlayerAlias> aliases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> aliasByKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Prediction> predictions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, StatLine> statLines = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> mergedInto = new ConcurrentHashMap<>();

    // ── Games ─────────────────────────────────────────────────

    @Override
    public Optional<CanonicalGame> findGame(String id) {
        return Optional.ofNullable(games.get(id)).map(g -> g.withSourceIds(sourceIdsOf(EntityKind.GAME, g.id())));
    }

    @Override
    public Optional<CanonicalGame> findGameByKey(GameKey key) {
        String id = gameKeys.get(key);
        return id != null ? findGame(id) : Optional.empty();
    }

    @Override
    public List<CanonicalGame> findGamesBetween(String sport, Instant from, Instant to) {
        return games.values().stream()
                .filter(g -> g.sport().equals(sport))
                .filter(g -> !g.scheduledAt().isBefore(from) && !g.scheduledAt().isAfter(to))
                .sorted(Comparator.comparing(CanonicalGame::scheduledAt))
                .map(g -> g.withSourceIds(sourceIdsOf(EntityKind.GAME, g.id())))
                .toList();
    }

    @Override
    public List<CanonicalGame> findGamesOnDay(String sport, LocalDate gameDay) {
        return games.values().stream()
                .filter(g -> g.sport().equals(sport) && g.gameDay().equals(gameDay))
                .sorted(Comparator.comparing(CanonicalGame::scheduledAt))
                .map(g -> g.withSourceIds(sourceIdsOf(EntityKind.GAME, g.id())))
                .toList();
    }

    @Override
    public List<CanonicalGame> findAllGames() {
        return games.values().stream()
                .sorted(Comparator.comparing(CanonicalGame::createdAt).thenComparing(CanonicalGame::id))
                .map(g -> g.withSourceIds(sourceIdsOf(EntityKind.GAME, g.id())))
                .toList();
    }

    @Override
    public CanonicalGame createGame(CanonicalGame game, SourceMapping mapping) {
        writeLock.lock();
        try {
            if (gameKeys.containsKey(game.naturalKey())) {
                throw new ConflictException(ConflictException.GAME_NATURAL_KEY,
                        "Game already exists for natural key " + game.naturalKey());
            }
            if (games.containsKey(game.id())) {
                throw new ConflictException(ConflictException.UNKNOWN, "Game id already exists: " + game.id());
            }
            if (mapping != null) {
                checkMappingConstraints(mapping);
            }
            games.put(game.id(), game);
            gameKeys.put(game.naturalKey(), game.id());
            if (mapping != null) {
                upsertMapping(mapping);
            }
            log.debug("store.game.created id={} key={}", game.id(), game.naturalKey());
            return findGame(game.id()).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CanonicalGame updateGame(CanonicalGame game) {
        writeLock.lock();
        try {
            CanonicalGame existing = games.get(game.id());
            if (existing == null) {
                throw new IllegalArgumentException("Game not found: " + game.id());
            }
            String owner = gameKeys.get(game.naturalKey());
            if (owner != null && !owner.equals(game.id())) {
                throw new ConflictException(ConflictException.GAME_NATURAL_KEY,
                        "Natural key " + game.naturalKey() + " belongs to game " + owner);
            }
            gameKeys.remove(existing.naturalKey());
            gameKeys.put(game.naturalKey(), game.id());
            games.put(game.id(), game.toBuilder().updatedAt(Instant.now()).sourceIds(Map.of()).build());
            return findGame(game.id()).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    // ── Players ───────────────────────────────────────────────

    @Override
    public Optional<CanonicalPlayer> findPlayer(String id) {
        return Optional.ofNullable(players.get(id)).map(p -> p.withSourceIds(sourceIdsOf(EntityKind.PLAYER, p.id())));
    }

    @Override
    public List<CanonicalPlayer> findPlayersByName(String sport, String normalizedName) {
        return players.values().stream()
                .filter(p -> p.sport().equals(sport) && p.normalizedName().equals(normalizedName))
                .sorted(Comparator.comparing(CanonicalPlayer::createdAt))
                .map(p -> p.withSourceIds(sourceIdsOf(EntityKind.PLAYER, p.id())))
                .toList();
    }

    @Override
    public List<CanonicalPlayer> findPlayersByTeam(String sport, String team) {
        return players.values().stream()
                .filter(p -> p.sport().equals(sport) && Objects.equals(p.team(), team))
                .sorted(Comparator.comparing(CanonicalPlayer::createdAt))
                .map(p -> p.withSourceIds(sourceIdsOf(EntityKind.PLAYER, p.id())))
                .toList();
    }

    @Override
    public List<CanonicalPlayer> findAllPlayers() {
        return players.values().stream()
                .sorted(Comparator.comparing(CanonicalPlayer::createdAt).thenComparing(CanonicalPlayer::id))
                .map(p -> p.withSourceIds(sourceIdsOf(EntityKind.PLAYER, p.id())))
                .toList();
    }

    @Override
    public CanonicalPlayer createPlayer(CanonicalPlayer player, SourceMapping mapping, PlayerAlias alias) {
        writeLock.lock();
        try {
            if (players.containsKey(player.id())) {
                throw new ConflictException(ConflictException.UNKNOWN, "Player id already exists: " + player.id());
            }
            if (mapping != null) {
                checkMappingConstraints(mapping);
            }
            if (alias != null) {
                checkAliasConstraints(alias);
            }
            players.put(player.id(), player);
            if (mapping != null) {
                upsertMapping(mapping);
            }
            if (alias != null) {
                putAlias(alias);
            }
            log.debug("store.player.created id={} name={}", player.id(), player.canonicalName());
            return findPlayer(player.id()).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CanonicalPlayer updatePlayer(CanonicalPlayer player) {
        writeLock.lock();
        try {
            if (!players.containsKey(player.id())) {
                throw new IllegalArgumentException("Player not found: " + player.id());
            }
            players.put(player.id(), player.toBuilder().updatedAt(Instant.now()).sourceIds(Map.of()).build());
            return findPlayer(player.id()).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    // ── Mappings ──────────────────────────────────────────────

    @Override
    public Optional<SourceMapping> findMapping(EntityKind kind, String sport, String source, String sourceId) {
        String id = mappingBySourceId.get(sourceIdKey(kind, sport, source, sourceId));
        return id != null ? Optional.ofNullable(mappings.get(id)) : Optional.empty();
    }

    @Override
    public List<SourceMapping> findMappings(EntityKind kind, String canonicalId) {
        return mappings.values().stream()
                .filter(m -> m.kind() == kind && canonicalId.equals(m.canonicalId()))
                .sorted(Comparator.comparing(SourceMapping::createdAt))
                .toList();
    }

    @Override
    public List<SourceMapping> findMappingsByStatus(EntityKind kind, MappingStatus status) {
        return mappings.values().stream()
                .filter(m -> m.kind() == kind && m.status() == status)
                .sorted(Comparator.comparing(SourceMapping::createdAt))
                .toList();
    }

    @Override
    public SourceMapping saveMapping(SourceMapping mapping) {
        writeLock.lock();
        try {
            requireCanonicalExists(mapping.kind(), mapping.canonicalId());
            SourceMapping existing = mappings.get(mapping.id());
            if (existing != null) {
                removeMappingIndexes(existing);
            }
            try {
                checkMappingConstraints(mapping);
            } catch (ConflictException e) {
                if (existing != null) {
                    putMapping(existing);
                }
                throw e;
            }
            putMapping(mapping);
            return mapping;
        } finally {
            writeLock.unlock();
        }
    }

    // ── Aliases ───────────────────────────────────────────────

    @Override
    public Optional<PlayerAlias> findAlias(String sport, String aliasKey, String source) {
        String id = aliasByKey.get(aliasKey(sport, aliasKey, source));
        return id != null ? Optional.ofNullable(aliases.get(id)) : Optional.empty();
    }

    @Override
    public List<PlayerAlias> findAliases(String canonicalId) {
        return aliases.values().stream()
                .filter(a -> a.canonicalId().equals(canonicalId))
                .sorted(Comparator.comparing(PlayerAlias::createdAt))
                .toList();
    }

    @Override
    public PlayerAlias saveAlias(PlayerAlias alias) {
        writeLock.lock();
        try {
            requireCanonicalExists(EntityKind.PLAYER, alias.canonicalId());
            PlayerAlias existing = aliases.get(alias.id());
            if (existing != null) {
                aliasByKey.remove(aliasKey(existing.sport(), existing.aliasKey(), existing.aliasSource()));
            }
            try {
                checkAliasConstraints(alias);
            } catch (ConflictException e) {
                if (existing != null) {
                    putAlias(existing);
                }
                throw e;
            }
            putAlias(alias);
            return alias;
        } finally {
            writeLock.unlock();
        }
    }

    // ── Dependents ────────────────────────────────────────────

    @Override
    public Prediction savePrediction(Prediction prediction) {
        writeLock.lock();
        try {
            requireCanonicalExists(EntityKind.GAME, prediction.gameId());
            requireCanonicalExists(EntityKind.PLAYER, prediction.playerId());
            predictions.put(prediction.id(), prediction);
            return prediction;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Prediction> findPredictionsForGame(String gameId) {
        return predictions.values().stream().filter(p -> p.gameId().equals(gameId)).toList();
    }

    @Override
    public List<Prediction> findPredictionsForPlayer(String playerId) {
        return predictions.values().stream().filter(p -> playerId.equals(p.playerId())).toList();
    }

    @Override
    public StatLine saveStatLine(StatLine statLine) {
        writeLock.lock();
        try {
            requireCanonicalExists(EntityKind.GAME, statLine.gameId());
            requireCanonicalExists(EntityKind.PLAYER, statLine.playerId());
            statLines.put(statLine.id(), statLine);
            return statLine;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<StatLine> findStatLinesForPlayer(String playerId) {
        return statLines.values().stream().filter(s -> s.playerId().equals(playerId)).toList();
    }

    @Override
    public List<StatLine> findStatLinesForGame(String gameId) {
        return statLines.values().stream().filter(s -> s.gameId().equals(gameId)).toList();
    }

    // ── Merges ────────────────────────────────────────────────

    @Override
    public MergeOutcome mergeGames(String survivorId, String loserId) {
        requireDistinct(survivorId, loserId);
        writeLock.lock();
        try {
            CanonicalGame loser = games.get(loserId);
            if (loser == null) {
                return MergeOutcome.noop(EntityKind.GAME, survivorId, loserId);
            }
            CanonicalGame survivor = games.get(survivorId);
            if (survivor == null) {
                throw new MergeIntegrityException("Survivor game does not exist: " + survivorId);
            }
            if (!survivor.sport().equals(loser.sport())) {
                throw new MergeIntegrityException("Cannot merge games of different sports: "
                        + survivor.sport() + " vs " + loser.sport());
            }
            List<SourceMapping> moving = findMappings(EntityKind.GAME, loserId);
            checkNoSourceClash(EntityKind.GAME, survivorId, moving);

            // all checks passed; apply
            moving.forEach(m -> replaceMapping(m, m.repointedTo(survivorId)));
            int predictionsMoved = 0;
            for (Prediction p : List.copyOf(predictions.values())) {
                if (p.gameId().equals(loserId)) {
                    predictions.put(p.id(), new Prediction(p.id(), survivorId, p.playerId(), p.market(), p.createdAt()));
                    predictionsMoved++;
                }
            }
            int statsMoved = 0;
            for (StatLine s : List.copyOf(statLines.values())) {
                if (s.gameId().equals(loserId)) {
                    statLines.put(s.id(), new StatLine(s.id(), s.playerId(), survivorId, s.statType(), s.value()));
                    statsMoved++;
                }
            }
            games.remove(loserId);
            gameKeys.remove(loser.naturalKey(), loserId);
            mergedInto.put(redirectKey(EntityKind.GAME, loserId), survivorId);
            return new MergeOutcome(EntityKind.GAME, survivorId, loserId, moving.size(), 0,
                    predictionsMoved, statsMoved, false);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public MergeOutcome mergePlayers(String survivorId, String loserId) {
        requireDistinct(survivorId, loserId);
        writeLock.lock();
        try {
            CanonicalPlayer loser = players.get(loserId);
            if (loser == null) {
                return MergeOutcome.noop(EntityKind.PLAYER, survivorId, loserId);
            }
            CanonicalPlayer survivor = players.get(survivorId);
            if (survivor == null) {
                throw new MergeIntegrityException("Survivor player does not exist: " + survivorId);
            }
            if (!survivor.sport().equals(loser.sport())) {
                throw new MergeIntegrityException("Cannot merge players of different sports: "
                        + survivor.sport() + " vs " + loser.sport());
            }
            List<SourceMapping> moving = findMappings(EntityKind.PLAYER, loserId);
            checkNoSourceClash(EntityKind.PLAYER, survivorId, moving);

            moving.forEach(m -> replaceMapping(m, m.repointedTo(survivorId)));
            List<PlayerAlias> movingAliases = findAliases(loserId);
            movingAliases.forEach(a -> aliases.put(a.id(), a.repointedTo(survivorId)));
            int predictionsMoved = 0;
            for (Prediction p : List.copyOf(predictions.values())) {
                if (loserId.equals(p.playerId())) {
                    predictions.put(p.id(), new Prediction(p.id(), p.gameId(), survivorId, p.market(), p.createdAt()));
                    predictionsMoved++;
                }
            }
            int statsMoved = 0;
            for (StatLine s : List.copyOf(statLines.values())) {
                if (s.playerId().equals(loserId)) {
                    statLines.put(s.id(), new StatLine(s.id(), survivorId, s.gameId(), s.statType(), s.value()));
                    statsMoved++;
                }
            }
            players.remove(loserId);
            mergedInto.put(redirectKey(EntityKind.PLAYER, loserId), survivorId);
            return new MergeOutcome(EntityKind.PLAYER, survivorId, loserId, moving.size(), movingAliases.size(),
                    predictionsMoved, statsMoved, false);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<String> findMergeTarget(EntityKind kind, String id) {
        return Optional.ofNullable(mergedInto.get(redirectKey(kind, id)));
    }

    // ── Internals (callers hold writeLock) ────────────────────

    private void checkNoSourceClash(EntityKind kind, String survivorId, List<SourceMapping> moving) {
        Map<String, SourceMapping> survivorBySource = new HashMap<>();
        findMappings(kind, survivorId).forEach(m -> survivorBySource.put(m.source(), m));
        for (SourceMapping m : moving) {
            SourceMapping clash = survivorBySource.get(m.source());
            if (clash != null) {
                throw new MergeIntegrityException("Conflicting " + m.source() + " ids: survivor has "
                        + clash.sourceId() + ", loser has " + m.sourceId());
            }
        }
    }

    private void checkMappingConstraints(SourceMapping mapping) {
        String bySource = mappingBySourceId.get(sourceIdKey(mapping));
        if (bySource != null && !bySource.equals(mapping.id())) {
            throw new ConflictException(mapping.kind() == EntityKind.GAME
                    ? ConflictException.GAME_SOURCE_ID : ConflictException.PLAYER_SOURCE_ID,
                    "Source id already mapped: " + sourceIdKey(mapping));
        }
        if (mapping.canonicalId() != null) {
            String byCanonical = mappingByCanonicalSource.get(canonicalSourceKey(mapping));
            if (byCanonical != null && !byCanonical.equals(mapping.id())) {
                throw new ConflictException(mapping.kind() == EntityKind.GAME
                        ? ConflictException.GAME_CANONICAL_SOURCE : ConflictException.PLAYER_CANONICAL_SOURCE,
                        "Canonical " + mapping.canonicalId() + " already has an id from " + mapping.source());
            }
        }
    }

    private void checkAliasConstraints(PlayerAlias alias) {
        String owner = aliasByKey.get(aliasKey(alias.sport(), alias.aliasKey(), alias.aliasSource()));
        if (owner != null && !owner.equals(alias.id())) {
            throw new ConflictException(ConflictException.PLAYER_ALIAS,
                    "Alias already recorded: " + alias.aliasKey() + " from " + alias.aliasSource());
        }
    }

    private void requireCanonicalExists(EntityKind kind, String id) {
        if (id == null) {
            return;
        }
        boolean exists = kind == EntityKind.GAME ? games.containsKey(id) : players.containsKey(id);
        if (!exists) {
            throw new IllegalArgumentException(kind.wireName() + " not found: " + id);
        }
    }

    private void putMapping(SourceMapping mapping) {
        mappings.put(mapping.id(), mapping);
        mappingBySourceId.put(sourceIdKey(mapping), mapping.id());
        if (mapping.canonicalId() != null) {
            mappingByCanonicalSource.put(canonicalSourceKey(mapping), mapping.id());
        }
    }

    private void upsertMapping(SourceMapping mapping) {
        SourceMapping existing = mappings.get(mapping.id());
        if (existing != null) {
            removeMappingIndexes(existing);
        }
        putMapping(mapping);
    }

    private void removeMappingIndexes(SourceMapping mapping) {
        mappingBySourceId.remove(sourceIdKey(mapping), mapping.id());
        if (mapping.canonicalId() != null) {
            mappingByCanonicalSource.remove(canonicalSourceKey(mapping), mapping.id());
        }
    }

    private void replaceMapping(SourceMapping old, SourceMapping updated) {
        removeMappingIndexes(old);
        putMapping(updated);
    }

    private void putAlias(PlayerAlias alias) {
        aliases.put(alias.id(), alias);
        aliasByKey.put(aliasKey(alias.sport(), alias.aliasKey(), alias.aliasSource()), alias.id());
    }

    private Map<String, String> sourceIdsOf(EntityKind kind, String canonicalId) {
        Map<String, String> ids = new HashMap<>();
        for (SourceMapping m : mappings.values()) {
            if (m.kind() == kind && m.isMatched() && canonicalId.equals(m.canonicalId())) {
                ids.put(m.source(), m.sourceId());
            }
        }
        return ids;
    }

    private static void requireDistinct(String survivorId, String loserId) {
        Objects.requireNonNull(survivorId, "survivorId is required");
        Objects.requireNonNull(loserId, "loserId is required");
        if (survivorId.equals(loserId)) {
            throw new IllegalArgumentException("Cannot merge an entity into itself: " + survivorId);
        }
    }

    private static String sourceIdKey(SourceMapping m) {
        return sourceIdKey(m.kind(), m.sport(), m.source(), m.sourceId());
    }

    private static String sourceIdKey(EntityKind kind, String sport, String source, String sourceId) {
        return kind + "|" + sport + "|" + source + "|" + sourceId;
    }

    private static String canonicalSourceKey(SourceMapping m) {
        return m.kind() + "|" + m.canonicalId() + "|" + m.source();
    }

    private static String aliasKey(String sport, String key, String source) {
        return sport + "|" + key + "|" + source;
    }

    private static String redirectKey(EntityKind kind, String id) {
        return kind + "|" + id;
    }
}
