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

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The canonical store: games, players, their source mappings, player aliases and the dependent rows
 * that reference them.
 *
 * <p>Every write method is atomic. Unique constraints (game natural key, per-source id, one id per
 * source per canonical entity, alias key) are enforced by the store itself and surface as
 * {@link ConflictException}; callers are expected to re-fetch and continue.</p>
 */
public interface CanonicalStore {

    // ── Games ─────────────────────────────────────────────────

    Optional<CanonicalGame> findGame(String id);

    Optional<CanonicalGame> findGameByKey(GameKey key);

    /**
     * Games of a sport whose start time falls in {@code [from, to]}.
     */
    List<CanonicalGame> findGamesBetween(String sport, Instant from, Instant to);

    List<CanonicalGame> findGamesOnDay(String sport, LocalDate gameDay);

    List<CanonicalGame> findAllGames();

    /**
     * Inserts a game and its source mapping in one transaction. A mapping whose id already exists
     * (a record leaving manual review) is updated instead of inserted.
     *
     * @throws ConflictException if the natural key or the source id is already taken
     */
    CanonicalGame createGame(CanonicalGame game, SourceMapping mapping);

    /**
     * Updates mutable game fields (start time, updatedAt).
     *
     * @throws ConflictException if the change would collide with another game's natural key
     */
    CanonicalGame updateGame(CanonicalGame game);

    // ── Players ───────────────────────────────────────────────

    Optional<CanonicalPlayer> findPlayer(String id);

    List<CanonicalPlayer> findPlayersByName(String sport, String normalizedName);

    List<CanonicalPlayer> findPlayersByTeam(String sport, String team);

    List<CanonicalPlayer> findAllPlayers();

    /**
     * Inserts a player together with its optional mapping (inserted or updated by id) and alias.
     */
    CanonicalPlayer createPlayer(CanonicalPlayer player, SourceMapping mapping, PlayerAlias alias);

    CanonicalPlayer updatePlayer(CanonicalPlayer player);

    // ── Mappings ──────────────────────────────────────────────

    Optional<SourceMapping> findMapping(EntityKind kind, String sport, String source, String sourceId);

    List<SourceMapping> findMappings(EntityKind kind, String canonicalId);

    List<SourceMapping> findMappingsByStatus(EntityKind kind, MappingStatus status);

    /**
     * Inserts the mapping, or updates it if a mapping with the same id exists.
     */
    SourceMapping saveMapping(SourceMapping mapping);

    // ── Aliases ───────────────────────────────────────────────

    Optional<PlayerAlias> findAlias(String sport, String aliasKey, String source);

    List<PlayerAlias> findAliases(String canonicalId);

    PlayerAlias saveAlias(PlayerAlias alias);

    // ── Dependents ────────────────────────────────────────────

    Prediction savePrediction(Prediction prediction);

    List<Prediction> findPredictionsForGame(String gameId);

    List<Prediction> findPredictionsForPlayer(String playerId);

    StatLine saveStatLine(StatLine statLine);

    List<StatLine> findStatLinesForPlayer(String playerId);

    List<StatLine> findStatLinesForGame(String gameId);

    // ── Merges ────────────────────────────────────────────────

    /**
     * Re-points every reference from the loser game to the survivor and deletes the loser, in one transaction.
     *
     * @throws MergeIntegrityException if a reference would be orphaned or the two games carry different
     *                                 ids from the same source
     */
    MergeOutcome mergeGames(String survivorId, String loserId);

    /**
     * Player counterpart of {@link #mergeGames}; also moves aliases.
     */
    MergeOutcome mergePlayers(String survivorId, String loserId);

    /**
     * The id an entity was merged into, if it was merged away.
     */
    Optional<String> findMergeTarget(EntityKind kind, String id);

    /**
     * Follows merge redirects until reaching an id that was not merged away.
     */
    default String resolveSurvivor(EntityKind kind, String id) {
        String current = id;
        for (int hops = 0; hops < 32; hops++) {
            Optional<String> next = findMergeTarget(kind, current);
            if (next.isEmpty()) {
                return current;
            }
            current = next.get();
        }
        throw new IllegalStateException("Merge redirect chain too long for " + kind + " " + id);
    }
}
