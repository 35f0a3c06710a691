package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.GameKey;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.PlayerAlias;
import com.sportsync.resolution.core.model.Prediction;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.StatLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link CanonicalStore} over a relational database (PostgreSQL in production, H2 in tests).
 * Unique constraints and foreign keys from {@code db/schema.sql} do the enforcing; this class only
 * groups statements into transactions and maps rows.
 */
public class JdbcCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCanonicalStore.class);

    private static final String GAME_COLUMNS =
            "id, sport, home_team, away_team, scheduled_at, game_day, primary_source, created_at, updated_at";
    private static final String PLAYER_COLUMNS =
            "id, sport, canonical_name, normalized_name, suffix, team, position, primary_source, created_at, updated_at";
    private static final String MAPPING_COLUMNS =
            "id, sport, source, source_id, canonical_id, confidence, method, status, created_at, updated_at";
    private static final String ALIAS_COLUMNS =
            "id, player_id, sport, alias_name, alias_key, alias_source, confidence, is_verified, created_at";

    private final SqlExecutor sql;

    public JdbcCanonicalStore(SqlExecutor sql) {
        this.sql = sql;
    }

    // ── Games ─────────────────────────────────────────────────

    @Override
    public Optional<CanonicalGame> findGame(String id) {
        return sql.queryOne("SELECT " + GAME_COLUMNS + " FROM games WHERE id = ?", JdbcCanonicalStore::game, id)
                .map(this::withGameSourceIds);
    }

    @Override
    public Optional<CanonicalGame> findGameByKey(GameKey key) {
        return sql.queryOne("SELECT " + GAME_COLUMNS + " FROM games"
                                + " WHERE sport = ? AND home_team = ? AND away_team = ? AND game_day = ?",
                        JdbcCanonicalStore::game, key.sport(), key.homeTeam(), key.awayTeam(), key.gameDay())
                .map(this::withGameSourceIds);
    }

    @Override
    public List<CanonicalGame> findGamesBetween(String sport, Instant from, Instant to) {
        return sql.query("SELECT " + GAME_COLUMNS + " FROM games"
                                + " WHERE sport = ? AND scheduled_at >= ? AND scheduled_at <= ? ORDER BY scheduled_at",
                        JdbcCanonicalStore::game, sport, from, to)
                .stream().map(this::withGameSourceIds).toList();
    }

    @Override
    public List<CanonicalGame> findGamesOnDay(String sport, LocalDate gameDay) {
        return sql.query("SELECT " + GAME_COLUMNS + " FROM games WHERE sport = ? AND game_day = ? ORDER BY scheduled_at",
                        JdbcCanonicalStore::game, sport, gameDay)
                .stream().map(this::withGameSourceIds).toList();
    }

    @Override
    public List<CanonicalGame> findAllGames() {
        return sql.query("SELECT " + GAME_COLUMNS + " FROM games ORDER BY created_at, id", JdbcCanonicalStore::game)
                .stream().map(this::withGameSourceIds).toList();
    }

    @Override
    public CanonicalGame createGame(CanonicalGame game, SourceMapping mapping) {
        sql.inTransaction(connection -> {
            SqlExecutor.update(connection, "INSERT INTO games (" + GAME_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    game.id(), game.sport(), game.homeTeam(), game.awayTeam(), game.scheduledAt(), game.gameDay(),
                    game.primarySource(), game.createdAt(), game.updatedAt());
            if (mapping != null) {
                upsertMapping(connection, mapping);
            }
            return null;
        });
        log.debug("store.game.created id={} key={}", game.id(), game.naturalKey());
        return findGame(game.id()).orElseThrow();
    }

    @Override
    public CanonicalGame updateGame(CanonicalGame game) {
        int rows = sql.update("UPDATE games SET scheduled_at = ?, game_day = ?, primary_source = ?, updated_at = ?"
                        + " WHERE id = ?",
                game.scheduledAt(), game.gameDay(), game.primarySource(), Instant.now(), game.id());
        if (rows == 0) {
            throw new IllegalArgumentException("Game not found: " + game.id());
        }
        return findGame(game.id()).orElseThrow();
    }

    // ── Players ───────────────────────────────────────────────

    @Override
    public Optional<CanonicalPlayer> findPlayer(String id) {
        return sql.queryOne("SELECT " + PLAYER_COLUMNS + " FROM players WHERE id = ?", JdbcCanonicalStore::player, id)
                .map(this::withPlayerSourceIds);
    }

    @Override
    public List<CanonicalPlayer> findPlayersByName(String sport, String normalizedName) {
        return sql.query("SELECT " + PLAYER_COLUMNS + " FROM players WHERE sport = ? AND normalized_name = ?"
                                + " ORDER BY created_at",
                        JdbcCanonicalStore::player, sport, normalizedName)
                .stream().map(this::withPlayerSourceIds).toList();
    }

    @Override
    public List<CanonicalPlayer> findPlayersByTeam(String sport, String team) {
        return sql.query("SELECT " + PLAYER_COLUMNS + " FROM players WHERE sport = ? AND team = ? ORDER BY created_at",
                        JdbcCanonicalStore::player, sport, team)
                .stream().map(this::withPlayerSourceIds).toList();
    }

    @Override
    public List<CanonicalPlayer> findAllPlayers() {
        return sql.query("SELECT " + PLAYER_COLUMNS + " FROM players ORDER BY created_at, id", JdbcCanonicalStore::player)
                .stream().map(this::withPlayerSourceIds).toList();
    }

    @Override
    public CanonicalPlayer createPlayer(CanonicalPlayer player, SourceMapping mapping, PlayerAlias alias) {
        sql.inTransaction(connection -> {
            SqlExecutor.update(connection, "INSERT INTO players (" + PLAYER_COLUMNS + ")"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    player.id(), player.sport(), player.canonicalName(), player.normalizedName(), player.suffix(),
                    player.team(), player.position(), player.primarySource(), player.createdAt(), player.updatedAt());
            if (mapping != null) {
                upsertMapping(connection, mapping);
            }
            if (alias != null) {
                insertAlias(connection, alias);
            }
            return null;
        });
        log.debug("store.player.created id={} name={}", player.id(), player.canonicalName());
        return findPlayer(player.id()).orElseThrow();
    }

    @Override
    public CanonicalPlayer updatePlayer(CanonicalPlayer player) {
        int rows = sql.update("UPDATE players SET canonical_name = ?, team = ?, position = ?, updated_at = ? WHERE id = ?",
                player.canonicalName(), player.team(), player.position(), Instant.now(), player.id());
        if (rows == 0) {
            throw new IllegalArgumentException("Player not found: " + player.id());
        }
        return findPlayer(player.id()).orElseThrow();
    }

    // ── Mappings ──────────────────────────────────────────────

    @Override
    public Optional<SourceMapping> findMapping(EntityKind kind, String sport, String source, String sourceId) {
        return sql.queryOne("SELECT " + MAPPING_COLUMNS + " FROM " + mappingTable(kind)
                        + " WHERE sport = ? AND source = ? AND source_id = ?",
                rs -> mapping(rs, kind), sport, source, sourceId);
    }

    @Override
    public List<SourceMapping> findMappings(EntityKind kind, String canonicalId) {
        return sql.query("SELECT " + MAPPING_COLUMNS + " FROM " + mappingTable(kind)
                        + " WHERE canonical_id = ? ORDER BY created_at",
                rs -> mapping(rs, kind), canonicalId);
    }

    @Override
    public List<SourceMapping> findMappingsByStatus(EntityKind kind, MappingStatus status) {
        return sql.query("SELECT " + MAPPING_COLUMNS + " FROM " + mappingTable(kind)
                        + " WHERE status = ? ORDER BY created_at",
                rs -> mapping(rs, kind), status);
    }

    @Override
    public SourceMapping saveMapping(SourceMapping mapping) {
        return sql.inTransaction(connection -> {
            upsertMapping(connection, mapping);
            return mapping;
        });
    }

    // ── Aliases ───────────────────────────────────────────────

    @Override
    public Optional<PlayerAlias> findAlias(String sport, String aliasKey, String source) {
        return sql.queryOne("SELECT " + ALIAS_COLUMNS + " FROM player_aliases"
                        + " WHERE sport = ? AND alias_key = ? AND alias_source = ?",
                JdbcCanonicalStore::alias, sport, aliasKey, source);
    }

    @Override
    public List<PlayerAlias> findAliases(String canonicalId) {
        return sql.query("SELECT " + ALIAS_COLUMNS + " FROM player_aliases WHERE player_id = ? ORDER BY created_at",
                JdbcCanonicalStore::alias, canonicalId);
    }

    @Override
    public PlayerAlias saveAlias(PlayerAlias alias) {
        return sql.inTransaction(connection -> {
            int updated = SqlExecutor.update(connection,
                    "UPDATE player_aliases SET player_id = ?, confidence = ?, is_verified = ? WHERE id = ?",
                    alias.canonicalId(), alias.confidence(), alias.verified(), alias.id());
            if (updated == 0) {
                insertAlias(connection, alias);
            }
            return alias;
        });
    }

    // ── Dependents ────────────────────────────────────────────

    @Override
    public Prediction savePrediction(Prediction p) {
        sql.update("INSERT INTO predictions (id, game_id, player_id, market, created_at) VALUES (?, ?, ?, ?, ?)",
                p.id(), p.gameId(), p.playerId(), p.market(), p.createdAt());
        return p;
    }

    @Override
    public List<Prediction> findPredictionsForGame(String gameId) {
        return sql.query("SELECT id, game_id, player_id, market, created_at FROM predictions WHERE game_id = ?",
                JdbcCanonicalStore::prediction, gameId);
    }

    @Override
    public List<Prediction> findPredictionsForPlayer(String playerId) {
        return sql.query("SELECT id, game_id, player_id, market, created_at FROM predictions WHERE player_id = ?",
                JdbcCanonicalStore::prediction, playerId);
    }

    @Override
    public StatLine saveStatLine(StatLine s) {
        sql.update("INSERT INTO stat_lines (id, player_id, game_id, stat_type, stat_value) VALUES (?, ?, ?, ?, ?)",
                s.id(), s.playerId(), s.gameId(), s.statType(), s.value());
        return s;
    }

    @Override
    public List<StatLine> findStatLinesForPlayer(String playerId) {
        return sql.query("SELECT id, player_id, game_id, stat_type, stat_value FROM stat_lines WHERE player_id = ?",
                JdbcCanonicalStore::statLine, playerId);
    }

    @Override
    public List<StatLine> findStatLinesForGame(String gameId) {
        return sql.query("SELECT id, player_id, game_id, stat_type, stat_value FROM stat_lines WHERE game_id = ?",
                JdbcCanonicalStore::statLine, gameId);
    }

    // ── Merges ────────────────────────────────────────────────

    @Override
    public MergeOutcome mergeGames(String survivorId, String loserId) {
        if (survivorId.equals(loserId)) {
            throw new IllegalArgumentException("Cannot merge an entity into itself: " + survivorId);
        }
        return sql.inTransaction(connection -> {
            Optional<String> loserSport = sportOf(connection, "games", loserId);
            if (loserSport.isEmpty()) {
                return MergeOutcome.noop(EntityKind.GAME, survivorId, loserId);
            }
            Optional<String> survivorSport = sportOf(connection, "games", survivorId);
            if (survivorSport.isEmpty()) {
                throw new MergeIntegrityException("Survivor game does not exist: " + survivorId);
            }
            if (!survivorSport.get().equals(loserSport.get())) {
                throw new MergeIntegrityException("Cannot merge games of different sports: "
                        + survivorSport.get() + " vs " + loserSport.get());
            }
            checkNoSourceClash(connection, "game_mappings", survivorId, loserId);

            int mappings = SqlExecutor.update(connection,
                    "UPDATE game_mappings SET canonical_id = ?, updated_at = ? WHERE canonical_id = ?",
                    survivorId, Instant.now(), loserId);
            int predictions = SqlExecutor.update(connection,
                    "UPDATE predictions SET game_id = ? WHERE game_id = ?", survivorId, loserId);
            int stats = SqlExecutor.update(connection,
                    "UPDATE stat_lines SET game_id = ? WHERE game_id = ?", survivorId, loserId);
            SqlExecutor.update(connection, "DELETE FROM games WHERE id = ?", loserId);
            recordRedirect(connection, EntityKind.GAME, loserId, survivorId);
            return new MergeOutcome(EntityKind.GAME, survivorId, loserId, mappings, 0, predictions, stats, false);
        });
    }

    @Override
    public MergeOutcome mergePlayers(String survivorId, String loserId) {
        if (survivorId.equals(loserId)) {
            throw new IllegalArgumentException("Cannot merge an entity into itself: " + survivorId);
        }
        return sql.inTransaction(connection -> {
            Optional<String> loserSport = sportOf(connection, "players", loserId);
            if (loserSport.isEmpty()) {
                return MergeOutcome.noop(EntityKind.PLAYER, survivorId, loserId);
            }
            Optional<String> survivorSport = sportOf(connection, "players", survivorId);
            if (survivorSport.isEmpty()) {
                throw new MergeIntegrityException("Survivor player does not exist: " + survivorId);
            }
            if (!survivorSport.get().equals(loserSport.get())) {
                throw new MergeIntegrityException("Cannot merge players of different sports: "
                        + survivorSport.get() + " vs " + loserSport.get());
            }
            checkNoSourceClash(connection, "player_mappings", survivorId, loserId);

            int mappings = SqlExecutor.update(connection,
                    "UPDATE player_mappings SET canonical_id = ?, updated_at = ? WHERE canonical_id = ?",
                    survivorId, Instant.now(), loserId);
            int aliases = SqlExecutor.update(connection,
                    "UPDATE player_aliases SET player_id = ? WHERE player_id = ?", survivorId, loserId);
            int predictions = SqlExecutor.update(connection,
                    "UPDATE predictions SET player_id = ? WHERE player_id = ?", survivorId, loserId);
            int stats = SqlExecutor.update(connection,
                    "UPDATE stat_lines SET player_id = ? WHERE player_id = ?", survivorId, loserId);
            SqlExecutor.update(connection, "DELETE FROM players WHERE id = ?", loserId);
            recordRedirect(connection, EntityKind.PLAYER, loserId, survivorId);
            return new MergeOutcome(EntityKind.PLAYER, survivorId, loserId, mappings, aliases, predictions, stats, false);
        });
    }

    @Override
    public Optional<String> findMergeTarget(EntityKind kind, String id) {
        return sql.queryOne("SELECT survivor_id FROM merge_history WHERE entity_kind = ? AND loser_id = ?",
                rs -> rs.getString("survivor_id"), kind, id);
    }

    // ── Internals ─────────────────────────────────────────────

    private static Optional<String> sportOf(Connection connection, String table, String id) throws SQLException {
        // row lock keeps a concurrent merge from deleting it under us
        List<String> rows = SqlExecutor.query(connection, "SELECT sport FROM " + table + " WHERE id = ? FOR UPDATE",
                rs -> rs.getString("sport"), id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static void checkNoSourceClash(Connection connection, String table, String survivorId, String loserId)
            throws SQLException {
        List<String> clashes = SqlExecutor.query(connection,
                "SELECT l.source FROM " + table + " l JOIN " + table + " s ON s.source = l.source"
                        + " WHERE l.canonical_id = ? AND s.canonical_id = ?",
                rs -> rs.getString("source"), loserId, survivorId);
        if (!clashes.isEmpty()) {
            throw new MergeIntegrityException("Conflicting source ids from " + clashes + " between "
                    + survivorId + " and " + loserId);
        }
    }

    private static void recordRedirect(Connection connection, EntityKind kind, String loserId, String survivorId)
            throws SQLException {
        SqlExecutor.update(connection,
                "INSERT INTO merge_history (id, entity_kind, loser_id, survivor_id, merged_at) VALUES (?, ?, ?, ?, ?)",
                UUID.randomUUID().toString(), kind, loserId, survivorId, Instant.now());
    }

    private static void upsertMapping(Connection connection, SourceMapping m) throws SQLException {
        int updated = SqlExecutor.update(connection, "UPDATE " + mappingTable(m.kind())
                        + " SET canonical_id = ?, confidence = ?, method = ?, status = ?, updated_at = ? WHERE id = ?",
                m.canonicalId(), m.confidence(), m.method(), m.status(), m.updatedAt(), m.id());
        if (updated == 0) {
            insertMapping(connection, m);
        }
    }

    private static void insertMapping(Connection connection, SourceMapping m) throws SQLException {
        SqlExecutor.update(connection, "INSERT INTO " + mappingTable(m.kind()) + " (" + MAPPING_COLUMNS + ")"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                m.id(), m.sport(), m.source(), m.sourceId(), m.canonicalId(), m.confidence(), m.method(), m.status(),
                m.createdAt(), m.updatedAt());
    }

    private static void insertAlias(Connection connection, PlayerAlias a) throws SQLException {
        SqlExecutor.update(connection, "INSERT INTO player_aliases (" + ALIAS_COLUMNS + ")"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                a.id(), a.canonicalId(), a.sport(), a.aliasName(), a.aliasKey(), a.aliasSource(), a.confidence(),
                a.verified(), a.createdAt());
    }

    private CanonicalGame withGameSourceIds(CanonicalGame game) {
        return game.withSourceIds(sourceIds("game_mappings", game.id()));
    }

    private CanonicalPlayer withPlayerSourceIds(CanonicalPlayer player) {
        return player.withSourceIds(sourceIds("player_mappings", player.id()));
    }

    private Map<String, String> sourceIds(String table, String canonicalId) {
        Map<String, String> ids = new HashMap<>();
        sql.query("SELECT source, source_id FROM " + table + " WHERE canonical_id = ? AND status = 'MATCHED'",
                rs -> ids.put(rs.getString("source"), rs.getString("source_id")), canonicalId);
        return ids;
    }

    private static String mappingTable(EntityKind kind) {
        return switch (kind) {
            case GAME -> "game_mappings";
            case PLAYER -> "player_mappings";
            case TEAM -> throw new IllegalArgumentException("Team mappings are seeded, not stored");
        };
    }

    private static CanonicalGame game(ResultSet rs) throws SQLException {
        return CanonicalGame.builder()
                .id(rs.getString("id"))
                .sport(rs.getString("sport"))
                .homeTeam(rs.getString("home_team"))
                .awayTeam(rs.getString("away_team"))
                .scheduledAt(SqlExecutor.instant(rs, "scheduled_at"))
                .gameDay(rs.getObject("game_day", LocalDate.class))
                .primarySource(rs.getString("primary_source"))
                .createdAt(SqlExecutor.instant(rs, "created_at"))
                .updatedAt(SqlExecutor.instant(rs, "updated_at"))
                .build();
    }

    private static CanonicalPlayer player(ResultSet rs) throws SQLException {
        return CanonicalPlayer.builder()
                .id(rs.getString("id"))
                .sport(rs.getString("sport"))
                .canonicalName(rs.getString("canonical_name"))
                .normalizedName(rs.getString("normalized_name"))
                .suffix(rs.getString("suffix"))
                .team(rs.getString("team"))
                .position(rs.getString("position"))
                .primarySource(rs.getString("primary_source"))
                .createdAt(SqlExecutor.instant(rs, "created_at"))
                .updatedAt(SqlExecutor.instant(rs, "updated_at"))
                .build();
    }

    private static SourceMapping mapping(ResultSet rs, EntityKind kind) throws SQLException {
        return new SourceMapping(
                rs.getString("id"),
                kind,
                rs.getString("sport"),
                rs.getString("source"),
                rs.getString("source_id"),
                rs.getString("canonical_id"),
                rs.getDouble("confidence"),
                MatchMethod.valueOf(rs.getString("method")),
                MappingStatus.valueOf(rs.getString("status")),
                SqlExecutor.instant(rs, "created_at"),
                SqlExecutor.instant(rs, "updated_at"));
    }

    private static PlayerAlias alias(ResultSet rs) throws SQLException {
        return new PlayerAlias(
                rs.getString("id"),
                rs.getString("player_id"),
                rs.getString("sport"),
                rs.getString("alias_name"),
                rs.getString("alias_key"),
                rs.getString("alias_source"),
                rs.getDouble("confidence"),
                rs.getBoolean("is_verified"),
                SqlExecutor.instant(rs, "created_at"));
    }

    private static Prediction prediction(ResultSet rs) throws SQLException {
        return new Prediction(rs.getString("id"), rs.getString("game_id"), rs.getString("player_id"),
                rs.getString("market"), SqlExecutor.instant(rs, "created_at"));
    }

    private static StatLine statLine(ResultSet rs) throws SQLException {
        return new StatLine(rs.getString("id"), rs.getString("player_id"), rs.getString("game_id"),
                rs.getString("stat_type"), rs.getDouble("stat_value"));
    }
}
