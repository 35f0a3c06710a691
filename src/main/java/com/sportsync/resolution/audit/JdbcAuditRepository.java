package com.sportsync.resolution.audit;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.store.JsonCodec;
import com.sportsync.resolution.store.SqlExecutor;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link AuditRepository} over the insert-only {@code audit_log} table.
 * State snapshots and match details are stored as JSON text.
 */
public class JdbcAuditRepository implements AuditRepository {

    private static final String COLUMNS =
            "id, action, entity_kind, entity_id, actor_id, previous_state, new_state, match_details, created_at";
    private static final String SELECT = "SELECT " + COLUMNS + " FROM audit_log";

    private final SqlExecutor sql;
    private final JsonCodec json;

    public JdbcAuditRepository(SqlExecutor sql, JsonCodec json) {
        this.sql = sql;
        this.json = json;
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        sql.update("INSERT INTO audit_log (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.id(), entry.action(), entry.entityKind(), entry.entityId(), entry.actorId(),
                json.write(entry.previousState()), json.write(entry.newState()), json.write(entry.matchDetails()),
                entry.timestamp());
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return sql.query(SELECT + " ORDER BY created_at, id", this::map);
    }

    @Override
    public List<AuditEntry> findByEntityId(String entityId) {
        return sql.query(SELECT + " WHERE entity_id = ? ORDER BY created_at, id", this::map, entityId);
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return sql.query(SELECT + " WHERE action = ? ORDER BY created_at, id", this::map, action);
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return sql.query(SELECT + " WHERE created_at >= ? AND created_at <= ? ORDER BY created_at, id",
                this::map, start, end);
    }

    @Override
    public int count() {
        return sql.queryOne("SELECT COUNT(*) AS n FROM audit_log", rs -> rs.getInt("n")).orElse(0);
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> newestFirst = sql.query(SELECT + " ORDER BY created_at DESC, id DESC LIMIT ?",
                this::map, limit);
        List<AuditEntry> result = new ArrayList<>(newestFirst);
        Collections.reverse(result);
        return result;
    }

    private AuditEntry map(ResultSet rs) throws SQLException {
        String kind = rs.getString("entity_kind");
        return AuditEntry.builder()
                .id(rs.getString("id"))
                .action(AuditAction.valueOf(rs.getString("action")))
                .entityKind(kind != null ? EntityKind.valueOf(kind) : null)
                .entityId(rs.getString("entity_id"))
                .actorId(rs.getString("actor_id"))
                .previousState(json.readMap(rs.getString("previous_state")))
                .newState(json.readMap(rs.getString("new_state")))
                .matchDetails(json.readMap(rs.getString("match_details")))
                .timestamp(SqlExecutor.instant(rs, "created_at"))
                .build();
    }
}
