package com.sportsync.resolution.sync;

import com.sportsync.resolution.store.ConflictException;
import com.sportsync.resolution.store.SqlExecutor;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyncMetadataRepository} over the {@code sync_metadata} table.
 */
public class JdbcSyncMetadataRepository implements SyncMetadataRepository {

    private static final String COLUMNS = "id, source, data_type, state, last_outcome, last_sync_started_at,"
            + " last_sync_completed_at, records_processed, records_matched, records_queued, records_failed,"
            + " error_message, sync_duration_ms, updated_at";

    private final SqlExecutor sql;

    public JdbcSyncMetadataRepository(SqlExecutor sql) {
        this.sql = sql;
    }

    @Override
    public Optional<SyncMetadata> find(String source, String dataType) {
        return sql.queryOne("SELECT " + COLUMNS + " FROM sync_metadata WHERE source = ? AND data_type = ?",
                this::map, source, dataType);
    }

    @Override
    public SyncMetadata save(SyncMetadata m) {
        if (update(m) > 0) {
            return m;
        }
        try {
            sql.update("INSERT INTO sync_metadata (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    m.id(), m.source(), m.dataType(), m.state(), m.lastOutcome(), m.lastSyncStartedAt(),
                    m.lastSyncCompletedAt(), m.recordsProcessed(), m.recordsMatched(), m.recordsQueued(),
                    m.recordsFailed(), truncate(m.errorMessage()), millis(m.duration()), m.updatedAt());
        } catch (ConflictException e) {
            // another process inserted the row between our update and insert
            if (update(m) == 0) {
                throw e;
            }
        }
        return m;
    }

    @Override
    public List<SyncMetadata> findAll() {
        return sql.query("SELECT " + COLUMNS + " FROM sync_metadata ORDER BY source, data_type", this::map);
    }

    private int update(SyncMetadata m) {
        return sql.update("UPDATE sync_metadata SET state = ?, last_outcome = ?, last_sync_started_at = ?,"
                        + " last_sync_completed_at = ?, records_processed = ?, records_matched = ?, records_queued = ?,"
                        + " records_failed = ?, error_message = ?, sync_duration_ms = ?, updated_at = ?"
                        + " WHERE source = ? AND data_type = ?",
                m.state(), m.lastOutcome(), m.lastSyncStartedAt(), m.lastSyncCompletedAt(), m.recordsProcessed(),
                m.recordsMatched(), m.recordsQueued(), m.recordsFailed(), truncate(m.errorMessage()),
                millis(m.duration()), m.updatedAt(), m.source(), m.dataType());
    }

    private static Long millis(Duration duration) {
        return duration != null ? duration.toMillis() : null;
    }

    private static String truncate(String message) {
        return message != null && message.length() > 2000 ? message.substring(0, 2000) : message;
    }

    private SyncMetadata map(ResultSet rs) throws SQLException {
        String outcome = rs.getString("last_outcome");
        long durationMs = rs.getLong("sync_duration_ms");
        Duration duration = rs.wasNull() ? null : Duration.ofMillis(durationMs);
        return new SyncMetadata(
                rs.getString("id"),
                rs.getString("source"),
                rs.getString("data_type"),
                SyncState.valueOf(rs.getString("state")),
                outcome != null ? SyncOutcome.valueOf(outcome) : null,
                SqlExecutor.instant(rs, "last_sync_started_at"),
                SqlExecutor.instant(rs, "last_sync_completed_at"),
                rs.getInt("records_processed"),
                rs.getInt("records_matched"),
                rs.getInt("records_queued"),
                rs.getInt("records_failed"),
                rs.getString("error_message"),
                duration,
                SqlExecutor.instant(rs, "updated_at"));
    }
}
