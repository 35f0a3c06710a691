package com.sportsync.resolution.ingest;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.store.ConflictException;
import com.sportsync.resolution.store.JsonCodec;
import com.sportsync.resolution.store.SqlExecutor;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceRecordRepository} over the {@code source_records} table; fields are stored as JSON.
 */
public class JdbcSourceRecordRepository implements SourceRecordRepository {

    private static final String COLUMNS = "id, entity_kind, sport, source, source_id, fields, ingested_at";

    private final SqlExecutor sql;
    private final JsonCodec json;

    public JdbcSourceRecordRepository(SqlExecutor sql, JsonCodec json) {
        this.sql = sql;
        this.json = json;
    }

    @Override
    public SourceRecord append(SourceRecord record) {
        try {
            sql.update("INSERT INTO source_records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                    record.id(), record.kind(), record.sport(), record.source(), record.sourceId(),
                    json.write(record.fields()), record.ingestedAt());
            return record;
        } catch (ConflictException e) {
            // same record appended twice, e.g. a resync of a stored record
            return findById(record.id()).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<SourceRecord> findById(String id) {
        return sql.queryOne("SELECT " + COLUMNS + " FROM source_records WHERE id = ?", this::map, id);
    }

    @Override
    public List<SourceRecord> findBySourceId(String source, String sourceId) {
        return sql.query("SELECT " + COLUMNS + " FROM source_records WHERE source = ? AND source_id = ?"
                + " ORDER BY ingested_at", this::map, source, sourceId);
    }

    @Override
    public long count() {
        return sql.queryOne("SELECT COUNT(*) AS n FROM source_records", rs -> rs.getLong("n")).orElse(0L);
    }

    private SourceRecord map(ResultSet rs) throws SQLException {
        return new SourceRecord(
                rs.getString("id"),
                EntityKind.valueOf(rs.getString("entity_kind")),
                rs.getString("sport"),
                rs.getString("source"),
                rs.getString("source_id"),
                json.readMap(rs.getString("fields")),
                SqlExecutor.instant(rs, "ingested_at"));
    }
}
