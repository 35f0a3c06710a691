package com.sportsync.resolution.ingest;

import com.sportsync.resolution.core.model.SourceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of raw records as ingested by sync runs.
 * Records are never mutated; audit match details point back to them by id.
 */
public interface SourceRecordRepository {

    SourceRecord append(SourceRecord record);

    Optional<SourceRecord> findById(String id);

    /**
     * Every stored copy of one source's record, oldest first.
     */
    List<SourceRecord> findBySourceId(String source, String sourceId);

    long count();
}
