package com.sportsync.resolution.ingest;

import com.sportsync.resolution.core.model.SourceRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link SourceRecordRepository}. Appending an id twice keeps the first copy.
 */
public class InMemorySourceRecordRepository implements SourceRecordRepository {

    private final ConcurrentMap<String, SourceRecord> records = new ConcurrentHashMap<>();

    @Override
    public SourceRecord append(SourceRecord record) {
        SourceRecord existing = records.putIfAbsent(record.id(), record);
        return existing != null ? existing : record;
    }

    @Override
    public Optional<SourceRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<SourceRecord> findBySourceId(String source, String sourceId) {
        return records.values().stream()
                .filter(r -> Objects.equals(source, r.source()) && Objects.equals(sourceId, r.sourceId()))
                .sorted(Comparator.comparing(SourceRecord::ingestedAt))
                .toList();
    }

    @Override
    public long count() {
        return records.size();
    }
}
