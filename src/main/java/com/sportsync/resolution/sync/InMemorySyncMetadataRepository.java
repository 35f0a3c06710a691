package com.sportsync.resolution.sync;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SyncMetadataRepository}.
 */
public class InMemorySyncMetadataRepository implements SyncMetadataRepository {

    private final ConcurrentMap<String, SyncMetadata> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncMetadata> find(String source, String dataType) {
        return Optional.ofNullable(rows.get(SyncMetadata.jobKey(source, dataType)));
    }

    @Override
    public SyncMetadata save(SyncMetadata metadata) {
        rows.put(metadata.jobKey(), metadata);
        return metadata;
    }

    @Override
    public List<SyncMetadata> findAll() {
        return rows.values().stream()
                .sorted(Comparator.comparing(SyncMetadata::source).thenComparing(SyncMetadata::dataType))
                .toList();
    }
}
