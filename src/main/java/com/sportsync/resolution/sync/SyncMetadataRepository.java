package com.sportsync.resolution.sync;

import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link SyncMetadata}, unique per (source, data type).
 */
public interface SyncMetadataRepository {

    Optional<SyncMetadata> find(String source, String dataType);

    /**
     * Inserts the row for its (source, data type), or replaces the existing one.
     */
    SyncMetadata save(SyncMetadata metadata);

    /**
     * All rows, ordered by source then data type.
     */
    List<SyncMetadata> findAll();
}
