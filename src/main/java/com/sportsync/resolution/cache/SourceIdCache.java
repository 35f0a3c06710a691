package com.sportsync.resolution.cache;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.Optional;

/**
 * Cache for {@code lookup_by_source_id}: (kind, sport, source, source id) to canonical id.
 * Only matched mappings are cached.
 */
public interface SourceIdCache {

    Optional<String> get(EntityKind kind, String sport, String source, String sourceId);

    void put(EntityKind kind, String sport, String source, String sourceId, String canonicalId);

    /**
     * Drops every entry that points at the given canonical id.
     */
    void invalidate(String canonicalId);

    void invalidateAll();

    SourceIdCacheStats getStats();
}
