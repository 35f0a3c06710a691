package com.sportsync.resolution.cache;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Used when caching is disabled. Every lookup is a miss.
 */
public class NoOpSourceIdCache implements SourceIdCache {

    private final AtomicLong lookups = new AtomicLong();

    @Override
    public Optional<String> get(EntityKind kind, String sport, String source, String sourceId) {
        lookups.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public void put(EntityKind kind, String sport, String source, String sourceId, String canonicalId) {
        // no-op
    }

    @Override
    public void invalidate(String canonicalId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public SourceIdCacheStats getStats() {
        return new SourceIdCacheStats(lookups.get(), 0, 0, 0, 0);
    }
}
