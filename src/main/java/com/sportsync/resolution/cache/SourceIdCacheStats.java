package com.sportsync.resolution.cache;

/**
 * Counters for the source id lookup cache.
 *
 * @param lookups             calls to {@link SourceIdCache#get}
 * @param hits                lookups answered from the cache
 * @param invalidatedEntries  entries dropped because their canonical id was invalidated or merged away
 * @param mergesApplied       merge events the cache has applied
 * @param entries             approximate number of cached source ids
 */
public record SourceIdCacheStats(long lookups, long hits, long invalidatedEntries, long mergesApplied,
                                 long entries) {

    public SourceIdCacheStats {
        if (hits > lookups) {
            throw new IllegalArgumentException("hits (" + hits + ") exceed lookups (" + lookups + ")");
        }
    }

    public long misses() {
        return lookups - hits;
    }

    /**
     * Share of lookups served without touching the store; 0.0 before the first lookup.
     */
    public double hitRate() {
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
