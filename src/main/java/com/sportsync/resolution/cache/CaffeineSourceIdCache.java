package com.sportsync.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.sportsync.resolution.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed source id cache.
 * Implements {@link MergeListener} so entries pointing at a merged-away entity are dropped.
 * Invalidation scans the live entries, so it never depends on removal notifications
 * that Caffeine delivers asynchronously after expiry.
 */
public class CaffeineSourceIdCache implements SourceIdCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSourceIdCache.class);

    private final Cache<CacheKey, String> cache;
    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong invalidatedEntries = new AtomicLong();
    private final AtomicLong mergesApplied = new AtomicLong();

    public CaffeineSourceIdCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineSourceIdCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(EntityKind kind, String sport, String source, String sourceId) {
        lookups.incrementAndGet();
        String canonicalId = cache.getIfPresent(new CacheKey(kind, sport, source, sourceId));
        if (canonicalId != null) {
            hits.incrementAndGet();
        }
        return Optional.ofNullable(canonicalId);
    }

    @Override
    public void put(EntityKind kind, String sport, String source, String sourceId, String canonicalId) {
        cache.put(new CacheKey(kind, sport, source, sourceId), canonicalId);
    }

    @Override
    public void invalidate(String canonicalId) {
        int dropped = 0;
        for (Iterator<String> values = cache.asMap().values().iterator(); values.hasNext(); ) {
            if (canonicalId.equals(values.next())) {
                values.remove();
                dropped++;
            }
        }
        if (dropped > 0) {
            invalidatedEntries.addAndGet(dropped);
            log.debug("cache.invalidated canonicalId={} entries={}", canonicalId, dropped);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Runs Caffeine's pending maintenance, including expiry notifications.
     */
    void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public SourceIdCacheStats getStats() {
        return new SourceIdCacheStats(lookups.get(), hits.get(), invalidatedEntries.get(), mergesApplied.get(),
                cache.estimatedSize());
    }

    @Override
    public void onMerge(EntityKind kind, String loserId, String survivorId) {
        invalidate(loserId);
        mergesApplied.incrementAndGet();
        log.debug("cache.merge kind={} loserId={} survivorId={}", kind, loserId, survivorId);
    }

    record CacheKey(EntityKind kind, String sport, String source, String sourceId) {
    }
}
