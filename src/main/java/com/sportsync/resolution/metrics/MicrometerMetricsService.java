package com.sportsync.resolution.metrics;

import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.sync.SyncOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sports.resolution.duration}: Timer (tags: kind, status, method)</li>
 *   <li>{@code sports.entity.created}: Counter (tag: kind)</li>
 *   <li>{@code sports.entity.merged}: Counter (tag: kind)</li>
 *   <li>{@code sports.review.enqueued}: Counter (tag: kind)</li>
 *   <li>{@code sports.candidate.score}: DistributionSummary (tag: kind)</li>
 *   <li>{@code sports.sync.run}: Timer (tags: source, dataType, outcome)</li>
 *   <li>{@code sports.sync.records}: Counter (tags: source, dataType, outcome)</li>
 *   <li>{@code sports.cache.hit} / {@code sports.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("sports.cache.hit")
                .description("Source id lookups served from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("sports.cache.miss")
                .description("Source id lookups that went to the store")
                .register(registry);
    }

    @Override
    public void recordResolution(EntityKind kind, MappingStatus status, MatchMethod method, Duration duration) {
        String key = "resolution:" + kind + ":" + status + ":" + method;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("sports.resolution.duration")
                        .description("Duration of one resolve call")
                        .tag("kind", kind.wireName())
                        .tag("status", status.wireName())
                        .tag("method", method.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
        counter("sports.entity.created", "New canonical entities created", "kind", kind.wireName()).increment();
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
        counter("sports.entity.merged", "Duplicate canonical entities merged away", "kind", kind.wireName()).increment();
    }

    @Override
    public void incrementReviewEnqueued(EntityKind kind) {
        counter("sports.review.enqueued", "Records routed to manual review", "kind", kind.wireName()).increment();
    }

    @Override
    public void recordCandidateScore(EntityKind kind, double score) {
        DistributionSummary summary = summaryCache.computeIfAbsent(kind.wireName(), k ->
                DistributionSummary.builder("sports.candidate.score")
                        .description("Confidence of scored match candidates")
                        .tag("kind", k)
                        .register(registry));
        summary.record(score);
    }

    @Override
    public void recordSyncRun(String source, String dataType, SyncOutcome outcome, Duration duration) {
        String key = "sync:" + source + ":" + dataType + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("sports.sync.run")
                        .description("Duration of one sync job run")
                        .tag("source", source)
                        .tag("dataType", dataType)
                        .tag("outcome", outcome.wireName())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecords(String source, String dataType, String outcome, int count) {
        if (count <= 0) {
            return;
        }
        String key = "records:" + source + ":" + dataType + ":" + outcome;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("sports.sync.records")
                        .description("Records processed by sync runs")
                        .tag("source", source)
                        .tag("dataType", dataType)
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
