package com.sportsync.resolution.cdi;

import com.sportsync.resolution.api.IdentityResolutionEngine;
import com.sportsync.resolution.api.MatchingOptions;
import com.sportsync.resolution.cache.CacheConfig;
import com.sportsync.resolution.core.model.SourceProfile;
import com.sportsync.resolution.metrics.MicrometerMetricsService;
import com.sportsync.resolution.review.ReviewService;
import com.sportsync.resolution.sync.SyncOptions;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the identity resolution engine from MicroProfile Config properties.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}. An empty
 * {@code sports-identity.store.jdbc-url} keeps every store in memory. When the container offers a
 * {@link MeterRegistry} bean, metrics are recorded through it.</p>
 *
 * <h2>Source profiles</h2>
 * <p>{@code sports-identity.sources} is a list of {@code name:authority[:cross-timezone][:creates-players]}:</p>
 * <pre>
 * sports-identity.sources=stats_api:100:creates-players,odds_api:50:cross-timezone
 * </pre>
 */
@ApplicationScoped
public class SportsIdentityProducer {

    private static final Logger log = LoggerFactory.getLogger(SportsIdentityProducer.class);

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sports-identity.matching.auto-accept-threshold", defaultValue = "0.85")
    double autoAcceptThreshold;

    @Inject
    @ConfigProperty(name = "sports-identity.matching.review-threshold", defaultValue = "0.70")
    double reviewThreshold;

    @Inject
    @ConfigProperty(name = "sports-identity.matching.time-tolerance-minutes", defaultValue = "120")
    long timeToleranceMinutes;

    @Inject
    @ConfigProperty(name = "sports-identity.matching.cross-timezone-tolerance-minutes", defaultValue = "360")
    long crossTimezoneToleranceMinutes;

    @Inject
    @ConfigProperty(name = "sports-identity.matching.system-actor", defaultValue = "SYSTEM")
    String systemActor;

    @Inject
    @ConfigProperty(name = "sports-identity.sources")
    Optional<List<String>> sources;

    @Inject
    @ConfigProperty(name = "sports-identity.teams.sports", defaultValue = "nba")
    List<String> teamSports;

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sports-identity.store.jdbc-url", defaultValue = "")
    String jdbcUrl;

    @Inject
    @ConfigProperty(name = "sports-identity.store.username")
    Optional<String> jdbcUsername;

    @Inject
    @ConfigProperty(name = "sports-identity.store.password")
    Optional<String> jdbcPassword;

    @Inject
    @ConfigProperty(name = "sports-identity.store.initialize-schema", defaultValue = "true")
    boolean initializeSchema;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sports-identity.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "sports-identity.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "sports-identity.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Sync ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sports-identity.sync.retry-max-attempts", defaultValue = "3")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "sports-identity.sync.initial-backoff-millis", defaultValue = "500")
    long initialBackoffMillis;

    @Inject
    @ConfigProperty(name = "sports-identity.sync.backoff-multiplier", defaultValue = "2.0")
    double backoffMultiplier;

    @Inject
    @ConfigProperty(name = "sports-identity.sync.timeout-seconds", defaultValue = "300")
    long syncTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "sports-identity.sync.scheduler-threads", defaultValue = "2")
    int schedulerThreads;

    @Inject
    @ConfigProperty(name = "sports-identity.sync.cancel-grace-seconds", defaultValue = "5")
    long cancelGraceSeconds;

    // ── Reconciliation and health ─────────────────────────────

    @Inject
    @ConfigProperty(name = "sports-identity.reconciliation.interval-minutes", defaultValue = "15")
    long reconciliationIntervalMinutes;

    @Inject
    @ConfigProperty(name = "sports-identity.review.max-backlog", defaultValue = "500")
    long maxReviewBacklog;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public IdentityResolutionEngine identityResolutionEngine() {
        MatchingOptions.Builder matching = MatchingOptions.builder()
                .autoAcceptThreshold(autoAcceptThreshold)
                .reviewThreshold(reviewThreshold)
                .timeTolerance(Duration.ofMinutes(timeToleranceMinutes))
                .crossTimezoneTolerance(Duration.ofMinutes(crossTimezoneToleranceMinutes))
                .systemActor(systemActor);
        sources.ifPresent(entries -> entries.forEach(entry -> matching.source(parseSource(entry))));

        SyncOptions syncOptions = SyncOptions.builder()
                .retryMaxAttempts(retryMaxAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMillis))
                .backoffMultiplier(backoffMultiplier)
                .defaultTimeout(Duration.ofSeconds(syncTimeoutSeconds))
                .cancelGrace(Duration.ofSeconds(cancelGraceSeconds))
                .schedulerThreads(schedulerThreads)
                .build();

        IdentityResolutionEngine.Builder builder = IdentityResolutionEngine.builder()
                .matchingOptions(matching.build())
                .syncOptions(syncOptions)
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled())
                .teamSports(teamSports.toArray(new String[0]))
                .maxReviewBacklog(maxReviewBacklog)
                .reconciliationInterval(Duration.ofMinutes(reconciliationIntervalMinutes));

        if (jdbcUrl != null && !jdbcUrl.isBlank()) {
            PGSimpleDataSource dataSource = new PGSimpleDataSource();
            dataSource.setUrl(jdbcUrl);
            jdbcUsername.ifPresent(dataSource::setUser);
            jdbcPassword.ifPresent(dataSource::setPassword);
            builder.dataSource(dataSource).initializeSchema(initializeSchema);
        }
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
        }

        log.info("engine.producing store={} cache={} sources={}",
                jdbcUrl == null || jdbcUrl.isBlank() ? "memory" : "jdbc", cacheEnabled,
                sources.map(List::size).orElse(0));
        return builder.build();
    }

    public void closeEngine(@Disposes IdentityResolutionEngine engine) {
        log.info("engine.disposing");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(IdentityResolutionEngine engine) {
        return engine.getReviewService();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    static SourceProfile parseSource(String entry) {
        String[] parts = entry.trim().split(":");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Source entry must be name:authority[:flags], got '" + entry + "'");
        }
        int authority;
        try {
            authority = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Source authority is not a number in '" + entry + "'", e);
        }
        boolean crossTimezone = false;
        boolean createsPlayers = false;
        for (int i = 2; i < parts.length; i++) {
            String flag = parts[i].trim().toLowerCase(Locale.ROOT);
            if (flag.equals("cross-timezone")) {
                crossTimezone = true;
            } else if (flag.equals("creates-players")) {
                createsPlayers = true;
            } else {
                throw new IllegalArgumentException("Unknown source flag '" + flag + "' in '" + entry + "'");
            }
        }
        return new SourceProfile(parts[0].trim(), authority, crossTimezone, createsPlayers);
    }
}
