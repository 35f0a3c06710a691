package com.sportsync.resolution.api;

import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.audit.AuditRepository;
import com.sportsync.resolution.audit.InMemoryAuditRepository;
import com.sportsync.resolution.audit.JdbcAuditRepository;
import com.sportsync.resolution.cache.CacheConfig;
import com.sportsync.resolution.cache.CaffeineSourceIdCache;
import com.sportsync.resolution.cache.MergeListener;
import com.sportsync.resolution.cache.NoOpSourceIdCache;
import com.sportsync.resolution.cache.SourceIdCache;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.PlayerContext;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.health.DataSourceHealthCheck;
import com.sportsync.resolution.health.HealthCheckRegistry;
import com.sportsync.resolution.health.HealthStatus;
import com.sportsync.resolution.health.ReviewBacklogHealthCheck;
import com.sportsync.resolution.health.SyncJobsHealthCheck;
import com.sportsync.resolution.ingest.InMemorySourceRecordRepository;
import com.sportsync.resolution.ingest.JdbcSourceRecordRepository;
import com.sportsync.resolution.ingest.SourceRecordRepository;
import com.sportsync.resolution.matching.GameMatcher;
import com.sportsync.resolution.matching.PlayerResolver;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.metrics.NoOpMetricsService;
import com.sportsync.resolution.normalize.NameNormalizer;
import com.sportsync.resolution.reconcile.DuplicateDetector;
import com.sportsync.resolution.reconcile.ReconciliationJob;
import com.sportsync.resolution.reconcile.ReconciliationReport;
import com.sportsync.resolution.reconcile.SurvivorSelector;
import com.sportsync.resolution.review.InMemoryReviewQueue;
import com.sportsync.resolution.review.JdbcReviewQueue;
import com.sportsync.resolution.review.ReviewItem;
import com.sportsync.resolution.review.ReviewQueue;
import com.sportsync.resolution.review.ReviewService;
import com.sportsync.resolution.similarity.NameSimilarity;
import com.sportsync.resolution.similarity.SimilarityWeights;
import com.sportsync.resolution.store.CanonicalStore;
import com.sportsync.resolution.store.InMemoryCanonicalStore;
import com.sportsync.resolution.store.JdbcCanonicalStore;
import com.sportsync.resolution.store.JsonCodec;
import com.sportsync.resolution.store.SchemaInitializer;
import com.sportsync.resolution.store.SqlExecutor;
import com.sportsync.resolution.sync.InMemorySyncMetadataRepository;
import com.sportsync.resolution.sync.JdbcSyncMetadataRepository;
import com.sportsync.resolution.sync.SyncJobDefinition;
import com.sportsync.resolution.sync.SyncMetadataRepository;
import com.sportsync.resolution.sync.SyncOptions;
import com.sportsync.resolution.sync.SyncOrchestrator;
import com.sportsync.resolution.sync.SyncRunResult;
import com.sportsync.resolution.sync.SyncStatusReport;
import com.sportsync.resolution.team.TeamMappingLoader;
import com.sportsync.resolution.team.TeamMappingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;

/**
 * Entry point of the library: resolves game and player records to canonical ids, runs the
 * sync jobs, and exposes review, reconciliation and status.
 *
 * <p>Without a {@link DataSource} every store is in memory; with one, every store is JDBC and the
 * schema is applied on build unless disabled.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (IdentityResolutionEngine engine = IdentityResolutionEngine.builder()
 *         .dataSource(dataSource)
 *         .matchingOptions(MatchingOptions.builder()
 *                 .source(new SourceProfile("stats_api", 100, false, true))
 *                 .build())
 *         .build()) {
 *
 *     engine.orchestrator().register(SyncJobDefinition.games("stats_api"), statsAdapter);
 *     engine.start();
 *
 *     ResolutionResult result = engine.resolveGame(record);
 *     Optional&lt;String&gt; id = engine.lookupBySourceId("nba", EntityKind.GAME, "odds_api", "evt-1");
 * }
 * </pre>
 */
public class IdentityResolutionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionEngine.class);

    private final MatchingOptions options;
    private final CanonicalStore store;
    private final SourceRecordRepository sourceRecords;
    private final AuditLogger auditLogger;
    private final ReviewService reviewService;
    private final GameMatcher gameMatcher;
    private final PlayerResolver playerResolver;
    private final ReconciliationJob reconciliationJob;
    private final SyncOrchestrator orchestrator;
    private final SourceIdCache cache;
    private final MetricsService metricsService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final Duration reconciliationInterval;

    private IdentityResolutionEngine(Builder builder) {
        this.options = builder.matchingOptions;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.reconciliationInterval = builder.reconciliationInterval;

        // Step 1: persistence
        JsonCodec json = new JsonCodec();
        AuditRepository auditRepository;
        ReviewQueue reviewQueue;
        SyncMetadataRepository syncMetadata;
        if (builder.dataSource != null) {
            SqlExecutor sql = new SqlExecutor(builder.dataSource);
            if (builder.initializeSchema) {
                new SchemaInitializer(sql).initialize();
            }
            this.store = new JdbcCanonicalStore(sql);
            this.sourceRecords = new JdbcSourceRecordRepository(sql, json);
            auditRepository = new JdbcAuditRepository(sql, json);
            reviewQueue = new JdbcReviewQueue(sql, json);
            syncMetadata = new JdbcSyncMetadataRepository(sql);
        } else {
            this.store = new InMemoryCanonicalStore();
            this.sourceRecords = new InMemorySourceRecordRepository();
            auditRepository = new InMemoryAuditRepository();
            reviewQueue = new InMemoryReviewQueue();
            syncMetadata = new InMemorySyncMetadataRepository();
        }

        // Step 2: shared services
        this.auditLogger = new AuditLogger(auditRepository);
        this.reviewService = new ReviewService(reviewQueue, auditLogger, metricsService);
        CacheConfig cacheConfig = builder.cacheConfig;
        this.cache = cacheConfig.enabled() ? new CaffeineSourceIdCache(cacheConfig) : new NoOpSourceIdCache();

        // Step 3: matchers, registered as review decision handlers
        NameNormalizer normalizer = builder.normalizer != null ? builder.normalizer : new NameNormalizer();
        TeamMappingRegistry teams = builder.teams != null
                ? builder.teams
                : new TeamMappingLoader().loadRegistry(builder.teamSports);
        this.gameMatcher = new GameMatcher(store, teams, normalizer,
                new NameSimilarity(SimilarityWeights.forTeamNames()), options, reviewService, auditLogger,
                metricsService);
        this.playerResolver = new PlayerResolver(store, teams, normalizer,
                new NameSimilarity(SimilarityWeights.forPlayerNames()), options, reviewService, auditLogger,
                metricsService);
        reviewService.registerHandler(EntityKind.GAME, gameMatcher);
        reviewService.registerHandler(EntityKind.PLAYER, playerResolver);

        // Step 4: reconciliation, with the cache listening for merges
        this.reconciliationJob = new ReconciliationJob(store, new DuplicateDetector(store, options),
                new SurvivorSelector(options), auditLogger, metricsService, options.getSystemActor());
        if (cache instanceof MergeListener) {
            reconciliationJob.addMergeListener((MergeListener) cache);
        }

        // Step 5: sync
        this.orchestrator = new SyncOrchestrator(this::resolveRecord, sourceRecords, syncMetadata,
                builder.syncOptions, metricsService);

        // Step 6: health
        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new SyncJobsHealthCheck(orchestrator));
        healthCheckRegistry.register(new ReviewBacklogHealthCheck(reviewQueue, builder.maxReviewBacklog));
        if (builder.dataSource != null) {
            healthCheckRegistry.register(new DataSourceHealthCheck(builder.dataSource));
        }

        log.info("engine.built store={} cache={} teams={}", store.getClass().getSimpleName(),
                cacheConfig.enabled(), teams.size());
    }

    // ── Resolution ────────────────────────────────────────────

    public ResolutionResult resolveGame(SourceRecord record) {
        return gameMatcher.resolve(record);
    }

    public ResolutionResult resolvePlayer(SourceRecord record, PlayerContext context) {
        return playerResolver.resolve(record, context != null ? context : PlayerContext.empty());
    }

    /**
     * Canonical id a source's id is mapped to, following merges. Only matched mappings count.
     */
    public Optional<String> lookupBySourceId(String sport, EntityKind kind, String source, String sourceId) {
        Optional<String> cached = cache.get(kind, sport, source, sourceId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();

        Optional<String> canonicalId = store.findMapping(kind, sport, source, sourceId)
                .filter(mapping -> mapping.status() == MappingStatus.MATCHED && mapping.canonicalId() != null)
                .map(mapping -> store.resolveSurvivor(kind, mapping.canonicalId()));
        canonicalId.ifPresent(id -> cache.put(kind, sport, source, sourceId, id));
        return canonicalId;
    }

    // ── Review ────────────────────────────────────────────────

    public Page<ReviewItem> listPending(PageRequest page) {
        return reviewService.listPending(page);
    }

    /**
     * Approves with the best candidate, or creates a new entity when the item has none.
     */
    public ResolutionResult approve(String itemId, String reviewer) {
        return reviewService.approve(itemId, reviewer, null);
    }

    /**
     * Approves with the given candidate; a null candidate creates a new entity.
     */
    public ResolutionResult approve(String itemId, String candidateId, String reviewer) {
        return reviewService.approve(itemId, candidateId, reviewer, null);
    }

    public void reject(String itemId, String reviewer, String notes) {
        reviewService.reject(itemId, reviewer, notes);
    }

    // ── Sync and reconciliation ───────────────────────────────

    public SyncOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Starts every registered sync job and the periodic reconciliation sweep.
     */
    public void start() {
        orchestrator.scheduleReconciliation(reconciliationJob, reconciliationInterval);
        orchestrator.start();
    }

    public SyncRunResult runNow(String source, String dataType) {
        return orchestrator.runNow(source, dataType);
    }

    public ResolutionResult resync(SourceRecord record) {
        return orchestrator.resync(record);
    }

    public ReconciliationReport reconcileNow() {
        return reconciliationJob.reconcile();
    }

    public SyncStatusReport syncStatus() {
        long unmatched = 0;
        long lowConfidence = 0;
        for (EntityKind kind : EntityKind.values()) {
            unmatched += store.findMappingsByStatus(kind, MappingStatus.FAILED).size();
            for (SourceMapping mapping : store.findMappingsByStatus(kind, MappingStatus.MATCHED)) {
                if (mapping.confidence() < options.getLowConfidenceThreshold()) {
                    lowConfidence++;
                }
            }
        }
        return orchestrator.statusReport(reviewService.countPending(), unmatched, lowConfidence);
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    // ── Accessors ─────────────────────────────────────────────

    public CanonicalStore getStore() {
        return store;
    }

    public SourceRecordRepository getSourceRecords() {
        return sourceRecords;
    }

    public AuditLogger getAuditLogger() {
        return auditLogger;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public SourceIdCache getCache() {
        return cache;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    @Override
    public void close() {
        orchestrator.close();
        log.info("engine.closed");
    }

    private ResolutionResult resolveRecord(SourceRecord record) {
        if (record.kind() == EntityKind.GAME) {
            return gameMatcher.resolve(record);
        }
        return playerResolver.resolve(record, PlayerContext.empty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DataSource dataSource;
        private boolean initializeSchema = true;
        private MatchingOptions matchingOptions = MatchingOptions.defaults();
        private SyncOptions syncOptions = SyncOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private NameNormalizer normalizer;
        private TeamMappingRegistry teams;
        private String[] teamSports = {"nba"};
        private long maxReviewBacklog = 500;
        private Duration reconciliationInterval = SyncJobDefinition.RECONCILIATION_INTERVAL;

        /**
         * Uses JDBC stores over this data source. The caller owns and closes it.
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Controls whether {@code db/schema.sql} is applied on build. Defaults to true.
         */
        public Builder initializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
            return this;
        }

        public Builder matchingOptions(MatchingOptions matchingOptions) {
            this.matchingOptions = matchingOptions;
            return this;
        }

        public Builder syncOptions(SyncOptions syncOptions) {
            this.syncOptions = syncOptions;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Uses a prebuilt team registry instead of the classpath seeds.
         */
        public Builder teams(TeamMappingRegistry teams) {
            this.teams = teams;
            return this;
        }

        /**
         * Sports whose {@code teams/<sport>.json} seeds are loaded. Defaults to nba.
         */
        public Builder teamSports(String... sports) {
            this.teamSports = sports.clone();
            return this;
        }

        public Builder maxReviewBacklog(long maxReviewBacklog) {
            this.maxReviewBacklog = maxReviewBacklog;
            return this;
        }

        public Builder reconciliationInterval(Duration reconciliationInterval) {
            this.reconciliationInterval = reconciliationInterval;
            return this;
        }

        public IdentityResolutionEngine build() {
            if (matchingOptions == null || syncOptions == null || cacheConfig == null) {
                throw new IllegalStateException("matchingOptions, syncOptions and cacheConfig are required");
            }
            if (reconciliationInterval == null || reconciliationInterval.isZero() || reconciliationInterval.isNegative()) {
                throw new IllegalStateException("reconciliationInterval must be positive");
            }
            return new IdentityResolutionEngine(this);
        }
    }
}
