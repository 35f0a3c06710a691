package com.sportsync.resolution.api;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.PlayerContext;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.health.HealthStatus;
import com.sportsync.resolution.metrics.MicrometerMetricsService;
import com.sportsync.resolution.reconcile.ReconciliationReport;
import com.sportsync.resolution.review.ReviewItem;
import com.sportsync.resolution.support.H2Database;
import com.sportsync.resolution.support.TestFixtures;
import com.sportsync.resolution.sync.SourceAdapter;
import com.sportsync.resolution.sync.SyncJobDefinition;
import com.sportsync.resolution.sync.SyncOutcome;
import com.sportsync.resolution.sync.SyncRunResult;
import com.sportsync.resolution.sync.SyncStatusReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.sportsync.resolution.support.TestFixtures.ESPN;
import static com.sportsync.resolution.support.TestFixtures.ODDS;
import static com.sportsync.resolution.support.TestFixtures.SPORT;
import static com.sportsync.resolution.support.TestFixtures.STATS;
import static com.sportsync.resolution.support.TestFixtures.game;
import static com.sportsync.resolution.support.TestFixtures.player;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityResolutionEngine")
class IdentityResolutionEngineTest {

    private SimpleMeterRegistry registry;
    private IdentityResolutionEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = IdentityResolutionEngine.builder()
                .matchingOptions(TestFixtures.options())
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Nested
    @DisplayName("Lookup by source id")
    class Lookup {

        @Test
        @DisplayName("Every linked source id resolves to the same canonical game")
        void linkedIdsResolve() {
            ResolutionResult stats = engine.resolveGame(
                    game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls", "2026-01-27T19:00:00Z"));
            engine.resolveGame(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));

            assertEquals(stats.canonicalId(),
                    engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401").orElseThrow());
            assertEquals(stats.canonicalId(),
                    engine.lookupBySourceId(SPORT, EntityKind.GAME, STATS, "evt-1").orElseThrow());
            assertTrue(engine.lookupBySourceId(SPORT, EntityKind.GAME, ODDS, "evt-1").isEmpty());
        }

        @Test
        @DisplayName("Repeated lookups are served from the cache")
        void cached() {
            engine.resolveGame(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));

            engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401");
            engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401");

            assertEquals(1.0, registry.get("sports.cache.hit").counter().count());
            assertEquals(1.0, registry.get("sports.cache.miss").counter().count());
            assertEquals(1, engine.getCache().getStats().hits());
        }

        @Test
        @DisplayName("Records waiting for review have no canonical id")
        void reviewNotVisible() {
            engine.resolveGame(game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z"));

            assertTrue(engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "402").isEmpty());
        }

        @Test
        @DisplayName("After a merge the loser's source ids resolve to the survivor")
        void followsMerges() {
            CanonicalGame survivor = createGame(STATS, "evt-1", "2026-01-28T04:00:00Z");
            CanonicalGame loser = createGame(ESPN, "401", "2026-01-28T05:30:00Z");
            assertEquals(loser.id(), engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401").orElseThrow());

            ReconciliationReport report = engine.reconcileNow();

            assertEquals(1, report.merged());
            assertEquals(survivor.id(), engine.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401").orElseThrow());
            assertEquals(1.0, registry.get("sports.entity.merged").tag("kind", "game").counter().count());
        }
    }

    @Nested
    @DisplayName("Review")
    class Review {

        @Test
        @DisplayName("Pending items can be listed and approved")
        void approve() {
            ResolutionResult queued = engine.resolveGame(
                    game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z"));
            ResolutionResult created = engine.resolvePlayer(player(STATS, "201939", "Stephen Curry", "GSW"), null);
            ResolutionResult nickname = engine.resolvePlayer(player(ESPN, "3975", "Steph Curry", "GSW"),
                    PlayerContext.empty());

            Page<ReviewItem> pending = engine.listPending(PageRequest.of(0, 10));
            assertEquals(2, pending.totalElements());

            ResolutionResult approved = engine.approve(nickname.reviewItemId(), created.canonicalId(), "alice");

            assertEquals(MatchMethod.MANUAL, approved.method());
            assertEquals(created.canonicalId(),
                    engine.lookupBySourceId(SPORT, EntityKind.PLAYER, ESPN, "3975").orElseThrow());
            assertEquals(1, engine.getReviewService().countPending());
            assertTrue(engine.getReviewService().get(queued.reviewItemId()).isPending());
        }

        @Test
        @DisplayName("Rejected records count as unmatched in the sync status")
        void rejectCountsUnmatched() {
            ResolutionResult queued = engine.resolveGame(
                    game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z"));
            engine.resolveGame(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls", "2026-01-28T00:30:00Z"));
            engine.resolveGame(game(ODDS, "odds-77", "Los Angeles Lakerz", "Chicago Bulls", "2026-01-28T00:30:00Z"));

            engine.reject(queued.reviewItemId(), "alice", "exhibition game");
            SyncStatusReport status = engine.syncStatus();

            assertEquals(0, status.pendingReviews());
            assertEquals(1, status.unmatchedMappings());
            assertEquals(1, status.lowConfidenceMappings());
            assertEquals(SyncStatusReport.Health.HEALTHY, status.health());
        }
    }

    @Test
    @DisplayName("A registered sync job stores and resolves what its adapter returns")
    void syncJob() {
        engine.orchestrator().register(SyncJobDefinition.games(ESPN), new SourceAdapter() {
            @Override
            public String source() {
                return ESPN;
            }

            @Override
            public List<SourceRecord> fetch(String dataType) {
                return List.of(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"),
                        game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z"));
            }
        });

        SyncRunResult run = engine.runNow(ESPN, SyncJobDefinition.GAMES);

        assertEquals(SyncOutcome.PARTIAL, run.outcome());
        assertEquals(1, run.matched());
        assertEquals(1, run.queued());
        assertEquals(2, engine.getSourceRecords().count());
        assertEquals(1.0, registry.get("sports.sync.run").tag("outcome", "partial").timer().count());
        HealthStatus health = engine.health();
        assertTrue(health.isDown());
        assertTrue(health.message().startsWith("syncJobs"));
    }

    @Test
    @DisplayName("A JDBC-backed engine applies the schema and reports database health")
    void jdbcEngine() {
        try (IdentityResolutionEngine jdbc = IdentityResolutionEngine.builder()
                .dataSource(H2Database.newDataSource())
                .matchingOptions(TestFixtures.options())
                .build()) {
            ResolutionResult created = jdbc.resolveGame(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));
            ResolutionResult replay = jdbc.resync(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));

            assertEquals(created.canonicalId(), replay.canonicalId());
            assertEquals(MatchMethod.EXACT_ID, replay.method());
            HealthStatus health = jdbc.health();
            assertTrue(health.isUp());
            assertTrue(health.details().containsKey("database"));
        }
    }

    @Test
    @DisplayName("On JDBC an oversized source id fails its record and the rest of the run carries on")
    void jdbcOversizedRecord() {
        try (IdentityResolutionEngine jdbc = IdentityResolutionEngine.builder()
                .dataSource(H2Database.newDataSource())
                .matchingOptions(TestFixtures.options())
                .build()) {
            jdbc.orchestrator().register(SyncJobDefinition.games(ESPN), new SourceAdapter() {
                @Override
                public String source() {
                    return ESPN;
                }

                @Override
                public List<SourceRecord> fetch(String dataType) {
                    return List.of(game(ESPN, "9".repeat(300), "BOS", "NYK", "2026-01-27T19:04:00Z"),
                            game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));
                }
            });

            SyncRunResult run = jdbc.runNow(ESPN, SyncJobDefinition.GAMES);

            assertEquals(SyncOutcome.PARTIAL, run.outcome());
            assertEquals(2, run.processed());
            assertEquals(1, run.matched());
            assertEquals(1, run.failed());
            assertNull(run.errorMessage());
            assertTrue(jdbc.lookupBySourceId(SPORT, EntityKind.GAME, ESPN, "401").isPresent());
        }
    }

    @Test
    @DisplayName("The builder rejects a non-positive reconciliation interval")
    void builderValidation() {
        assertThrows(IllegalStateException.class,
                () -> IdentityResolutionEngine.builder().reconciliationInterval(Duration.ZERO).build());
        assertThrows(IllegalStateException.class,
                () -> IdentityResolutionEngine.builder().matchingOptions(null).build());
    }

    private CanonicalGame createGame(String source, String sourceId, String scheduledAt) {
        Instant at = Instant.parse(scheduledAt);
        CanonicalGame game = CanonicalGame.builder()
                .sport(SPORT)
                .homeTeam("LAL")
                .awayTeam("CHI")
                .scheduledAt(at)
                .gameDay(engine.getOptions().gameDay(SPORT, at))
                .primarySource(source)
                .build();
        return engine.getStore().createGame(game, SourceMapping.matched(EntityKind.GAME, SPORT, source, sourceId,
                game.id(), 1.0, MatchMethod.CREATED));
    }
}
