package com.sportsync.resolution.sync;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.ingest.InMemorySourceRecordRepository;
import com.sportsync.resolution.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sportsync.resolution.support.TestFixtures.ESPN;
import static com.sportsync.resolution.support.TestFixtures.STATS;
import static com.sportsync.resolution.support.TestFixtures.game;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyncOrchestrator")
class SyncOrchestratorTest {

    private InMemorySourceRecordRepository records;
    private InMemorySyncMetadataRepository metadata;
    private AtomicInteger resolved;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        records = new InMemorySourceRecordRepository();
        metadata = new InMemorySyncMetadataRepository();
        resolved = new AtomicInteger();
        RecordResolver resolver = record -> {
            resolved.incrementAndGet();
            return ResolutionResult.matched("g-" + record.sourceId(), 1.0, MatchMethod.EXACT_ID);
        };
        SyncOptions options = SyncOptions.builder().initialBackoff(Duration.ofMillis(10)).build();
        orchestrator = new SyncOrchestrator(resolver, records, metadata, options, new NoOpMetricsService());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    @DisplayName("An adapter can only serve jobs of its own source")
    void adapterSourceMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(STATS)));
    }

    @Test
    @DisplayName("A job key can be registered once")
    void duplicateRegistration() {
        orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(ESPN));

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(ESPN)));
        assertEquals(1, orchestrator.jobs().size());
    }

    @Test
    @DisplayName("runNow runs the job on the calling thread")
    void runNow() {
        orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(ESPN, "401", "402"));

        SyncRunResult result = orchestrator.runNow(ESPN, SyncJobDefinition.GAMES);

        assertEquals(SyncOutcome.SUCCESS, result.outcome());
        assertEquals(2, result.matched());
        assertEquals(2, records.count());
        assertThrows(IllegalArgumentException.class, () -> orchestrator.runNow(ESPN, SyncJobDefinition.ODDS));
    }

    @Test
    @DisplayName("Starting schedules every registered job immediately")
    void startSchedules() throws Exception {
        CountDownLatch fetched = new CountDownLatch(2);
        orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(ESPN, fetched, "401"));
        orchestrator.register(SyncJobDefinition.games(STATS), new FixedAdapter(STATS, fetched, "evt-1"));

        orchestrator.start();

        assertTrue(orchestrator.isStarted());
        assertTrue(fetched.await(10, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A failing job does not stop the others")
    void failureIsolated() {
        orchestrator.register(SyncJobDefinition.games(STATS), new FixedAdapter(STATS) {
            @Override
            public List<SourceRecord> fetch(String dataType) {
                throw new IllegalStateException("provider schema changed");
            }
        });
        orchestrator.register(SyncJobDefinition.games(ESPN), new FixedAdapter(ESPN, "401"));

        assertEquals(SyncOutcome.FAILED, orchestrator.runNow(STATS, SyncJobDefinition.GAMES).outcome());
        assertEquals(SyncOutcome.SUCCESS, orchestrator.runNow(ESPN, SyncJobDefinition.GAMES).outcome());

        SyncStatusReport report = orchestrator.statusReport(0, 0, 0);
        assertEquals(SyncStatusReport.Health.DEGRADED, report.health());
        assertEquals(List.of("espn/games", "stats_api/games"),
                report.jobs().stream().map(SyncMetadata::jobKey).toList());
    }

    @Test
    @DisplayName("A single record can be resynced outside any run")
    void resync() {
        ResolutionResult result = orchestrator.resync(game(ESPN, "401", "LAL", "CHI", "2026-01-28T00:30:00Z"));

        assertEquals("g-401", result.canonicalId());
        assertEquals(1, resolved.get());
        assertEquals(1, records.findBySourceId(ESPN, "401").size());
    }

    /**
     * Returns the same game records on every fetch.
     */
    private static class FixedAdapter implements SourceAdapter {
        private final String source;
        private final CountDownLatch fetched;
        private final List<String> sourceIds;

        FixedAdapter(String source, String... sourceIds) {
            this(source, null, sourceIds);
        }

        FixedAdapter(String source, CountDownLatch fetched, String... sourceIds) {
            this.source = source;
            this.fetched = fetched;
            this.sourceIds = List.of(sourceIds);
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public List<SourceRecord> fetch(String dataType) {
            if (fetched != null) {
                fetched.countDown();
            }
            return sourceIds.stream()
                    .map(id -> game(source, id, "LAL", "CHI", "2026-01-28T00:30:00Z"))
                    .toList();
        }
    }
}
