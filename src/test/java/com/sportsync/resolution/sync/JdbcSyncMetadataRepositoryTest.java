package com.sportsync.resolution.sync;

import com.sportsync.resolution.support.H2Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcSyncMetadataRepository")
class JdbcSyncMetadataRepositoryTest {

    private JdbcSyncMetadataRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcSyncMetadataRepository(H2Database.newExecutor());
    }

    @Test
    @DisplayName("A fresh row round-trips with no outcome and no duration")
    void initialRow() {
        repository.save(SyncMetadata.initial("espn", "games"));

        SyncMetadata row = repository.find("espn", "games").orElseThrow();
        assertEquals(SyncState.IDLE, row.state());
        assertNull(row.lastOutcome());
        assertNull(row.duration());
        assertFalse(row.hasRun());
    }

    @Test
    @DisplayName("Saving again replaces the single row of the job")
    void oneRowPerJob() {
        SyncMetadata initial = repository.save(SyncMetadata.initial("espn", "games"));
        Instant started = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        SyncMetadata finished = initial.started(started)
                .withState(SyncState.MATCHING)
                .withCounts(10, 7, 2, 1)
                .finished(SyncOutcome.PARTIAL, started.plusSeconds(3), null)
                .withState(SyncState.IDLE);

        repository.save(finished);

        List<SyncMetadata> rows = repository.findAll();
        assertEquals(1, rows.size());
        SyncMetadata row = rows.get(0);
        assertEquals(initial.id(), row.id());
        assertEquals(SyncOutcome.PARTIAL, row.lastOutcome());
        assertEquals(10, row.recordsProcessed());
        assertEquals(2, row.recordsQueued());
        assertEquals(3_000, row.duration().toMillis());
        assertEquals(started, row.lastSyncStartedAt());
    }

    @Test
    @DisplayName("Long error messages are truncated")
    void errorTruncated() {
        SyncMetadata failed = SyncMetadata.initial("odds_api", "odds")
                .started(Instant.now())
                .finished(SyncOutcome.FAILED, Instant.now(), "x".repeat(5_000));

        repository.save(failed);

        assertEquals(2_000, repository.find("odds_api", "odds").orElseThrow().errorMessage().length());
    }

    @Test
    @DisplayName("Rows are listed by source then data type")
    void ordering() {
        repository.save(SyncMetadata.initial("stats_api", "games"));
        repository.save(SyncMetadata.initial("espn", "player_stats"));
        repository.save(SyncMetadata.initial("espn", "games"));

        List<String> keys = repository.findAll().stream().map(SyncMetadata::jobKey).toList();

        assertEquals(List.of("espn/games", "espn/player_stats", "stats_api/games"), keys);
        assertTrue(repository.find("espn", "odds").isEmpty());
    }
}
