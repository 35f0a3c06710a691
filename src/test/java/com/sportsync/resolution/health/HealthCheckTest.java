package com.sportsync.resolution.health;

import com.sportsync.resolution.review.ReviewQueue;
import com.sportsync.resolution.support.H2Database;
import com.sportsync.resolution.sync.SyncMetadata;
import com.sportsync.resolution.sync.SyncOrchestrator;
import com.sportsync.resolution.sync.SyncOutcome;
import com.sportsync.resolution.sync.SyncStatusReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Health checks")
class HealthCheckTest {

    @Mock
    private ReviewQueue reviewQueue;

    @Mock
    private SyncOrchestrator orchestrator;

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("An empty registry is up")
        void empty() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("The aggregate reports the worst check and every result")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("database", HealthStatus.up()));
            registry.register(fixed("reviewBacklog", HealthStatus.degraded("too many")));
            registry.register(fixed("syncJobs", HealthStatus.up()));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDegraded());
            assertEquals("reviewBacklog: too many", status.message());
            assertEquals(3, status.details().size());
        }

        @Test
        @DisplayName("A check that throws counts as down")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("database", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertTrue(status.message().startsWith("broken"));
        }
    }

    @Nested
    @DisplayName("Status")
    class StatusValues {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"HEALTHY, UP", "DEGRADED, DEGRADED", "UNHEALTHY, DOWN"})
        @DisplayName("Sync health maps onto engine status")
        void fromSyncHealth(SyncStatusReport.Health health, HealthStatus.Status expected) {
            assertEquals(expected, HealthStatus.Status.of(health));
        }

        @Test
        @DisplayName("The worse of two statuses wins either way round")
        void worse() {
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.UP.worse(HealthStatus.Status.DOWN));
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.DOWN.worse(HealthStatus.Status.DEGRADED));
            assertEquals(HealthStatus.Status.UP, HealthStatus.Status.UP.worse(HealthStatus.Status.UP));
        }

        @Test
        @DisplayName("Details accumulate and the check time is kept")
        void detailsAndTime() {
            HealthStatus status = HealthStatus.degraded("slow").withDetail("pending", 3L).withDetail("limit", 2L);

            assertEquals(2, status.details().size());
            assertNotNull(status.checkedAt());
            assertTrue(status.isWorseThan(HealthStatus.Status.UP));
            assertFalse(status.isWorseThan(HealthStatus.Status.DEGRADED));
        }
    }

    @Test
    @DisplayName("The review backlog degrades above its limit")
    void reviewBacklog() {
        when(reviewQueue.countPending()).thenReturn(10L, 11L);
        ReviewBacklogHealthCheck check = new ReviewBacklogHealthCheck(reviewQueue, 10);

        HealthStatus atLimit = check.check();
        HealthStatus above = check.check();

        assertTrue(atLimit.isUp());
        assertTrue(above.isDegraded());
        assertEquals(11L, above.details().get("pending"));
        assertThrows(IllegalArgumentException.class, () -> new ReviewBacklogHealthCheck(reviewQueue, -1));
    }

    @Test
    @DisplayName("Sync job health follows the last outcome of every job")
    void syncJobs() {
        when(orchestrator.jobMetadata()).thenReturn(List.of(
                ran("espn", SyncOutcome.SUCCESS),
                ran("stats_api", SyncOutcome.FAILED),
                SyncMetadata.initial("odds_api", "odds")));

        HealthStatus status = new SyncJobsHealthCheck(orchestrator).check();

        assertTrue(status.isDegraded());
        assertEquals("success", status.details().get("espn/games"));
        assertEquals("failed", status.details().get("stats_api/games"));
        assertEquals("never_run", status.details().get("odds_api/odds"));
        assertEquals("degraded", status.details().get("health"));
    }

    @Test
    @DisplayName("Every failed sync job means down")
    void syncJobsDown() {
        when(orchestrator.jobMetadata()).thenReturn(List.of(ran("espn", SyncOutcome.FAILED)));

        assertTrue(new SyncJobsHealthCheck(orchestrator).check().isDown());
    }

    @Nested
    @DisplayName("Database")
    class Database {

        @Mock
        private DataSource unreachable;

        @Test
        @DisplayName("A reachable database is up with its product name")
        void reachable() {
            HealthStatus status = new DataSourceHealthCheck(H2Database.newDataSource()).check();

            assertTrue(status.isUp());
            assertEquals("H2", status.details().get("product"));
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("A connection failure is down with its SQL state")
        void unreachable() throws SQLException {
            when(unreachable.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

            HealthStatus status = new DataSourceHealthCheck(unreachable).check();

            assertTrue(status.isDown());
            assertEquals("08001", status.details().get("sqlState"));
        }
    }

    private static HealthCheck fixed(String name, HealthStatus status) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status;
            }
        };
    }

    private static SyncMetadata ran(String source, SyncOutcome outcome) {
        Instant now = Instant.now();
        return SyncMetadata.initial(source, "games").started(now).finished(outcome, now, null);
    }
}
