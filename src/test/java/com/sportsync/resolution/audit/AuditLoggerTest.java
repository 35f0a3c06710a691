package com.sportsync.resolution.audit;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.SourceMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditLogger")
class AuditLoggerTest {

    private AuditLogger audit;

    @BeforeEach
    void setUp() {
        audit = new AuditLogger();
    }

    @Test
    @DisplayName("Creations carry the new state and the match details")
    void created() {
        CanonicalGame game = CanonicalGame.builder()
                .sport("nba").homeTeam("LAL").awayTeam("CHI")
                .scheduledAt(Instant.parse("2026-01-28T00:30:00Z"))
                .gameDay(LocalDate.of(2026, 1, 27))
                .primarySource("espn")
                .build();

        AuditEntry entry = audit.created(EntityKind.GAME, game.id(), "SYSTEM", AuditLogger.snapshot(game),
                Map.of("method", "CREATED", "sourceRecordId", "rec-1"));

        assertEquals(AuditAction.ENTITY_CREATED, entry.action());
        assertTrue(entry.previousState().isEmpty());
        assertEquals("2026-01-27", entry.newState().get("gameDay"));
        assertEquals("rec-1", entry.matchDetails().get("sourceRecordId"));
        assertEquals(List.of(entry), audit.getEntriesForEntity(game.id()));
    }

    @Test
    @DisplayName("A new mapping is a creation, a changed one an update")
    void mappingActions() {
        SourceMapping review = SourceMapping.inReview(EntityKind.PLAYER, "nba", "espn", "3975", 0.78);
        SourceMapping resolved = review.resolvedTo("p-1", 1.0, MatchMethod.MANUAL);

        AuditEntry inserted = audit.mapping(null, review, "SYSTEM", null);
        AuditEntry changed = audit.mapping(review, resolved, "alice", null);

        assertEquals(AuditAction.MAPPING_CREATED, inserted.action());
        assertEquals(review.id(), inserted.entityId());
        assertEquals(AuditAction.MAPPING_UPDATED, changed.action());
        assertEquals("p-1", changed.entityId());
        assertEquals("MANUAL_REVIEW", changed.previousState().get("status"));
        assertEquals("MATCHED", changed.newState().get("status"));
    }

    @Test
    @DisplayName("Null values in snapshots are dropped instead of failing")
    void nullValuesDropped() {
        Map<String, Object> state = new HashMap<>();
        state.put("team", null);
        state.put("name", "Victor Wembanyama");

        AuditEntry entry = audit.updated(EntityKind.PLAYER, "p-1", "SYSTEM", state, Map.of("team", "SAS"), null);

        assertEquals(Map.of("name", "Victor Wembanyama"), entry.previousState());
        assertTrue(entry.matchDetails().isEmpty());
    }

    @Test
    @DisplayName("History can be queried by action, time range and recency")
    void queries() throws InterruptedException {
        Instant before = Instant.now();
        audit.record(AuditAction.REVIEW_REQUESTED, EntityKind.GAME, "r-1", "SYSTEM", null, null, null);
        Thread.sleep(5);
        audit.record(AuditAction.REVIEW_APPROVED, EntityKind.GAME, "g-1", "alice", null, null, null);
        Thread.sleep(5);
        audit.record(AuditAction.ENTITY_MERGED, EntityKind.GAME, "g-1", "reconciler", null, null, null);

        assertEquals(3, audit.size());
        assertEquals(1, audit.getEntriesByAction(AuditAction.ENTITY_MERGED).size());
        assertEquals(3, audit.getEntriesBetween(before, Instant.now()).size());
        List<AuditEntry> recent = audit.getRecentEntries(2);
        assertEquals(List.of(AuditAction.REVIEW_APPROVED, AuditAction.ENTITY_MERGED),
                recent.stream().map(AuditEntry::action).toList());
    }
}
