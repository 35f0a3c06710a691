package com.sportsync.resolution.review;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.audit.AuditAction;
import com.sportsync.resolution.audit.AuditEntry;
import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewService")
class ReviewServiceTest {

    @Mock
    private ReviewDecisionHandler gameHandler;

    @Mock
    private MetricsService metrics;

    private InMemoryReviewQueue queue;
    private AuditLogger audit;
    private ReviewService service;

    @BeforeEach
    void setUp() {
        queue = new InMemoryReviewQueue();
        audit = new AuditLogger();
        service = new ReviewService(queue, audit, metrics);
        service.registerHandler(EntityKind.GAME, gameHandler);
    }

    @Nested
    @DisplayName("Submitting")
    class Submitting {

        @Test
        @DisplayName("A new item is audited by the system and counted")
        void submitAudits() {
            ReviewItem item = service.submitForReview(gameItem("401", candidate("g-1", 0.78)));

            List<AuditEntry> requested = audit.getEntriesByAction(AuditAction.REVIEW_REQUESTED);
            assertEquals(1, requested.size());
            assertEquals("SYSTEM", requested.get(0).actorId());
            assertEquals(item.getId(), requested.get(0).entityId());
            verify(metrics).incrementReviewEnqueued(EntityKind.GAME);
        }

        @Test
        @DisplayName("Resubmitting a queued record is silent")
        void duplicateSilent() {
            ReviewItem first = service.submitForReview(gameItem("401"));
            ReviewItem second = service.submitForReview(gameItem("401"));

            assertEquals(first.getId(), second.getId());
            assertEquals(1, audit.getEntriesByAction(AuditAction.REVIEW_REQUESTED).size());
            verify(metrics, times(1)).incrementReviewEnqueued(EntityKind.GAME);
        }
    }

    @Nested
    @DisplayName("Approving")
    class Approving {

        @Test
        @DisplayName("Without a candidate id the best candidate is chosen")
        void bestCandidateChosen() {
            ReviewItem item = service.submitForReview(gameItem("401", candidate("g-low", 0.71), candidate("g-best", 0.80)));
            when(gameHandler.applyApproval(any(), eq("g-best"), eq("alice")))
                    .thenReturn(ResolutionResult.approved("g-best", false));

            ResolutionResult result = service.approve(item.getId(), "alice", "looks right");

            assertEquals("g-best", result.canonicalId());
            ReviewItem decided = service.get(item.getId());
            assertEquals(ReviewStatus.APPROVED, decided.getStatus());
            assertEquals("g-best", decided.getChosenCandidateId());
            assertEquals("looks right", decided.getNotes());
            AuditEntry approved = audit.getEntriesByAction(AuditAction.REVIEW_APPROVED).get(0);
            assertEquals("alice", approved.actorId());
            assertEquals("g-best", approved.entityId());
        }

        @Test
        @DisplayName("An explicit candidate id wins over the best one")
        void explicitCandidate() {
            ReviewItem item = service.submitForReview(gameItem("401", candidate("g-low", 0.71), candidate("g-best", 0.80)));
            when(gameHandler.applyApproval(any(), eq("g-low"), eq("alice")))
                    .thenReturn(ResolutionResult.approved("g-low", false));

            assertEquals("g-low", service.approve(item.getId(), "g-low", "alice", null).canonicalId());
        }

        @Test
        @DisplayName("No candidates means the handler creates a new entity")
        void noCandidatesCreates() {
            ReviewItem item = service.submitForReview(gameItem("402"));
            when(gameHandler.applyApproval(any(), isNull(), eq("alice")))
                    .thenReturn(ResolutionResult.approved("g-new", true));

            ResolutionResult result = service.approve(item.getId(), "alice", null);

            assertTrue(result.created());
            ArgumentCaptor<ReviewItem> captor = ArgumentCaptor.forClass(ReviewItem.class);
            verify(gameHandler).applyApproval(captor.capture(), isNull(), eq("alice"));
            assertEquals(ReviewStatus.APPROVED, captor.getValue().getStatus());
        }

        @Test
        @DisplayName("A failing store write puts the item back to pending")
        void failureReopens() {
            ReviewItem item = service.submitForReview(gameItem("401", candidate("g-1", 0.78)));
            when(gameHandler.applyApproval(any(), any(), any())).thenThrow(new StoreException("db down", null));

            assertThrows(StoreException.class, () -> service.approve(item.getId(), "alice", null));

            ReviewItem current = service.get(item.getId());
            assertTrue(current.isPending());
            assertNull(current.getReviewerId());
            assertTrue(audit.getEntriesByAction(AuditAction.REVIEW_APPROVED).isEmpty());
        }
    }

    @Nested
    @DisplayName("Deciding twice")
    class DecidingTwice {

        @Test
        @DisplayName("A decided item cannot be approved or rejected again")
        void conflict() {
            ReviewItem item = service.submitForReview(gameItem("401"));
            service.reject(item.getId(), "alice", "not a game");

            ReviewConflictException conflict = assertThrows(ReviewConflictException.class,
                    () -> service.approve(item.getId(), "bob", null));
            assertEquals(ReviewStatus.REJECTED, conflict.getActualStatus());
            assertThrows(ReviewConflictException.class, () -> service.reject(item.getId(), "bob", null));
            verify(gameHandler, times(1)).applyRejection(any(), eq("alice"));
            verify(gameHandler, never()).applyApproval(any(), any(), any());
        }

        @Test
        @DisplayName("Unknown items and unhandled kinds are rejected")
        void unknownItemOrKind() {
            assertThrows(IllegalArgumentException.class, () -> service.approve("missing", "alice", null));

            ReviewItem playerItem = service.submitForReview(ReviewItem.builder()
                    .kind(EntityKind.PLAYER).sport("nba").source("espn").recordKey("3975").build());
            assertThrows(IllegalStateException.class, () -> service.reject(playerItem.getId(), "alice", null));
            assertTrue(service.get(playerItem.getId()).isPending());
        }
    }

    @Test
    @DisplayName("Rejection is applied by the handler and audited")
    void rejectAudits() {
        ReviewItem item = service.submitForReview(gameItem("401"));

        service.reject(item.getId(), "alice", "preseason");

        verify(gameHandler).applyRejection(any(ReviewItem.class), eq("alice"));
        AuditEntry rejected = audit.getEntriesByAction(AuditAction.REVIEW_REJECTED).get(0);
        assertEquals("alice", rejected.actorId());
        assertEquals(ReviewStatus.REJECTED, service.get(item.getId()).getStatus());
        assertEquals(0, service.countPending());
    }

    private static ReviewItem gameItem(String sourceId, ReviewCandidate... candidates) {
        return ReviewItem.builder()
                .kind(EntityKind.GAME)
                .sport("nba")
                .source("espn")
                .recordKey(sourceId)
                .recordFields(Map.of("home_team", "LAL", "away_team", "CHI",
                        "scheduled_at", "2026-01-28T00:30:00Z"))
                .candidates(List.of(candidates))
                .submittedAt(Instant.now())
                .reason("test")
                .build();
    }

    private static ReviewCandidate candidate(String id, double confidence) {
        return new ReviewCandidate(id, id, confidence, Map.of());
    }
}
