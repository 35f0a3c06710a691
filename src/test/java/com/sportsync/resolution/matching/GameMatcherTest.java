package com.sportsync.resolution.matching;

import com.sportsync.resolution.api.ResolutionResult;
import com.sportsync.resolution.audit.AuditAction;
import com.sportsync.resolution.core.ValidationException;
import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.SourceRecord;
import com.sportsync.resolution.review.ReviewItem;
import com.sportsync.resolution.review.ReviewStatus;
import com.sportsync.resolution.store.CanonicalStore;
import com.sportsync.resolution.store.InMemoryCanonicalStore;
import com.sportsync.resolution.support.TestFixtures;
import com.sportsync.resolution.support.TestFixtures.Harness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.sportsync.resolution.support.TestFixtures.ESPN;
import static com.sportsync.resolution.support.TestFixtures.ODDS;
import static com.sportsync.resolution.support.TestFixtures.SPORT;
import static com.sportsync.resolution.support.TestFixtures.STATS;
import static com.sportsync.resolution.support.TestFixtures.game;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

@DisplayName("GameMatcher")
class GameMatcherTest {

    private CanonicalStore store;
    private Harness harness;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        harness = TestFixtures.harness(store);
    }

    @Nested
    @DisplayName("Creating and linking")
    class CreatingAndLinking {

        @Test
        @DisplayName("First sighting creates the game on its Eastern game day")
        void createsGame() {
            ResolutionResult result = resolve(game(STATS, "0022500701", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));

            assertTrue(result.isMatched());
            assertTrue(result.created());
            assertEquals(MatchMethod.CREATED, result.method());
            CanonicalGame game = store.findGame(result.canonicalId()).orElseThrow();
            assertEquals("LAL", game.homeTeam());
            assertEquals("CHI", game.awayTeam());
            assertEquals(LocalDate.of(2026, 1, 27), game.gameDay());
            assertEquals(STATS, game.primarySource());
            assertEquals(1, harness.audit().getEntriesByAction(AuditAction.ENTITY_CREATED).size());
        }

        @Test
        @DisplayName("Another source four minutes off links to the same game")
        void timeWindowLink() {
            ResolutionResult first = resolve(game(STATS, "0022500701", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-27T19:00:00Z"));
            ResolutionResult second = resolve(game(ESPN, "401810101", "LAL", "CHI", "2026-01-27T19:04:00Z"));

            assertEquals(first.canonicalId(), second.canonicalId());
            assertEquals(MatchMethod.TIME_WINDOW, second.method());
            assertEquals(0.95, second.confidence());
            assertFalse(second.created());
            assertEquals(1, store.findAllGames().size());
            assertEquals(2, store.findGame(first.canonicalId()).orElseThrow().sourceIds().size());
        }

        @Test
        @DisplayName("A known source id resolves to 1.0 without touching the pipeline again")
        void exactIdIsIdempotent() {
            SourceRecord record = game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls", "2026-01-28T00:30:00Z");
            ResolutionResult first = resolve(record);
            ResolutionResult again = resolve(record);
            ResolutionResult third = resolve(record);

            assertEquals(first.canonicalId(), again.canonicalId());
            assertEquals(first.canonicalId(), third.canonicalId());
            assertEquals(MatchMethod.EXACT_ID, again.method());
            assertEquals(1.0, again.confidence());
            assertEquals(1, store.findAllGames().size());
            assertEquals(1, harness.audit().getEntriesByAction(AuditAction.ENTITY_CREATED).size());
        }

        @Test
        @DisplayName("A re-ingested odds event with a respelled team still hits its exact id")
        void exactIdIgnoresRespelling() {
            ResolutionResult mapped = resolve(game(ODDS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            ResolutionResult respelled = resolve(game(ODDS, "evt-1", "LA Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));

            assertEquals(mapped.canonicalId(), respelled.canonicalId());
            assertEquals(MatchMethod.EXACT_ID, respelled.method());
            assertEquals(1.0, respelled.confidence());
            assertFalse(respelled.created());
            assertEquals(1, store.findAllGames().size());
        }

        @Test
        @DisplayName("A misspelled team on the same day links through the fuzzy step")
        void fuzzyTeamName() {
            ResolutionResult created = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            ResolutionResult fuzzy = resolve(game(ODDS, "odds-77", "Los Angeles Lakerz", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));

            assertTrue(fuzzy.isMatched());
            assertEquals(created.canonicalId(), fuzzy.canonicalId());
            assertEquals(MatchMethod.FUZZY_TEAM_NAME, fuzzy.method());
            assertEquals(0.85, fuzzy.confidence());
        }

        @Test
        @DisplayName("Cross-timezone sources get the wider tolerance")
        void crossTimezoneTolerance() {
            ResolutionResult created = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            ResolutionResult shifted = resolve(game(ODDS, "odds-77", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T05:00:00Z"));

            assertEquals(created.canonicalId(), shifted.canonicalId());
            assertEquals(MatchMethod.TIME_WINDOW, shifted.method());
        }

        @Test
        @DisplayName("Reversed home and away is a different game")
        void reversedMatchup() {
            ResolutionResult home = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            ResolutionResult away = resolve(game(STATS, "evt-2", "Chicago Bulls", "Los Angeles Lakers",
                    "2026-01-28T00:30:00Z"));

            assertNotEquals(home.canonicalId(), away.canonicalId());
            assertTrue(away.created());
        }

        @Test
        @DisplayName("Malformed records are rejected before anything is written")
        void validation() {
            SourceRecord missingAway = SourceRecord.game()
                    .sport(SPORT).source(STATS).sourceId("evt-9")
                    .field(SourceRecord.HOME_TEAM, "Los Angeles Lakers")
                    .field(SourceRecord.SCHEDULED_AT, "2026-01-28T00:30:00Z")
                    .build();
            SourceRecord badTime = game(STATS, "evt-9", "Los Angeles Lakers", "Chicago Bulls", "tonight");

            assertThrows(ValidationException.class, () -> resolve(missingAway));
            assertThrows(ValidationException.class, () -> resolve(badTime));
            assertTrue(store.findAllGames().isEmpty());
        }

        @Test
        @DisplayName("Two spellings of the same team are a validation error, not a crash")
        void teamAgainstItself() {
            SourceRecord record = game(ESPN, "401", "LAL", "Los Angeles Lakers", "2026-01-28T00:30:00Z");

            ValidationException e = assertThrows(ValidationException.class, () -> resolve(record));

            assertEquals(SourceRecord.AWAY_TEAM, e.getField());
            assertTrue(store.findAllGames().isEmpty());
            assertEquals(0, harness.reviews().countPending());
        }
    }

    @Nested
    @DisplayName("Start time updates")
    class StartTimeUpdates {

        @Test
        @DisplayName("A higher authority source corrects the start time")
        void higherAuthorityUpdates() {
            ResolutionResult created = resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T00:30:00Z"));
            resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls", "2026-01-28T00:40:00Z"));

            CanonicalGame game = store.findGame(created.canonicalId()).orElseThrow();
            assertEquals(Instant.parse("2026-01-28T00:40:00Z"), game.scheduledAt());
            assertEquals(STATS, game.primarySource());
            assertEquals(1, harness.audit().getEntriesByAction(AuditAction.ENTITY_UPDATED).size());
        }

        @Test
        @DisplayName("A lower authority source never moves the start time")
        void lowerAuthorityIgnored() {
            ResolutionResult created = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            resolve(game(ODDS, "odds-1", "Los Angeles Lakers", "Chicago Bulls", "2026-01-28T00:50:00Z"));

            CanonicalGame game = store.findGame(created.canonicalId()).orElseThrow();
            assertEquals(Instant.parse("2026-01-28T00:30:00Z"), game.scheduledAt());
            assertEquals(STATS, game.primarySource());
        }

        @Test
        @DisplayName("An update that would change the game day is skipped")
        void gameDayChangeSkipped() {
            ResolutionResult created = resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T04:50:00Z"));
            ResolutionResult linked = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T05:10:00Z"));

            assertEquals(created.canonicalId(), linked.canonicalId());
            CanonicalGame game = store.findGame(created.canonicalId()).orElseThrow();
            assertEquals(Instant.parse("2026-01-28T04:50:00Z"), game.scheduledAt());
            assertEquals(LocalDate.of(2026, 1, 27), game.gameDay());
        }
    }

    @Nested
    @DisplayName("Manual review")
    class ManualReview {

        @Test
        @DisplayName("An unknown team goes to review instead of creating a game")
        void unknownTeamQueued() {
            ResolutionResult result = resolve(game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls",
                    "2026-02-10T00:30:00Z"));

            assertTrue(result.isManualReview());
            assertNull(result.canonicalId());
            assertNotNull(result.reviewItemId());
            assertTrue(store.findAllGames().isEmpty());
            assertEquals(MappingStatus.MANUAL_REVIEW,
                    store.findMapping(EntityKind.GAME, SPORT, ESPN, "402").orElseThrow().status());
            ReviewItem item = harness.reviews().get(result.reviewItemId());
            assertTrue(item.getReason().contains("team not recognized"));
        }

        @Test
        @DisplayName("Resolving a queued record again returns the same review item")
        void reviewIsIdempotent() {
            SourceRecord record = game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z");
            ResolutionResult first = resolve(record);
            ResolutionResult again = resolve(record);

            assertEquals(first.reviewItemId(), again.reviewItemId());
            assertEquals(1, harness.reviews().countPending());
            assertEquals(1, harness.audit().getEntriesByAction(AuditAction.REVIEW_REQUESTED).size());
        }

        @Test
        @DisplayName("A plausible but distant candidate is queued, then approved onto it")
        void plausibleCandidateApproved() {
            ResolutionResult existing = resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T04:30:00Z"));
            ResolutionResult queued = resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T07:00:00Z"));

            assertTrue(queued.isManualReview());
            assertTrue(queued.confidence() >= 0.70 && queued.confidence() < 0.85, "score " + queued.confidence());
            ReviewItem item = harness.reviews().get(queued.reviewItemId());
            assertEquals(existing.canonicalId(), item.getBestCandidate().orElseThrow().canonicalId());

            ResolutionResult approved = harness.reviews().approve(queued.reviewItemId(), "alice", "same game");

            assertEquals(existing.canonicalId(), approved.canonicalId());
            assertEquals(MatchMethod.MANUAL, approved.method());
            assertFalse(approved.created());
            assertEquals(ReviewStatus.APPROVED, harness.reviews().get(queued.reviewItemId()).getStatus());
            SourceMapping mapping = store.findMapping(EntityKind.GAME, SPORT, ESPN, "401").orElseThrow();
            assertEquals(MappingStatus.MATCHED, mapping.status());
            assertEquals(existing.canonicalId(), mapping.canonicalId());
            assertEquals(1, store.findAllGames().size());

            ResolutionResult replay = resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T07:00:00Z"));
            assertEquals(MatchMethod.EXACT_ID, replay.method());
        }

        @Test
        @DisplayName("Approving an item without candidates creates the game")
        void approveCreates() {
            SourceRecord record = game(ESPN, "405", "LAL", "CHI", "2026-03-02T00:30:00Z");
            ReviewItem item = harness.reviews().submitForReview(ReviewItem.builder()
                    .kind(EntityKind.GAME)
                    .sport(SPORT)
                    .source(ESPN)
                    .recordKey("405")
                    .sourceRecordId(record.id())
                    .recordFields(record.fields())
                    .reason("flagged by operator")
                    .build());

            ResolutionResult approved = harness.reviews().approve(item.getId(), "alice", "new game");

            assertTrue(approved.created());
            assertEquals(MatchMethod.MANUAL, approved.method());
            CanonicalGame game = store.findGame(approved.canonicalId()).orElseThrow();
            assertEquals("LAL", game.homeTeam());
            assertEquals("405", game.sourceIds().get(ESPN));
            assertEquals(MatchMethod.MANUAL,
                    store.findMapping(EntityKind.GAME, SPORT, ESPN, "405").orElseThrow().method());
        }

        @Test
        @DisplayName("Approving an unrecognized team fails and puts the item back")
        void approveUnknownTeamReopens() {
            ResolutionResult queued = resolve(game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls",
                    "2026-02-10T00:30:00Z"));

            assertThrows(ValidationException.class,
                    () -> harness.reviews().approve(queued.reviewItemId(), "alice", null));

            assertEquals(ReviewStatus.PENDING, harness.reviews().get(queued.reviewItemId()).getStatus());
            assertTrue(store.findAllGames().isEmpty());
        }

        @Test
        @DisplayName("Rejection leaves the record explicitly unmatched")
        void rejectMarksUnmatched() {
            SourceRecord record = game(ESPN, "402", "Springfield Isotopes", "Chicago Bulls", "2026-02-10T00:30:00Z");
            ResolutionResult queued = resolve(record);

            harness.reviews().reject(queued.reviewItemId(), "alice", "exhibition game");

            assertEquals(MappingStatus.FAILED,
                    store.findMapping(EntityKind.GAME, SPORT, ESPN, "402").orElseThrow().status());
            ResolutionResult again = resolve(record);
            assertEquals(MappingStatus.FAILED, again.status());
            assertNull(again.canonicalId());
            assertEquals(1, harness.audit().getEntriesByAction(AuditAction.REVIEW_REJECTED).size());
        }

        @Test
        @DisplayName("A game with a different id from the same source is never linked automatically")
        void sameSourceDifferentIdNotLinked() {
            resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T00:30:00Z"));
            ResolutionResult second = resolve(game(ESPN, "499", "LAL", "CHI", "2026-01-28T00:30:00Z"));

            assertTrue(second.isManualReview());
            assertEquals(1, store.findAllGames().size());
            assertEquals(MappingStatus.MANUAL_REVIEW,
                    store.findMapping(EntityKind.GAME, SPORT, ESPN, "499").orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("Concurrent writers")
    class ConcurrentWriters {

        @Test
        @DisplayName("Losing the natural key race links to the winner")
        void naturalKeyConflictLinksToWinner() {
            CanonicalStore racing = spy(new InMemoryCanonicalStore());
            Harness h = TestFixtures.harness(racing);
            ResolutionResult winner = h.games().resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-27T19:00:00Z"));

            // the loser read before the winner committed
            doReturn(List.of()).when(racing).findGamesBetween(anyString(), any(), any());
            doReturn(List.of()).when(racing).findGamesOnDay(anyString(), any());

            ResolutionResult loser = h.games().resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-27T19:04:00Z"));

            assertEquals(winner.canonicalId(), loser.canonicalId());
            assertEquals(MatchMethod.NATURAL_KEY, loser.method());
            assertFalse(loser.created());
            assertEquals(1, racing.findAllGames().size());
            assertEquals(winner.canonicalId(),
                    racing.findMapping(EntityKind.GAME, SPORT, ESPN, "401").orElseThrow().canonicalId());
        }

        @Test
        @DisplayName("Losing the source id race rereads the stored mapping")
        void sourceIdConflictRereads() {
            CanonicalStore racing = spy(new InMemoryCanonicalStore());
            Harness h = TestFixtures.harness(racing);
            ResolutionResult created = h.games().resolve(game(STATS, "evt-1", "Los Angeles Lakers", "Chicago Bulls",
                    "2026-01-28T00:30:00Z"));
            racing.saveMapping(SourceMapping.matched(EntityKind.GAME, SPORT, ESPN, "401", created.canonicalId(),
                    0.95, MatchMethod.TIME_WINDOW));

            doReturn(Optional.empty()).doCallRealMethod()
                    .when(racing).findMapping(EntityKind.GAME, SPORT, ESPN, "401");

            ResolutionResult result = h.games().resolve(game(ESPN, "401", "LAL", "CHI", "2026-01-28T00:31:00Z"));

            assertEquals(created.canonicalId(), result.canonicalId());
            assertEquals(MatchMethod.EXACT_ID, result.method());
        }
    }

    private ResolutionResult resolve(SourceRecord record) {
        return harness.games().resolve(record);
    }
}
