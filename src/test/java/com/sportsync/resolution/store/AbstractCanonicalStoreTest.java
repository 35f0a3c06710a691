package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.MappingStatus;
import com.sportsync.resolution.core.model.MatchMethod;
import com.sportsync.resolution.core.model.PlayerAlias;
import com.sportsync.resolution.core.model.Prediction;
import com.sportsync.resolution.core.model.SourceMapping;
import com.sportsync.resolution.core.model.StatLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link CanonicalStore} implementation must share.
 */
abstract class AbstractCanonicalStoreTest {

    protected static final String SPORT = "nba";
    protected static final Instant TIP_OFF = Instant.parse("2026-01-28T00:30:00Z");
    protected static final LocalDate GAME_DAY = LocalDate.of(2026, 1, 27);

    protected CanonicalStore store;

    protected abstract CanonicalStore createStore();

    @BeforeEach
    void setUp() {
        store = createStore();
    }

    @Nested
    @DisplayName("Games")
    class Games {

        @Test
        @DisplayName("Create stores the game with its mapping and exposes source ids")
        void createGame() {
            CanonicalGame game = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(game, gameMapping("stats_api", "0022500701", game.id()));

            CanonicalGame found = store.findGame(game.id()).orElseThrow();
            assertEquals("LAL", found.homeTeam());
            assertEquals(TIP_OFF, found.scheduledAt());
            assertEquals(Map.of("stats_api", "0022500701"), found.sourceIds());
            assertEquals(game.id(), store.findGameByKey(game.naturalKey()).orElseThrow().id());
            assertTrue(store.findMapping(EntityKind.GAME, SPORT, "stats_api", "0022500701").isPresent());
        }

        @Test
        @DisplayName("A second game on the same natural key is a conflict and leaves nothing behind")
        void naturalKeyConflict() {
            CanonicalGame first = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(first, gameMapping("stats_api", "g-1", first.id()));

            CanonicalGame second = game("LAL", "CHI", TIP_OFF.plusSeconds(240), GAME_DAY);
            ConflictException conflict = assertThrows(ConflictException.class,
                    () -> store.createGame(second, gameMapping("espn", "401", second.id())));

            assertTrue(conflict.isNaturalKey());
            assertTrue(store.findGame(second.id()).isEmpty());
            assertTrue(store.findMapping(EntityKind.GAME, SPORT, "espn", "401").isEmpty());
            assertEquals(1, store.findAllGames().size());
        }

        @Test
        @DisplayName("Reversed home and away is a different natural key")
        void reversedMatchupIsDistinct() {
            store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
            store.createGame(game("CHI", "LAL", TIP_OFF, GAME_DAY), null);
            assertEquals(2, store.findGamesOnDay(SPORT, GAME_DAY).size());
        }

        @Test
        @DisplayName("A source id maps to at most one game")
        void sourceIdConflict() {
            CanonicalGame first = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(first, gameMapping("espn", "401", first.id()));

            CanonicalGame other = game("BOS", "NYK", TIP_OFF, GAME_DAY);
            ConflictException conflict = assertThrows(ConflictException.class,
                    () -> store.createGame(other, gameMapping("espn", "401", other.id())));
            assertTrue(conflict.isSourceId());
            assertTrue(store.findGame(other.id()).isEmpty());
        }

        @Test
        @DisplayName("A game carries at most one id per source")
        void canonicalSourceConflict() {
            CanonicalGame game = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(game, gameMapping("espn", "401", game.id()));

            ConflictException conflict = assertThrows(ConflictException.class,
                    () -> store.saveMapping(gameMapping("espn", "402", game.id())));
            assertTrue(conflict.isCanonicalSource());
        }

        @Test
        @DisplayName("Window and day queries filter by sport and time")
        void rangeQueries() {
            store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
            store.createGame(game("BOS", "NYK", TIP_OFF.plusSeconds(3 * 3600), GAME_DAY), null);
            store.createGame(game("MIA", "ORL", TIP_OFF.plusSeconds(26 * 3600), GAME_DAY.plusDays(1)), null);

            List<CanonicalGame> window = store.findGamesBetween(SPORT, TIP_OFF.minusSeconds(7200),
                    TIP_OFF.plusSeconds(7200));
            assertEquals(1, window.size());
            assertEquals("LAL", window.get(0).homeTeam());
            assertEquals(2, store.findGamesOnDay(SPORT, GAME_DAY).size());
            assertTrue(store.findGamesOnDay("nhl", GAME_DAY).isEmpty());
        }

        @Test
        @DisplayName("Update changes the start time and rejects natural key collisions")
        void updateGame() {
            CanonicalGame game = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(game, null);
            CanonicalGame other = game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(1));
            store.createGame(other, null);

            Instant moved = TIP_OFF.plusSeconds(1800);
            store.updateGame(store.findGame(game.id()).orElseThrow().toBuilder().scheduledAt(moved).build());
            assertEquals(moved, store.findGame(game.id()).orElseThrow().scheduledAt());

            CanonicalGame collide = store.findGame(other.id()).orElseThrow().toBuilder().gameDay(GAME_DAY).build();
            assertThrows(ConflictException.class, () -> store.updateGame(collide));
        }
    }

    @Nested
    @DisplayName("Mappings")
    class Mappings {

        @Test
        @DisplayName("A review mapping has no canonical id and can later be resolved in place")
        void reviewMappingResolvesInPlace() {
            SourceMapping pending = SourceMapping.inReview(EntityKind.GAME, SPORT, "odds_api", "ev-9", 0.75);
            store.saveMapping(pending);
            assertEquals(List.of(pending.id()), store.findMappingsByStatus(EntityKind.GAME, MappingStatus.MANUAL_REVIEW)
                    .stream().map(SourceMapping::id).toList());

            CanonicalGame game = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(game, pending.resolvedTo(game.id(), 1.0, MatchMethod.MANUAL));

            SourceMapping resolved = store.findMapping(EntityKind.GAME, SPORT, "odds_api", "ev-9").orElseThrow();
            assertEquals(pending.id(), resolved.id());
            assertEquals(game.id(), resolved.canonicalId());
            assertEquals(MappingStatus.MATCHED, resolved.status());
            assertTrue(store.findMappingsByStatus(EntityKind.GAME, MappingStatus.MANUAL_REVIEW).isEmpty());
        }

        @Test
        @DisplayName("Only matched mappings appear in source ids")
        void unmatchedMappingsHidden() {
            CanonicalGame game = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            store.createGame(game, gameMapping("stats_api", "g-1", game.id()));
            store.saveMapping(SourceMapping.inReview(EntityKind.GAME, SPORT, "espn", "401", 0.72));

            assertEquals(Map.of("stats_api", "g-1"), store.findGame(game.id()).orElseThrow().sourceIds());
        }
    }

    @Nested
    @DisplayName("Players and aliases")
    class Players {

        @Test
        @DisplayName("Create stores player, mapping and alias together")
        void createPlayer() {
            CanonicalPlayer player = player("Tim Hardaway", "tim hardaway", "jr", "DAL");
            store.createPlayer(player,
                    SourceMapping.matched(EntityKind.PLAYER, SPORT, "stats_api", "203501", player.id(),
                            1.0, MatchMethod.CREATED),
                    PlayerAlias.of(player.id(), SPORT, "Tim Hardaway Jr.", "tim hardaway jr", "stats_api", 1.0, false));

            CanonicalPlayer found = store.findPlayer(player.id()).orElseThrow();
            assertEquals("jr", found.suffix());
            assertEquals(Map.of("stats_api", "203501"), found.sourceIds());
            assertEquals(1, store.findPlayersByName(SPORT, "tim hardaway").size());
            assertEquals(1, store.findPlayersByTeam(SPORT, "DAL").size());
            assertTrue(store.findAlias(SPORT, "tim hardaway jr", "stats_api").isPresent());
        }

        @Test
        @DisplayName("Alias keys are unique per sport and source")
        void aliasUniqueness() {
            CanonicalPlayer a = store.createPlayer(player("Kevin Porter", "kevin porter", "jr", "MIL"), null, null);
            CanonicalPlayer b = store.createPlayer(player("Kevin Porter", "kevin porter", "", "HOU"), null, null);
            store.saveAlias(PlayerAlias.of(a.id(), SPORT, "K. Porter", "k porter", "espn", 0.9, false));

            ConflictException conflict = assertThrows(ConflictException.class,
                    () -> store.saveAlias(PlayerAlias.of(b.id(), SPORT, "K Porter", "k porter", "espn", 0.9, false)));
            assertEquals(ConflictException.PLAYER_ALIAS, conflict.getConstraint());

            store.saveAlias(PlayerAlias.of(b.id(), SPORT, "K Porter", "k porter", "odds_api", 0.9, false));
            assertEquals(1, store.findAliases(b.id()).size());
        }

        @Test
        @DisplayName("Saving an existing alias updates verification in place")
        void aliasUpdate() {
            CanonicalPlayer p = store.createPlayer(player("Nic Claxton", "nic claxton", "", "BKN"), null, null);
            PlayerAlias alias = store.saveAlias(
                    PlayerAlias.of(p.id(), SPORT, "Nicolas Claxton", "nicolas claxton", "espn", 0.88, false));
            store.saveAlias(alias.asVerified());

            List<PlayerAlias> aliases = store.findAliases(p.id());
            assertEquals(1, aliases.size());
            assertTrue(aliases.get(0).verified());
        }

        @Test
        @DisplayName("Update changes team and position")
        void updatePlayer() {
            CanonicalPlayer p = store.createPlayer(player("Dennis Schroder", "dennis schroder", "", "BKN"), null, null);
            store.updatePlayer(store.findPlayer(p.id()).orElseThrow().toBuilder().team("GSW").position("G").build());

            CanonicalPlayer found = store.findPlayer(p.id()).orElseThrow();
            assertEquals("GSW", found.team());
            assertEquals("G", found.position());
            assertTrue(store.findPlayersByTeam(SPORT, "BKN").isEmpty());
        }
    }

    @Nested
    @DisplayName("Merges")
    class Merges {

        @Test
        @DisplayName("Merging games moves mappings, predictions and stat lines, then redirects the loser")
        void mergeGames() {
            CanonicalGame survivor = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            CanonicalGame loser = game("LAL", "CHI", TIP_OFF.plusSeconds(5400), GAME_DAY.plusDays(1));
            store.createGame(survivor, gameMapping("stats_api", "g-1", survivor.id()));
            store.createGame(loser, gameMapping("espn", "401", loser.id()));
            CanonicalPlayer player = store.createPlayer(player("LeBron James", "lebron james", "", "LAL"), null, null);
            Prediction prediction = store.savePrediction(Prediction.of(loser.id(), player.id(), "points"));
            store.saveStatLine(StatLine.of(player.id(), loser.id(), "points", 31));

            MergeOutcome outcome = store.mergeGames(survivor.id(), loser.id());

            assertFalse(outcome.alreadyMerged());
            assertEquals(1, outcome.mappingsMoved());
            assertEquals(1, outcome.predictionsMoved());
            assertEquals(1, outcome.statLinesMoved());
            assertTrue(store.findGame(loser.id()).isEmpty());
            assertEquals(Map.of("stats_api", "g-1", "espn", "401"), store.findGame(survivor.id()).orElseThrow().sourceIds());
            assertEquals(List.of(prediction.id()),
                    store.findPredictionsForGame(survivor.id()).stream().map(Prediction::id).toList());
            assertEquals(1, store.findStatLinesForGame(survivor.id()).size());
            assertTrue(store.findPredictionsForGame(loser.id()).isEmpty());
            assertEquals(survivor.id(), store.resolveSurvivor(EntityKind.GAME, loser.id()));
        }

        @Test
        @DisplayName("Merging the same pair twice is a no-op the second time")
        void mergeIsIdempotent() {
            CanonicalGame survivor = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
            CanonicalGame loser = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(1)), null);

            store.mergeGames(survivor.id(), loser.id());
            MergeOutcome again = store.mergeGames(survivor.id(), loser.id());

            assertTrue(again.alreadyMerged());
            assertEquals(1, store.findAllGames().size());
        }

        @Test
        @DisplayName("Different ids from the same source abort the merge with nothing changed")
        void sourceClashAborts() {
            CanonicalGame survivor = game("LAL", "CHI", TIP_OFF, GAME_DAY);
            CanonicalGame loser = game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(1));
            store.createGame(survivor, gameMapping("espn", "401", survivor.id()));
            store.createGame(loser, gameMapping("espn", "402", loser.id()));
            store.savePrediction(Prediction.of(loser.id(), null, "spread"));

            assertThrows(MergeIntegrityException.class, () -> store.mergeGames(survivor.id(), loser.id()));

            assertTrue(store.findGame(loser.id()).isPresent());
            assertEquals(1, store.findPredictionsForGame(loser.id()).size());
            assertEquals(loser.id(), store.findMapping(EntityKind.GAME, SPORT, "espn", "402").orElseThrow().canonicalId());
            assertEquals(loser.id(), store.resolveSurvivor(EntityKind.GAME, loser.id()));
        }

        @Test
        @DisplayName("A missing survivor aborts the merge")
        void missingSurvivor() {
            CanonicalGame loser = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
            assertThrows(MergeIntegrityException.class, () -> store.mergeGames("nope", loser.id()));
            assertThrows(IllegalArgumentException.class, () -> store.mergeGames(loser.id(), loser.id()));
        }

        @Test
        @DisplayName("Merging players moves aliases and dependent rows")
        void mergePlayers() {
            CanonicalPlayer survivor = player("Nikola Jokic", "nikola jokic", "", "DEN");
            CanonicalPlayer loser = player("Nikola Jokic", "nikola jokic", "", "DEN");
            store.createPlayer(survivor, SourceMapping.matched(EntityKind.PLAYER, SPORT, "stats_api", "203999",
                    survivor.id(), 1.0, MatchMethod.CREATED), null);
            store.createPlayer(loser, SourceMapping.matched(EntityKind.PLAYER, SPORT, "espn", "3112335",
                    loser.id(), 1.0, MatchMethod.CREATED),
                    PlayerAlias.of(loser.id(), SPORT, "Nikola Jokić", "nikola jokic", "espn", 1.0, false));
            CanonicalGame game = store.createGame(game("DEN", "PHX", TIP_OFF, GAME_DAY), null);
            store.savePrediction(Prediction.of(game.id(), loser.id(), "rebounds"));

            MergeOutcome outcome = store.mergePlayers(survivor.id(), loser.id());

            assertEquals(1, outcome.aliasesMoved());
            assertEquals(1, outcome.predictionsMoved());
            assertEquals(2, store.findPlayer(survivor.id()).orElseThrow().sourceIds().size());
            assertEquals(survivor.id(), store.findAlias(SPORT, "nikola jokic", "espn").orElseThrow().canonicalId());
            assertEquals(1, store.findPredictionsForPlayer(survivor.id()).size());
            assertEquals(survivor.id(), store.resolveSurvivor(EntityKind.PLAYER, loser.id()));
        }

        @Test
        @DisplayName("Redirect chains resolve to the final survivor")
        void redirectChain() {
            CanonicalGame a = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
            CanonicalGame b = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(1)), null);
            CanonicalGame c = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(2)), null);

            store.mergeGames(b.id(), a.id());
            store.mergeGames(c.id(), b.id());

            assertEquals(c.id(), store.resolveSurvivor(EntityKind.GAME, a.id()));
            assertEquals(c.id(), store.resolveSurvivor(EntityKind.GAME, c.id()));
        }
    }

    protected static CanonicalGame game(String home, String away, Instant scheduledAt, LocalDate gameDay) {
        return CanonicalGame.builder()
                .sport(SPORT)
                .homeTeam(home)
                .awayTeam(away)
                .scheduledAt(scheduledAt)
                .gameDay(gameDay)
                .primarySource("stats_api")
                .build();
    }

    protected static CanonicalPlayer player(String name, String normalized, String suffix, String team) {
        return CanonicalPlayer.builder()
                .sport(SPORT)
                .canonicalName(name)
                .normalizedName(normalized)
                .suffix(suffix)
                .team(team)
                .primarySource("stats_api")
                .build();
    }

    protected static SourceMapping gameMapping(String source, String sourceId, String gameId) {
        return SourceMapping.matched(EntityKind.GAME, SPORT, source, sourceId, gameId, 1.0, MatchMethod.CREATED);
    }
}
