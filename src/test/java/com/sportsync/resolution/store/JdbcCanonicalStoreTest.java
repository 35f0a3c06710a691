package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.core.model.Prediction;
import com.sportsync.resolution.support.H2Database;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcCanonicalStore (H2, PostgreSQL mode)")
class JdbcCanonicalStoreTest extends AbstractCanonicalStoreTest {

    private SqlExecutor sql;

    @Override
    protected CanonicalStore createStore() {
        sql = H2Database.newExecutor();
        return new JdbcCanonicalStore(sql);
    }

    @Test
    @DisplayName("Foreign key violations surface as merge integrity failures")
    void foreignKeyTranslated() {
        assertThrows(MergeIntegrityException.class,
                () -> store.savePrediction(Prediction.of("missing-game", null, "points")));
    }

    @Test
    @DisplayName("Schema initialization can run twice")
    void schemaIdempotent() {
        new SchemaInitializer(sql).initialize();
        CanonicalGame game = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
        assertTrue(store.findGame(game.id()).isPresent());
    }

    @Test
    @DisplayName("Merge history survives in the database")
    void mergeHistoryPersisted() {
        CanonicalGame survivor = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
        CanonicalGame loser = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY.plusDays(1)), null);
        store.mergeGames(survivor.id(), loser.id());

        CanonicalStore reopened = new JdbcCanonicalStore(sql);
        assertEquals(survivor.id(), reopened.findMergeTarget(EntityKind.GAME, loser.id()).orElseThrow());
    }
}
