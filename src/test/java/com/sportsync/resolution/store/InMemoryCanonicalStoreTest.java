package com.sportsync.resolution.store;

import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.Prediction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCanonicalStore")
class InMemoryCanonicalStoreTest extends AbstractCanonicalStoreTest {

    @Override
    protected CanonicalStore createStore() {
        return new InMemoryCanonicalStore();
    }

    @Test
    @DisplayName("Dependent rows must reference existing entities")
    void dependentsNeedParents() {
        assertThrows(IllegalArgumentException.class,
                () -> store.savePrediction(Prediction.of("missing-game", null, "points")));

        CanonicalGame game = store.createGame(game("LAL", "CHI", TIP_OFF, GAME_DAY), null);
        assertThrows(IllegalArgumentException.class,
                () -> store.savePrediction(Prediction.of(game.id(), "missing-player", "points")));
    }

    @Test
    @DisplayName("Updating an unknown entity fails")
    void updateUnknown() {
        assertThrows(IllegalArgumentException.class,
                () -> store.updateGame(game("LAL", "CHI", TIP_OFF, GAME_DAY)));
        CanonicalPlayer stranger = player("Nobody", "nobody", "", null);
        assertThrows(IllegalArgumentException.class, () -> store.updatePlayer(stranger));
    }
}
