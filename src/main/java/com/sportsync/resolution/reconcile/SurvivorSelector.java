package com.sportsync.resolution.reconcile;

import com.sportsync.resolution.api.MatchingOptions;
import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Picks the row that survives a merge: highest primary-source authority, then earliest created,
 * then smallest id so the choice is stable across runs.
 */
public class SurvivorSelector {

    private final MatchingOptions options;

    public SurvivorSelector(MatchingOptions options) {
        this.options = options;
    }

    public CanonicalGame selectGame(List<CanonicalGame> games) {
        return select(games, CanonicalGame::primarySource, CanonicalGame::createdAt, CanonicalGame::id);
    }

    public CanonicalPlayer selectPlayer(List<CanonicalPlayer> players) {
        return select(players, CanonicalPlayer::primarySource, CanonicalPlayer::createdAt, CanonicalPlayer::id);
    }

    private <T> T select(List<T> rows, Function<T, String> source, Function<T, Instant> createdAt,
                         Function<T, String> id) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("No rows to choose a survivor from");
        }
        Comparator<T> order = Comparator.<T>comparingInt(row -> authority(source.apply(row))).reversed()
                .thenComparing(createdAt)
                .thenComparing(id);
        return rows.stream().min(order).orElseThrow();
    }

    private int authority(String source) {
        return source != null ? options.sourceProfile(source).authority() : Integer.MIN_VALUE;
    }
}
