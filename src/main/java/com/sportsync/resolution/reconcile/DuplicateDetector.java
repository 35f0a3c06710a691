package com.sportsync.resolution.reconcile;

import com.sportsync.resolution.api.MatchingOptions;
import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.store.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans the canonical store for rows the unique constraints could not stop.
 *
 * <p>Games: the same sport and matchup with start times chained within the matching tolerance,
 * which happens when two inserts fall into different game-day buckets. Players: the same sport,
 * normalized name, suffix and team. A source id can never point at two rows; the mapping
 * constraint already rules that out.</p>
 */
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final CanonicalStore store;
    private final Duration gameWindow;

    public DuplicateDetector(CanonicalStore store, MatchingOptions options) {
        this(store, options.getTimeTolerance());
    }

    public DuplicateDetector(CanonicalStore store, Duration gameWindow) {
        this.store = store;
        this.gameWindow = gameWindow;
    }

    public List<DuplicateGroup> findGameDuplicates() {
        Map<String, List<CanonicalGame>> byMatchup = new LinkedHashMap<>();
        for (CanonicalGame game : store.findAllGames()) {
            String matchup = game.sport() + "|" + game.homeTeam() + "|" + game.awayTeam();
            byMatchup.computeIfAbsent(matchup, k -> new ArrayList<>()).add(game);
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        for (List<CanonicalGame> games : byMatchup.values()) {
            if (games.size() < 2) {
                continue;
            }
            games.sort(Comparator.comparing(CanonicalGame::scheduledAt).thenComparing(CanonicalGame::id));
            List<String> cluster = new ArrayList<>();
            CanonicalGame previous = null;
            for (CanonicalGame game : games) {
                boolean close = previous != null
                        && Duration.between(previous.scheduledAt(), game.scheduledAt()).compareTo(gameWindow) <= 0;
                if (!close) {
                    addGroup(groups, EntityKind.GAME, cluster, "same matchup within " + gameWindow);
                    cluster = new ArrayList<>();
                }
                cluster.add(game.id());
                previous = game;
            }
            addGroup(groups, EntityKind.GAME, cluster, "same matchup within " + gameWindow);
        }
        log.debug("reconcile.game_duplicates groups={}", groups.size());
        return groups;
    }

    public List<DuplicateGroup> findPlayerDuplicates() {
        Map<String, List<String>> byIdentity = new LinkedHashMap<>();
        for (CanonicalPlayer player : store.findAllPlayers()) {
            if (player.team() == null) {
                continue;
            }
            String identity = player.sport() + "|" + player.normalizedName() + "|" + player.suffix() + "|"
                    + player.team();
            byIdentity.computeIfAbsent(identity, k -> new ArrayList<>()).add(player.id());
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        byIdentity.values().forEach(ids -> addGroup(groups, EntityKind.PLAYER, ids, "same name and team"));
        log.debug("reconcile.player_duplicates groups={}", groups.size());
        return groups;
    }

    private static void addGroup(List<DuplicateGroup> groups, EntityKind kind, List<String> ids, String reason) {
        if (ids.size() >= 2) {
            groups.add(new DuplicateGroup(kind, ids, reason));
        }
    }
}
