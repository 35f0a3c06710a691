package com.sportsync.resolution.reconcile;

import com.sportsync.resolution.audit.AuditAction;
import com.sportsync.resolution.audit.AuditLogger;
import com.sportsync.resolution.cache.MergeListener;
import com.sportsync.resolution.core.model.CanonicalGame;
import com.sportsync.resolution.core.model.CanonicalPlayer;
import com.sportsync.resolution.core.model.EntityKind;
import com.sportsync.resolution.logging.LogContext;
import com.sportsync.resolution.metrics.MetricsService;
import com.sportsync.resolution.store.CanonicalStore;
import com.sportsync.resolution.store.MergeIntegrityException;
import com.sportsync.resolution.store.MergeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic sweep that merges duplicate canonical rows into one survivor.
 *
 * <p>Each merge re-points mappings, aliases, predictions and stat lines in the same transaction that
 * deletes the loser. A merge that would break integrity is aborted on its own and both rows stay for
 * the next sweep. The sweep is idempotent: a second run over a clean store finds nothing, and a
 * loser that is already gone is a no-op.</p>
 */
public class ReconciliationJob implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final CanonicalStore store;
    private final DuplicateDetector detector;
    private final SurvivorSelector selector;
    private final AuditLogger auditLogger;
    private final MetricsService metricsService;
    private final String actorId;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock running = new ReentrantLock();

    public ReconciliationJob(CanonicalStore store, DuplicateDetector detector, SurvivorSelector selector,
                             AuditLogger auditLogger, MetricsService metricsService, String actorId) {
        this.store = store;
        this.detector = detector;
        this.selector = selector;
        this.auditLogger = auditLogger;
        this.metricsService = metricsService;
        this.actorId = actorId;
    }

    /**
     * Adds a listener notified after every applied merge.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    @Override
    public void run() {
        reconcile();
    }

    /**
     * Runs one sweep. If a sweep is already running, returns a skipped report immediately.
     */
    public ReconciliationReport reconcile() {
        Instant startedAt = Instant.now();
        if (!running.tryLock()) {
            log.info("reconcile.skipped reason=already_running");
            return ReconciliationReport.skipped(startedAt);
        }
        try {
            List<DuplicateGroup> groups = new ArrayList<>(detector.findGameDuplicates());
            groups.addAll(detector.findPlayerDuplicates());

            Sweep sweep = new Sweep();
            for (DuplicateGroup group : groups) {
                if (group.kind() == EntityKind.GAME) {
                    reconcileGames(group, sweep);
                } else {
                    reconcilePlayers(group, sweep);
                }
            }

            ReconciliationReport report = new ReconciliationReport(startedAt,
                    Duration.between(startedAt, Instant.now()), groups.size(), sweep.merges, sweep.aborted,
                    sweep.alreadyMerged, false);
            log.info("reconcile.completed groups={} merged={} aborted={} alreadyMerged={} durationMs={}",
                    report.groupsFound(), report.merged(), report.aborted(), report.alreadyMerged(),
                    report.duration().toMillis());
            return report;
        } finally {
            running.unlock();
        }
    }

    private void reconcileGames(DuplicateGroup group, Sweep sweep) {
        List<CanonicalGame> games = group.ids().stream()
                .map(store::findGame)
                .flatMap(Optional::stream)
                .toList();
        if (games.size() < 2) {
            return;
        }
        CanonicalGame survivor = selector.selectGame(games);
        for (CanonicalGame loser : games) {
            if (!loser.id().equals(survivor.id())) {
                merge(EntityKind.GAME, survivor.id(), loser.id(), AuditLogger.snapshot(survivor),
                        AuditLogger.snapshot(loser), group.reason(), sweep);
            }
        }
    }

    private void reconcilePlayers(DuplicateGroup group, Sweep sweep) {
        List<CanonicalPlayer> players = group.ids().stream()
                .map(store::findPlayer)
                .flatMap(Optional::stream)
                .toList();
        if (players.size() < 2) {
            return;
        }
        CanonicalPlayer survivor = selector.selectPlayer(players);
        for (CanonicalPlayer loser : players) {
            if (!loser.id().equals(survivor.id())) {
                merge(EntityKind.PLAYER, survivor.id(), loser.id(), AuditLogger.snapshot(survivor),
                        AuditLogger.snapshot(loser), group.reason(), sweep);
            }
        }
    }

    private void merge(EntityKind kind, String survivorId, String loserId, Map<String, Object> survivorState,
                       Map<String, Object> loserState, String reason, Sweep sweep) {
        try (LogContext ignored = LogContext.forMerge(LogContext.generateCorrelationId(), kind, survivorId, loserId)) {
            MergeOutcome outcome;
            try {
                outcome = kind == EntityKind.GAME
                        ? store.mergeGames(survivorId, loserId)
                        : store.mergePlayers(survivorId, loserId);
            } catch (MergeIntegrityException e) {
                sweep.aborted++;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("survivorId", survivorId);
                details.put("loserId", loserId);
                details.put("reason", reason);
                details.put("error", e.getMessage());
                auditLogger.record(AuditAction.MERGE_ABORTED, kind, loserId, actorId, loserState, null, details);
                log.warn("reconcile.merge_aborted kind={} survivorId={} loserId={} error={}",
                        kind.wireName(), survivorId, loserId, e.getMessage());
                return;
            }

            if (outcome.alreadyMerged()) {
                sweep.alreadyMerged++;
                log.debug("reconcile.already_merged kind={} loserId={}", kind.wireName(), loserId);
                return;
            }
            sweep.merges.add(outcome);
            Map<String, Object> details = new LinkedHashMap<>(outcome.asMap());
            details.put("reason", reason);
            auditLogger.record(AuditAction.ENTITY_MERGED, kind, survivorId, actorId, loserState, survivorState,
                    details);
            metricsService.incrementEntityMerged(kind);
            notifyMergeListeners(kind, loserId, survivorId);
            log.info("reconcile.merged kind={} survivorId={} loserId={} mappingsMoved={} predictionsMoved={}",
                    kind.wireName(), survivorId, loserId, outcome.mappingsMoved(), outcome.predictionsMoved());
        }
    }

    private void notifyMergeListeners(EntityKind kind, String loserId, String survivorId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(kind, loserId, survivorId);
            } catch (RuntimeException e) {
                log.warn("reconcile.listener_failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private static final class Sweep {
        final List<MergeOutcome> merges = new ArrayList<>();
        int aborted;
        int alreadyMerged;
    }
}
