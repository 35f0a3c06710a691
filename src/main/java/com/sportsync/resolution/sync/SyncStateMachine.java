package com.sportsync.resolution.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guards the state of one sync job. Every change is a compare-and-set, so two triggers of the same
 * job can never both leave IDLE.
 */
public class SyncStateMachine {
    private static final Logger log = LoggerFactory.getLogger(SyncStateMachine.class);

    /**
     * Called after each successful transition.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(SyncState from, SyncState to);
    }

    private final String jobKey;
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.IDLE);
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public SyncStateMachine(String jobKey) {
        this.jobKey = jobKey;
    }

    public SyncState current() {
        return state.get();
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Moves IDLE to SYNCING if the job is idle.
     *
     * @return false if the job is already running or finishing a run
     */
    public boolean tryStart() {
        if (!state.compareAndSet(SyncState.IDLE, SyncState.SYNCING)) {
            return false;
        }
        fire(SyncState.IDLE, SyncState.SYNCING);
        return true;
    }

    /**
     * Moves from the current state to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transition(SyncState next) {
        while (true) {
            SyncState from = state.get();
            if (!from.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal sync transition for " + jobKey + ": " + from + " -> " + next);
            }
            if (state.compareAndSet(from, next)) {
                fire(from, next);
                return;
            }
        }
    }

    /**
     * Moves {@code expected} to {@code next} only if the job is still in {@code expected}.
     *
     * @return false if another thread changed the state first
     */
    public boolean tryTransition(SyncState expected, SyncState next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal sync transition for " + jobKey + ": " + expected + " -> " + next);
        }
        if (!state.compareAndSet(expected, next)) {
            return false;
        }
        fire(expected, next);
        return true;
    }

    private void fire(SyncState from, SyncState to) {
        log.debug("sync.transition job={} from={} to={}", jobKey, from, to);
        for (TransitionListener listener : listeners) {
            listener.onTransition(from, to);
        }
    }
}
