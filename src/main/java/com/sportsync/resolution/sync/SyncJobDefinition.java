package com.sportsync.resolution.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * What to sync and how often.
 *
 * @param source   source name
 * @param dataType data type fetched from the source
 * @param interval delay between the end of one run and the start of the next
 * @param timeout  run timeout, null for the orchestrator default
 */
public record SyncJobDefinition(String source, String dataType, Duration interval, Duration timeout) {

    public static final String GAMES = "games";
    public static final String ODDS = "odds";
    public static final String PLAYER_STATS = "player_stats";

    /** Reconciliation sweep interval used when nothing else is configured. */
    public static final Duration RECONCILIATION_INTERVAL = Duration.ofMinutes(15);

    public SyncJobDefinition {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(interval, "interval is required");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    /** Schedules twice daily. */
    public static SyncJobDefinition games(String source) {
        return new SyncJobDefinition(source, GAMES, Duration.ofHours(12), null);
    }

    /** Every five minutes. */
    public static SyncJobDefinition odds(String source) {
        return new SyncJobDefinition(source, ODDS, Duration.ofMinutes(5), null);
    }

    /** Hourly. */
    public static SyncJobDefinition playerStats(String source) {
        return new SyncJobDefinition(source, PLAYER_STATS, Duration.ofHours(1), null);
    }

    public SyncJobDefinition withTimeout(Duration newTimeout) {
        return new SyncJobDefinition(source, dataType, interval, newTimeout);
    }

    public String jobKey() {
        return SyncMetadata.jobKey(source, dataType);
    }
}
