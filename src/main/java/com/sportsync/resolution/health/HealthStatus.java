package com.sportsync.resolution.health;

import com.sportsync.resolution.sync.SyncStatusReport;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one health check, or of the registry as a whole.
 *
 * @param status    UP, DEGRADED or DOWN
 * @param message   what the worst finding was, "OK" when there is none
 * @param details   check-specific values (job outcomes, pending reviews, database product)
 * @param checkedAt when the check ran
 */
public record HealthStatus(Status status, String message, Map<String, Object> details, Instant checkedAt) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        /**
         * Sync health as an engine status: healthy is UP, degraded stays DEGRADED, unhealthy is DOWN.
         */
        public static Status of(SyncStatusReport.Health health) {
            return switch (health) {
                case HEALTHY -> UP;
                case DEGRADED -> DEGRADED;
                case UNHEALTHY -> DOWN;
            };
        }

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status");
        message = message != null ? message : status.name();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        checkedAt = checkedAt != null ? checkedAt : Instant.now();
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of(), Instant.now());
    }

    public static HealthStatus up() {
        return of(Status.UP, "OK");
    }

    public static HealthStatus degraded(String reason) {
        return of(Status.DEGRADED, reason);
    }

    public static HealthStatus down(String reason) {
        return of(Status.DOWN, reason);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(details);
        next.put(key, value);
        return new HealthStatus(status, message, next, checkedAt);
    }

    /**
     * True when this status is strictly worse than {@code other}; ties keep the earlier finding.
     */
    public boolean isWorseThan(Status other) {
        return status.ordinal() > other.ordinal();
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
