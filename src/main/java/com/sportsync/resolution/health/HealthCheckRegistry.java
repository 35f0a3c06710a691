package com.sportsync.resolution.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered check and reports the worst status.
 *
 * <p>A check that throws counts as DOWN. Per-check results go into the aggregate's details,
 * keyed by check name.</p>
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.of(HealthStatus.Status.UP, "No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.isWorseThan(worst)) {
                worst = worst.worse(result.status());
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check_failed check={} error={}", check.getName(), e.getMessage());
            return HealthStatus.down("Check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
