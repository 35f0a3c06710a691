package com.sportsync.resolution.health;

/**
 * A single named check: sync jobs, review backlog, database.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
