package com.sportsync.resolution.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Borrows a connection and validates it, reporting the round-trip latency.
 */
public class DataSourceHealthCheck implements HealthCheck {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    public DataSourceHealthCheck(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(VALIDATION_TIMEOUT_SECONDS);
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus base = valid
                    ? HealthStatus.up()
                    : HealthStatus.down("Connection failed validation");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("product", connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            return HealthStatus.down("Database connection failed: " + e.getMessage())
                    .withDetail("sqlState", String.valueOf(e.getSQLState()));
        }
    }
}
