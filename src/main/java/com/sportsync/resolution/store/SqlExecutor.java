package com.sportsync.resolution.store;

import com.sportsync.resolution.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Thin JDBC helper shared by the SQL-backed repositories.
 * Runs statements with positional parameters, maps rows and translates constraint violations
 * into {@link ConflictException} and {@link MergeIntegrityException}. A value the database refuses
 * (SQLState class 22) concerns one record and becomes a {@link ValidationException}.
 */
public class SqlExecutor {
    private static final Logger log = LoggerFactory.getLogger(SqlExecutor.class);

    static final String UNIQUE_VIOLATION = "23505";
    static final String FOREIGN_KEY_VIOLATION = "23503";
    /** SQLState class for data exceptions: value too long, out of range, bad format. */
    static final String DATA_EXCEPTION_CLASS = "22";

    private static final List<String> KNOWN_CONSTRAINTS = List.of(
            ConflictException.GAME_NATURAL_KEY,
            ConflictException.GAME_SOURCE_ID,
            ConflictException.GAME_CANONICAL_SOURCE,
            ConflictException.PLAYER_SOURCE_ID,
            ConflictException.PLAYER_CANONICAL_SOURCE,
            ConflictException.PLAYER_ALIAS,
            "uq_review_items_record",
            "uq_sync_metadata_job",
            "uq_merge_history_loser"
    );

    private final DataSource dataSource;

    public SqlExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    /**
     * Runs the work in a single transaction. Commits on success and rolls back on any failure.
     */
    public <T> T inTransaction(TransactionWork<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException e) {
                rollback(connection, e);
                throw translate(e);
            } catch (RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        try (Connection connection = dataSource.getConnection()) {
            return query(connection, sql, mapper, params);
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int update(String sql, Object... params) {
        try (Connection connection = dataSource.getConnection()) {
            return update(connection, sql, params);
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    public static <T> List<T> query(Connection connection, String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        }
    }

    public static int update(Connection connection, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        }
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            int index = i + 1;
            if (param == null) {
                ps.setNull(index, Types.NULL);
            } else if (param instanceof Instant instant) {
                ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
            } else if (param instanceof Enum<?> e) {
                ps.setString(index, e.name());
            } else {
                ps.setObject(index, param);
            }
        }
    }

    RuntimeException translate(SQLException e) {
        String state = e.getSQLState();
        if (UNIQUE_VIOLATION.equals(state)) {
            String constraint = constraintOf(e);
            log.debug("sql.conflict constraint={} message={}", constraint, e.getMessage());
            return new ConflictException(constraint, "Unique constraint violated: " + constraint, e);
        }
        if (FOREIGN_KEY_VIOLATION.equals(state)) {
            return new MergeIntegrityException("Foreign key violated: " + e.getMessage(), e);
        }
        if (state != null && state.startsWith(DATA_EXCEPTION_CLASS)) {
            log.debug("sql.data_rejected state={} message={}", state, e.getMessage());
            return new ValidationException(null, "value rejected by the database (state " + state + "): "
                    + e.getMessage(), e);
        }
        return new StoreException("SQL failure (state " + state + "): " + e.getMessage(), e);
    }

    static String constraintOf(SQLException e) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        for (String name : KNOWN_CONSTRAINTS) {
            if (message.contains(name)) {
                return name;
            }
        }
        return ConflictException.UNKNOWN;
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("sql.rollback.failed message={}", rollbackFailure.getMessage());
        }
    }
}
