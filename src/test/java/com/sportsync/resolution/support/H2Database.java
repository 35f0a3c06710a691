package com.sportsync.resolution.support;

import com.sportsync.resolution.store.SchemaInitializer;
import com.sportsync.resolution.store.SqlExecutor;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * A private in-memory H2 database in PostgreSQL mode, with the schema applied.
 */
public final class H2Database {

    private H2Database() {
    }

    public static DataSource newDataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    public static SqlExecutor newExecutor() {
        SqlExecutor executor = new SqlExecutor(newDataSource());
        new SchemaInitializer(executor).initialize();
        return executor;
    }
}
