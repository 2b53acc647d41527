package com.equipment.analytics.repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;

/**
 * In-memory H2 databases in PostgreSQL mode, initialised with the Flyway migration script.
 */
public final class H2Databases {

    private static final String MIGRATION = "classpath:db/migration/V1__create_dataset_tables.sql";

    private H2Databases() {
    }

    /**
     * @return a data source on a fresh, private, migrated database
     */
    public static DataSource fresh() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        dataSource.setUser("sa");
        dataSource.setPassword("");

        try (Connection conn = dataSource.getConnection();
             Statement statement = conn.createStatement()) {
            statement.execute("RUNSCRIPT FROM '" + MIGRATION + "'");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to migrate test database", e);
        }
        return dataSource;
    }
}
