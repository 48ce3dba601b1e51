package org.unicitylabs.hydrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Pooled HSQLDB data source and schema migration.
 */
public final class StoreDataSources {

    private static final Logger logger = LoggerFactory.getLogger(StoreDataSources.class);
    public static final String DEFAULT_JDBC_URL = "jdbc:hsqldb:mem:hydrator";
    private static final String MIGRATION_LOCATION = "classpath:db/migration";

    /**
     * Open a small connection pool. File databases should use a URL such as
     * {@code jdbc:hsqldb:file:/var/lib/hydrator/events;hsqldb.tx=mvcc}.
     */
    public static HikariDataSource create(String jdbcUrl, String username, String password) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("hydrator-store");
        if (jdbcUrl.startsWith("jdbc:hsqldb:")) {
            cfg.setDriverClassName("org.hsqldb.jdbc.JDBCDriver");
        }
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(username != null ? username : "SA");
        cfg.setPassword(password != null ? password : "");

        cfg.setMaximumPoolSize(4);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(5_000);
        cfg.setValidationTimeout(5_000);
        cfg.setIdleTimeout(60_000);

        logger.info("Opening record store at {}", jdbcUrl);
        return new HikariDataSource(cfg);
    }

    /**
     * Bring the schema up to date.
     */
    public static void migrate(DataSource dataSource) {
        MigrateResult result = Flyway.configure()
                .dataSource(dataSource)
                .locations(MIGRATION_LOCATION)
                .load()
                .migrate();
        logger.info("Record store schema migrated ({} migration(s) applied)", result.migrationsExecuted);
    }

    private StoreDataSources() {
        // Utility class
    }
}
