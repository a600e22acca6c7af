package co.deferworks.lode.db;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Applies the {@code jobs} and {@code failed_jobs} schema with Flyway. The scripts live
 * under {@code classpath:db/migration} and run on PostgreSQL and H2 alike.
 */
public class DatabaseMigrations {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMigrations.class);

    public static final String LOCATION = "classpath:db/migration";

    public static int runMigrations(String jdbcUrl, String username, String password) {
        Flyway flyway = Flyway.configure(DatabaseMigrations.class.getClassLoader())
                .dataSource(jdbcUrl, username, password)
                .locations(LOCATION)
                .load();
        return migrate(flyway);
    }

    public static int runMigrations(DataSource dataSource) {
        Flyway flyway = Flyway.configure(DatabaseMigrations.class.getClassLoader())
                .dataSource(dataSource)
                .locations(LOCATION)
                .load();
        return migrate(flyway);
    }

    private static int migrate(Flyway flyway) {
        var result = flyway.migrate();
        log.info("Applied {} migration(s), schema now at version {}.", result.migrationsExecuted,
                result.targetSchemaVersion);
        return result.migrationsExecuted;
    }
}
