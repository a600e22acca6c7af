package co.deferworks.lode.driver;

import co.deferworks.lode.core.JobResolver;
import co.deferworks.lode.db.DatabaseMigrations;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Wires a connection pool, the schema, a job store and an engine together for one
 * database.
 */
public class LodeDriver {

    private static final Logger log = LoggerFactory.getLogger(LodeDriver.class);

    private final HikariDataSource dataSource;
    private final QueueManager queueManager;
    private final LodeEngine lodeEngine;

    public LodeDriver(String jdbcUrl, String username, String password, JobResolver resolver, int numberOfWorkers) {
        this(jdbcUrl, username, password, resolver, numberOfWorkers, QueueConfig.defaults());
    }

    public LodeDriver(String jdbcUrl, String username, String password, JobResolver resolver, int numberOfWorkers,
                      QueueConfig queueConfig) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(Math.max(10, numberOfWorkers + 2));
        config.setMinimumIdle(2);
        config.setPoolName("lode");

        this.dataSource = new HikariDataSource(config);
        try {
            DatabaseMigrations.runMigrations(dataSource);
            var store = JobStores.forJdbcUrl(jdbcUrl, dataSource);
            log.info("Using {} job store.", store.name());
            this.queueManager = new QueueManager(store, resolver, queueConfig);
            this.lodeEngine = new LodeEngine(queueManager, numberOfWorkers);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Borrows a pooled connection, for example to enqueue jobs inside an application
     * transaction.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public void start() {
        log.info("Starting LodeDriver...");
        lodeEngine.start();
        log.info("LodeDriver started.");
    }

    public void shutdown() {
        log.info("Shutting down LodeDriver...");
        lodeEngine.shutdown();
        dataSource.close();
        log.info("LodeDriver shut down.");
    }

    public QueueManager getQueueManager() {
        return queueManager;
    }
}
