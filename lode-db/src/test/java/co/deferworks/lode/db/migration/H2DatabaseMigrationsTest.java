package co.deferworks.lode.db.migration;

import co.deferworks.lode.db.DatabaseMigrations;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2DatabaseMigrationsTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    @Test
    void createsBothTables() throws SQLException {
        assertEquals(1, DatabaseMigrations.runMigrations(dataSource));

        try (var conn = dataSource.getConnection();
             var st = conn.createStatement()) {
            var jobs = st.executeQuery("SELECT COUNT(*) FROM jobs");
            assertTrue(jobs.next());
            assertEquals(0, jobs.getInt(1));

            var failedJobs = st.executeQuery("SELECT COUNT(*) FROM failed_jobs");
            assertTrue(failedJobs.next());
            assertEquals(0, failedJobs.getInt(1));
        }
    }

    @Test
    void secondRunAppliesNothing() {
        DatabaseMigrations.runMigrations(dataSource);
        assertEquals(0, DatabaseMigrations.runMigrations(dataSource));
    }

    @Test
    void failedJobUuidIsUnique() throws SQLException {
        DatabaseMigrations.runMigrations(dataSource);
        var uuid = UUID.randomUUID();
        var sql = "INSERT INTO failed_jobs (uuid, queue, kind, payload, failed_at) VALUES (?, 'default', 'k', '{}', ?)";

        try (var conn = dataSource.getConnection()) {
            try (var statement = conn.prepareStatement(sql)) {
                statement.setObject(1, uuid);
                statement.setObject(2, OffsetDateTime.now(ZoneOffset.UTC));
                statement.executeUpdate();
            }
            try (var statement = conn.prepareStatement(sql)) {
                statement.setObject(1, uuid);
                statement.setObject(2, OffsetDateTime.now(ZoneOffset.UTC));
                assertThrows(SQLException.class, statement::executeUpdate);
            }
        }
    }
}
