package co.deferworks.lode.driver;

import co.deferworks.lode.core.Job;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * The PostgresJobStore reserves jobs with a single {@code UPDATE ... RETURNING} whose
 * target row is picked by a {@code FOR UPDATE SKIP LOCKED} subquery. Concurrent workers
 * skip rows another transaction is claiming instead of waiting on them, so reservation
 * never blocks and never hands out the same job twice.
 */
public class PostgresJobStore extends AbstractJdbcJobStore {

    private static final String RESERVE_SQL = """
            UPDATE %1$s
            SET reserved_at = ?
            WHERE id = (
                SELECT id
                FROM %1$s
                WHERE %2$s%3$s
                ORDER BY %4$s
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING %5$s
            """;

    private final String reserveSql;
    private final String reserveFromQueueSql;

    public PostgresJobStore(DataSource dataSource) {
        this(dataSource, DEFAULT_JOBS_TABLE, DEFAULT_FAILED_JOBS_TABLE);
    }

    public PostgresJobStore(DataSource dataSource, String jobsTable, String failedJobsTable) {
        super(dataSource, jobsTable, failedJobsTable);
        this.reserveSql = RESERVE_SQL.formatted(this.jobsTable, ELIGIBLE, "", RESERVATION_ORDER, JOB_COLUMNS);
        this.reserveFromQueueSql =
                RESERVE_SQL.formatted(this.jobsTable, ELIGIBLE, " AND queue = ?", RESERVATION_ORDER, JOB_COLUMNS);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public Optional<Job> reserve(String queue, OffsetDateTime now, OffsetDateTime staleBefore) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(queue != null ? reserveFromQueueSql : reserveSql)) {

            setTimestamp(statement, 1, now);
            setTimestamp(statement, 2, staleBefore);
            setTimestamp(statement, 3, now);
            if (queue != null) {
                statement.setString(4, queue);
            }

            try (var resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(mapRowToJob(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error reserving job", e);
        }
    }
}
