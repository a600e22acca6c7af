package co.deferworks.lode.driver;

import co.deferworks.lode.core.BackoffStrategy;
import co.deferworks.lode.core.FailedJob;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * JDBC job store built from plain SQL that runs on PostgreSQL and H2 alike.
 * <p>
 * Reservation reads a handful of candidate ids in eligibility order and then claims one
 * with a conditional update that repeats the eligibility test on that single row. Whoever
 * gets an update count of one owns the job; everybody else moves on to the next candidate.
 * Dialects with row-skipping locks override {@link #reserve} with a single statement.
 */
public abstract class AbstractJdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractJdbcJobStore.class);

    public static final String DEFAULT_JOBS_TABLE = "jobs";
    public static final String DEFAULT_FAILED_JOBS_TABLE = "failed_jobs";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    static final int CLAIM_CANDIDATES = 8;
    static final int CLAIM_ROUNDS = 3;

    protected static final String JOB_COLUMNS =
            "id, queue, kind, payload, priority, attempts, max_attempts, backoff_strategy, retry_delay, "
                    + "tags, last_error, reserved_at, available_at, created_at";

    protected static final String FAILED_JOB_COLUMNS =
            "id, uuid, queue, kind, payload, tags, exception, priority, attempts, original_job_id, failed_at";

    private static final String TAG_SEPARATOR = ",";

    protected static final String ELIGIBLE =
            "(reserved_at IS NULL OR reserved_at <= ?) AND available_at <= ?";

    protected static final String RESERVATION_ORDER = "priority ASC, available_at ASC, id ASC";

    protected final DataSource dataSource;
    protected final String jobsTable;
    protected final String failedJobsTable;

    private final String insertJobSql;
    private final String findByIdSql;
    private final String claimSql;
    private final String completeSql;
    private final String releaseSql;
    private final String insertFailedJobSql;
    private final String releaseStaleSql;
    private final String findFailedSql;
    private final String findFailedByIdSql;
    private final String findFailedByTagSql;
    private final String deleteFailedByIdSql;
    private final String deleteFailedBeforeSql;

    protected AbstractJdbcJobStore(DataSource dataSource) {
        this(dataSource, DEFAULT_JOBS_TABLE, DEFAULT_FAILED_JOBS_TABLE);
    }

    protected AbstractJdbcJobStore(DataSource dataSource, String jobsTable, String failedJobsTable) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.jobsTable = validateTableName(jobsTable);
        this.failedJobsTable = validateTableName(failedJobsTable);

        this.insertJobSql = """
                INSERT INTO %s (queue, kind, payload, priority, attempts, max_attempts, backoff_strategy,
                                retry_delay, tags, last_error, reserved_at, available_at, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(this.jobsTable);
        this.findByIdSql = "SELECT " + JOB_COLUMNS + " FROM " + this.jobsTable + " WHERE id = ?";
        this.claimSql = "UPDATE " + this.jobsTable + " SET reserved_at = ? WHERE id = ? AND " + ELIGIBLE;
        this.completeSql = "DELETE FROM " + this.jobsTable + " WHERE id = ? AND reserved_at = ?";
        this.releaseSql = """
                UPDATE %s
                SET reserved_at = NULL, attempts = ?, available_at = ?, last_error = ?
                WHERE id = ? AND reserved_at = ?
                """.formatted(this.jobsTable);
        this.insertFailedJobSql = """
                INSERT INTO %s (uuid, queue, kind, payload, tags, exception, priority, attempts, original_job_id,
                                failed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(this.failedJobsTable);
        this.releaseStaleSql = "UPDATE " + this.jobsTable
                + " SET reserved_at = NULL WHERE reserved_at IS NOT NULL AND reserved_at <= ?";
        this.findFailedSql = "SELECT " + FAILED_JOB_COLUMNS + " FROM " + this.failedJobsTable
                + " ORDER BY failed_at DESC, id DESC LIMIT ? OFFSET ?";
        this.findFailedByIdSql = "SELECT " + FAILED_JOB_COLUMNS + " FROM " + this.failedJobsTable + " WHERE id = ?";
        // Wrapping the stored list in separators lets one LIKE match a whole tag only.
        this.findFailedByTagSql = "SELECT " + FAILED_JOB_COLUMNS + " FROM " + this.failedJobsTable
                + " WHERE ',' || tags || ',' LIKE ? ORDER BY failed_at DESC, id DESC LIMIT ? OFFSET ?";
        this.deleteFailedByIdSql = "DELETE FROM " + this.failedJobsTable + " WHERE id = ?";
        this.deleteFailedBeforeSql = "DELETE FROM " + this.failedJobsTable + " WHERE failed_at <= ?";
    }

    static String validateTableName(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }

    /**
     * Short name of the database this store targets, used in log lines.
     */
    public abstract String name();

    @Override
    public Job insert(Job job) {
        try (var connection = dataSource.getConnection()) {
            return insert(job, connection);
        } catch (SQLException e) {
            throw new JobStoreException("Error inserting job", e);
        }
    }

    @Override
    public Job insert(Job job, Connection connection) {
        try (var statement = connection.prepareStatement(insertJobSql, Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, job.queue());
            statement.setString(2, job.kind());
            statement.setString(3, job.payload());
            statement.setInt(4, job.priority());
            statement.setInt(5, job.attempts());
            setNullableInt(statement, 6, job.maxAttempts());
            statement.setString(7, job.backoffStrategy() == null ? null : job.backoffStrategy().name());
            setNullableInt(statement, 8, job.retryDelaySeconds());
            statement.setString(9, joinTags(job.tags()));
            statement.setString(10, job.lastError());
            setTimestamp(statement, 11, job.reservedAt());
            setTimestamp(statement, 12, job.availableAt());
            setTimestamp(statement, 13, job.createdAt());
            statement.executeUpdate();

            try (var keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new JobStoreException("Failed to insert job, no id generated", null);
                }
                return job.toBuilder().id(keys.getLong(1)).build();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error inserting job", e);
        }
    }

    @Override
    public Optional<Job> findById(long id) {
        try (var connection = dataSource.getConnection()) {
            return findById(id, connection);
        } catch (SQLException e) {
            throw new JobStoreException("Error finding job by id", e);
        }
    }

    protected Optional<Job> findById(long id, Connection connection) throws SQLException {
        try (var statement = connection.prepareStatement(findByIdSql)) {
            statement.setLong(1, id);
            try (var resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(mapRowToJob(resultSet)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Job> reserve(String queue, OffsetDateTime now, OffsetDateTime staleBefore) {
        try (var connection = dataSource.getConnection()) {
            for (int round = 0; round < CLAIM_ROUNDS; round++) {
                List<Long> candidates = selectCandidates(connection, queue, now, staleBefore);
                if (candidates.isEmpty()) {
                    return Optional.empty();
                }
                for (Long id : candidates) {
                    if (claim(connection, id, now, staleBefore)) {
                        return findById(id, connection);
                    }
                }
                log.debug("Lost every reservation race in round {} on {}", round, jobsTable);
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new JobStoreException("Error reserving job", e);
        }
    }

    private List<Long> selectCandidates(Connection connection, String queue, OffsetDateTime now,
                                        OffsetDateTime staleBefore) throws SQLException {
        var sql = "SELECT id FROM " + jobsTable + " WHERE " + ELIGIBLE
                + (queue != null ? " AND queue = ?" : "")
                + " ORDER BY " + RESERVATION_ORDER + " LIMIT " + CLAIM_CANDIDATES;
        try (var statement = connection.prepareStatement(sql)) {
            setTimestamp(statement, 1, staleBefore);
            setTimestamp(statement, 2, now);
            if (queue != null) {
                statement.setString(3, queue);
            }
            var ids = new ArrayList<Long>(CLAIM_CANDIDATES);
            try (var resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    ids.add(resultSet.getLong(1));
                }
            }
            return ids;
        }
    }

    private boolean claim(Connection connection, long id, OffsetDateTime now, OffsetDateTime staleBefore)
            throws SQLException {
        try (var statement = connection.prepareStatement(claimSql)) {
            setTimestamp(statement, 1, now);
            statement.setLong(2, id);
            setTimestamp(statement, 3, staleBefore);
            setTimestamp(statement, 4, now);
            return statement.executeUpdate() == 1;
        } catch (SQLException e) {
            if (isLostRace(e)) {
                log.debug("Reservation of job {} lost to a concurrent worker: {}", id, e.getMessage());
                return false;
            }
            throw e;
        }
    }

    /**
     * Whether the error means another transaction touched the row first. Such errors end
     * one claim attempt, not the reservation.
     */
    protected boolean isLostRace(SQLException e) {
        return "40001".equals(e.getSQLState());
    }

    @Override
    public boolean complete(Job reserved) {
        requireReserved(reserved);
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(completeSql)) {
            statement.setLong(1, reserved.id());
            setTimestamp(statement, 2, reserved.reservedAt());
            return statement.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new JobStoreException("Error completing job " + reserved.id(), e);
        }
    }

    @Override
    public boolean release(Job reserved, int attempts, OffsetDateTime availableAt, String lastError) {
        requireReserved(reserved);
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(releaseSql)) {
            statement.setInt(1, attempts);
            setTimestamp(statement, 2, availableAt);
            statement.setString(3, lastError);
            statement.setLong(4, reserved.id());
            setTimestamp(statement, 5, reserved.reservedAt());
            return statement.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new JobStoreException("Error releasing job " + reserved.id(), e);
        }
    }

    @Override
    public boolean bury(Job reserved, FailedJob failedJob) {
        requireReserved(reserved);
        return inTransaction("burying job " + reserved.id(), connection -> {
            try (var delete = connection.prepareStatement(completeSql)) {
                delete.setLong(1, reserved.id());
                setTimestamp(delete, 2, reserved.reservedAt());
                if (delete.executeUpdate() != 1) {
                    connection.rollback();
                    return false;
                }
            }
            insertFailedJob(connection, failedJob);
            return true;
        });
    }

    private void insertFailedJob(Connection connection, FailedJob failedJob) throws SQLException {
        try (var statement = connection.prepareStatement(insertFailedJobSql)) {
            statement.setObject(1, failedJob.uuid());
            statement.setString(2, failedJob.queue());
            statement.setString(3, failedJob.kind());
            statement.setString(4, failedJob.payload());
            statement.setString(5, joinTags(failedJob.tags()));
            statement.setString(6, failedJob.exception());
            statement.setInt(7, failedJob.priority());
            statement.setInt(8, failedJob.attempts());
            if (failedJob.originalJobId() == null) {
                statement.setNull(9, Types.BIGINT);
            } else {
                statement.setLong(9, failedJob.originalJobId());
            }
            setTimestamp(statement, 10, failedJob.failedAt());
            statement.executeUpdate();
        }
    }

    @Override
    public int releaseStale(OffsetDateTime staleBefore) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(releaseStaleSql)) {
            setTimestamp(statement, 1, staleBefore);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Error releasing stale reservations", e);
        }
    }

    @Override
    public QueueStats stats(String queue, OffsetDateTime now) {
        var queueFilter = queue != null ? " WHERE queue = ?" : "";
        var jobCounts = """
                SELECT
                    COUNT(CASE WHEN reserved_at IS NULL THEN 1 END),
                    COUNT(CASE WHEN reserved_at IS NULL AND available_at > ? THEN 1 END),
                    COUNT(reserved_at)
                FROM %s%s
                """.formatted(jobsTable, queueFilter);
        var failedCount = "SELECT COUNT(*) FROM " + failedJobsTable + queueFilter;

        try (var connection = dataSource.getConnection()) {
            long pending;
            long delayed;
            long reserved;
            try (var statement = connection.prepareStatement(jobCounts)) {
                setTimestamp(statement, 1, now);
                if (queue != null) {
                    statement.setString(2, queue);
                }
                try (var resultSet = statement.executeQuery()) {
                    resultSet.next();
                    pending = resultSet.getLong(1);
                    delayed = resultSet.getLong(2);
                    reserved = resultSet.getLong(3);
                }
            }
            long failed;
            try (var statement = connection.prepareStatement(failedCount)) {
                if (queue != null) {
                    statement.setString(1, queue);
                }
                try (var resultSet = statement.executeQuery()) {
                    resultSet.next();
                    failed = resultSet.getLong(1);
                }
            }
            return new QueueStats(queue, pending, delayed, reserved, failed);
        } catch (SQLException e) {
            throw new JobStoreException("Error reading queue stats", e);
        }
    }

    @Override
    public List<FailedJob> findFailed(int limit, int offset) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(findFailedSql)) {
            statement.setInt(1, limit);
            statement.setInt(2, offset);
            var failedJobs = new ArrayList<FailedJob>();
            try (var resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    failedJobs.add(mapRowToFailedJob(resultSet));
                }
            }
            return failedJobs;
        } catch (SQLException e) {
            throw new JobStoreException("Error listing failed jobs", e);
        }
    }

    @Override
    public List<FailedJob> findFailedByTag(String tag, int limit, int offset) {
        Objects.requireNonNull(tag, "tag");
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(findFailedByTagSql)) {
            statement.setString(1, "%," + escapeLike(tag) + ",%");
            statement.setInt(2, limit);
            statement.setInt(3, offset);
            var failedJobs = new ArrayList<FailedJob>();
            try (var resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    failedJobs.add(mapRowToFailedJob(resultSet));
                }
            }
            return failedJobs;
        } catch (SQLException e) {
            throw new JobStoreException("Error listing failed jobs by tag", e);
        }
    }

    @Override
    public Optional<FailedJob> findFailedById(long id) {
        try (var connection = dataSource.getConnection()) {
            return findFailedById(id, connection);
        } catch (SQLException e) {
            throw new JobStoreException("Error finding failed job by id", e);
        }
    }

    private Optional<FailedJob> findFailedById(long id, Connection connection) throws SQLException {
        try (var statement = connection.prepareStatement(findFailedByIdSql)) {
            statement.setLong(1, id);
            try (var resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(mapRowToFailedJob(resultSet)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Long> findFailedIds(String queue) {
        var sql = "SELECT id FROM " + failedJobsTable
                + (queue != null ? " WHERE queue = ?" : "")
                + " ORDER BY failed_at ASC, id ASC";
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(sql)) {
            if (queue != null) {
                statement.setString(1, queue);
            }
            var ids = new ArrayList<Long>();
            try (var resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    ids.add(resultSet.getLong(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new JobStoreException("Error listing failed job ids", e);
        }
    }

    @Override
    public Optional<Job> requeueFailed(long failedJobId, OffsetDateTime now) {
        return inTransaction("requeueing failed job " + failedJobId, connection -> {
            Optional<FailedJob> failed = findFailedById(failedJobId, connection);
            if (failed.isEmpty()) {
                return Optional.empty();
            }
            try (var delete = connection.prepareStatement(deleteFailedByIdSql)) {
                delete.setLong(1, failedJobId);
                if (delete.executeUpdate() != 1) {
                    // Somebody else requeued or purged it in the meantime.
                    connection.rollback();
                    return Optional.empty();
                }
            }
            var failedJob = failed.get();
            var job = Job.builder()
                    .kind(failedJob.kind())
                    .queue(failedJob.queue())
                    .payload(failedJob.payload())
                    .priority(failedJob.priority())
                    .tags(failedJob.tags())
                    .availableAt(now)
                    .createdAt(now)
                    .build();
            return Optional.of(insert(job, connection));
        });
    }

    @Override
    public int deleteFailed(String queue) {
        var sql = "DELETE FROM " + failedJobsTable + (queue != null ? " WHERE queue = ?" : "");
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(sql)) {
            if (queue != null) {
                statement.setString(1, queue);
            }
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Error deleting failed jobs", e);
        }
    }

    @Override
    public int deleteFailedBefore(OffsetDateTime threshold) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(deleteFailedBeforeSql)) {
            setTimestamp(statement, 1, threshold);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Error purging failed jobs", e);
        }
    }

    @FunctionalInterface
    protected interface TransactionWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Runs {@code work} on one connection with auto-commit off and commits when it returns.
     * Work that calls {@link Connection#rollback()} itself leaves nothing to commit.
     */
    protected <T> T inTransaction(String action, TransactionWork<T> work) {
        try (var connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error " + action, e);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static void requireReserved(Job job) {
        if (job.id() == null || job.reservedAt() == null) {
            throw new IllegalArgumentException("Job is not a reserved job: " + job);
        }
    }

    protected static void setTimestamp(PreparedStatement statement, int index, OffsetDateTime value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            statement.setObject(index, value);
        }
    }

    private static void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static String joinTags(List<String> tags) {
        return tags.isEmpty() ? null : String.join(TAG_SEPARATOR, tags);
    }

    private static List<String> splitTags(String tags) {
        return tags == null || tags.isEmpty() ? List.of() : List.of(tags.split(TAG_SEPARATOR));
    }

    // H2 and PostgreSQL both treat backslash as the default LIKE escape.
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static OffsetDateTime getTimestamp(ResultSet rs, String column) throws SQLException {
        var value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.withOffsetSameInstant(ZoneOffset.UTC);
    }

    protected Job mapRowToJob(ResultSet rs) throws SQLException {
        var backoff = rs.getString("backoff_strategy");
        return Job.builder()
                .id(rs.getLong("id"))
                .queue(rs.getString("queue"))
                .kind(rs.getString("kind"))
                .payload(rs.getString("payload"))
                .priority(rs.getInt("priority"))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(getNullableInt(rs, "max_attempts"))
                .backoffStrategy(backoff == null ? null : BackoffStrategy.parse(backoff))
                .retryDelaySeconds(getNullableInt(rs, "retry_delay"))
                .tags(splitTags(rs.getString("tags")))
                .lastError(rs.getString("last_error"))
                .reservedAt(getTimestamp(rs, "reserved_at"))
                .availableAt(getTimestamp(rs, "available_at"))
                .createdAt(getTimestamp(rs, "created_at"))
                .build();
    }

    protected FailedJob mapRowToFailedJob(ResultSet rs) throws SQLException {
        long originalJobId = rs.getLong("original_job_id");
        Long original = rs.wasNull() ? null : originalJobId;
        return new FailedJob(
                rs.getLong("id"),
                rs.getObject("uuid", UUID.class),
                rs.getString("queue"),
                rs.getString("kind"),
                rs.getString("payload"),
                splitTags(rs.getString("tags")),
                rs.getString("exception"),
                rs.getInt("priority"),
                rs.getInt("attempts"),
                original,
                getTimestamp(rs, "failed_at"));
    }
}
