package co.deferworks.lode.driver;

import co.deferworks.lode.core.FailedJob;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.QueueStats;

import java.sql.Connection;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * The JobStore interface defines every read and write on the {@code jobs} and
 * {@code failed_jobs} tables. Nothing else in the queue touches those tables, so the
 * atomicity guarantees below are the guarantees of the whole queue.
 * <p>
 * Operations that act on a reserved job take the {@link Job} returned by
 * {@link #reserve(String, OffsetDateTime, OffsetDateTime)} and only apply while the row is
 * still held under that same reservation. A worker whose lease expired, and whose job was
 * reserved again by someone else, gets {@code false} back instead of clobbering the new
 * holder's state.
 * <p>
 * All methods throw {@link JobStoreException} when the database cannot be reached or
 * rejects a statement.
 */
public interface JobStore {

    /**
     * Enqueues a new job by inserting it into the database.
     *
     * @param job The job to be enqueued; its id is ignored.
     * @return The stored job, including its generated ID.
     */
    Job insert(Job job);

    /**
     * Enqueues a new job within an existing transaction. The job becomes visible to
     * workers only once the caller commits.
     *
     * @param job        The job to be enqueued; its id is ignored.
     * @param connection The existing JDBC connection to use for the transaction.
     * @return The stored job, including its generated ID.
     */
    Job insert(Job job, Connection connection);

    /**
     * Retrieves a job by its unique ID.
     *
     * @param id The ID of the job to retrieve.
     * @return An Optional containing the job if it is still queued, or an empty Optional otherwise.
     */
    Optional<Job> findById(long id);

    /**
     * Atomically selects the next eligible job and marks it reserved. A job is eligible
     * when its {@code available_at} has passed and it is either unreserved or its
     * reservation is at or before {@code staleBefore}. Among eligible jobs the lowest
     * priority value wins, then the earliest {@code available_at}, then the lowest id.
     * Two concurrent callers never reserve the same row.
     *
     * @param queue       Only consider this queue, or every queue when null.
     * @param now         The reservation timestamp to stamp on the row.
     * @param staleBefore Reservations at or before this instant count as abandoned.
     * @return The reserved job, or an empty Optional when nothing is eligible.
     */
    Optional<Job> reserve(String queue, OffsetDateTime now, OffsetDateTime staleBefore);

    /**
     * Deletes a job that ran successfully.
     *
     * @param reserved The job as returned by {@code reserve}.
     * @return Whether the row was still held under that reservation and is now gone.
     */
    boolean complete(Job reserved);

    /**
     * Puts a failed job back in line: clears the reservation, records the attempt count and
     * error, and moves {@code available_at} forward for backoff.
     *
     * @param reserved    The job as returned by {@code reserve}.
     * @param attempts    The attempt count including the attempt that just failed.
     * @param availableAt When the job may be reserved again.
     * @param lastError   A short description of the failure.
     * @return Whether the row was still held under that reservation.
     */
    boolean release(Job reserved, int attempts, OffsetDateTime availableAt, String lastError);

    /**
     * Moves a job that exhausted its retries to the dead-letter table. The insert into
     * {@code failed_jobs} and the delete from {@code jobs} commit together or not at all.
     *
     * @param reserved  The job as returned by {@code reserve}.
     * @param failedJob The dead letter to record.
     * @return Whether the move happened; false if the reservation was lost.
     */
    boolean bury(Job reserved, FailedJob failedJob);

    /**
     * Clears reservations at or before {@code staleBefore}, so that jobs held by crashed
     * workers return to the pending pool.
     *
     * @return The number of reservations released.
     */
    int releaseStale(OffsetDateTime staleBefore);

    /**
     * Counts jobs per state. Read-only.
     *
     * @param queue Restrict counts to this queue, or all queues when null.
     * @param now   Used to tell delayed jobs apart from ready ones.
     */
    QueueStats stats(String queue, OffsetDateTime now);

    /**
     * Lists dead letters, most recent first.
     */
    List<FailedJob> findFailed(int limit, int offset);

    /**
     * Lists dead letters carrying the given tag, most recent first.
     */
    List<FailedJob> findFailedByTag(String tag, int limit, int offset);

    Optional<FailedJob> findFailedById(long id);

    /**
     * Lists the ids of dead letters in the order they failed, optionally for one queue.
     */
    List<Long> findFailedIds(String queue);

    /**
     * Moves a dead letter back into {@code jobs} as a fresh job with no attempts, available
     * at {@code now}. The insert and the delete from {@code failed_jobs} commit together.
     *
     * @return The new job, or an empty Optional if the dead letter does not exist (any more).
     */
    Optional<Job> requeueFailed(long failedJobId, OffsetDateTime now);

    /**
     * Deletes dead letters, optionally for one queue only.
     *
     * @return The number of rows deleted.
     */
    int deleteFailed(String queue);

    /**
     * Deletes dead letters that failed at or before {@code threshold}.
     *
     * @return The number of rows deleted.
     */
    int deleteFailedBefore(OffsetDateTime threshold);
}
