package co.deferworks.lode.driver;

import co.deferworks.lode.core.BatchResult;
import co.deferworks.lode.core.ExecutionResult;
import co.deferworks.lode.core.FailedJob;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.JobOptions;
import co.deferworks.lode.core.JobResolver;
import co.deferworks.lode.core.QueueLogger;
import co.deferworks.lode.core.QueueStats;
import co.deferworks.lode.core.RetryPolicy;
import co.deferworks.lode.core.Slf4jQueueLogger;

import java.sql.Connection;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the queue: dispatches jobs, runs workers, and administers dead letters.
 * <p>
 * Dispatch methods never throw for bad input or an unavailable store; they log the
 * problem and return {@code false}. Worker loops survive handler failures and transient
 * store failures, and give up with a {@link JobStoreException} once the store has failed
 * {@link QueueConfig#storeFailureLimit()} times in a row. Administrative methods propagate
 * {@link JobStoreException}.
 */
public class QueueManager {

    public static final int DEFAULT_FAILED_JOBS_LIMIT = 50;
    public static final int DEFAULT_PURGE_DAYS = 7;

    private final JobStore store;
    private final JobResolver resolver;
    private final JobExecutor executor;
    private final RetryPolicy retryPolicy;
    private final QueueConfig config;
    private final QueueLogger queueLogger;
    private final Clock clock;
    private final Set<Worker> activeWorkers = ConcurrentHashMap.newKeySet();

    public QueueManager(JobStore store, JobResolver resolver) {
        this(store, resolver, QueueConfig.defaults());
    }

    public QueueManager(JobStore store, JobResolver resolver, QueueConfig config) {
        this(store, resolver, config, new Slf4jQueueLogger(), Clock.systemUTC());
    }

    public QueueManager(JobStore store, JobResolver resolver, QueueConfig config, QueueLogger queueLogger,
                        Clock clock) {
        this(store, resolver, config, config.retryPolicy(), queueLogger, clock);
    }

    public QueueManager(JobStore store, JobResolver resolver, QueueConfig config, RetryPolicy retryPolicy,
                        QueueLogger queueLogger, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.config = Objects.requireNonNull(config, "config");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.queueLogger = Objects.requireNonNull(queueLogger, "queueLogger");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = new JobExecutor(resolver, queueLogger);
    }

    public QueueConfig config() {
        return config;
    }

    // Dispatch

    public boolean add(String kind, String payload) {
        return add(kind, payload, Job.DEFAULT_QUEUE);
    }

    public boolean add(String kind, String payload, String queue) {
        return add(kind, payload, queue, Job.DEFAULT_PRIORITY);
    }

    public boolean add(String kind, String payload, String queue, int priority) {
        return add(kind, payload, queue, priority, null);
    }

    public boolean add(String kind, String payload, String queue, int priority, Duration delay) {
        return add(kind, payload, queue, priority, delay, JobOptions.none());
    }

    /**
     * Enqueues a job, or runs it right away when the queue is disabled.
     *
     * @param delay   how long to hold the job back; null for none
     * @param options per-job retry overrides
     * @return whether the job was stored (or, with the queue disabled, ran successfully)
     */
    public boolean add(String kind, String payload, String queue, int priority, Duration delay,
                       JobOptions options) {
        return add(kind, payload, queue, priority, delay, options, null);
    }

    /**
     * Like {@link #add(String, String, String, int, Duration, JobOptions)}, but inserts on
     * the given connection so that the job is part of the caller's transaction. A null
     * connection borrows one from the store.
     */
    public boolean add(String kind, String payload, String queue, int priority, Duration delay,
                       JobOptions options, Connection connection) {
        var problem = validate(kind, payload, queue, delay);
        if (problem != null) {
            queueLogger.error("Job rejected: " + problem, Map.of("kind", String.valueOf(kind)), null, queue, kind);
            return false;
        }
        if (!config.enabled()) {
            return executor.executeSync(kind, payload);
        }

        var now = now();
        var job = Job.builder()
                .kind(kind)
                .queue(queue)
                .payload(payload)
                .priority(priority)
                .options(options == null ? JobOptions.none() : options)
                .availableAt(delay == null ? now : now.plus(delay))
                .createdAt(now)
                .build();
        try {
            var stored = connection == null ? store.insert(job) : store.insert(job, connection);
            queueLogger.info("Job dispatched",
                    Map.of("priority", priority, "available_at", stored.availableAt()), stored);
            return true;
        } catch (JobStoreException e) {
            queueLogger.error("Job dispatch failed", Map.of("error", describe(e)), null, queue, kind);
            return false;
        }
    }

    private String validate(String kind, String payload, String queue, Duration delay) {
        if (kind == null || kind.isBlank()) {
            return "kind must not be blank";
        }
        if (!resolver.canResolve(kind)) {
            return "no handler registered for kind " + kind;
        }
        if (payload == null) {
            return "payload must not be null";
        }
        if (queue == null || queue.isBlank()) {
            return "queue must not be blank";
        }
        if (delay != null && delay.isNegative()) {
            return "delay must not be negative";
        }
        if (delay != null) {
            try {
                now().plus(delay);
            } catch (DateTimeException | ArithmeticException e) {
                return "delay is out of range: " + delay;
            }
        }
        return null;
    }

    public PendingDispatch dispatch(String kind) {
        return new PendingDispatch(this, kind);
    }

    // Processing

    /**
     * Runs a worker loop on every queue in the calling thread until {@link #stop()} is
     * called or the thread is interrupted.
     */
    public void process() {
        process(null);
    }

    public void process(String queue) {
        process(queue, () -> false);
    }

    /**
     * Runs a worker loop in the calling thread. The loop checks for a stop request between
     * jobs, never in the middle of one.
     *
     * @param queue         the queue to work, or null for all queues
     * @param stopRequested polled between jobs
     * @throws JobStoreException once the store has failed too many times in a row
     */
    public void process(String queue, BooleanSupplier stopRequested) {
        new Worker(this, queue, stopRequested).run();
    }

    /**
     * Asks every running worker loop started through this manager to finish its current
     * job and return.
     */
    public void stop() {
        activeWorkers.forEach(Worker::stop);
    }

    void register(Worker worker) {
        activeWorkers.add(worker);
    }

    void unregister(Worker worker) {
        activeWorkers.remove(worker);
    }

    public BatchResult processBatch() {
        return processBatch(config.batchSize(), null, config.batchMaxExecutionTime());
    }

    public BatchResult processBatch(int batchSize) {
        return processBatch(batchSize, null, config.batchMaxExecutionTime());
    }

    public BatchResult processBatch(int batchSize, String queue) {
        return processBatch(batchSize, queue, config.batchMaxExecutionTime());
    }

    /**
     * Runs up to {@code batchSize} jobs, stopping early when nothing is eligible or when
     * {@code maxExecutionTime} has passed. The time limit is checked between jobs, so a long
     * job can overrun it.
     *
     * @throws JobStoreException once the store has failed too many times in a row
     */
    public BatchResult processBatch(int batchSize, String queue, Duration maxExecutionTime) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        long started = System.nanoTime();
        long budget = maxExecutionTime.toNanos();
        int processed = 0;
        int succeeded = 0;
        int failed = 0;

        while (processed < batchSize && System.nanoTime() - started < budget) {
            var outcome = processNextRetrying(queue, () -> false);
            if (!outcome.processed()) {
                break;
            }
            processed++;
            if (outcome.succeeded()) {
                succeeded++;
            } else {
                failed++;
            }
        }

        var result = new BatchResult(processed, succeeded, failed, Duration.ofNanos(System.nanoTime() - started));
        queueLogger.info("Batch finished", Map.of(
                "processed", processed, "succeeded", succeeded, "failed", failed,
                "elapsed_ms", result.elapsed().toMillis()), null, queue, null);
        return result;
    }

    /**
     * Reserves and runs a single job.
     *
     * @throws JobStoreException if the reservation itself fails
     */
    public ProcessOutcome processNext(String queue) {
        var now = now();
        Optional<Job> reserved = store.reserve(queue, now, now.minus(config.leaseTimeout()));
        if (reserved.isEmpty()) {
            return ProcessOutcome.IDLE;
        }
        var job = reserved.get();
        queueLogger.debug("Job reserved", Map.of("attempts", job.attempts()), job);

        var result = executor.execute(job);
        if (result.succeeded()) {
            return acknowledgeSuccess(job, result);
        }
        return acknowledgeFailure(job, result);
    }

    private ProcessOutcome acknowledgeSuccess(Job job, ExecutionResult result) {
        try {
            if (!store.complete(job)) {
                queueLogger.warning("Job completed after its reservation was lost; it may run again",
                        Map.of("reserved_at", job.reservedAt()), job);
                return ProcessOutcome.ACK_FAILED;
            }
        } catch (JobStoreException e) {
            queueLogger.error("Could not record job completion", Map.of("error", describe(e)), job);
            return ProcessOutcome.ACK_FAILED;
        }
        queueLogger.info("Job completed", Map.of("elapsed_ms", result.elapsed().toMillis()), job);
        return ProcessOutcome.SUCCEEDED;
    }

    private ProcessOutcome acknowledgeFailure(Job job, ExecutionResult result) {
        var now = now();
        var decision = retryPolicy.decide(job, result, now);
        var context = new HashMap<String, Object>();
        context.put("attempts", decision.attempts());
        context.put("failure", result.failureKind());
        context.put("error", result.errorMessage());

        try {
            if (decision.shouldRetry()) {
                var retryAt = decision.retryAt().truncatedTo(ChronoUnit.MICROS);
                if (!store.release(job, decision.attempts(), retryAt, result.errorMessage())) {
                    queueLogger.warning("Job failed after its reservation was lost", context, job);
                    return ProcessOutcome.ACK_FAILED;
                }
                context.put("retry_at", retryAt);
                queueLogger.warning("Job failed, retry scheduled", context, job);
                return ProcessOutcome.RETRY_SCHEDULED;
            }

            var failedJob = FailedJob.from(job, decision.attempts(), result.errorDetails(), now);
            if (!store.bury(job, failedJob)) {
                queueLogger.warning("Job failed for good after its reservation was lost", context, job);
                return ProcessOutcome.ACK_FAILED;
            }
            context.put("failed_job_uuid", failedJob.uuid());
            queueLogger.error("Job failed permanently and moved to failed jobs", context, job);
            return ProcessOutcome.DEAD_LETTERED;
        } catch (JobStoreException e) {
            context.put("store_error", describe(e));
            queueLogger.error("Could not record job failure", context, job);
            return ProcessOutcome.ACK_FAILED;
        }
    }

    /**
     * {@link #processNext(String)} that rides out transient store failures, pausing for a
     * doubling delay between tries.
     *
     * @return {@link ProcessOutcome#IDLE} if a stop was requested while waiting
     * @throws JobStoreException after {@link QueueConfig#storeFailureLimit()} failures in a row
     */
    ProcessOutcome processNextRetrying(String queue, BooleanSupplier stopRequested) {
        int failures = 0;
        while (true) {
            try {
                return processNext(queue);
            } catch (JobStoreException e) {
                failures++;
                if (failures >= config.storeFailureLimit()) {
                    queueLogger.error("Job store unavailable, giving up",
                            Map.of("failures", failures, "error", describe(e)), null, queue, null);
                    throw e;
                }
                var delay = storeRetryDelay(failures);
                queueLogger.warning("Job store unavailable, retrying",
                        Map.of("failures", failures, "retry_in_ms", delay.toMillis(), "error", describe(e)),
                        null, queue, null);
                if (stopRequested.getAsBoolean() || !sleep(delay)) {
                    return ProcessOutcome.IDLE;
                }
            }
        }
    }

    Duration storeRetryDelay(int consecutiveFailures) {
        int doublings = Math.min(Math.max(consecutiveFailures - 1, 0), 20);
        var delay = config.storeRetryDelay().multipliedBy(1L << doublings);
        return delay.compareTo(QueueConfig.MAX_STORE_RETRY_DELAY) > 0 ? QueueConfig.MAX_STORE_RETRY_DELAY : delay;
    }

    /**
     * @return false if the thread was interrupted while sleeping
     */
    static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Inspection and maintenance

    public QueueStats getStats() {
        return getStats(null);
    }

    public QueueStats getStats(String queue) {
        return store.stats(queue, now());
    }

    public List<FailedJob> getFailedJobs() {
        return getFailedJobs(DEFAULT_FAILED_JOBS_LIMIT, 0);
    }

    /**
     * Dead letters, most recent first.
     */
    public List<FailedJob> getFailedJobs(int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        return store.findFailed(limit, offset);
    }

    /**
     * Dead letters dispatched with the given tag, most recent first.
     */
    public List<FailedJob> getFailedJobsTagged(String tag, int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        return store.findFailedByTag(tag, limit, offset);
    }

    public Optional<FailedJob> getFailedJob(long id) {
        return store.findFailedById(id);
    }

    /**
     * Puts a dead letter back on its queue as a fresh job.
     *
     * @return false if no dead letter with that id exists
     */
    public boolean retryFailedJob(long id) {
        var requeued = store.requeueFailed(id, now());
        if (requeued.isEmpty()) {
            queueLogger.warning("Failed job not found", Map.of("failed_job_id", id));
            return false;
        }
        queueLogger.info("Failed job requeued", Map.of("failed_job_id", id), requeued.get());
        return true;
    }

    public int retryAllFailedJobs() {
        return retryAllFailedJobs(null);
    }

    /**
     * @return how many dead letters were requeued
     */
    public int retryAllFailedJobs(String queue) {
        int retried = 0;
        for (Long id : store.findFailedIds(queue)) {
            if (store.requeueFailed(id, now()).isPresent()) {
                retried++;
            }
        }
        queueLogger.info("Failed jobs requeued", Map.of("count", retried), null, queue, null);
        return retried;
    }

    public int purgeOldJobs() {
        return purgeOldJobs(DEFAULT_PURGE_DAYS);
    }

    /**
     * Deletes dead letters that failed {@code olderThanDays} days ago or earlier.
     *
     * @return the number of dead letters deleted
     */
    public int purgeOldJobs(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must be >= 0, got: " + olderThanDays);
        }
        int purged = store.deleteFailedBefore(now().minusDays(olderThanDays));
        queueLogger.info("Old failed jobs purged", Map.of("count", purged, "older_than_days", olderThanDays));
        return purged;
    }

    public int purgeFailedJobs() {
        return purgeFailedJobs(null);
    }

    public int purgeFailedJobs(String queue) {
        int purged = store.deleteFailed(queue);
        queueLogger.info("Failed jobs purged", Map.of("count", purged), null, queue, null);
        return purged;
    }

    /**
     * Clears reservations older than the lease timeout so that their jobs show up as
     * pending again.
     */
    public int releaseStaleReservations() {
        int released = store.releaseStale(now().minus(config.leaseTimeout()));
        if (released > 0) {
            queueLogger.warning("Released stale reservations", Map.of("count", released));
        }
        return released;
    }

    OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    private static String describe(Exception e) {
        var cause = e.getCause() != null ? e.getCause() : e;
        return e.getMessage() + ": " + cause.getMessage();
    }
}
