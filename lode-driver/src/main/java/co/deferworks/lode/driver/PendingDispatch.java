package co.deferworks.lode.driver;

import co.deferworks.lode.core.BackoffStrategy;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.JobOptions;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;

/**
 * Fluent builder for one dispatch, obtained from {@link QueueManager#dispatch(String)}.
 *
 * <pre>{@code
 * queueManager.dispatch("send-email")
 *         .onQueue("mail")
 *         .priority(1)
 *         .delay(Duration.ofMinutes(5))
 *         .maxAttempts(5)
 *         .tags("signup", "mail")
 *         .dispatch("{\"to\":\"someone@example.com\"}");
 * }</pre>
 */
public final class PendingDispatch {

    private final QueueManager queueManager;
    private final String kind;
    private String queue = Job.DEFAULT_QUEUE;
    private int priority = Job.DEFAULT_PRIORITY;
    private Duration delay;
    private JobOptions options = JobOptions.none();

    PendingDispatch(QueueManager queueManager, String kind) {
        this.queueManager = queueManager;
        this.kind = kind;
    }

    public PendingDispatch onQueue(String queue) {
        this.queue = queue;
        return this;
    }

    /**
     * Lower values run first.
     */
    public PendingDispatch priority(int priority) {
        this.priority = priority;
        return this;
    }

    public PendingDispatch delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public PendingDispatch maxAttempts(int maxAttempts) {
        this.options = options.withMaxAttempts(maxAttempts);
        return this;
    }

    public PendingDispatch backoff(BackoffStrategy backoffStrategy) {
        this.options = options.withBackoffStrategy(backoffStrategy);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the delay is negative or does not fit the
     *                                  {@code retry_delay} column in whole seconds
     */
    public PendingDispatch retryAfter(Duration retryDelay) {
        long seconds = retryDelay.toSeconds();
        if (retryDelay.isNegative() || seconds > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("retryDelay must be between 0 and " + Integer.MAX_VALUE
                    + " seconds, got: " + retryDelay);
        }
        this.options = options.withRetryDelaySeconds((int) seconds);
        return this;
    }

    /**
     * Labels the job. Tags are kept when the job is dead-lettered and when it is retried
     * from there.
     */
    public PendingDispatch tags(String... tags) {
        this.options = options.withTags(List.of(tags));
        return this;
    }

    public boolean dispatch(String payload) {
        return queueManager.add(kind, payload, queue, priority, delay, options);
    }

    /**
     * Enqueues on the caller's connection, so the job commits or rolls back with the
     * caller's transaction.
     */
    public boolean dispatch(String payload, Connection connection) {
        return queueManager.add(kind, payload, queue, priority, delay, options, connection);
    }
}
