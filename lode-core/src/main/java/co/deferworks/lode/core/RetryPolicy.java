package co.deferworks.lode.core;

import java.time.OffsetDateTime;

/**
 * Decides whether a failed attempt is retried, and when, or whether the job goes to the
 * dead-letter table. Implementations see only values, so the backoff strategy can be
 * swapped without touching the store or the executor.
 *
 * @see BackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param job     the job as it was reserved; {@code job.attempts()} does not yet count
     *                the attempt that just failed
     * @param failure the failed execution result
     * @param now     the current time
     */
    RetryDecision decide(Job job, ExecutionResult failure, OffsetDateTime now);
}
