package co.deferworks.lode.core;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy that reschedules a failed job after a growing delay until the job has
 * failed {@code maxAttempts} times, then dead-letters it.
 * <p>
 * Delay for the n-th failure (n = attempts including the one that just failed):
 * <ul>
 *   <li>{@link BackoffStrategy#EXPONENTIAL}: {@code base * 2^(n-1)}</li>
 *   <li>{@link BackoffStrategy#LINEAR}: {@code base * n}</li>
 *   <li>{@link BackoffStrategy#FIXED}: {@code base}</li>
 * </ul>
 * capped at {@code maxDelay}, then shifted by up to 10% either way when jitter is on, so
 * that jobs which failed together do not all come back in the same instant.
 * <p>
 * A job's own {@link JobOptions} win over the values given here.
 */
public final class BackoffRetryPolicy implements RetryPolicy {

    private static final double JITTER_FRACTION = 0.1;

    private final int maxAttempts;
    private final BackoffStrategy strategy;
    private final long baseDelaySeconds;
    private final long maxDelaySeconds;
    private final boolean jitter;

    public BackoffRetryPolicy(int maxAttempts, BackoffStrategy strategy, Duration baseDelay, Duration maxDelay,
                              boolean jitter) {
        if (maxAttempts < 1 || maxAttempts > JobOptions.MAX_ATTEMPTS_LIMIT) {
            throw new IllegalArgumentException(
                    "maxAttempts must be between 1 and " + JobOptions.MAX_ATTEMPTS_LIMIT + ", got: " + maxAttempts);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.maxAttempts = maxAttempts;
        this.strategy = strategy;
        this.baseDelaySeconds = baseDelay.toSeconds();
        this.maxDelaySeconds = maxDelay.toSeconds();
        this.jitter = jitter;
    }

    public static BackoffRetryPolicy defaults() {
        return new BackoffRetryPolicy(3, BackoffStrategy.EXPONENTIAL, Duration.ofSeconds(60), Duration.ofHours(1),
                true);
    }

    @Override
    public RetryDecision decide(Job job, ExecutionResult failure, OffsetDateTime now) {
        int attempts = job.attempts() + 1;
        int limit = job.maxAttempts() != null ? job.maxAttempts() : maxAttempts;
        if (attempts >= limit) {
            return RetryDecision.deadLetter(attempts);
        }
        var jobStrategy = job.backoffStrategy() != null ? job.backoffStrategy() : strategy;
        long base = job.retryDelaySeconds() != null ? job.retryDelaySeconds() : baseDelaySeconds;
        long delay = delaySeconds(jobStrategy, base, attempts);
        return RetryDecision.retryAt(attempts, now.plusSeconds(delay));
    }

    /**
     * The delay before the next attempt, in seconds, after {@code attempts} failures.
     */
    public long delaySeconds(BackoffStrategy strategy, long base, int attempts) {
        long delay;
        if (strategy == BackoffStrategy.LINEAR) {
            delay = linear(base, attempts);
        } else if (strategy == BackoffStrategy.FIXED) {
            delay = base;
        } else {
            delay = exponential(base, attempts);
        }
        delay = Math.min(delay, maxDelaySeconds);
        if (jitter && delay > 0) {
            long spread = (long) (delay * JITTER_FRACTION);
            delay += ThreadLocalRandom.current().nextLong(-spread, spread + 1);
        }
        return Math.max(0L, delay);
    }

    private long exponential(long base, int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        if (attempts >= 63) {
            return maxDelaySeconds;
        }
        long factor = 1L << (attempts - 1);
        // Cap before multiplying so large attempt counts cannot overflow.
        if (base != 0 && factor > maxDelaySeconds / base) {
            return maxDelaySeconds;
        }
        return base * factor;
    }

    private long linear(long base, int attempts) {
        if (base != 0 && attempts > maxDelaySeconds / base) {
            return maxDelaySeconds;
        }
        return base * Math.max(0, attempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public BackoffStrategy strategy() {
        return strategy;
    }
}
