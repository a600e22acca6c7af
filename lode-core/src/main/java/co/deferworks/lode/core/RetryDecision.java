package co.deferworks.lode.core;

import java.time.OffsetDateTime;

/**
 * What to do with a job whose latest attempt failed.
 *
 * @param attempts    the attempt count to record, including the attempt that just failed
 * @param retryAt     when the job becomes available again; null when it is dead-lettered
 */
public record RetryDecision(int attempts, OffsetDateTime retryAt) {

    public static RetryDecision retryAt(int attempts, OffsetDateTime retryAt) {
        return new RetryDecision(attempts, retryAt);
    }

    public static RetryDecision deadLetter(int attempts) {
        return new RetryDecision(attempts, null);
    }

    public boolean shouldRetry() {
        return retryAt != null;
    }
}
