package co.deferworks.lode.core;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A dead letter: a job that exhausted its retry budget and was moved to {@code failed_jobs}.
 * It is never picked up again unless it is explicitly retried, which puts a fresh copy back
 * into {@code jobs} with its attempt count reset and its tags kept.
 */
public record FailedJob(
        Long id,
        UUID uuid,
        String queue,
        String kind,
        String payload,
        List<String> tags,
        String exception,
        int priority,
        int attempts,
        Long originalJobId,
        OffsetDateTime failedAt
) {

    public FailedJob {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Builds the dead letter for a reserved job that failed for the last time.
     */
    public static FailedJob from(Job job, int attempts, String exception, OffsetDateTime failedAt) {
        return new FailedJob(null, UUID.randomUUID(), job.queue(), job.kind(), job.payload(), job.tags(),
                exception, job.priority(), attempts, job.id(), failedAt);
    }

    @Override
    public String toString() {
        return "failed_job.id=" + id +
                " failed_job.uuid=" + uuid +
                " failed_job.kind=" + kind +
                " failed_job.queue=" + queue +
                " failed_job.attempts=" + attempts +
                " failed_job.failed_at=" + failedAt;
    }
}
