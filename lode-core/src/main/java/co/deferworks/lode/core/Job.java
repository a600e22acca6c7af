package co.deferworks.lode.core;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Job is a row in the {@code jobs} table: a unit of work waiting to run, or being run
 * by a worker right now.
 * <p>
 * A job is eligible for reservation when it is not reserved (or its reservation has
 * outlived the lease timeout) and its {@code availableAt} has passed. Workers reserve
 * jobs by stamping {@code reservedAt}; that timestamp doubles as the lease token, so a
 * worker whose lease expired and was handed to somebody else can no longer complete,
 * reschedule or bury the job.
 * <p>
 * Once a job completes, its row is deleted. Once it exhausts its retry budget, it moves
 * to {@code failed_jobs} as a {@link FailedJob}.
 * <p>
 * {@code tags} are free-form labels given at dispatch. They travel with the job into
 * {@code failed_jobs} and back out again on retry.
 */
public record Job(
        Long id,
        String kind,
        String queue,
        String payload,
        int priority,
        int attempts,
        Integer maxAttempts,
        BackoffStrategy backoffStrategy,
        Integer retryDelaySeconds,
        List<String> tags,
        String lastError,
        OffsetDateTime reservedAt,
        OffsetDateTime availableAt,
        OffsetDateTime createdAt
) {

    public Job {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_PRIORITY = 5;

    public static Builder builder() {
        return new Builder();
    }

    public boolean isReserved() {
        return reservedAt != null;
    }

    /**
     * The options this job was dispatched with.
     */
    public JobOptions options() {
        return new JobOptions(maxAttempts, backoffStrategy, retryDelaySeconds, tags);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .queue(queue)
                .payload(payload)
                .priority(priority)
                .attempts(attempts)
                .options(options())
                .lastError(lastError)
                .reservedAt(reservedAt)
                .availableAt(availableAt)
                .createdAt(createdAt);
    }

    public static final class Builder {
        private Long id;
        private String kind;
        private String queue = DEFAULT_QUEUE;
        private String payload = "{}";
        private int priority = DEFAULT_PRIORITY;
        private int attempts = 0;
        private Integer maxAttempts;
        private BackoffStrategy backoffStrategy;
        private Integer retryDelaySeconds;
        private List<String> tags = List.of();
        private String lastError;
        private OffsetDateTime reservedAt;
        private OffsetDateTime availableAt;
        private OffsetDateTime createdAt;

        private Builder() {
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder retryDelaySeconds(Integer retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder options(JobOptions options) {
            this.maxAttempts = options.maxAttempts();
            this.backoffStrategy = options.backoffStrategy();
            this.retryDelaySeconds = options.retryDelaySeconds();
            this.tags = options.tags();
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder reservedAt(OffsetDateTime reservedAt) {
            this.reservedAt = reservedAt;
            return this;
        }

        public Builder availableAt(OffsetDateTime availableAt) {
            this.availableAt = availableAt;
            return this;
        }

        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Job build() {
            return new Job(id, kind, queue, payload, priority, attempts, maxAttempts, backoffStrategy,
                    retryDelaySeconds, tags, lastError, reservedAt, availableAt, createdAt);
        }
    }

    @Override
    public String toString() {
        return "job.id=" + id +
                " job.kind=" + kind +
                " job.queue=" + queue +
                " job.priority=" + priority +
                " job.attempts=" + attempts +
                " job.available_at=" + availableAt +
                " job.reserved_at=" + reservedAt
                ;
    }
}
