package co.deferworks.lode.core;

import java.util.List;

/**
 * Per-job options fixed at dispatch time and persisted with the job: overrides of the
 * retry policy plus the job's tags. A {@code null} override means "use the configured default".
 * <p>
 * Tags are stored as one comma-separated column, so a tag may not contain a comma.
 */
public record JobOptions(
        Integer maxAttempts,
        BackoffStrategy backoffStrategy,
        Integer retryDelaySeconds,
        List<String> tags
) {

    // attempts and max_attempts are SMALLINT columns.
    public static final int MAX_ATTEMPTS_LIMIT = Short.MAX_VALUE;

    private static final JobOptions NONE = new JobOptions(null, null, null, List.of());

    public JobOptions {
        if (maxAttempts != null && (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS_LIMIT)) {
            throw new IllegalArgumentException(
                    "maxAttempts must be between 1 and " + MAX_ATTEMPTS_LIMIT + ", got: " + maxAttempts);
        }
        if (retryDelaySeconds != null && retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds must be >= 0, got: " + retryDelaySeconds);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        for (var tag : tags) {
            if (tag.isBlank() || tag.contains(",")) {
                throw new IllegalArgumentException("tags must be non-blank and free of commas, got: '" + tag + "'");
            }
        }
    }

    public JobOptions(Integer maxAttempts, BackoffStrategy backoffStrategy, Integer retryDelaySeconds) {
        this(maxAttempts, backoffStrategy, retryDelaySeconds, List.of());
    }

    public static JobOptions none() {
        return NONE;
    }

    public JobOptions withMaxAttempts(Integer maxAttempts) {
        return new JobOptions(maxAttempts, backoffStrategy, retryDelaySeconds, tags);
    }

    public JobOptions withBackoffStrategy(BackoffStrategy backoffStrategy) {
        return new JobOptions(maxAttempts, backoffStrategy, retryDelaySeconds, tags);
    }

    public JobOptions withRetryDelaySeconds(Integer retryDelaySeconds) {
        return new JobOptions(maxAttempts, backoffStrategy, retryDelaySeconds, tags);
    }

    public JobOptions withTags(List<String> tags) {
        return new JobOptions(maxAttempts, backoffStrategy, retryDelaySeconds, tags);
    }
}
