package co.deferworks.lode.driver;

import co.deferworks.lode.core.BackoffRetryPolicy;
import co.deferworks.lode.core.BackoffStrategy;
import co.deferworks.lode.core.JobOptions;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runtime settings of the queue.
 *
 * @param enabled               when false, dispatching runs the job synchronously instead of storing it
 * @param maxAttempts           attempts before a job is dead-lettered, unless the job overrides it
 * @param backoffStrategy       how retry delays grow, unless the job overrides it
 * @param retryDelay            base retry delay, unless the job overrides it
 * @param maxRetryDelay         cap on any single retry delay
 * @param jitter                whether to shift retry delays by up to 10% either way
 * @param leaseTimeout          how long a reservation protects a job from other workers
 * @param pollInterval          how long an idle worker sleeps before looking again
 * @param storeRetryDelay       first pause after a failed reservation; doubles per failure
 * @param storeFailureLimit     consecutive reservation failures after which a worker gives up
 * @param reaperInterval        how often the engine clears expired reservations
 * @param batchSize             default job count for {@code processBatch}
 * @param batchMaxExecutionTime default time budget for {@code processBatch}
 */
public record QueueConfig(
        boolean enabled,
        int maxAttempts,
        BackoffStrategy backoffStrategy,
        Duration retryDelay,
        Duration maxRetryDelay,
        boolean jitter,
        Duration leaseTimeout,
        Duration pollInterval,
        Duration storeRetryDelay,
        int storeFailureLimit,
        Duration reaperInterval,
        int batchSize,
        Duration batchMaxExecutionTime
) {

    public static final Duration MAX_STORE_RETRY_DELAY = Duration.ofSeconds(30);

    public QueueConfig {
        Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        requirePositive("leaseTimeout", leaseTimeout);
        requirePositive("pollInterval", pollInterval);
        requirePositive("storeRetryDelay", storeRetryDelay);
        requirePositive("reaperInterval", reaperInterval);
        requirePositive("batchMaxExecutionTime", batchMaxExecutionTime);
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(maxRetryDelay, "maxRetryDelay");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0, got: " + retryDelay);
        }
        if (maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay must be >= retryDelay, got: " + maxRetryDelay);
        }
        if (maxAttempts < 1 || maxAttempts > JobOptions.MAX_ATTEMPTS_LIMIT) {
            throw new IllegalArgumentException(
                    "maxAttempts must be between 1 and " + JobOptions.MAX_ATTEMPTS_LIMIT + ", got: " + maxAttempts);
        }
        if (storeFailureLimit < 1) {
            throw new IllegalArgumentException("storeFailureLimit must be >= 1, got: " + storeFailureLimit);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    public static QueueConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from {@code LODE_*} variables, falling back to the defaults for any
     * that are absent or blank.
     *
     * @throws IllegalArgumentException if a variable holds an unparsable or invalid value
     */
    public static QueueConfig fromEnvironment(Map<String, String> env) {
        var builder = builder();
        read(env, "LODE_ENABLED", value -> builder.enabled(parseBoolean("LODE_ENABLED", value)));
        read(env, "LODE_MAX_ATTEMPTS", value -> builder.maxAttempts(parseInt("LODE_MAX_ATTEMPTS", value)));
        read(env, "LODE_BACKOFF_STRATEGY", value -> builder.backoffStrategy(BackoffStrategy.parse(value)));
        read(env, "LODE_RETRY_DELAY_SECONDS",
                value -> builder.retryDelay(Duration.ofSeconds(parseInt("LODE_RETRY_DELAY_SECONDS", value))));
        read(env, "LODE_MAX_RETRY_DELAY_SECONDS",
                value -> builder.maxRetryDelay(Duration.ofSeconds(parseInt("LODE_MAX_RETRY_DELAY_SECONDS", value))));
        read(env, "LODE_JITTER", value -> builder.jitter(parseBoolean("LODE_JITTER", value)));
        read(env, "LODE_LEASE_TIMEOUT_SECONDS",
                value -> builder.leaseTimeout(Duration.ofSeconds(parseInt("LODE_LEASE_TIMEOUT_SECONDS", value))));
        read(env, "LODE_POLL_INTERVAL_MS",
                value -> builder.pollInterval(Duration.ofMillis(parseInt("LODE_POLL_INTERVAL_MS", value))));
        read(env, "LODE_STORE_RETRY_DELAY_MS",
                value -> builder.storeRetryDelay(Duration.ofMillis(parseInt("LODE_STORE_RETRY_DELAY_MS", value))));
        read(env, "LODE_STORE_FAILURE_LIMIT",
                value -> builder.storeFailureLimit(parseInt("LODE_STORE_FAILURE_LIMIT", value)));
        read(env, "LODE_REAPER_INTERVAL_SECONDS",
                value -> builder.reaperInterval(Duration.ofSeconds(parseInt("LODE_REAPER_INTERVAL_SECONDS", value))));
        read(env, "LODE_BATCH_SIZE", value -> builder.batchSize(parseInt("LODE_BATCH_SIZE", value)));
        read(env, "LODE_BATCH_MAX_SECONDS",
                value -> builder.batchMaxExecutionTime(Duration.ofSeconds(parseInt("LODE_BATCH_MAX_SECONDS", value))));
        return builder.build();
    }

    private static void read(Map<String, String> env, String name, Consumer<String> apply) {
        var value = env.get(name);
        if (value != null && !value.isBlank()) {
            apply.accept(value.trim());
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false, got: " + value);
    }

    /**
     * The retry policy these settings describe.
     */
    public BackoffRetryPolicy retryPolicy() {
        return new BackoffRetryPolicy(maxAttempts, backoffStrategy, retryDelay, maxRetryDelay, jitter);
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .maxAttempts(maxAttempts)
                .backoffStrategy(backoffStrategy)
                .retryDelay(retryDelay)
                .maxRetryDelay(maxRetryDelay)
                .jitter(jitter)
                .leaseTimeout(leaseTimeout)
                .pollInterval(pollInterval)
                .storeRetryDelay(storeRetryDelay)
                .storeFailureLimit(storeFailureLimit)
                .reaperInterval(reaperInterval)
                .batchSize(batchSize)
                .batchMaxExecutionTime(batchMaxExecutionTime);
    }

    public static final class Builder {
        private boolean enabled = true;
        private int maxAttempts = 3;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration retryDelay = Duration.ofSeconds(60);
        private Duration maxRetryDelay = Duration.ofHours(1);
        private boolean jitter = true;
        private Duration leaseTimeout = Duration.ofSeconds(300);
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration storeRetryDelay = Duration.ofSeconds(1);
        private int storeFailureLimit = 5;
        private Duration reaperInterval = Duration.ofMinutes(5);
        private int batchSize = 10;
        private Duration batchMaxExecutionTime = Duration.ofSeconds(55);

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder storeRetryDelay(Duration storeRetryDelay) {
            this.storeRetryDelay = storeRetryDelay;
            return this;
        }

        public Builder storeFailureLimit(int storeFailureLimit) {
            this.storeFailureLimit = storeFailureLimit;
            return this;
        }

        public Builder reaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchMaxExecutionTime(Duration batchMaxExecutionTime) {
            this.batchMaxExecutionTime = batchMaxExecutionTime;
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(enabled, maxAttempts, backoffStrategy, retryDelay, maxRetryDelay, jitter,
                    leaseTimeout, pollInterval, storeRetryDelay, storeFailureLimit, reaperInterval, batchSize,
                    batchMaxExecutionTime);
        }
    }
}
