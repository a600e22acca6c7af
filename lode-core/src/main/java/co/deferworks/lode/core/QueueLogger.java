package co.deferworks.lode.core;

import java.time.Duration;
import java.util.Map;

/**
 * Structured sink for queue lifecycle events and per-job metrics.
 * <p>
 * {@code jobId}, {@code queue} and {@code kind} are optional and may be null; when
 * present they identify the job a message is about.
 *
 * @see Slf4jQueueLogger
 */
public interface QueueLogger {

    void debug(String message, Map<String, ?> context, Long jobId, String queue, String kind);

    void info(String message, Map<String, ?> context, Long jobId, String queue, String kind);

    void warning(String message, Map<String, ?> context, Long jobId, String queue, String kind);

    void error(String message, Map<String, ?> context, Long jobId, String queue, String kind);

    /**
     * Records how long a job ran and how much heap it took along the way.
     */
    void jobMetrics(long jobId, String queue, String kind, Duration executionTime, long memoryBytes);

    default void debug(String message, Map<String, ?> context) {
        debug(message, context, null, null, null);
    }

    default void info(String message, Map<String, ?> context) {
        info(message, context, null, null, null);
    }

    default void warning(String message, Map<String, ?> context) {
        warning(message, context, null, null, null);
    }

    default void error(String message, Map<String, ?> context) {
        error(message, context, null, null, null);
    }

    default void debug(String message, Map<String, ?> context, Job job) {
        debug(message, context, job.id(), job.queue(), job.kind());
    }

    default void info(String message, Map<String, ?> context, Job job) {
        info(message, context, job.id(), job.queue(), job.kind());
    }

    default void warning(String message, Map<String, ?> context, Job job) {
        warning(message, context, job.id(), job.queue(), job.kind());
    }

    default void error(String message, Map<String, ?> context, Job job) {
        error(message, context, job.id(), job.queue(), job.kind());
    }
}
