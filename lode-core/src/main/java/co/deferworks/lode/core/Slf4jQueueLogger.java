package co.deferworks.lode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link QueueLogger} backed by SLF4J. The job identifiers go into the MDC as
 * {@code job.id}, {@code job.queue} and {@code job.kind} for the duration of the call, and
 * the context map is appended to the message as sorted {@code key=value} pairs.
 */
public class Slf4jQueueLogger implements QueueLogger {

    static final String MDC_JOB_ID = "job.id";
    static final String MDC_QUEUE = "job.queue";
    static final String MDC_KIND = "job.kind";

    private final Logger log;

    public Slf4jQueueLogger() {
        this(LoggerFactory.getLogger("co.deferworks.lode.queue"));
    }

    public Slf4jQueueLogger(Logger log) {
        this.log = log;
    }

    @Override
    public void debug(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try (var ignored = withJob(jobId, queue, kind)) {
            log.debug("{}{}", message, render(context));
        }
    }

    @Override
    public void info(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        try (var ignored = withJob(jobId, queue, kind)) {
            log.info("{}{}", message, render(context));
        }
    }

    @Override
    public void warning(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        try (var ignored = withJob(jobId, queue, kind)) {
            log.warn("{}{}", message, render(context));
        }
    }

    @Override
    public void error(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        try (var ignored = withJob(jobId, queue, kind)) {
            log.error("{}{}", message, render(context));
        }
    }

    @Override
    public void jobMetrics(long jobId, String queue, String kind, Duration executionTime, long memoryBytes) {
        try (var ignored = withJob(jobId, queue, kind)) {
            log.info("Job metrics execution_ms={} memory_bytes={}", executionTime.toMillis(), memoryBytes);
        }
    }

    static String render(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        var builder = new StringBuilder();
        new TreeMap<>(context).forEach((key, value) -> builder.append(' ').append(key).append('=').append(value));
        return builder.toString();
    }

    private static MdcScope withJob(Long jobId, String queue, String kind) {
        var scope = new MdcScope();
        scope.put(MDC_JOB_ID, jobId == null ? null : jobId.toString());
        scope.put(MDC_QUEUE, queue);
        scope.put(MDC_KIND, kind);
        return scope;
    }

    /**
     * Restores the MDC entries it overwrote when closed.
     */
    private static final class MdcScope implements AutoCloseable {
        private final Map<String, String> previous = new TreeMap<>();

        void put(String key, String value) {
            if (value == null) {
                return;
            }
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
