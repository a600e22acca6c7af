package co.deferworks.lode.driver;

import co.deferworks.lode.core.QueueLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * QueueLogger that keeps every call for later assertions.
 */
final class RecordingQueueLogger implements QueueLogger {

    record Entry(String level, String message, Map<String, ?> context, Long jobId, String queue, String kind) {
    }

    record Metrics(long jobId, String queue, String kind, Duration executionTime, long memoryBytes) {
    }

    private final List<Entry> entries = new ArrayList<>();
    private final List<Metrics> metrics = new ArrayList<>();

    @Override
    public void debug(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        record("debug", message, context, jobId, queue, kind);
    }

    @Override
    public void info(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        record("info", message, context, jobId, queue, kind);
    }

    @Override
    public void warning(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        record("warning", message, context, jobId, queue, kind);
    }

    @Override
    public void error(String message, Map<String, ?> context, Long jobId, String queue, String kind) {
        record("error", message, context, jobId, queue, kind);
    }

    @Override
    public synchronized void jobMetrics(long jobId, String queue, String kind, Duration executionTime,
                                        long memoryBytes) {
        metrics.add(new Metrics(jobId, queue, kind, executionTime, memoryBytes));
    }

    private synchronized void record(String level, String message, Map<String, ?> context, Long jobId,
                                     String queue, String kind) {
        entries.add(new Entry(level, message, context, jobId, queue, kind));
    }

    synchronized List<Entry> entries(String level) {
        return entries.stream().filter(e -> e.level().equals(level)).collect(Collectors.toList());
    }

    synchronized List<String> messages(String level) {
        return entries(level).stream().map(Entry::message).collect(Collectors.toList());
    }

    synchronized List<Metrics> metrics() {
        return new ArrayList<>(metrics);
    }
}
