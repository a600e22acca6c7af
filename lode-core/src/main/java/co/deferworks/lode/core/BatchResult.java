package co.deferworks.lode.core;

import java.time.Duration;

/**
 * Summary of one {@code processBatch} run. Every processed job is counted as either
 * succeeded or failed.
 */
public record BatchResult(int processed, int succeeded, int failed, Duration elapsed) {

    @Override
    public String toString() {
        return "batch.processed=" + processed +
                " batch.succeeded=" + succeeded +
                " batch.failed=" + failed +
                " batch.elapsed_ms=" + elapsed.toMillis();
    }
}
