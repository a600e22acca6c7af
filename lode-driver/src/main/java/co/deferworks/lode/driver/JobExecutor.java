package co.deferworks.lode.driver;

import co.deferworks.lode.core.ExecutionResult;
import co.deferworks.lode.core.ExecutionResult.FailureKind;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.JobHandler;
import co.deferworks.lode.core.JobResolutionException;
import co.deferworks.lode.core.JobResolver;
import co.deferworks.lode.core.QueueLogger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a job's handler and runs it, turning whatever happens into an
 * {@link ExecutionResult}. Never throws for handler or resolution failures, {@link Error}s
 * included. Only a {@link VirtualMachineError} is let through.
 */
public class JobExecutor {

    private final JobResolver resolver;
    private final QueueLogger queueLogger;

    public JobExecutor(JobResolver resolver, QueueLogger queueLogger) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.queueLogger = Objects.requireNonNull(queueLogger, "queueLogger");
    }

    public ExecutionResult execute(Job job) {
        queueLogger.debug("Starting job", Map.of("attempts", job.attempts()), job);
        var runtime = Runtime.getRuntime();
        long memoryBefore = runtime.totalMemory() - runtime.freeMemory();
        long started = System.nanoTime();

        JobHandler handler;
        try {
            handler = resolver.resolve(job.kind());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (JobResolutionException | RuntimeException | Error e) {
            return ExecutionResult.failure(FailureKind.RESOLUTION, e, elapsedSince(started));
        }

        try {
            handler.handle(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(FailureKind.HANDLER, e, elapsedSince(started));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            return ExecutionResult.failure(FailureKind.HANDLER, t, elapsedSince(started));
        }

        var elapsed = elapsedSince(started);
        long memoryUsed = Math.max(0L, runtime.totalMemory() - runtime.freeMemory() - memoryBefore);
        if (job.id() != null) {
            queueLogger.jobMetrics(job.id(), job.queue(), job.kind(), elapsed, memoryUsed);
        }
        return ExecutionResult.success(elapsed);
    }

    /**
     * Runs a job in the calling thread without touching the store, for when the queue is
     * switched off.
     *
     * @return whether the handler completed without throwing
     */
    public boolean executeSync(String kind, String payload) {
        var job = Job.builder().kind(kind).payload(payload).build();
        var result = execute(job);
        if (result.succeeded()) {
            queueLogger.info("Job executed synchronously",
                    Map.of("elapsed_ms", result.elapsed().toMillis()), null, job.queue(), kind);
            return true;
        }
        queueLogger.error("Synchronous job execution failed",
                Map.of("failure", result.failureKind(), "error", result.errorMessage()), null, job.queue(), kind);
        return false;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
