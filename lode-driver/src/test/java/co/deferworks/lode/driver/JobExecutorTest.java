package co.deferworks.lode.driver;

import co.deferworks.lode.core.ExecutionResult.FailureKind;
import co.deferworks.lode.core.Job;
import co.deferworks.lode.core.JobRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobExecutorTest {

    private RecordingQueueLogger queueLogger;
    private List<String> seen;
    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        queueLogger = new RecordingQueueLogger();
        seen = new ArrayList<>();
        var registry = new JobRegistry()
                .register("ok", job -> seen.add(job.payload()))
                .register("fail", job -> {
                    throw new IllegalArgumentException("bad payload");
                })
                .register("silent-fail", job -> {
                    throw new UnsupportedOperationException();
                })
                .register("assert-fails", job -> {
                    throw new AssertionError("handler bug");
                })
                .registerFactory("broken-factory", () -> {
                    throw new IllegalStateException("cannot build");
                })
                .registerFactory("linkage-factory", () -> {
                    throw new NoClassDefFoundError("com/example/Missing");
                });
        executor = new JobExecutor(registry, queueLogger);
    }

    private static Job job(String kind) {
        return Job.builder().id(7L).kind(kind).queue("q").payload("p").build();
    }

    @Test
    void testSuccessfulExecution() {
        var result = executor.execute(job("ok"));

        assertTrue(result.succeeded());
        assertNull(result.errorMessage());
        assertEquals(List.of("p"), seen);
        assertEquals(1, queueLogger.metrics().size());
        assertEquals(7L, queueLogger.metrics().get(0).jobId());
        assertTrue(queueLogger.metrics().get(0).memoryBytes() >= 0);
        assertEquals(List.of("Starting job"), queueLogger.messages("debug"));
    }

    @Test
    void testHandlerFailure() {
        var result = executor.execute(job("fail"));

        assertFalse(result.succeeded());
        assertEquals(FailureKind.HANDLER, result.failureKind());
        assertEquals("bad payload", result.errorMessage());
        assertTrue(result.errorDetails().contains("IllegalArgumentException"));
        assertTrue(queueLogger.metrics().isEmpty());
    }

    @Test
    void testHandlerFailureWithoutMessageUsesClassName() {
        var result = executor.execute(job("silent-fail"));

        assertEquals(UnsupportedOperationException.class.getName(), result.errorMessage());
    }

    @Test
    void testUnknownKindIsResolutionFailure() {
        var result = executor.execute(job("nope"));

        assertEquals(FailureKind.RESOLUTION, result.failureKind());
        assertTrue(result.errorMessage().contains("nope"));
    }

    @Test
    void testFactoryFailureIsResolutionFailure() {
        var result = executor.execute(job("broken-factory"));

        assertEquals(FailureKind.RESOLUTION, result.failureKind());
        assertTrue(result.errorDetails().contains("cannot build"));
    }

    @Test
    void testHandlerErrorIsHandlerFailure() {
        var result = executor.execute(job("assert-fails"));

        assertFalse(result.succeeded());
        assertEquals(FailureKind.HANDLER, result.failureKind());
        assertEquals("handler bug", result.errorMessage());
        assertTrue(result.errorDetails().contains("AssertionError"));
    }

    @Test
    void testFactoryErrorIsResolutionFailure() {
        var result = executor.execute(job("linkage-factory"));

        assertEquals(FailureKind.RESOLUTION, result.failureKind());
        assertEquals("com/example/Missing", result.errorMessage());
    }

    @Test
    void testVirtualMachineErrorIsNotCaptured() {
        var registry = new JobRegistry().register("oom", job -> {
            throw new OutOfMemoryError("simulated");
        });
        var oomExecutor = new JobExecutor(registry, queueLogger);

        assertThrows(OutOfMemoryError.class, () -> oomExecutor.execute(job("oom")));
    }

    @Test
    void testExecuteSync() {
        assertTrue(executor.executeSync("ok", "inline"));
        assertFalse(executor.executeSync("fail", "inline"));
        assertFalse(executor.executeSync("nope", "inline"));

        assertEquals(List.of("inline"), seen);
        assertTrue(queueLogger.metrics().isEmpty());
        assertEquals(List.of("Job executed synchronously"), queueLogger.messages("info"));
        assertEquals(2, queueLogger.messages("error").size());
    }
}
