package co.deferworks.lode.driver;

import co.deferworks.lode.core.JobRegistry;
import co.deferworks.lode.core.RetryDecision;
import co.deferworks.lode.core.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @Test
    void testRejectsEmptyPool() {
        var queueManager = new QueueManager(new H2JobStore(H2Databases.migrated()), new JobRegistry());

        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(queueManager, 0));
    }

    @Test
    void testPoolOnlyWorksItsQueue() throws InterruptedException {
        var mailDone = new CountDownLatch(1);
        var registry = new JobRegistry().register("mail", job -> mailDone.countDown());
        var config = QueueConfig.builder().pollInterval(Duration.ofMillis(20)).build();
        var queueManager = new QueueManager(new H2JobStore(H2Databases.migrated()), registry, config,
                new RecordingQueueLogger(), Clock.systemUTC());
        queueManager.add("mail", "{}", "mail");
        queueManager.add("mail", "{}", "other");

        var pool = new WorkerPool(queueManager, 2, "mail");
        pool.start();
        try {
            assertTrue(mailDone.await(10, TimeUnit.SECONDS));
            assertThrows(IllegalStateException.class, pool::start);
        } finally {
            pool.shutdown();
        }

        assertEquals(0, queueManager.getStats("mail").total());
        assertEquals(1, queueManager.getStats("other").pending());
    }

    @Test
    void testWorkerKeepsRunningAfterHandlerError() throws InterruptedException {
        var okDone = new CountDownLatch(1);
        var registry = new JobRegistry()
                .register("assert-fails", job -> {
                    throw new AssertionError("handler bug");
                })
                .register("ok", job -> okDone.countDown());
        var config = QueueConfig.builder().pollInterval(Duration.ofMillis(20)).maxAttempts(1).build();
        var queueManager = new QueueManager(new H2JobStore(H2Databases.migrated()), registry, config,
                new RecordingQueueLogger(), Clock.systemUTC());
        queueManager.add("assert-fails", "{}", "default", 1);

        var pool = new WorkerPool(queueManager, 1);
        pool.start();
        try {
            queueManager.add("ok", "{}", "default", 5);
            assertTrue(okDone.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdown();
        }

        assertEquals(1, queueManager.getStats().failed());
    }

    @Test
    void testWorkerKeepsRunningAfterRetryPolicyBug() throws InterruptedException {
        var okDone = new CountDownLatch(1);
        var registry = new JobRegistry()
                .register("fails", job -> {
                    throw new IllegalStateException("expected");
                })
                .register("ok", job -> okDone.countDown());
        var policyCalls = new AtomicInteger();
        RetryPolicy brokenOnce = (job, failure, now) -> {
            if (policyCalls.getAndIncrement() == 0) {
                throw new IllegalStateException("policy bug");
            }
            return RetryDecision.deadLetter(job.attempts() + 1);
        };
        var config = QueueConfig.builder().pollInterval(Duration.ofMillis(20)).build();
        var queueManager = new QueueManager(new H2JobStore(H2Databases.migrated()), registry, config, brokenOnce,
                new RecordingQueueLogger(), Clock.systemUTC());
        queueManager.add("fails", "{}", "default", 1);
        queueManager.add("ok", "{}", "default", 5);

        var pool = new WorkerPool(queueManager, 1);
        pool.start();
        try {
            assertTrue(okDone.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdown();
        }

        assertEquals(1, policyCalls.get());
        // The job whose failure could not be recorded stays reserved until its lease runs out.
        assertEquals(1, queueManager.getStats().reserved());
    }
}
