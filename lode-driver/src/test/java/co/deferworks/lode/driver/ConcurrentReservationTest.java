package co.deferworks.lode.driver;

import co.deferworks.lode.core.JobRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentReservationTest {

    private static final int JOBS = 200;
    private static final int WORKERS = 8;

    @Test
    void testEveryJobRunsExactlyOnce() throws Exception {
        var dataSource = H2Databases.migrated();
        var store = new H2JobStore(dataSource);
        Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
        var done = new AtomicInteger();
        var registry = new JobRegistry().register("count", job -> {
            runs.computeIfAbsent(job.payload(), p -> new AtomicInteger()).incrementAndGet();
            done.incrementAndGet();
        });
        var queueManager = new QueueManager(store, registry, QueueConfig.defaults(), new RecordingQueueLogger(),
                Clock.systemUTC());
        for (int i = 0; i < JOBS; i++) {
            assertTrue(queueManager.add("count", "job-" + i));
        }

        var start = new CountDownLatch(1);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(60);
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int w = 0; w < WORKERS; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    // A worker can come back empty-handed after losing several races in a row.
                    while (done.get() < JOBS && System.nanoTime() < deadline) {
                        queueManager.processNext(null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(90, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(JOBS, runs.size());
        runs.forEach((payload, count) -> assertEquals(1, count.get(), payload + " ran more than once"));
        assertEquals(0, queueManager.getStats().total());
    }
}
