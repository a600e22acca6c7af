package co.deferworks.lode.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final QueueManager queueManager;
    private final int numberOfWorkers;
    private final String queue;
    private final List<Worker> workers = new ArrayList<>();
    private ExecutorService executorService;

    public WorkerPool(QueueManager queueManager, int numberOfWorkers) {
        this(queueManager, numberOfWorkers, null);
    }

    public WorkerPool(QueueManager queueManager, int numberOfWorkers, String queue) {
        if (numberOfWorkers < 1) {
            throw new IllegalArgumentException("numberOfWorkers must be >= 1, got: " + numberOfWorkers);
        }
        this.queueManager = queueManager;
        this.numberOfWorkers = numberOfWorkers;
        this.queue = queue;
    }

    public synchronized void start() {
        if (executorService != null) {
            throw new IllegalStateException("Worker pool already started.");
        }
        log.info("Starting worker pool with {} workers.", numberOfWorkers);
        executorService = Executors.newFixedThreadPool(numberOfWorkers, workerThreadFactory());
        for (int i = 0; i < numberOfWorkers; i++) {
            var worker = new Worker(queueManager, queue);
            workers.add(worker);
            executorService.submit(() -> runWorker(worker));
        }
    }

    private static void runWorker(Worker worker) {
        try {
            worker.run();
        } catch (JobStoreException e) {
            log.error("Worker {} exited, the pool is running one worker short: {}", worker.workerId(), e.getMessage());
        } catch (Throwable t) {
            log.error("Worker {} died, the pool is running one worker short.", worker.workerId(), t);
        }
    }

    /**
     * Lets every worker finish the job it is running, waiting up to 30 seconds before
     * interrupting them.
     */
    public synchronized void shutdown() {
        log.info("Shutting down worker pool.");
        if (executorService != null) {
            workers.forEach(Worker::stop);
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not terminate in time, interrupting workers.");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executorService.shutdownNow();
                log.warn("Worker pool shutdown interrupted.", e);
            }
        }
    }

    public int size() {
        return numberOfWorkers;
    }

    private static ThreadFactory workerThreadFactory() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "lode-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
