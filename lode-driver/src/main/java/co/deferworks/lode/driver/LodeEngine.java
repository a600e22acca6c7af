package co.deferworks.lode.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class LodeEngine {

    private static final Logger log = LoggerFactory.getLogger(LodeEngine.class);

    private final QueueManager queueManager;
    private final WorkerPool workerPool;
    private final ScheduledExecutorService reaperScheduler;

    public LodeEngine(QueueManager queueManager, int numberOfWorkers) {
        this(queueManager, numberOfWorkers, null);
    }

    public LodeEngine(QueueManager queueManager, int numberOfWorkers, String queue) {
        this.queueManager = queueManager;
        this.workerPool = new WorkerPool(queueManager, numberOfWorkers, queue);
        this.reaperScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "lode-reaper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public QueueManager getQueueManager() {
        return queueManager;
    }

    public void start() {
        log.info("Starting Lode Engine...");
        workerPool.start();
        long interval = queueManager.config().reaperInterval().toMillis();
        reaperScheduler.scheduleAtFixedRate(this::reapStaleReservations, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Lode Engine started.");
    }

    void reapStaleReservations() {
        try {
            int released = queueManager.releaseStaleReservations();
            log.debug("Reaper released {} stale reservations.", released);
        } catch (JobStoreException e) {
            // A thrown exception would cancel the schedule; the next run tries again.
            log.error("Reaper could not release stale reservations: {}", e.getMessage(), e);
        }
    }

    public void shutdown() {
        log.info("Shutting down Lode Engine...");
        workerPool.shutdown();
        reaperScheduler.shutdown();
        try {
            if (!reaperScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reaper scheduler did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reaper scheduler shutdown interrupted.", e);
        }
        log.info("Lode Engine shut down.");
    }
}
