package co.deferworks.lode.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.BooleanSupplier;

public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final UUID workerId;
    private final QueueManager queueManager;
    private final String queue;
    private final BooleanSupplier stopRequested;
    private volatile boolean stopped;

    public Worker(QueueManager queueManager, String queue) {
        this(queueManager, queue, () -> false);
    }

    public Worker(QueueManager queueManager, String queue, BooleanSupplier stopRequested) {
        this.workerId = UUID.randomUUID();
        this.queueManager = queueManager;
        this.queue = queue;
        this.stopRequested = stopRequested;
    }

    public UUID workerId() {
        return workerId;
    }

    public void stop() {
        stopped = true;
    }

    private boolean shouldStop() {
        return stopped || stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    @Override
    public void run() {
        log.info("Worker {} started on queue {}.", workerId, queue == null ? "*" : queue);
        queueManager.register(this);
        try {
            while (!shouldStop()) {
                ProcessOutcome outcome;
                try {
                    outcome = queueManager.processNextRetrying(queue, this::shouldStop);
                } catch (JobStoreException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Worker {} failed to process a job: {}", workerId, e.getMessage(), e);
                    outcome = ProcessOutcome.IDLE;
                }
                if (outcome == ProcessOutcome.IDLE && !shouldStop()
                        && !QueueManager.sleep(queueManager.config().pollInterval())) {
                    log.info("Worker {} interrupted.", workerId);
                }
            }
        } catch (JobStoreException e) {
            log.error("Worker {} stopping, job store keeps failing: {}", workerId, e.getMessage(), e);
            throw e;
        } finally {
            queueManager.unregister(this);
        }
        log.info("Worker {} stopped.", workerId);
    }
}
