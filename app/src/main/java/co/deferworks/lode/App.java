package co.deferworks.lode;

import co.deferworks.lode.core.BackoffStrategy;
import co.deferworks.lode.core.JobRegistry;
import co.deferworks.lode.driver.LodeDriver;
import co.deferworks.lode.driver.QueueConfig;
import co.deferworks.lode.driver.QueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        String jdbcUrl = System.getenv("JDBC_URL");
        String username = System.getenv("DB_USER");
        String password = System.getenv("DB_PASSWORD");
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            log.error("JDBC_URL is not set.");
            System.exit(1);
        }

        QueueConfig config = QueueConfig.fromEnvironment(System.getenv());
        LodeDriver driver = new LodeDriver(jdbcUrl, username, password, jobRegistry(), 5, config);

        try {
            driver.start();
            QueueManager queueManager = driver.getQueueManager();

            // Plain dispatch.
            boolean added = queueManager.add("send-welcome-email", "{\"user\": 42}");
            log.info("Dispatched welcome email: {}", added);

            // Urgent work on its own queue, and a delayed reminder.
            queueManager.dispatch("resize-image").onQueue("media").priority(1).dispatch("{\"image\": \"a.png\"}");
            queueManager.dispatch("send-reminder").delay(Duration.ofSeconds(5)).dispatch("{\"user\": 42}");

            // A job that always fails, retried twice with a short fixed delay before it is dead-lettered.
            queueManager.dispatch("flaky-import")
                    .maxAttempts(3)
                    .backoff(BackoffStrategy.FIXED)
                    .retryAfter(Duration.ofSeconds(2))
                    .tags("import", "nightly")
                    .dispatch("{\"file\": \"broken.csv\"}");

            // Transactional dispatch: the job only exists if the surrounding transaction commits.
            try (Connection connection = driver.getConnection()) {
                connection.setAutoCommit(false);
                queueManager.dispatch("send-invoice").dispatch("{\"invoice\": 7}", connection);
                // Other writes of the same business transaction would go here.
                connection.commit();
                log.info("Transaction committed with its invoice job.");
            } catch (Exception e) {
                log.error("Transactional dispatch failed: ", e);
            }

            // Keep the application running for a bit to allow workers to process jobs.
            TimeUnit.SECONDS.sleep(15);

            log.info("Queue stats: {}", queueManager.getStats());
            queueManager.getFailedJobs().forEach(failed -> log.info("Dead letter: {}", failed));
            queueManager.getFailedJobsTagged("import", 10, 0)
                    .forEach(failed -> log.info("Failed import: {} tags={}", failed.payload(), failed.tags()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for jobs.", e);
        } finally {
            driver.shutdown();
        }
    }

    private static JobRegistry jobRegistry() {
        return new JobRegistry()
                .register("send-welcome-email", job -> log.info("Sending welcome email: {}", job.payload()))
                .register("send-reminder", job -> log.info("Sending reminder: {}", job.payload()))
                .register("send-invoice", job -> log.info("Sending invoice: {}", job.payload()))
                .register("resize-image", job -> {
                    // Simulate some work
                    TimeUnit.SECONDS.sleep(1);
                    log.info("Resized image: {}", job.payload());
                })
                .register("flaky-import", job -> {
                    throw new IllegalStateException("Simulated import failure");
                });
    }
}
