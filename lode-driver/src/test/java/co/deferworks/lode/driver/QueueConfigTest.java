package co.deferworks.lode.driver;

import co.deferworks.lode.core.BackoffStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueConfigTest {

    @Test
    void testDefaults() {
        var config = QueueConfig.defaults();

        assertTrue(config.enabled());
        assertEquals(3, config.maxAttempts());
        assertEquals(BackoffStrategy.EXPONENTIAL, config.backoffStrategy());
        assertEquals(Duration.ofSeconds(60), config.retryDelay());
        assertEquals(Duration.ofHours(1), config.maxRetryDelay());
        assertTrue(config.jitter());
        assertEquals(Duration.ofSeconds(300), config.leaseTimeout());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(5, config.storeFailureLimit());
        assertEquals(Duration.ofMinutes(5), config.reaperInterval());
        assertEquals(10, config.batchSize());
        assertEquals(Duration.ofSeconds(55), config.batchMaxExecutionTime());
    }

    @Test
    void testFromEnvironment() {
        var config = QueueConfig.fromEnvironment(Map.of(
                "LODE_ENABLED", "false",
                "LODE_MAX_ATTEMPTS", "7",
                "LODE_BACKOFF_STRATEGY", "linear",
                "LODE_RETRY_DELAY_SECONDS", "10",
                "LODE_LEASE_TIMEOUT_SECONDS", "90",
                "LODE_POLL_INTERVAL_MS", "250",
                "LODE_BATCH_SIZE", " 25 ",
                "LODE_JITTER", "1",
                "UNRELATED", "x"));

        assertFalse(config.enabled());
        assertEquals(7, config.maxAttempts());
        assertEquals(BackoffStrategy.LINEAR, config.backoffStrategy());
        assertEquals(Duration.ofSeconds(10), config.retryDelay());
        assertEquals(Duration.ofSeconds(90), config.leaseTimeout());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(25, config.batchSize());
        assertTrue(config.jitter());
        assertEquals(QueueConfig.defaults().reaperInterval(), config.reaperInterval());
    }

    @Test
    void testFromEnvironmentIgnoresBlankValues() {
        assertEquals(QueueConfig.defaults(), QueueConfig.fromEnvironment(Map.of("LODE_MAX_ATTEMPTS", "  ")));
    }

    @Test
    void testFromEnvironmentRejectsGarbage() {
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfig.fromEnvironment(Map.of("LODE_MAX_ATTEMPTS", "many")));
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfig.fromEnvironment(Map.of("LODE_ENABLED", "maybe")));
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfig.fromEnvironment(Map.of("LODE_BACKOFF_STRATEGY", "random")));
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfig.fromEnvironment(Map.of("LODE_MAX_ATTEMPTS", "0")));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().leaseTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().maxAttempts(40_000).build());
        assertThrows(IllegalArgumentException.class, () -> QueueConfig.builder().storeFailureLimit(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfig.builder().retryDelay(Duration.ofMinutes(10)).maxRetryDelay(Duration.ofMinutes(1)).build());
        assertThrows(NullPointerException.class, () -> QueueConfig.builder().backoffStrategy(null).build());
    }

    @Test
    void testRetryPolicyFollowsConfig() {
        var policy = QueueConfig.builder().maxAttempts(4).backoffStrategy(BackoffStrategy.FIXED).build().retryPolicy();

        assertEquals(4, policy.maxAttempts());
        assertEquals(BackoffStrategy.FIXED, policy.strategy());
    }

    @Test
    void testToBuilderRoundTrip() {
        var config = QueueConfig.builder().maxAttempts(9).jitter(true).build();

        assertEquals(config, config.toBuilder().build());
    }
}
