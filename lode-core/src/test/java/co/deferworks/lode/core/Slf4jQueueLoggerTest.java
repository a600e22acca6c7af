package co.deferworks.lode.core;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jQueueLoggerTest {

    @Test
    void rendersContextAsSortedPairs() {
        assertEquals(" attempt=2 queue=mail", Slf4jQueueLogger.render(Map.of("queue", "mail", "attempt", 2)));
        assertEquals("", Slf4jQueueLogger.render(Map.of()));
        assertEquals("", Slf4jQueueLogger.render(null));
    }

    @Test
    void restoresMdcAfterLogging() {
        MDC.put(Slf4jQueueLogger.MDC_QUEUE, "outer");
        try {
            var logger = new Slf4jQueueLogger();
            logger.info("Job added", Map.of("priority", 1), 9L, "inner", "send-email");
            logger.jobMetrics(9L, "inner", "send-email", Duration.ofMillis(12), 1024);

            assertEquals("outer", MDC.get(Slf4jQueueLogger.MDC_QUEUE));
            assertNull(MDC.get(Slf4jQueueLogger.MDC_JOB_ID));
            assertNull(MDC.get(Slf4jQueueLogger.MDC_KIND));
        } finally {
            MDC.clear();
        }
    }
}
