package com.questrail.scheduler.config;

import com.questrail.scheduler.observability.NullObservabilitySink;
import com.questrail.scheduler.observability.Slf4jSchedulerObservabilitySink;
import com.questrail.scheduler.time.SystemWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SchedulerConfigTest
 * -----------------------------------------------------------------------------
 * Validates scheduler configuration defaults, builder and validation.
 */
class SchedulerConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals("delay-scheduler-worker", config.threadName());
        assertFalse(config.daemon());
        assertEquals(Duration.ofMillis(10), config.idleRecheckInterval());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertSame(SystemWallClock.INSTANCE, config.wallClock());
    }

    @Test
    void builderOverridesEveryField() {
        Slf4jSchedulerObservabilitySink sink = new Slf4jSchedulerObservabilitySink();
        Instant fixed = Instant.parse("2024-01-01T00:00:00Z");

        SchedulerConfig config = SchedulerConfig.builder()
                .withThreadName("jobs")
                .withDaemon(true)
                .withIdleRecheckInterval(Duration.ofMillis(3))
                .withObservabilitySink(sink)
                .withWallClock(() -> fixed)
                .build();

        assertEquals("jobs", config.threadName());
        assertTrue(config.daemon());
        assertEquals(Duration.ofMillis(3), config.idleRecheckInterval());
        assertSame(sink, config.observabilitySink());
        assertEquals(fixed, config.wallClock().now());
    }

    @Test
    void rejectsNullFields() {
        assertThrows(NullPointerException.class, () -> SchedulerConfig.builder().withThreadName(null).build());
        assertThrows(NullPointerException.class, () -> SchedulerConfig.builder().withIdleRecheckInterval(null).build());
        assertThrows(NullPointerException.class, () -> SchedulerConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class, () -> SchedulerConfig.builder().withWallClock(null).build());
    }

    @Test
    void rejectsBlankThreadName() {
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.builder().withThreadName("  ").build());
    }

    @Test
    void rejectsNonPositiveIdleRecheckInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.builder().withIdleRecheckInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.builder().withIdleRecheckInterval(Duration.ofMillis(-1)).build());
    }
}
