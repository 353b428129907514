package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * Record representing a worker thread lifecycle transition.
 */
public record SchedulerLifecycleEvent(
    Instant timestamp,
    String threadName,
    Phase phase
) {
    public enum Phase {
        STARTED,
        TERMINATED
    }
}
