package com.questrail.scheduler.config;

import com.questrail.scheduler.observability.NullObservabilitySink;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import com.questrail.scheduler.time.SystemWallClock;
import com.questrail.scheduler.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * SchedulerConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for a single-worker delay scheduler.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>threadName</b> — Name of the dedicated worker thread.</li>
 *   <li><b>daemon</b> — Whether the worker thread is a daemon thread. A
 *       non-daemon worker keeps the JVM alive until the queue drains after
 *       the no-more-submissions signal.</li>
 *   <li><b>idleRecheckInterval</b> — Upper bound on how long an idle worker
 *       sleeps before re-reading the externally owned no-more-submissions
 *       signal. Flipping that signal does not wake the worker by itself.</li>
 *   <li><b>observabilitySink</b> — Receives job and lifecycle events.</li>
 *   <li><b>wallClock</b> — Timestamps observability events only.</li>
 * </ul>
 */
public record SchedulerConfig(
        String threadName,
        boolean daemon,
        Duration idleRecheckInterval,
        SchedulerObservabilitySink observabilitySink,
        WallClock wallClock
) {
    public static final String DEFAULT_THREAD_NAME = "delay-scheduler-worker";
    public static final Duration DEFAULT_IDLE_RECHECK_INTERVAL = Duration.ofMillis(10);

    public SchedulerConfig {
        Objects.requireNonNull(threadName, "threadName");
        Objects.requireNonNull(idleRecheckInterval, "idleRecheckInterval");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");

        if (threadName.isBlank()) {
            throw new IllegalArgumentException("threadName must not be blank");
        }
        if (idleRecheckInterval.isNegative() || idleRecheckInterval.isZero()) {
            throw new IllegalArgumentException("idleRecheckInterval must be positive");
        }
    }

    /**
     * Non-daemon worker named {@value #DEFAULT_THREAD_NAME}, 10ms idle recheck,
     * no observability.
     */
    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String threadName = DEFAULT_THREAD_NAME;
        private boolean daemon = false;
        private Duration idleRecheckInterval = DEFAULT_IDLE_RECHECK_INTERVAL;
        private SchedulerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withThreadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public Builder withDaemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public Builder withIdleRecheckInterval(Duration interval) {
            this.idleRecheckInterval = interval;
            return this;
        }

        public Builder withObservabilitySink(SchedulerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(threadName, daemon, idleRecheckInterval, observabilitySink, wallClock);
        }
    }
}
