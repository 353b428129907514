package com.questrail.scheduler.harness;

import com.questrail.scheduler.api.JobHandle;
import com.questrail.scheduler.config.SchedulerConfig;
import com.questrail.scheduler.internal.exec.SingleThreadDelayScheduler;
import com.questrail.scheduler.observability.CompositeSchedulerObservabilitySink;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import com.questrail.scheduler.time.MonotonicClock;
import com.questrail.scheduler.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TimingHarness
 * =============================================================================
 * Runs a {@link RandomJobPlan} through a real-clock scheduler and checks the
 * recorded start times against the planned due times.
 *
 * <h2>Sequence</h2>
 * <ol>
 *   <li>schedule every planned job with a no-op action; cancel the marked ones at once</li>
 *   <li>raise the no-more-submissions signal and wake the worker</li>
 *   <li>wait for the worker to drain and terminate</li>
 *   <li>compare expected due times with {@link ExecutionRecorder} completions</li>
 * </ol>
 *
 * <p>All comparison state is local to one {@link #run} call.</p>
 */
public final class TimingHarness {

    private static final Logger log = LoggerFactory.getLogger(TimingHarness.class);

    private final MonotonicClock clock;
    private final Duration tolerance;
    private final Duration drainTimeout;
    private final SchedulerObservabilitySink extraSink;

    public TimingHarness(Duration tolerance, Duration drainTimeout, SchedulerObservabilitySink extraSink) {
        this(SystemMonotonicClock.INSTANCE, tolerance, drainTimeout, extraSink);
    }

    TimingHarness(MonotonicClock clock, Duration tolerance, Duration drainTimeout, SchedulerObservabilitySink extraSink) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        this.extraSink = Objects.requireNonNull(extraSink, "extraSink");
        if (tolerance.isNegative() || tolerance.isZero()) {
            throw new IllegalArgumentException("tolerance must be positive");
        }
    }

    public TimingReport run(RandomJobPlan plan) throws InterruptedException {
        Objects.requireNonNull(plan, "plan");

        ExecutionRecorder recorder = new ExecutionRecorder();
        SchedulerConfig config = SchedulerConfig.builder()
                .withThreadName("timing-harness-worker")
                .withObservabilitySink(new CompositeSchedulerObservabilitySink(recorder, extraSink))
                .build();

        Map<Long, Long> expectedDueAt = new HashMap<>();
        Set<Long> cancelled = new HashSet<>();
        AtomicBoolean noMoreSubmissions = new AtomicBoolean(false);

        boolean drained = false;
        try (SingleThreadDelayScheduler scheduler = SingleThreadDelayScheduler.builder()
                .withClock(clock)
                .withNoMoreSubmissions(noMoreSubmissions::get)
                .withConfig(config)
                .build())
        {
            for (RandomJobPlan.PlannedJob planned : plan.jobs()) {
                long dueAt = clock.nowNanos() + planned.delay().toNanos();
                JobHandle handle = scheduler.schedule(planned.id(), () -> {}, dueAt);
                if (planned.cancel()) {
                    handle.cancel();
                    cancelled.add(planned.id());
                } else {
                    expectedDueAt.put(planned.id(), dueAt);
                }
            }

            noMoreSubmissions.set(true);
            scheduler.wakeUp();

            drained = scheduler.awaitTermination(drainTimeout);
            if (!drained) {
                List<Long> dropped = scheduler.shutdownNow();
                log.warn("Plan {} did not drain within {}; {} job(s) dropped", plan.seed(), drainTimeout, dropped.size());
            }
        }

        TimingReport report = TimingReport.compare(expectedDueAt, cancelled, recorder.executed(),
                recorder.failures(), tolerance, drained);
        log.debug("Plan {} ({} jobs): {}", plan.seed(), plan.size(), report.summary());
        return report;
    }
}
