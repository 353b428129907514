package com.questrail.scheduler.harness;

import com.questrail.scheduler.observability.JobExecutedEvent;
import com.questrail.scheduler.observability.JobFailedEvent;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Expected-versus-actual comparison of one timing run.
 *
 * @param expectedCount        jobs that should have run
 * @param executedCount        jobs that did run
 * @param missing              expected jobs that neither ran nor failed
 * @param failed               expected jobs whose action threw
 * @param cancelledButExecuted cancelled jobs that ran anyway
 * @param early                jobs that started before their due time, with lateness in nanos
 * @param late                 jobs that started more than the tolerance after their due time
 * @param maxLatenessNanos     worst lateness over every executed expected job
 * @param drained              whether the scheduler drained within the harness timeout
 */
public record TimingReport(
        int expectedCount,
        int executedCount,
        Set<Long> missing,
        Set<Long> failed,
        Set<Long> cancelledButExecuted,
        Map<Long, Long> early,
        Map<Long, Long> late,
        long maxLatenessNanos,
        boolean drained
) {
    public TimingReport {
        missing = Set.copyOf(missing);
        failed = Set.copyOf(failed);
        cancelledButExecuted = Set.copyOf(cancelledButExecuted);
        early = Map.copyOf(early);
        late = Map.copyOf(late);
    }

    /**
     * Compares expected due times with recorded executions.
     *
     * @param expectedDueAt expected due time per non-cancelled job id
     * @param cancelled     ids of jobs cancelled before their due time
     * @param executed      recorded executions per job id
     * @param failures      recorded action failures
     * @param tolerance     maximum accepted lateness
     * @param drained       whether the run drained in time
     */
    public static TimingReport compare(Map<Long, Long> expectedDueAt,
                                       Set<Long> cancelled,
                                       Map<Long, JobExecutedEvent> executed,
                                       Collection<JobFailedEvent> failures,
                                       Duration tolerance,
                                       boolean drained)
    {
        Objects.requireNonNull(expectedDueAt, "expectedDueAt");
        Objects.requireNonNull(cancelled, "cancelled");
        Objects.requireNonNull(executed, "executed");
        Objects.requireNonNull(failures, "failures");
        Objects.requireNonNull(tolerance, "tolerance");

        long toleranceNanos = tolerance.toNanos();
        Set<Long> failedIds = new TreeSet<>();
        for (JobFailedEvent failure : failures) {
            failedIds.add(failure.jobId());
        }

        Set<Long> missing = new TreeSet<>();
        Set<Long> failed = new TreeSet<>();
        Map<Long, Long> early = new TreeMap<>();
        Map<Long, Long> late = new TreeMap<>();
        long maxLateness = 0L;

        for (Map.Entry<Long, Long> expected : expectedDueAt.entrySet()) {
            JobExecutedEvent event = executed.get(expected.getKey());
            if (event == null) {
                if (failedIds.contains(expected.getKey())) {
                    failed.add(expected.getKey());
                } else {
                    missing.add(expected.getKey());
                }
                continue;
            }
            long lateness = event.startedAtNanos() - expected.getValue();
            maxLateness = Math.max(maxLateness, lateness);
            if (lateness < 0) {
                early.put(expected.getKey(), lateness);
            } else if (lateness >= toleranceNanos) {
                late.put(expected.getKey(), lateness);
            }
        }

        Set<Long> cancelledButExecuted = new TreeSet<>();
        for (Long id : cancelled) {
            if (executed.containsKey(id)) {
                cancelledButExecuted.add(id);
            }
        }

        return new TimingReport(expectedDueAt.size(), executed.size(), missing, failed,
                cancelledButExecuted, early, late, maxLateness, drained);
    }

    public boolean passed() {
        return drained
                && expectedCount == executedCount
                && missing.isEmpty()
                && failed.isEmpty()
                && cancelledButExecuted.isEmpty()
                && early.isEmpty()
                && late.isEmpty();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(passed() ? "PASSED" : "FAILED")
          .append(": expected=").append(expectedCount)
          .append(", executed=").append(executedCount)
          .append(", maxLateness=").append(maxLatenessNanos).append("ns");
        if (!drained) {
            sb.append(", not drained");
        }
        if (!missing.isEmpty()) {
            sb.append(", missing=").append(new TreeSet<>(missing));
        }
        if (!failed.isEmpty()) {
            sb.append(", failed=").append(new TreeSet<>(failed));
        }
        if (!cancelledButExecuted.isEmpty()) {
            sb.append(", cancelledButExecuted=").append(new TreeSet<>(cancelledButExecuted));
        }
        if (!early.isEmpty()) {
            sb.append(", early=").append(new TreeMap<>(early));
        }
        if (!late.isEmpty()) {
            sb.append(", late=").append(new TreeMap<>(late));
        }
        return sb.toString();
    }
}
