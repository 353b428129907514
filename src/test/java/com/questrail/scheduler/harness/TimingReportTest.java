package com.questrail.scheduler.harness;

import com.questrail.scheduler.observability.JobExecutedEvent;
import com.questrail.scheduler.observability.JobFailedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimingReportTest {

    private static final Duration TOLERANCE = Duration.ofNanos(600_000);

    private static JobExecutedEvent ran(long id, long due, long started) {
        return new JobExecutedEvent(Instant.EPOCH, id, due, started, started);
    }

    @Test
    void passesWhenEveryExpectedJobRanWithinTolerance() {
        TimingReport report = TimingReport.compare(
                Map.of(1L, 1_000L, 2L, 2_000L),
                Set.of(3L),
                Map.of(1L, ran(1, 1_000, 1_100), 2L, ran(2, 2_000, 2_500)),
                List.of(),
                TOLERANCE,
                true);

        assertTrue(report.passed(), report.summary());
        assertEquals(500L, report.maxLatenessNanos());
        assertTrue(report.summary().startsWith("PASSED"));
    }

    @Test
    void flagsMissingJobs() {
        TimingReport report = TimingReport.compare(
                Map.of(1L, 1_000L, 2L, 2_000L),
                Set.of(),
                Map.of(1L, ran(1, 1_000, 1_000)),
                List.of(),
                TOLERANCE,
                true);

        assertFalse(report.passed());
        assertEquals(Set.of(2L), report.missing());
        assertTrue(report.summary().contains("missing=[2]"));
    }

    @Test
    void flagsCancelledJobsThatRan() {
        TimingReport report = TimingReport.compare(
                Map.of(),
                Set.of(5L),
                Map.of(5L, ran(5, 1_000, 1_000)),
                List.of(),
                TOLERANCE,
                true);

        assertFalse(report.passed());
        assertEquals(Set.of(5L), report.cancelledButExecuted());
    }

    @Test
    void flagsEarlyAndLateJobs() {
        TimingReport report = TimingReport.compare(
                Map.of(1L, 1_000_000L, 2L, 1_000_000L),
                Set.of(),
                Map.of(1L, ran(1, 1_000_000, 999_000), 2L, ran(2, 1_000_000, 1_600_000)),
                List.of(),
                TOLERANCE,
                true);

        assertFalse(report.passed());
        assertEquals(Map.of(1L, -1_000L), report.early());
        assertEquals(Map.of(2L, 600_000L), report.late());
    }

    @Test
    void undrainedRunFails() {
        TimingReport report = TimingReport.compare(Map.of(), Set.of(), Map.of(), List.of(), TOLERANCE, false);

        assertFalse(report.passed());
        assertTrue(report.summary().contains("not drained"));
    }

    @Test
    void failedJobsFailTheReportAndAreNotCountedAsMissing() {
        JobFailedEvent failure = new JobFailedEvent(Instant.EPOCH, 2L, 2_000L, 2_000L,
                new IllegalStateException("expected in test"));

        TimingReport report = TimingReport.compare(
                Map.of(1L, 1_000L, 2L, 2_000L),
                Set.of(),
                Map.of(1L, ran(1, 1_000, 1_000)),
                List.of(failure),
                TOLERANCE,
                true);

        assertFalse(report.passed());
        assertEquals(Set.of(2L), report.failed());
        assertTrue(report.missing().isEmpty());
        assertTrue(report.summary().contains("failed=[2]"));
    }
}
