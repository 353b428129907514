package com.questrail.scheduler.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Production implementation of SchedulerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSchedulerObservabilitySink implements SchedulerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSchedulerObservabilitySink.class);

    @Override
    public void onJobScheduled(JobScheduledEvent event) {
        log.debug("Scheduled job {} due at {}", event.jobId(), event.dueAtNanos());
    }

    @Override
    public void onJobCancelled(JobCancelledEvent event) {
        log.debug("Cancelled job {} due at {}", event.jobId(), event.dueAtNanos());
    }

    @Override
    public void onJobExecuted(JobExecutedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Executed job {} at {} ({} us late, took {} us)",
                event.jobId(),
                event.startedAtNanos(),
                TimeUnit.NANOSECONDS.toMicros(event.latenessNanos()),
                TimeUnit.NANOSECONDS.toMicros(event.durationNanos()));
        }
    }

    @Override
    public void onJobFailed(JobFailedEvent event) {
        log.error("Job {} failed", event.jobId(), event.cause());
    }

    @Override
    public void onLifecycle(SchedulerLifecycleEvent event) {
        log.info("Scheduler worker {}: {}", event.threadName(), event.phase());
    }
}
