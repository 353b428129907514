package com.questrail.scheduler.harness;

import com.questrail.scheduler.observability.JobCancelledEvent;
import com.questrail.scheduler.observability.JobExecutedEvent;
import com.questrail.scheduler.observability.JobFailedEvent;
import com.questrail.scheduler.observability.JobScheduledEvent;
import com.questrail.scheduler.observability.SchedulerLifecycleEvent;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run record of job completions, keyed by job identifier.
 */
public final class ExecutionRecorder implements SchedulerObservabilitySink {

    private final Map<Long, JobExecutedEvent> executed = new LinkedHashMap<>();
    private final List<JobFailedEvent> failures = new ArrayList<>();

    @Override
    public void onJobScheduled(JobScheduledEvent event) {}

    @Override
    public void onJobCancelled(JobCancelledEvent event) {}

    @Override
    public synchronized void onJobExecuted(JobExecutedEvent event) {
        executed.put(event.jobId(), event);
    }

    @Override
    public synchronized void onJobFailed(JobFailedEvent event) {
        failures.add(event);
    }

    @Override
    public void onLifecycle(SchedulerLifecycleEvent event) {}

    /**
     * Completions in execution order.
     */
    public synchronized Map<Long, JobExecutedEvent> executed() {
        return new LinkedHashMap<>(executed);
    }

    public synchronized List<JobFailedEvent> failures() {
        return new ArrayList<>(failures);
    }
}
