package com.questrail.scheduler.internal.exec;

import com.questrail.scheduler.api.JobHandle;
import com.questrail.scheduler.api.JobState;
import com.questrail.scheduler.internal.queue.ScheduledJob;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link JobHandle} that reaches its job only through a {@link WeakReference}.
 *
 * <p>Once the scheduler drops a job, the handle cannot keep it (or its action)
 * alive; cancellation then finds nothing and returns {@code false}. The state
 * cell is shared with the job and stays readable after the job is collected.</p>
 */
final class WeakJobHandle implements JobHandle {

    private final SingleThreadDelayScheduler owner;
    private final WeakReference<ScheduledJob> job;
    private final AtomicReference<JobState> state;
    private final long id;
    private final long dueAtNanos;

    WeakJobHandle(SingleThreadDelayScheduler owner, ScheduledJob job) {
        this.owner = owner;
        this.job = new WeakReference<>(job);
        this.state = job.stateCell();
        this.id = job.id();
        this.dueAtNanos = job.dueAtNanos();
    }

    SingleThreadDelayScheduler owner() {
        return owner;
    }

    /**
     * @return the job, or {@code null} if it has already been reclaimed
     */
    ScheduledJob job() {
        return job.get();
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public long dueAtNanos() {
        return dueAtNanos;
    }

    @Override
    public JobState state() {
        return state.get();
    }

    @Override
    public boolean cancel() {
        if (state.get().isTerminal()) {
            return false;
        }
        return owner.cancel(this);
    }

    @Override
    public String toString() {
        return "JobHandle{id=" + id + ", dueAtNanos=" + dueAtNanos + ", state=" + state.get() + '}';
    }
}
