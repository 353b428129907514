package com.questrail.scheduler.internal.queue;

import com.questrail.scheduler.api.JobState;

import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ScheduledJob
 * =============================================================================
 * A queued unit of deferred work: identifier, action and absolute due time.
 *
 * <h2>Ordering</h2>
 * Jobs are ordered by {@code (dueAtNanos, id, sequence)}. The scheduler-assigned
 * {@code sequence} is unique per scheduler, so two jobs never compare equal even
 * when both due time and identifier collide.
 *
 * <h2>State</h2>
 * The lifecycle state lives in a small shared cell that handles may hold
 * strongly; the job itself (and its action) is only weakly reachable from
 * handles.
 */
public final class ScheduledJob {

    public static final Comparator<ScheduledJob> EXECUTION_ORDER = Comparator
            .comparingLong(ScheduledJob::dueAtNanos)
            .thenComparingLong(ScheduledJob::id)
            .thenComparingLong(ScheduledJob::sequence);

    private final long id;
    private final long sequence;
    private final Runnable action;
    private final long dueAtNanos;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.PENDING);

    public ScheduledJob(long id, long sequence, Runnable action, long dueAtNanos) {
        this.id = id;
        this.sequence = sequence;
        this.action = Objects.requireNonNull(action, "action");
        this.dueAtNanos = dueAtNanos;
    }

    public long id() {
        return id;
    }

    public long sequence() {
        return sequence;
    }

    public Runnable action() {
        return action;
    }

    public long dueAtNanos() {
        return dueAtNanos;
    }

    public JobState state() {
        return state.get();
    }

    /**
     * The shared state cell; handed to handles so they can report state
     * without referencing the job.
     */
    public AtomicReference<JobState> stateCell() {
        return state;
    }

    public boolean isDueAt(long nowNanos) {
        return dueAtNanos <= nowNanos;
    }

    public boolean markCancelled() {
        return state.compareAndSet(JobState.PENDING, JobState.CANCELLED);
    }

    public boolean markRunning() {
        return state.compareAndSet(JobState.PENDING, JobState.RUNNING);
    }

    public void markCompleted() {
        state.compareAndSet(JobState.RUNNING, JobState.COMPLETED);
    }

    public void markFailed() {
        state.compareAndSet(JobState.RUNNING, JobState.FAILED);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id=" + id + ", seq=" + sequence + ", dueAtNanos=" + dueAtNanos + ", state=" + state.get() + '}';
    }
}
