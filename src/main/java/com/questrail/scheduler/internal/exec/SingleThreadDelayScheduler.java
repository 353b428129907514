package com.questrail.scheduler.internal.exec;

import com.questrail.scheduler.api.DelayScheduler;
import com.questrail.scheduler.api.JobHandle;
import com.questrail.scheduler.config.SchedulerConfig;
import com.questrail.scheduler.internal.queue.JobQueue;
import com.questrail.scheduler.internal.queue.ScheduledJob;
import com.questrail.scheduler.observability.JobCancelledEvent;
import com.questrail.scheduler.observability.JobExecutedEvent;
import com.questrail.scheduler.observability.JobFailedEvent;
import com.questrail.scheduler.observability.JobScheduledEvent;
import com.questrail.scheduler.observability.SchedulerLifecycleEvent;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import com.questrail.scheduler.time.MonotonicClock;
import com.questrail.scheduler.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * SingleThreadDelayScheduler
 * =============================================================================
 * {@link DelayScheduler} that runs every job on one dedicated worker thread.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>One worker thread runs the dispatch loop for the scheduler's lifetime.</li>
 *   <li>Any number of threads may call {@link #schedule}, {@link #cancel} and
 *       {@link #done} concurrently.</li>
 *   <li>A single lock guards the queue; a single condition, awaited with a
 *       deadline, puts the worker to sleep until the earliest due time or
 *       until a schedule, cancel or wake-up signal arrives.</li>
 *   <li>Actions run with the lock released, so a slow action delays later
 *       jobs but never blocks producers.</li>
 * </ul>
 *
 * <h2>Dispatch loop</h2>
 * <pre>
 *   lock
 *   loop:
 *     queue empty and no-more-submissions raised → terminate
 *     queue empty                                → sleep(idleRecheckInterval)
 *     earliest due in the future                 → sleep(until due)
 *     earliest due                               → pop, unlock, run, lock
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   builder().build()          → worker started
 *   schedule / cancel          → from any thread
 *   noMoreSubmissions = true   → owned by the caller
 *   close()                    → joins the worker once the queue drains
 * </pre>
 *
 * <p>There is no forced stop for a running action. An action that never
 * returns blocks the worker and every later job. {@link #shutdownNow()}
 * interrupts the worker and discards the queue; it exists for teardown.</p>
 */
public final class SingleThreadDelayScheduler implements DelayScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadDelayScheduler.class);

    private final MonotonicClock clock;
    private final BooleanSupplier noMoreSubmissions;
    private final SchedulerConfig config;
    private final SchedulerObservabilitySink observabilitySink;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition wakeCondition = queueLock.newCondition();
    private final JobQueue queue = new JobQueue();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Runnable clockAdvanceListener = this::wakeUp;

    // Guarded by queueLock.
    private boolean accepting = true;

    private volatile boolean stopRequested = false;

    private volatile Thread worker;

    /**
     * Creates a scheduler. The worker does not run until {@link #start()}.
     *
     * @param clock             time source for due times; never swapped afterwards
     * @param noMoreSubmissions externally owned signal, read but never written,
     *                          that no further {@code schedule} calls will occur
     * @param config            operational configuration
     */
    public SingleThreadDelayScheduler(MonotonicClock clock,
                                      BooleanSupplier noMoreSubmissions,
                                      SchedulerConfig config)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.noMoreSubmissions = Objects.requireNonNull(noMoreSubmissions, "noMoreSubmissions");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = config.observabilitySink();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the worker thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            clock.addAdvanceListener(clockAdvanceListener);
            Thread thread = new Thread(this::runDispatchLoop, config.threadName());
            thread.setDaemon(config.daemon());
            worker = thread;
            thread.start();
        }
    }

    @Override
    public JobHandle schedule(long id, Runnable action, long dueAtNanos) {
        Objects.requireNonNull(action, "action");
        ScheduledJob job = new ScheduledJob(id, sequence.getAndIncrement(), action, dueAtNanos);

        queueLock.lock();
        try {
            if (!accepting) {
                throw new IllegalStateException("scheduler terminated");
            }
            queue.insert(job);
            wakeCondition.signalAll();
        } finally {
            queueLock.unlock();
        }

        publish(sink -> sink.onJobScheduled(new JobScheduledEvent(
                config.wallClock().now(), id, dueAtNanos)));
        return new WeakJobHandle(this, job);
    }

    @Override
    public boolean cancel(JobHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (!(handle instanceof WeakJobHandle) || ((WeakJobHandle) handle).owner() != this) {
            throw new IllegalArgumentException("Handle was not issued by this scheduler: " + handle);
        }

        ScheduledJob job = ((WeakJobHandle) handle).job();
        if (job == null) {
            return false;
        }

        queueLock.lock();
        try {
            // Only a queued job is still PENDING; the worker flips RUNNING under this lock.
            if (!queue.remove(job)) {
                return false;
            }
            job.markCancelled();
            wakeCondition.signalAll();
        } finally {
            queueLock.unlock();
        }

        publish(sink -> sink.onJobCancelled(new JobCancelledEvent(
                config.wallClock().now(), job.id(), job.dueAtNanos())));
        return true;
    }

    @Override
    public boolean done() {
        queueLock.lock();
        try {
            return queue.isEmpty();
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public int pendingCount() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    Thread workerThread() {
        return worker;
    }

    /**
     * Makes the worker re-evaluate its sleep target now. Callers use this after
     * raising the no-more-submissions signal; virtual clocks trigger it on advance.
     */
    public void wakeUp() {
        queueLock.lock();
        try {
            wakeCondition.signalAll();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * @return {@code true} once the dispatch loop has exited
     */
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /**
     * Waits for the dispatch loop to exit.
     *
     * @return {@code true} if the worker terminated within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (worker == null) {
            return isTerminated();
        }
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Joins the worker thread. Blocks until the queue drains after the
     * no-more-submissions signal, so the caller must stop submitting first.
     */
    @Override
    public void close() {
        if (worker == null) {
            return;
        }
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops accepting jobs, discards everything still queued and interrupts
     * the worker. A running action is not waited for.
     *
     * @return identifiers of the discarded jobs, in execution order
     */
    public List<Long> shutdownNow() {
        List<ScheduledJob> dropped;
        queueLock.lock();
        try {
            accepting = false;
            stopRequested = true;
            dropped = queue.drain();
            for (ScheduledJob job : dropped) {
                job.markCancelled();
            }
            wakeCondition.signalAll();
        } finally {
            queueLock.unlock();
        }

        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }

        List<Long> ids = new ArrayList<>(dropped.size());
        for (ScheduledJob job : dropped) {
            ids.add(job.id());
            publish(sink -> sink.onJobCancelled(new JobCancelledEvent(
                    config.wallClock().now(), job.id(), job.dueAtNanos())));
        }
        if (!dropped.isEmpty()) {
            log.warn("Scheduler {} shut down with {} pending job(s) discarded", config.threadName(), dropped.size());
        }
        return ids;
    }

    /**
     * Main dispatch loop - runs on the dedicated worker thread.
     */
    private void runDispatchLoop() {
        publish(sink -> sink.onLifecycle(new SchedulerLifecycleEvent(
                config.wallClock().now(), config.threadName(), SchedulerLifecycleEvent.Phase.STARTED)));
        try {
            while (true) {
                try {
                    if (!dispatchNext()) {
                        break;
                    }
                } catch (InterruptedException e) {
                    if (stopRequested) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    // Only shutdownNow() may end the loop through interruption.
                    log.warn("Scheduler worker {} interrupted outside shutdownNow(); {} pending job(s) kept",
                            config.threadName(), pendingCount());
                }
            }
        } finally {
            queueLock.lock();
            try {
                accepting = false;
            } finally {
                queueLock.unlock();
            }
            clock.removeAdvanceListener(clockAdvanceListener);
            publish(sink -> sink.onLifecycle(new SchedulerLifecycleEvent(
                    config.wallClock().now(), config.threadName(), SchedulerLifecycleEvent.Phase.TERMINATED)));
            terminated.countDown();
        }
    }

    /**
     * Waits for and runs one job. Kept in its own frame so the worker holds no
     * reference to a finished job while it sleeps.
     *
     * @return {@code false} once the loop must terminate
     */
    private boolean dispatchNext() throws InterruptedException {
        ScheduledJob job = awaitNextDueJob();
        if (job == null) {
            return false;
        }
        execute(job);
        return true;
    }

    /**
     * Blocks until the earliest job is due and removes it from the queue.
     *
     * @return the job to run, or {@code null} once the loop must terminate
     */
    private ScheduledJob awaitNextDueJob() throws InterruptedException {
        queueLock.lock();
        try {
            while (true) {
                if (stopRequested) {
                    return null;
                }

                ScheduledJob next = queue.peekEarliest();
                if (next == null) {
                    if (noMoreSubmissions.getAsBoolean()) {
                        // Decided under the lock so no schedule() can slip in behind it.
                        accepting = false;
                        return null;
                    }
                    wakeCondition.awaitNanos(config.idleRecheckInterval().toNanos());
                    continue;
                }

                long now = clock.nowNanos();
                if (!next.isDueAt(now)) {
                    long waitNanos = next.dueAtNanos() - now;
                    if (waitNanos <= 0) {
                        // Overflowed: the due time is further away than a long can express.
                        waitNanos = Long.MAX_VALUE;
                    }
                    wakeCondition.awaitNanos(waitNanos);
                    continue;
                }

                queue.popEarliest();
                next.markRunning();
                return next;
            }
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Runs one job with the queue lock released and reports the outcome.
     */
    private void execute(ScheduledJob job) {
        long startedAt = clock.nowNanos();
        try {
            job.action().run();
        } catch (Exception e) {
            job.markFailed();
            publish(sink -> sink.onJobFailed(new JobFailedEvent(
                    config.wallClock().now(), job.id(), job.dueAtNanos(), startedAt, e)));
            clearStrayInterrupt(job);
            return;
        }
        long finishedAt = clock.nowNanos();
        job.markCompleted();
        clearStrayInterrupt(job);
        publish(sink -> sink.onJobExecuted(new JobExecutedEvent(
                config.wallClock().now(), job.id(), job.dueAtNanos(), startedAt, finishedAt)));
    }

    /**
     * An action that leaves the worker's interrupt flag set must not end the
     * dispatch loop; only {@link #shutdownNow()} may.
     */
    private void clearStrayInterrupt(ScheduledJob job) {
        if (Thread.interrupted() && !stopRequested) {
            log.warn("Job {} left the worker thread interrupted; flag cleared", job.id());
        }
    }

    private void publish(Consumer<SchedulerObservabilitySink> emission) {
        try {
            emission.accept(observabilitySink);
        } catch (RuntimeException e) {
            log.warn("Observability sink threw; event dropped", e);
        }
    }

    public static final class Builder {
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private BooleanSupplier noMoreSubmissions = () -> false;
        private SchedulerConfig config = SchedulerConfig.defaults();

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Signal, owned by the caller, that no further {@code schedule} calls
         * will occur. Defaults to never; such a scheduler only stops through
         * {@link #shutdownNow()}.
         */
        public Builder withNoMoreSubmissions(BooleanSupplier signal) {
            this.noMoreSubmissions = signal;
            return this;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Builds the scheduler and starts its worker thread.
         */
        public SingleThreadDelayScheduler build() {
            SingleThreadDelayScheduler scheduler = new SingleThreadDelayScheduler(clock, noMoreSubmissions, config);
            scheduler.start();
            return scheduler;
        }
    }
}
