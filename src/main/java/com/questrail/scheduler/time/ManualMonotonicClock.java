package com.questrail.scheduler.time;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ManualMonotonicClock
 * =============================================================================
 * Virtual {@link MonotonicClock} whose value changes only through explicit
 * {@code advance} calls.
 *
 * <ul>
 *   <li>Starts at {@link System#nanoTime()} by default, or at a caller-chosen base</li>
 *   <li>Never moves with elapsed real time</li>
 *   <li>Never goes backwards</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Reads and advances are serialized by a lock owned by the clock. Advance
 * listeners run after that lock is released, on the advancing thread.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final ReentrantLock timeLock = new ReentrantLock();
    private final List<Runnable> advanceListeners = new CopyOnWriteArrayList<>();
    private long nowNanos;

    public ManualMonotonicClock() {
        this(System.nanoTime());
    }

    public ManualMonotonicClock(long startNanos) {
        this.nowNanos = startNanos;
    }

    @Override
    public long nowNanos() {
        timeLock.lock();
        try {
            return nowNanos;
        } finally {
            timeLock.unlock();
        }
    }

    @Override
    public void advance(Duration amount) {
        Objects.requireNonNull(amount, "amount");
        advanceNanos(amount.toNanos());
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        timeLock.lock();
        try {
            nowNanos += deltaNanos;
        } finally {
            timeLock.unlock();
        }
        fireAdvanced();
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    /**
     * Moves the clock to an absolute tick value.
     *
     * @throws IllegalArgumentException if {@code targetNanos} is before the current value
     */
    public void advanceTo(long targetNanos) {
        timeLock.lock();
        try {
            if (targetNanos < nowNanos) {
                throw new IllegalArgumentException("Cannot move monotonic clock backwards (current: "
                        + nowNanos + ", target: " + targetNanos + ")");
            }
            nowNanos = targetNanos;
        } finally {
            timeLock.unlock();
        }
        fireAdvanced();
    }

    @Override
    public void addAdvanceListener(Runnable listener) {
        advanceListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeAdvanceListener(Runnable listener) {
        advanceListeners.remove(Objects.requireNonNull(listener, "listener"));
    }

    private void fireAdvanced() {
        for (Runnable listener : advanceListeners) {
            listener.run();
        }
    }
}
