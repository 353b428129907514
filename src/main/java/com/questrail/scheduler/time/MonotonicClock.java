package com.questrail.scheduler.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every due-time decision the scheduler makes.
 *
 * <h2>Binding invariant</h2>
 * Values returned by {@link #nowNanos()} MUST be monotonically non-decreasing.
 * The scheduler never executes a job before its due time only as long as this
 * holds; a clock that goes backwards is not detected.
 *
 * <p>
 * Two families of implementation exist:
 * <ul>
 *   <li>real clocks ({@link SystemMonotonicClock}) that follow
 *       {@link System#nanoTime()} and ignore {@link #advance(Duration)}</li>
 *   <li>virtual clocks ({@link ManualMonotonicClock}) that move only when
 *       explicitly advanced</li>
 * </ul>
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful relative to other values of the same clock.
     * </p>
     */
    long nowNanos();

    /**
     * Moves the clock forward by {@code amount}.
     *
     * <p>
     * Real clocks advance on their own; for them this is a no-op.
     * </p>
     *
     * @param amount non-negative duration
     */
    default void advance(Duration amount)
    {
        Objects.requireNonNull(amount, "amount");
    }

    /**
     * Registers a listener run after every explicit {@link #advance(Duration)}.
     * Clocks that never advance explicitly never invoke it.
     */
    default void addAdvanceListener(Runnable listener)
    {
        Objects.requireNonNull(listener, "listener");
    }

    /**
     * Removes a listener previously registered with {@link #addAdvanceListener(Runnable)}.
     */
    default void removeAdvanceListener(Runnable listener)
    {
        Objects.requireNonNull(listener, "listener");
    }
}
