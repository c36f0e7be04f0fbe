package com.questrail.insights.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution for the coordinator's refresh ticks and the event client's
 * reconnect attempts.
 *
 * <p>Deadlines are monotonic nanoseconds from a {@link MonotonicClock}. Tests
 * substitute a manually-driven implementation so cadence behavior can be
 * asserted without sleeping.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in {@link MonotonicClock#nowNanos()} units
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task {@code delay} after the clock's current reading.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
