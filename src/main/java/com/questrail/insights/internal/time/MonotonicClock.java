package com.questrail.insights.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for refresh cadence and reconnect back-off.
 *
 * <p>Cadence must not drift or jump when the host's wall clock is adjusted, so
 * every deadline in the coordinator is computed from this clock. Wall-clock
 * time ({@link WallClock}) is only used for the snapshot's last-update stamp
 * and for observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
