package com.questrail.insights.internal.time;

/**
 * Cancellation handle for a scheduled refresh tick or push reconnect attempt.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         already ran or was cancelled before
     */
    boolean cancel();
}
