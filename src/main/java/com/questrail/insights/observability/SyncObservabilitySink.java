package com.questrail.insights.observability;

/**
 * Receives synchronization observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods may be called concurrently from the refresh-cycle thread, fan-out
 * worker threads and the push delivery thread. Implementations must not throw.</p>
 */
public interface SyncObservabilitySink {
    /**
     * Called when a full or site-scoped refresh cycle finishes, whatever its outcome.
     */
    void onCycleCompleted(CycleCompletedEvent event);

    /**
     * Called when a scheduled tick is skipped because a cycle is still running.
     */
    void onTickCoalesced(TickCoalescedEvent event);

    /**
     * Called when a fetch below the top of the cycle fails and is contained at its key.
     */
    void onFetchFailure(FetchFailureEvent event);

    /**
     * Called for every push callback, applied or dropped.
     */
    void onPushUpdate(PushUpdateEvent event);

    /**
     * Called for failures outside a fetch: listener exceptions, unexpected cycle
     * errors, push decoding failures.
     */
    void onError(SyncErrorEvent event);
}
