package com.questrail.insights.observability;

/**
 * No-op implementation of SyncObservabilitySink.
 */
public final class NullObservabilitySink implements SyncObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {}

    @Override
    public void onTickCoalesced(TickCoalescedEvent event) {}

    @Override
    public void onFetchFailure(FetchFailureEvent event) {}

    @Override
    public void onPushUpdate(PushUpdateEvent event) {}

    @Override
    public void onError(SyncErrorEvent event) {}
}
