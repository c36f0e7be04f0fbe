package com.questrail.insights.observability;

import com.questrail.insights.api.RefreshOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SyncObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSyncObservabilitySink implements SyncObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSyncObservabilitySink.class);

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {
        RefreshOutcome outcome = event.outcome();
        String scope = event.siteScope() != null ? "site " + event.siteScope() : "all sites";

        switch (outcome.status()) {
            case SUCCESS -> log.info("Refresh of {} completed in {} ms ({} sites refreshed, {} failed)",
                scope, event.elapsed().toMillis(), event.sitesRefreshed(), event.sitesFailed());
            case SKIPPED -> log.debug("Refresh of {} skipped: {}", scope, outcome.detail());
            case AUTHENTICATION_FAILURE -> log.error("Refresh of {} failed, credentials rejected: {}",
                scope, outcome.detail());
            case CONNECTIVITY_FAILURE -> log.warn("Refresh of {} failed, API unreachable: {}",
                scope, outcome.detail());
            case UNEXPECTED_FAILURE -> log.error("Refresh of {} failed unexpectedly: {}",
                scope, outcome.detail(), outcome.cause());
        }
    }

    @Override
    public void onTickCoalesced(TickCoalescedEvent event) {
        log.debug("Refresh tick skipped, {} cycle(s) still in flight", event.cyclesInFlight());
    }

    @Override
    public void onFetchFailure(FetchFailureEvent event) {
        log.warn("Fetch failed [{}] {}: {}", event.scope(), event.location(), event.message());
        if (log.isDebugEnabled() && event.cause() != null) {
            log.debug("Fetch failure detail", event.cause());
        }
    }

    @Override
    public void onPushUpdate(PushUpdateEvent event) {
        if (event.isDropped()) {
            log.debug("Push {} update dropped ({}): kind={} id={}",
                event.channel(), event.disposition(), event.kind(), event.id());
        } else {
            log.debug("Push {} update {}: kind={} id={}",
                event.channel(), event.disposition(), event.kind(), event.id());
        }
    }

    @Override
    public void onError(SyncErrorEvent event) {
        log.error("Sync error: {}", event.message(), event.cause());
    }
}
