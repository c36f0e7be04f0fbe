package com.questrail.insights.observability;

import com.questrail.insights.api.RefreshOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * A refresh cycle finished.
 *
 * @param siteScope     site id for a site-scoped refresh, {@code null} for a full cycle
 * @param sitesRefreshed sites whose devices, clients and statistics were published
 * @param sitesFailed    sites whose listing failed and kept their previous contents
 */
public record CycleCompletedEvent(
    Instant timestamp,
    String siteScope,
    RefreshOutcome outcome,
    int sitesRefreshed,
    int sitesFailed,
    Duration elapsed
) {
}
