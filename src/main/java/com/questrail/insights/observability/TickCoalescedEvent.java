package com.questrail.insights.observability;

import java.time.Instant;

/**
 * A scheduled refresh tick fired while {@code cyclesInFlight} cycles were
 * still queued or running, and was dropped.
 */
public record TickCoalescedEvent(Instant timestamp, int cyclesInFlight) {
}
