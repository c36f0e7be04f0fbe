package com.questrail.insights.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly outside a contained fetch.
 */
public record SyncErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
