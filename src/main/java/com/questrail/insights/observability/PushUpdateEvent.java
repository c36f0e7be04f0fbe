package com.questrail.insights.observability;

import java.time.Instant;

/**
 * A push callback was handled.
 *
 * @param kind raw model key (device channel) or event kind (event channel)
 * @param id   object identifier, {@code null} when the object carried none
 */
public record PushUpdateEvent(
    Instant timestamp,
    Channel channel,
    String kind,
    String id,
    Disposition disposition
) {
    public enum Channel {
        DEVICE,
        EVENT
    }

    public enum Disposition {
        /** Stored; for events, no entity field was correlated. */
        APPLIED,
        /** Event stored and correlated onto a known entity. */
        CORRELATED,
        DROPPED_MISSING_ID,
        DROPPED_UNKNOWN_KIND
    }

    public boolean isDropped() {
        return disposition == Disposition.DROPPED_MISSING_ID
                || disposition == Disposition.DROPPED_UNKNOWN_KIND;
    }
}
