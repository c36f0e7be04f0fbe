package com.questrail.insights.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for the snapshot's last-update stamp and for event
 * timestamps. Never used for cadence.
 */
public interface WallClock
{
    Instant now();
}
