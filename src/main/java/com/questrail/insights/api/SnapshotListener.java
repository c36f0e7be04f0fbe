package com.questrail.insights.api;

/**
 * Notified after every mutation batch, synchronously, on the thread that
 * performed the mutation (the refresh-cycle thread or the push delivery
 * thread). Those two threads are independent, so a listener may be invoked
 * concurrently with itself and must be thread-safe.
 *
 * <p>Implementations should read what they need from the snapshot and return
 * quickly. An exception thrown here is reported and swallowed; it never
 * prevents other listeners from running and never affects the snapshot.</p>
 */
@FunctionalInterface
public interface SnapshotListener
{
    void onSnapshotChanged(InsightsSnapshot snapshot, SnapshotChange change);
}
