package com.questrail.insights.api;

/**
 * Handle returned when registering a {@link SnapshotListener}; closing it
 * deregisters the listener. Closing twice is harmless.
 */
public interface ListenerRegistration extends AutoCloseable
{
    @Override
    void close();
}
