package com.questrail.insights.transport;

/**
 * PushEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a persistent, server-push text message stream (one
 * WebSocket subscription).
 *
 * <p>The endpoint does not reconnect on its own. Whoever owns it observes
 * {@link PushEndpointListener#onDisconnected(Throwable)} and decides when to
 * call {@link #start()} again.</p>
 */
public interface PushEndpoint
{
    /**
     * Open the connection asynchronously.
     *
     * <p>On success the listener receives {@link PushEndpointListener#onConnected()};
     * on failure it receives {@link PushEndpointListener#onDisconnected(Throwable)}
     * with the cause. Calling {@code start()} while open is a no-op.</p>
     */
    void start();

    /**
     * Close the connection. The listener receives at most one
     * {@code onDisconnected(null)} for an orderly close.
     */
    void stop();

    boolean isOpen();

    /**
     * Register the listener that receives messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(PushEndpointListener listener);
}
