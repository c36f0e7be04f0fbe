package com.questrail.insights.transport;

/**
 * PushEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link PushEndpoint}.
 *
 * <p>Callbacks for one endpoint are delivered serially. Netty endpoints
 * deliver them on the channel's event loop, so implementations must not block.</p>
 */
public interface PushEndpointListener
{
    /** The subscription handshake completed; messages may follow. */
    void onConnected();

    /**
     * The connection is gone or could not be established.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onDisconnected(Throwable cause);

    /**
     * One complete text message, exactly as received.
     */
    void onMessage(String text);
}
