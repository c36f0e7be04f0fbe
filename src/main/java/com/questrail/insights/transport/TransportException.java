package com.questrail.insights.transport;

/**
 * The request could not be completed at the transport level: connection
 * refused, TLS failure, timeout, or the channel closed before a full response
 * arrived. An HTTP error status is not a transport failure.
 */
public class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
