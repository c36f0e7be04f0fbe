package com.questrail.insights.client;

/**
 * The remote API could not be reached or answered with a server-side error.
 * Always retryable.
 */
public final class ConnectivityException extends InsightsApiException
{
    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
