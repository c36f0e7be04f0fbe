package com.questrail.insights.client;

/**
 * The remote API rejected the configured credentials (HTTP 401 or 403).
 */
public final class AuthenticationException extends InsightsApiException
{
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
