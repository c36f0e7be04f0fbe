package com.questrail.insights.client;

/**
 * Base failure raised by the resource and event clients.
 *
 * <p>Subclasses classify the failure so the coordinator can decide whether a
 * refresh cycle must stop, can be retried, or only affects one key:</p>
 * <ul>
 *   <li>{@link AuthenticationException}: credentials rejected; the cycle stops
 *       and re-authentication is required</li>
 *   <li>{@link ConnectivityException}: timeouts, I/O errors, server errors;
 *       retryable, the snapshot is preserved</li>
 *   <li>{@link ResourceNotFoundException}: the addressed resource does not exist</li>
 * </ul>
 * A bare {@code InsightsApiException} is an unclassified API failure.
 */
public class InsightsApiException extends RuntimeException
{
    public InsightsApiException(String message) {
        super(message);
    }

    public InsightsApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
