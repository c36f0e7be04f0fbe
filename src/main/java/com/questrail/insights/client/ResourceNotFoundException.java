package com.questrail.insights.client;

/**
 * The addressed site, device or entity does not exist on the remote side (HTTP 404).
 */
public final class ResourceNotFoundException extends InsightsApiException
{
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
