package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives event-notify pushes (motion, smart detection, doorbell ring, ...).
 */
@FunctionalInterface
public interface EventUpdateCallback
{
    void onEventUpdate(String eventKind, JsonNode object);
}
