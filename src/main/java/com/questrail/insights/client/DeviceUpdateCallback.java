package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives device-replace pushes: the full current object of one entity.
 *
 * <p>{@code modelKey} is passed through exactly as received; resolving it
 * against the recognized kinds is the receiver's job.</p>
 */
@FunctionalInterface
public interface DeviceUpdateCallback
{
    void onDeviceUpdate(String modelKey, JsonNode object);
}
