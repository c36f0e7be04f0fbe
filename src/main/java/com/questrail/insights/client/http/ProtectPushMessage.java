package com.questrail.insights.client.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One decoded subscription message: {@code {"type":"add|update|remove","item":{...}}}.
 *
 * @param kind the item's {@code modelKey} (device channel) or {@code type} (event channel)
 */
public record ProtectPushMessage(Action action, String kind, JsonNode item)
{
    public enum Action
    {
        ADD,
        UPDATE,
        REMOVE
    }

    public ProtectPushMessage {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(item, "item");
    }
}
