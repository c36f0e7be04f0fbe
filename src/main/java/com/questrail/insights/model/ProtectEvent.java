package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The most recent object seen for one {@code (eventKind, eventId)} pair.
 */
public final class ProtectEvent
{
    private final String eventKind;
    private final String id;
    private final ObjectNode attributes;

    private ProtectEvent(String eventKind, String id, ObjectNode attributes) {
        this.eventKind = eventKind;
        this.id = id;
        this.attributes = attributes;
    }

    /**
     * @throws IllegalArgumentException if the object carries no {@code id}
     */
    public static ProtectEvent of(String eventKind, JsonNode object) {
        Objects.requireNonNull(eventKind, "eventKind");
        String id = JsonFields.require(JsonFields.id(object), eventKind + " event id", object);
        return new ProtectEvent(eventKind, id, JsonFields.copyOf(object));
    }

    public String eventKind() {
        return eventKind;
    }

    public Optional<ProtectEventType> type() {
        return ProtectEventType.fromWireName(eventKind);
    }

    public String id() {
        return id;
    }

    /** Identifier of the entity this event refers to, if any. */
    public Optional<String> device() {
        return JsonFields.text(attributes, "device");
    }

    public OptionalLong start() {
        return JsonFields.longValue(attributes, "start");
    }

    public OptionalLong end() {
        return JsonFields.longValue(attributes, "end");
    }

    public List<String> smartDetectTypes() {
        return JsonFields.textList(attributes, "smartDetectTypes");
    }

    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtectEvent that)) return false;
        return eventKind.equals(that.eventKind) && id.equals(that.id) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventKind, id, attributes);
    }

    @Override
    public String toString() {
        return "ProtectEvent{" + eventKind + "/" + id + ", device=" + device().orElse("-") + "}";
    }
}
