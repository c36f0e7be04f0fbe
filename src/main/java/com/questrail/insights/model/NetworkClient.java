package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * An end-host connected to a site's network.
 *
 * <p>{@link #uplinkDeviceId()} is a lookup reference to the device the client
 * connects through. It does not imply ownership: clients live in their own
 * per-site map.</p>
 */
public final class NetworkClient
{
    private final String siteId;
    private final String id;
    private final ObjectNode attributes;

    private NetworkClient(String siteId, String id, ObjectNode attributes) {
        this.siteId = siteId;
        this.id = id;
        this.attributes = attributes;
    }

    public static NetworkClient of(String siteId, JsonNode object) {
        Objects.requireNonNull(siteId, "siteId");
        String id = JsonFields.require(JsonFields.id(object), "client id", object);
        return new NetworkClient(siteId, id, JsonFields.copyOf(object));
    }

    public String siteId() {
        return siteId;
    }

    public String id() {
        return id;
    }

    public Optional<String> name() {
        return JsonFields.text(attributes, "name");
    }

    public Optional<String> uplinkDeviceId() {
        return JsonFields.text(attributes, "uplinkDeviceId");
    }

    public boolean isUplinkedTo(String deviceId) {
        return uplinkDeviceId().map(deviceId::equals).orElse(false);
    }

    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkClient that)) return false;
        return siteId.equals(that.siteId) && id.equals(that.id) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(siteId, id, attributes);
    }

    @Override
    public String toString() {
        return "NetworkClient{" + siteId + "/" + id + ", uplink=" + uplinkDeviceId().orElse("-") + "}";
    }
}
