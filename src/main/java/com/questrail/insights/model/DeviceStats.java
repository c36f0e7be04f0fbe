package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * DeviceStats
 * -----------------------------------------------------------------------------
 * Point-in-time statistics for one device plus the clients currently uplinked
 * to it.
 *
 * <p>The {@code id} attribute always equals the device identifier. The client
 * list is denormalized: it is recomputed every refresh cycle by filtering the
 * site's client set and is never persisted separately.</p>
 *
 * <p>An {@linkplain #empty(String) empty} record stands in for a device whose
 * statistics fetch failed during the latest cycle.</p>
 */
public final class DeviceStats
{
    private final String deviceId;
    private final ObjectNode attributes;
    private final List<NetworkClient> clients;
    private final boolean empty;

    private DeviceStats(String deviceId, ObjectNode attributes, List<NetworkClient> clients, boolean empty) {
        this.deviceId = deviceId;
        this.attributes = attributes;
        this.clients = clients;
        this.empty = empty;
    }

    /**
     * Builds a statistics record annotated with the uplinked subset of
     * {@code siteClients}.
     */
    public static DeviceStats of(String deviceId, JsonNode statistics, Collection<NetworkClient> siteClients) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(siteClients, "siteClients");
        ObjectNode attrs = JsonFields.copyOf(statistics);
        attrs.put("id", deviceId);
        return new DeviceStats(deviceId, attrs, uplinkedTo(deviceId, siteClients), false);
    }

    public static DeviceStats empty(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        ObjectNode attrs = JsonNodeFactory.instance.objectNode();
        attrs.put("id", deviceId);
        return new DeviceStats(deviceId, attrs, List.of(), true);
    }

    /**
     * Returns exactly the clients whose uplink reference equals {@code deviceId}.
     */
    public static List<NetworkClient> uplinkedTo(String deviceId, Collection<NetworkClient> siteClients) {
        return siteClients.stream()
                .filter(c -> c.isUplinkedTo(deviceId))
                .collect(Collectors.toUnmodifiableList());
    }

    public String id() {
        return deviceId;
    }

    public boolean isEmpty() {
        return empty;
    }

    public List<NetworkClient> clients() {
        return clients;
    }

    public OptionalLong uptimeSeconds() {
        return JsonFields.longValue(attributes, "uptimeSec");
    }

    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceStats that)) return false;
        return empty == that.empty
                && deviceId.equals(that.deviceId)
                && attributes.equals(that.attributes)
                && clients.equals(that.clients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, attributes, clients, empty);
    }

    @Override
    public String toString() {
        return "DeviceStats{" + deviceId + (empty ? ", empty" : "") + ", clients=" + clients.size() + "}";
    }
}
