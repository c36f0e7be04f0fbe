package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Device
 * -----------------------------------------------------------------------------
 * A managed network appliance within a site, keyed by {@link DeviceKey}.
 *
 * <h2>Composition</h2>
 * A device record is assembled from two independent API calls:
 * <ul>
 *   <li>the base listing object (name, model, state, ...)</li>
 *   <li>an optional supplementary "device info" object (firmware version, ...)</li>
 * </ul>
 * {@link #withInfo(JsonNode)} overlays the supplementary fields onto a copy of
 * the base record. When the supplementary fetch fails the base record is used
 * as-is; it never loses its listing fields.
 */
public final class Device
{
    private final DeviceKey key;
    private final ObjectNode attributes;

    private Device(DeviceKey key, ObjectNode attributes) {
        this.key = key;
        this.attributes = attributes;
    }

    /**
     * Builds a device from a site listing object.
     *
     * @throws IllegalArgumentException if the object carries no {@code id}
     */
    public static Device of(String siteId, JsonNode listing) {
        Objects.requireNonNull(siteId, "siteId");
        String id = JsonFields.require(JsonFields.id(listing), "device id", listing);
        return new Device(new DeviceKey(siteId, id), JsonFields.copyOf(listing));
    }

    /**
     * Returns a new device whose attributes are this device's listing fields
     * overlaid with every non-null field of {@code info}. The identifier is
     * never overwritten.
     */
    public Device withInfo(JsonNode info) {
        if (info == null || !info.isObject()) {
            return this;
        }
        ObjectNode merged = attributes.deepCopy();
        info.fields().forEachRemaining(field -> {
            if (!field.getValue().isNull()) {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        merged.put("id", key.deviceId());
        return new Device(key, merged);
    }

    public DeviceKey key() {
        return key;
    }

    public String siteId() {
        return key.siteId();
    }

    public String id() {
        return key.deviceId();
    }

    public Optional<String> name() {
        return JsonFields.text(attributes, "name");
    }

    public Optional<String> model() {
        return JsonFields.text(attributes, "model");
    }

    public Optional<String> state() {
        return JsonFields.text(attributes, "state");
    }

    public Optional<String> firmwareVersion() {
        return JsonFields.text(attributes, "firmwareVersion");
    }

    public boolean isOnline() {
        return state().map("ONLINE"::equalsIgnoreCase).orElse(false);
    }

    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Device that)) return false;
        return key.equals(that.key) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, attributes);
    }

    @Override
    public String toString() {
        return "Device{" + key + ", name=" + name().orElse("?") + "}";
    }
}
