package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * ProtectEntity
 * -----------------------------------------------------------------------------
 * A device of the video/sensor subsystem (camera, light, sensor, NVR, viewer,
 * chime). Entities are keyed by identifier only; they are not site scoped.
 *
 * <h2>Update paths</h2>
 * <ul>
 *   <li><b>Replacement</b>: a bulk fetch or a device-replace push builds a new
 *       entity via {@link #of(ProtectModelKind, JsonNode)} and replaces the
 *       stored one whole.</li>
 *   <li><b>Correlation patch</b>: an event push derives a new entity with only
 *       the correlated fields changed ({@code lastMotion},
 *       {@code lastSmartDetectTypes}, {@code lastRing}).</li>
 * </ul>
 * Both paths produce a fresh instance; a stored entity is never mutated.
 */
public final class ProtectEntity
{
    public static final String LAST_MOTION = "lastMotion";
    public static final String LAST_SMART_DETECT_TYPES = "lastSmartDetectTypes";
    public static final String LAST_RING = "lastRing";

    private final ProtectModelKind kind;
    private final String id;
    private final ObjectNode attributes;

    private ProtectEntity(ProtectModelKind kind, String id, ObjectNode attributes) {
        this.kind = kind;
        this.id = id;
        this.attributes = attributes;
    }

    /**
     * @throws IllegalArgumentException if the object carries no {@code id}
     */
    public static ProtectEntity of(ProtectModelKind kind, JsonNode object) {
        Objects.requireNonNull(kind, "kind");
        String id = JsonFields.require(JsonFields.id(object), kind.modelKey() + " id", object);
        return new ProtectEntity(kind, id, JsonFields.copyOf(object));
    }

    public static Optional<String> idOf(JsonNode object) {
        return JsonFields.id(object);
    }

    public ProtectModelKind kind() {
        return kind;
    }

    public String id() {
        return id;
    }

    public Optional<String> name() {
        return JsonFields.text(attributes, "name");
    }

    public Optional<String> state() {
        return JsonFields.text(attributes, "state");
    }

    public OptionalLong lastMotion() {
        return JsonFields.longValue(attributes, LAST_MOTION);
    }

    public OptionalLong lastRing() {
        return JsonFields.longValue(attributes, LAST_RING);
    }

    public List<String> lastSmartDetectTypes() {
        return JsonFields.textList(attributes, LAST_SMART_DETECT_TYPES);
    }

    /**
     * Motion correlation: sets {@code lastMotion} and replaces the smart
     * detection classification with {@code smartDetectTypes}.
     */
    public ProtectEntity withMotion(OptionalLong start, List<String> smartDetectTypes) {
        ObjectNode patched = attributes.deepCopy();
        putTimestamp(patched, LAST_MOTION, start);
        ArrayNode types = patched.putArray(LAST_SMART_DETECT_TYPES);
        smartDetectTypes.forEach(types::add);
        return new ProtectEntity(kind, id, patched);
    }

    /**
     * Motion correlation for kinds without smart detection: only {@code lastMotion}.
     */
    public ProtectEntity withLastMotion(OptionalLong start) {
        ObjectNode patched = attributes.deepCopy();
        putTimestamp(patched, LAST_MOTION, start);
        return new ProtectEntity(kind, id, patched);
    }

    public ProtectEntity withLastRing(OptionalLong start) {
        ObjectNode patched = attributes.deepCopy();
        putTimestamp(patched, LAST_RING, start);
        return new ProtectEntity(kind, id, patched);
    }

    private static void putTimestamp(ObjectNode target, String field, OptionalLong value) {
        if (value.isPresent()) {
            target.put(field, value.getAsLong());
        } else {
            target.putNull(field);
        }
    }

    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtectEntity that)) return false;
        return kind == that.kind && id.equals(that.id) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, attributes);
    }

    @Override
    public String toString() {
        return "ProtectEntity{" + kind.modelKey() + "/" + id + "}";
    }
}
