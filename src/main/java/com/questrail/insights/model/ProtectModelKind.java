package com.questrail.insights.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ProtectModelKind
 * -----------------------------------------------------------------------------
 * Closed set of entity kinds recognized from the video/sensor subsystem.
 *
 * <p>Push payloads identify their kind with a string {@code modelKey}. That
 * string is resolved against this enum exactly once, where the payload enters
 * the coordinator; anything unrecognized is dropped there instead of being
 * stored under an unknown key.</p>
 */
public enum ProtectModelKind
{
    CAMERA("camera", "cameras", true),
    LIGHT("light", "lights", true),
    SENSOR("sensor", "sensors", true),
    NVR("nvr", "nvrs", true),
    VIEWER("viewer", "viewers", false),
    CHIME("chime", "chimes", true);

    private final String modelKey;
    private final String pluralKey;
    private final boolean bulkRefreshed;

    ProtectModelKind(String modelKey, String pluralKey, boolean bulkRefreshed) {
        this.modelKey = modelKey;
        this.pluralKey = pluralKey;
        this.bulkRefreshed = bulkRefreshed;
    }

    /** Singular wire name, e.g. {@code camera}. */
    public String modelKey() {
        return modelKey;
    }

    /** Plural name used for collection paths and wrapper keys, e.g. {@code cameras}. */
    public String pluralKey() {
        return pluralKey;
    }

    /**
     * Whether the scheduled refresh fetches this kind in bulk. Viewers are only
     * ever learned from push updates.
     */
    public boolean isBulkRefreshed() {
        return bulkRefreshed;
    }

    public static Optional<ProtectModelKind> fromModelKey(String modelKey) {
        if (modelKey == null) {
            return Optional.empty();
        }
        for (ProtectModelKind kind : values()) {
            if (kind.modelKey.equals(modelKey)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static List<ProtectModelKind> bulkKinds() {
        return Arrays.stream(values())
                .filter(ProtectModelKind::isBulkRefreshed)
                .collect(Collectors.toUnmodifiableList());
    }
}
