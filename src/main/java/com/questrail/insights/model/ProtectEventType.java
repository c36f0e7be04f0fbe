package com.questrail.insights.model;

import java.util.Optional;

/**
 * Push event kinds that carry field-correlation rules onto a stored entity.
 *
 * <p>Any other event kind is still stored, it just never touches an entity.</p>
 */
public enum ProtectEventType
{
    MOTION("motion"),
    SMART_DETECT_ZONE("smartDetectZone"),
    RING("ring");

    private final String wireName;

    ProtectEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ProtectEventType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (ProtectEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
