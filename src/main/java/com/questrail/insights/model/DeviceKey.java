package com.questrail.insights.model;

import java.util.Objects;

/**
 * Composite key of a managed network device: devices are only unique within a site.
 */
public record DeviceKey(String siteId, String deviceId) {
    public DeviceKey {
        Objects.requireNonNull(siteId, "siteId");
        Objects.requireNonNull(deviceId, "deviceId");
    }

    @Override
    public String toString() {
        return siteId + "/" + deviceId;
    }
}
