package com.questrail.insights.core;

import com.questrail.insights.model.Device;
import com.questrail.insights.model.DeviceStats;
import com.questrail.insights.model.NetworkClient;

import java.util.Map;
import java.util.Objects;

/**
 * The nested maps of one site as produced by one completed refresh of that
 * site. Published to the store as a single value so readers never see devices
 * from one refresh next to statistics from another.
 */
record SiteState(
    Map<String, Device> devices,
    Map<String, NetworkClient> clients,
    Map<String, DeviceStats> stats
) {
    static final SiteState EMPTY = new SiteState(Map.of(), Map.of(), Map.of());

    SiteState {
        devices = Map.copyOf(Objects.requireNonNull(devices, "devices"));
        clients = Map.copyOf(Objects.requireNonNull(clients, "clients"));
        stats = Map.copyOf(Objects.requireNonNull(stats, "stats"));
        for (String deviceId : devices.keySet()) {
            if (!stats.containsKey(deviceId)) {
                throw new IllegalArgumentException("device " + deviceId + " has no statistics record");
            }
        }
    }
}
