package com.questrail.insights.api;

import com.questrail.insights.model.Device;
import com.questrail.insights.model.DeviceStats;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.ProtectEntity;
import com.questrail.insights.model.ProtectEvent;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.model.Site;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * InsightsSnapshot
 * -----------------------------------------------------------------------------
 * Read-only view of the current known state, shared by every reader of the
 * projection layer.
 *
 * <h2>Consistency</h2>
 * <ul>
 *   <li>Every returned record is immutable. A reader sees either the previous
 *       or the current value for a key, never a half-written one.</li>
 *   <li>A site's devices, clients and statistics are published together, so
 *       {@link #getDevices(String)} and {@link #getDeviceStats(String, String)}
 *       always describe the same completed refresh of that site.</li>
 *   <li>Returned maps are unmodifiable copies or views of immutable maps.</li>
 * </ul>
 *
 * <h2>Staleness</h2>
 * Keys whose latest fetch failed keep their previous value and are not flagged
 * as stale. {@link #isAvailable()} is the only success/failure signal.
 */
public interface InsightsSnapshot
{
    /**
     * {@code true} once a refresh cycle's site listing has succeeded, and until
     * a later cycle fails at the top level.
     */
    boolean isAvailable();

    /** Completion time of the last successful full refresh cycle. */
    Optional<Instant> lastUpdate();

    Map<String, Site> getSites();

    Optional<Site> getSite(String siteId);

    Map<String, Device> getDevices(String siteId);

    Optional<Device> getDevice(String siteId, String deviceId);

    Optional<DeviceStats> getDeviceStats(String siteId, String deviceId);

    Map<String, NetworkClient> getClients(String siteId);

    Map<String, ProtectEntity> getProtectEntities(ProtectModelKind kind);

    Optional<ProtectEntity> getProtectEntity(ProtectModelKind kind, String id);

    Optional<ProtectEvent> getEvent(String eventKind, String eventId);
}
