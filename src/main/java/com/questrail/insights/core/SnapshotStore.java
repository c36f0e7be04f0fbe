package com.questrail.insights.core;

import com.questrail.insights.api.InsightsSnapshot;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.DeviceStats;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.ProtectEntity;
import com.questrail.insights.model.ProtectEvent;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.model.Site;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * SnapshotStore
 * -----------------------------------------------------------------------------
 * Canonical in-memory state shared by the refresh cycle, the push merger and
 * every reader.
 *
 * <h2>Write discipline</h2>
 * Every stored value is immutable, and every write replaces one top-level key
 * atomically:
 * <ul>
 *   <li>the site list is one volatile reference, swapped whole;</li>
 *   <li>each site's devices, clients and statistics form one {@link SiteState}
 *       swapped whole per site;</li>
 *   <li>each protect entity and each event is its own map entry. Bulk and
 *       push replacements use {@code put} (last writer wins); correlation
 *       patches use {@code computeIfPresent}, which is atomic per key against
 *       both.</li>
 * </ul>
 * Readers therefore never lock and never observe a half-written value.
 *
 * <p>Write methods are package-private: only the coordinator's collaborators
 * in this package mutate the store.</p>
 */
public final class SnapshotStore implements InsightsSnapshot
{
    private volatile Map<String, Site> sites = Map.of();
    private final ConcurrentMap<String, SiteState> siteStates = new ConcurrentHashMap<>();

    private final Map<ProtectModelKind, ConcurrentMap<String, ProtectEntity>> protect =
            new EnumMap<>(ProtectModelKind.class);
    private final ConcurrentMap<String, ConcurrentMap<String, ProtectEvent>> events = new ConcurrentHashMap<>();

    private volatile boolean available;
    private volatile Instant lastUpdate;

    public SnapshotStore() {
        for (ProtectModelKind kind : ProtectModelKind.values()) {
            protect.put(kind, new ConcurrentHashMap<>());
        }
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<Instant> lastUpdate() {
        return Optional.ofNullable(lastUpdate);
    }

    @Override
    public Map<String, Site> getSites() {
        return sites;
    }

    @Override
    public Optional<Site> getSite(String siteId) {
        return Optional.ofNullable(sites.get(siteId));
    }

    @Override
    public Map<String, Device> getDevices(String siteId) {
        return siteState(siteId).devices();
    }

    @Override
    public Optional<Device> getDevice(String siteId, String deviceId) {
        return Optional.ofNullable(siteState(siteId).devices().get(deviceId));
    }

    @Override
    public Optional<DeviceStats> getDeviceStats(String siteId, String deviceId) {
        return Optional.ofNullable(siteState(siteId).stats().get(deviceId));
    }

    @Override
    public Map<String, NetworkClient> getClients(String siteId) {
        return siteState(siteId).clients();
    }

    @Override
    public Map<String, ProtectEntity> getProtectEntities(ProtectModelKind kind) {
        return Map.copyOf(protect.get(kind));
    }

    @Override
    public Optional<ProtectEntity> getProtectEntity(ProtectModelKind kind, String id) {
        return Optional.ofNullable(protect.get(kind).get(id));
    }

    @Override
    public Optional<ProtectEvent> getEvent(String eventKind, String eventId) {
        Map<String, ProtectEvent> byId = events.get(eventKind);
        return byId == null ? Optional.empty() : Optional.ofNullable(byId.get(eventId));
    }

    /** Number of stored events across all kinds. */
    public int eventCount() {
        return events.values().stream().mapToInt(Map::size).sum();
    }

    private SiteState siteState(String siteId) {
        return siteId == null ? SiteState.EMPTY : siteStates.getOrDefault(siteId, SiteState.EMPTY);
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    /**
     * Replaces the site map wholesale. Nested state of sites absent from the
     * new list is dropped; nested state of sites still present is kept until
     * that site is republished.
     */
    void replaceSites(Collection<Site> latest) {
        Map<String, Site> next = new LinkedHashMap<>();
        for (Site site : latest) {
            next.put(site.id(), site);
        }
        sites = Collections.unmodifiableMap(next);
        siteStates.keySet().retainAll(next.keySet());
    }

    /**
     * Publishes one site's refreshed devices, clients and statistics together.
     * Ignored if the site is no longer in the site map.
     */
    void publishSite(String siteId, SiteState state) {
        Objects.requireNonNull(state, "state");
        if (sites.containsKey(siteId)) {
            siteStates.put(siteId, state);
        }
    }

    void replaceProtectEntity(ProtectEntity entity) {
        protect.get(entity.kind()).put(entity.id(), entity);
    }

    /**
     * Applies {@code patch} to the stored entity, if there is one.
     *
     * @return {@code true} if an entity was present and patched
     */
    boolean patchProtectEntity(ProtectModelKind kind, String id, UnaryOperator<ProtectEntity> patch) {
        return protect.get(kind).computeIfPresent(id, (k, current) -> patch.apply(current)) != null;
    }

    boolean hasProtectEntity(ProtectModelKind kind, String id) {
        return protect.get(kind).containsKey(id);
    }

    void putEvent(ProtectEvent event) {
        events.computeIfAbsent(event.eventKind(), k -> new ConcurrentHashMap<>()).put(event.id(), event);
    }

    void markAvailable(Instant at) {
        lastUpdate = Objects.requireNonNull(at, "at");
        available = true;
    }

    void markUnavailable() {
        available = false;
    }
}
