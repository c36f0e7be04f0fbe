package com.questrail.insights.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.api.RefreshOutcome;
import com.questrail.insights.api.RefreshOutcome.Status;
import com.questrail.insights.client.AuthenticationException;
import com.questrail.insights.client.ConnectivityException;
import com.questrail.insights.client.ResourceClient;
import com.questrail.insights.internal.time.MonotonicClock;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.DeviceStats;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.Site;
import com.questrail.insights.observability.CycleCompletedEvent;
import com.questrail.insights.observability.FetchFailureEvent;
import com.questrail.insights.observability.FetchFailureEvent.Scope;
import com.questrail.insights.observability.SyncObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * RefreshCycle
 * -----------------------------------------------------------------------------
 * One pull of the resource tree into the {@link SnapshotStore}.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>List sites. A failure here ends the cycle: the outcome is classified,
 *       {@code available} is cleared and nothing else is written. On success
 *       the site map is replaced.</li>
 *   <li>For every site at once, list devices and clients in parallel. If
 *       either fails the site's nested maps keep their previous contents.</li>
 *   <li>For every device of a listed site at once, fetch device info and
 *       statistics in parallel. An info failure keeps the listing fields; a
 *       statistics failure stores an empty statistics record.</li>
 *   <li>Each site's devices, clients and statistics are published together as
 *       soon as that site's subtree completes.</li>
 *   <li>Once every site has completed, {@code available} is set and the
 *       last-update time recorded.</li>
 *   <li>If configured, the video/sensor bulk pass runs.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * {@link #run()} and {@link #runSite(String)} block the calling thread (the
 * coordinator's cycle thread) until the cycle has finished. Fetches run on
 * {@code fetchExecutor} and are composed without blocking any worker, so a
 * bounded pool cannot deadlock.
 *
 * <p>Not thread-safe: at most one cycle may run at a time. The coordinator
 * guarantees this.</p>
 */
final class RefreshCycle
{
    private final ResourceClient resources;
    private final ProtectBulkRefresh protectRefresh;
    private final SnapshotStore store;
    private final Executor fetchExecutor;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    /**
     * @param protectRefresh bulk pass for the video/sensor kinds; {@code null} to skip it
     */
    RefreshCycle(ResourceClient resources,
                 ProtectBulkRefresh protectRefresh,
                 SnapshotStore store,
                 Executor fetchExecutor,
                 MonotonicClock clock,
                 WallClock wallClock,
                 SyncObservabilitySink sink) {
        this.resources = Objects.requireNonNull(resources, "resources");
        this.protectRefresh = protectRefresh;
        this.store = Objects.requireNonNull(store, "store");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    RefreshOutcome run() {
        long started = clock.nowNanos();

        List<Site> sites;
        try {
            sites = resources.listSites();
        }
        catch (RuntimeException e) {
            store.markUnavailable();
            return complete(null, classify(e), 0, 0, started);
        }

        try {
            store.replaceSites(sites);

            List<CompletableFuture<Boolean>> subtrees = new ArrayList<>(sites.size());
            for (Site site : sites) {
                subtrees.add(refreshSite(site.id()));
            }
            CompletableFuture.allOf(subtrees.toArray(new CompletableFuture<?>[0])).join();

            int refreshed = 0;
            for (CompletableFuture<Boolean> subtree : subtrees) {
                if (subtree.join()) {
                    refreshed++;
                }
            }

            Instant now = wallClock.now();
            store.markAvailable(now);

            if (protectRefresh != null) {
                protectRefresh.run();
            }
            return complete(null, RefreshOutcome.success(now), refreshed, sites.size() - refreshed, started);
        }
        catch (RuntimeException e) {
            store.markUnavailable();
            Throwable cause = unwrap(e);
            return complete(null, RefreshOutcome.failure(Status.UNEXPECTED_FAILURE, wallClock.now(),
                    describe(cause), cause), 0, sites.size(), started);
        }
    }

    /**
     * Re-runs the per-site part of the cycle for one site already in the site
     * map. Does not touch {@code available} or the last-update time.
     */
    RefreshOutcome runSite(String siteId) {
        long started = clock.nowNanos();

        if (store.getSite(siteId).isEmpty()) {
            return complete(siteId, RefreshOutcome.skipped(wallClock.now(), "unknown site " + siteId), 0, 0, started);
        }

        try {
            if (refreshSite(siteId).join()) {
                return complete(siteId, RefreshOutcome.success(wallClock.now()), 1, 0, started);
            }
            return complete(siteId, RefreshOutcome.failure(Status.CONNECTIVITY_FAILURE, wallClock.now(),
                    "site " + siteId + " could not be refreshed", null), 0, 1, started);
        }
        catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            return complete(siteId, RefreshOutcome.failure(Status.UNEXPECTED_FAILURE, wallClock.now(),
                    describe(cause), cause), 0, 1, started);
        }
    }

    /**
     * Completes with {@code true} once the site was published, {@code false}
     * if its device or client listing failed. Never completes exceptionally.
     */
    CompletableFuture<Boolean> refreshSite(String siteId) {
        CompletableFuture<List<Device>> devices =
                CompletableFuture.supplyAsync(() -> resources.listDevices(siteId), fetchExecutor);
        CompletableFuture<List<NetworkClient>> clients =
                CompletableFuture.supplyAsync(() -> resources.listClients(siteId), fetchExecutor);

        return devices
                .thenCombine(clients, (d, c) -> refreshDevices(siteId, d, c))
                .thenCompose(state -> state)
                .thenApply(state -> {
                    store.publishSite(siteId, state);
                    return true;
                })
                .exceptionally(e -> {
                    sink.onFetchFailure(FetchFailureEvent.site(wallClock.now(), siteId, unwrap(e)));
                    return false;
                });
    }

    private CompletableFuture<SiteState> refreshDevices(String siteId, List<Device> listing, List<NetworkClient> siteClients) {
        Map<String, NetworkClient> clientsById = new LinkedHashMap<>();
        for (NetworkClient client : siteClients) {
            clientsById.put(client.id(), client);
        }

        Map<String, Device> unique = new LinkedHashMap<>();
        for (Device device : listing) {
            unique.put(device.id(), device);
        }

        List<CompletableFuture<Device>> infos = new ArrayList<>(unique.size());
        List<CompletableFuture<DeviceStats>> stats = new ArrayList<>(unique.size());
        for (Device device : unique.values()) {
            infos.add(fetchInfo(device));
            stats.add(fetchStats(device, clientsById.values()));
        }

        List<CompletableFuture<?>> all = new ArrayList<>(infos);
        all.addAll(stats);
        return CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            Map<String, Device> devicesById = new LinkedHashMap<>();
            infos.forEach(f -> {
                Device d = f.join();
                devicesById.put(d.id(), d);
            });
            Map<String, DeviceStats> statsById = new LinkedHashMap<>();
            stats.forEach(f -> {
                DeviceStats s = f.join();
                statsById.put(s.id(), s);
            });
            return new SiteState(devicesById, clientsById, statsById);
        });
    }

    private CompletableFuture<Device> fetchInfo(Device device) {
        return CompletableFuture
                .supplyAsync(() -> resources.getDeviceInfo(device.siteId(), device.id()), fetchExecutor)
                .handle((JsonNode info, Throwable error) -> {
                    if (error != null) {
                        sink.onFetchFailure(FetchFailureEvent.device(wallClock.now(), Scope.DEVICE_INFO,
                                device.siteId(), device.id(), unwrap(error)));
                        return device;
                    }
                    return device.withInfo(info);
                });
    }

    private CompletableFuture<DeviceStats> fetchStats(Device device, Collection<NetworkClient> siteClients) {
        return CompletableFuture
                .supplyAsync(() -> resources.getDeviceStats(device.siteId(), device.id()), fetchExecutor)
                .handle((JsonNode statistics, Throwable error) -> {
                    if (error != null) {
                        sink.onFetchFailure(FetchFailureEvent.device(wallClock.now(), Scope.DEVICE_STATS,
                                device.siteId(), device.id(), unwrap(error)));
                        return DeviceStats.empty(device.id());
                    }
                    return DeviceStats.of(device.id(), statistics, siteClients);
                });
    }

    private RefreshOutcome complete(String siteScope, RefreshOutcome outcome, int refreshed, int failed, long startedNanos) {
        Duration elapsed = Duration.ofNanos(Math.max(0, clock.nowNanos() - startedNanos));
        sink.onCycleCompleted(new CycleCompletedEvent(outcome.completedAt(), siteScope, outcome, refreshed, failed, elapsed));
        return outcome;
    }

    private RefreshOutcome classify(RuntimeException e) {
        Instant now = wallClock.now();
        if (e instanceof AuthenticationException) {
            return RefreshOutcome.failure(Status.AUTHENTICATION_FAILURE, now, describe(e), e);
        }
        if (e instanceof ConnectivityException) {
            return RefreshOutcome.failure(Status.CONNECTIVITY_FAILURE, now, describe(e), e);
        }
        return RefreshOutcome.failure(Status.UNEXPECTED_FAILURE, now, describe(e), e);
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
