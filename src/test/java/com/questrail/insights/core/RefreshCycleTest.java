package com.questrail.insights.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.insights.api.RefreshOutcome;
import com.questrail.insights.api.RefreshOutcome.Status;
import com.questrail.insights.client.AuthenticationException;
import com.questrail.insights.client.ConnectivityException;
import com.questrail.insights.client.FakeEventClient;
import com.questrail.insights.client.FakeResourceClient;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.DeviceStats;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.observability.CycleCompletedEvent;
import com.questrail.insights.observability.FetchFailureEvent;
import com.questrail.insights.observability.RecordingObservabilitySink;
import com.questrail.insights.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.questrail.insights.TestJson.array;
import static com.questrail.insights.TestJson.object;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RefreshCycleTest
 * -----------------------------------------------------------------------------
 * Pull algorithm: per-level failure containment, statistics annotation and
 * outcome classification.
 */
class RefreshCycleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private FakeResourceClient resources;
    private SnapshotStore store;
    private RecordingObservabilitySink sink;
    private ExecutorService executor;
    private final WallClock wallClock = () -> NOW;

    @BeforeEach
    void setUp() {
        resources = new FakeResourceClient();
        store = new SnapshotStore();
        sink = new RecordingObservabilitySink();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RefreshCycle cycle() {
        return cycle(null, executor);
    }

    private RefreshCycle cycle(ProtectBulkRefresh protect, ExecutorService fetchExecutor) {
        return new RefreshCycle(resources, protect, store, fetchExecutor, new ManualMonotonicClock(), wallClock, sink);
    }

    private void oneSiteTwoDevices() {
        resources.sites(object("id", "s1", "name", "Home"))
                .devices("s1", object("id", "d1", "name", "Gateway"), object("id", "d2", "name", "Switch"))
                .clients("s1",
                        object("id", "c1", "uplinkDeviceId", "d1"),
                        object("id", "c2", "uplinkDeviceId", "d2"),
                        object("id", "c3", "uplinkDeviceId", "d1"),
                        object("id", "c4"))
                .info("s1", "d1", object("firmwareVersion", "4.0.6"))
                .info("s1", "d2", object("firmwareVersion", "7.1.0"))
                .stats("s1", "d1", object("uptimeSec", 100))
                .stats("s1", "d2", object("uptimeSec", 200));
    }

    @Test
    void successfulCyclePopulatesSnapshotAndMarksAvailable() {
        oneSiteTwoDevices();

        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.SUCCESS, outcome.status());
        assertTrue(store.isAvailable());
        assertEquals(NOW, store.lastUpdate().orElseThrow());
        assertEquals("Home", store.getSite("s1").orElseThrow().name().orElseThrow());
        assertEquals(Set.of("d1", "d2"), store.getDevices("s1").keySet());
        assertEquals(4, store.getClients("s1").size());
        assertEquals("4.0.6", store.getDevice("s1", "d1").orElseThrow().firmwareVersion().orElseThrow());
    }

    @Test
    void everyDeviceHasStatisticsRecordEvenWhenItsFetchFails() {
        oneSiteTwoDevices();
        resources.fail("stats:s1/d2", new ConnectivityException("timeout"));

        cycle().run();

        for (String deviceId : store.getDevices("s1").keySet()) {
            DeviceStats stats = store.getDeviceStats("s1", deviceId).orElseThrow();
            assertEquals(deviceId, stats.id());
            assertEquals(deviceId, stats.attributes().path("id").asText());
        }
        assertTrue(store.getDeviceStats("s1", "d2").orElseThrow().isEmpty());
    }

    @Test
    void deviceInfoFailureKeepsListingFields() {
        oneSiteTwoDevices();
        resources.fail("info:s1/d1", new ConnectivityException("reset"));

        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.SUCCESS, outcome.status());
        Device d1 = store.getDevice("s1", "d1").orElseThrow();
        assertEquals("Gateway", d1.name().orElseThrow());
        assertTrue(d1.firmwareVersion().isEmpty());
        assertEquals("7.1.0", store.getDevice("s1", "d2").orElseThrow().firmwareVersion().orElseThrow());

        List<FetchFailureEvent> failures = sink.fetchFailures(FetchFailureEvent.Scope.DEVICE_INFO);
        assertEquals(1, failures.size());
        assertEquals("s1", failures.get(0).siteId());
        assertEquals("d1", failures.get(0).deviceId());
    }

    @Test
    void statisticsFailureOverwritesPreviousStatisticsButNotTheDevice() {
        oneSiteTwoDevices();
        cycle().run();
        assertEquals(100, store.getDeviceStats("s1", "d1").orElseThrow().uptimeSeconds().getAsLong());

        resources.fail("stats:s1/d1", new ConnectivityException("timeout"));
        cycle().run();

        DeviceStats stats = store.getDeviceStats("s1", "d1").orElseThrow();
        assertTrue(stats.isEmpty());
        assertTrue(stats.uptimeSeconds().isEmpty());
        assertTrue(stats.clients().isEmpty());
        assertEquals("Gateway", store.getDevice("s1", "d1").orElseThrow().name().orElseThrow());
    }

    @Test
    void clientListingFailureKeepsPreviousNestedMaps() {
        oneSiteTwoDevices();
        cycle().run();

        // Devices change upstream, but the client listing fails this time.
        resources.devices("s1", object("id", "d9", "name", "New"))
                .fail("clients:s1", new ConnectivityException("refused"));
        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.SUCCESS, outcome.status());
        assertEquals(Set.of("d1", "d2"), store.getDevices("s1").keySet());
        assertEquals(4, store.getClients("s1").size());
        assertEquals(100, store.getDeviceStats("s1", "d1").orElseThrow().uptimeSeconds().getAsLong());
        assertTrue(store.getSite("s1").isPresent());
        assertEquals(1, sink.fetchFailures(FetchFailureEvent.Scope.SITE).size());
    }

    @Test
    void deviceListingFailureKeepsPreviousClientsAndStatistics() {
        oneSiteTwoDevices();
        cycle().run();

        resources.clients("s1", object("id", "c9", "uplinkDeviceId", "d1"))
                .stats("s1", "d1", object("uptimeSec", 999))
                .fail("devices:s1", new ConnectivityException("reset"));
        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.SUCCESS, outcome.status());
        assertEquals(Set.of("d1", "d2"), store.getDevices("s1").keySet());
        assertEquals(4, store.getClients("s1").size());
        assertEquals(100, store.getDeviceStats("s1", "d1").orElseThrow().uptimeSeconds().getAsLong());
        assertEquals(2, store.getDeviceStats("s1", "d1").orElseThrow().clients().size());
        assertEquals(1, resources.callCount("stats:s1/d1"));
        assertEquals(1, sink.fetchFailures(FetchFailureEvent.Scope.SITE).size());
    }

    @Test
    void statisticsCarryExactlyTheUplinkedClients() {
        oneSiteTwoDevices();

        cycle().run();

        List<String> d1Clients = store.getDeviceStats("s1", "d1").orElseThrow().clients().stream()
                .map(NetworkClient::id).sorted().collect(Collectors.toList());
        List<String> d2Clients = store.getDeviceStats("s1", "d2").orElseThrow().clients().stream()
                .map(NetworkClient::id).collect(Collectors.toList());

        assertEquals(List.of("c1", "c3"), d1Clients);
        assertEquals(List.of("c2"), d2Clients);
    }

    @Test
    void authenticationFailureThenSuccessTogglesAvailability() {
        oneSiteTwoDevices();
        resources.fail("sites", new AuthenticationException("Invalid API key"));

        RefreshOutcome failed = cycle().run();
        assertEquals(Status.AUTHENTICATION_FAILURE, failed.status());
        assertFalse(failed.isRetryable());
        assertFalse(store.isAvailable());
        assertTrue(resources.calls().stream().noneMatch(c -> c.startsWith("devices:")));

        resources.clearFailure("sites");
        RefreshOutcome recovered = cycle().run();
        assertEquals(Status.SUCCESS, recovered.status());
        assertTrue(store.isAvailable());
    }

    @Test
    void connectivityFailureOnSiteListingPreservesSnapshot() {
        oneSiteTwoDevices();
        cycle().run();

        resources.fail("sites", new ConnectivityException("timeout"));
        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.CONNECTIVITY_FAILURE, outcome.status());
        assertTrue(outcome.isRetryable());
        assertFalse(store.isAvailable());
        assertTrue(store.getSite("s1").isPresent());
        assertEquals(2, store.getDevices("s1").size());
    }

    @Test
    void unclassifiedFailureIsUnexpected() {
        resources.fail("sites", new IllegalStateException("boom"));

        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.UNEXPECTED_FAILURE, outcome.status());
        assertTrue(outcome.isRetryable());
        assertEquals("boom", outcome.detail());
        assertTrue(outcome.failureCause().orElseThrow() instanceof IllegalStateException);
    }

    @Test
    void oneSitesFailureDoesNotAffectSiblingSites() {
        resources.sites(object("id", "s1"), object("id", "s2"))
                .devices("s1", object("id", "a"))
                .devices("s2", object("id", "b"))
                .stats("s2", "b", object("uptimeSec", 1))
                .fail("devices:s1", new ConnectivityException("timeout"));

        RefreshOutcome outcome = cycle().run();

        assertEquals(Status.SUCCESS, outcome.status());
        assertTrue(store.getDevices("s1").isEmpty());
        assertTrue(store.getDevice("s2", "b").isPresent());

        CycleCompletedEvent completed = sink.eventsOfType(CycleCompletedEvent.class).get(0);
        assertEquals(1, completed.sitesRefreshed());
        assertEquals(1, completed.sitesFailed());
    }

    @Test
    void sitesMissingFromLatestListingAreDropped() {
        resources.sites(object("id", "s1"), object("id", "s2"))
                .devices("s2", object("id", "b"));
        cycle().run();
        assertTrue(store.getDevice("s2", "b").isPresent());

        resources.sites(object("id", "s1"));
        cycle().run();

        assertEquals(Set.of("s1"), store.getSites().keySet());
        assertTrue(store.getDevices("s2").isEmpty());
    }

    @Test
    void boundedFetchPoolCompletesLargeFanOut() {
        resources.sites(object("id", "s1"), object("id", "s2"));
        for (String site : List.of("s1", "s2")) {
            ObjectNode[] devices = new ObjectNode[20];
            for (int i = 0; i < devices.length; i++) {
                devices[i] = object("id", site + "-d" + i);
                resources.stats(site, site + "-d" + i, object("uptimeSec", i));
            }
            resources.devices(site, devices);
        }

        ExecutorService single = Executors.newFixedThreadPool(1);
        try {
            RefreshOutcome outcome = cycle(null, single).run();
            assertEquals(Status.SUCCESS, outcome.status());
            assertEquals(20, store.getDevices("s1").size());
            assertEquals(20, store.getDevices("s2").size());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void siteScopedRefreshOfUnknownSiteIsSkipped() {
        RefreshOutcome outcome = cycle().runSite("nope");

        assertEquals(Status.SKIPPED, outcome.status());
        assertTrue(resources.calls().isEmpty());
    }

    @Test
    void siteScopedRefreshTouchesOnlyThatSite() {
        resources.sites(object("id", "s1"), object("id", "s2"))
                .devices("s1", object("id", "a", "name", "old"))
                .devices("s2", object("id", "b"));
        cycle().run();

        resources.devices("s1", object("id", "a", "name", "new"));
        int before = resources.calls().size();
        RefreshOutcome outcome = cycle().runSite("s1");

        assertEquals(Status.SUCCESS, outcome.status());
        assertEquals("new", store.getDevice("s1", "a").orElseThrow().name().orElseThrow());
        assertTrue(resources.calls().subList(before, resources.calls().size()).stream()
                .noneMatch(c -> c.equals("sites") || c.endsWith(":s2") || c.contains("s2/")));
    }

    @Test
    void failedSiteScopedRefreshLeavesAvailabilityAlone() {
        resources.sites(object("id", "s1")).devices("s1", object("id", "a"));
        cycle().run();
        assertTrue(store.isAvailable());

        resources.fail("devices:s1", new ConnectivityException("down"));
        RefreshOutcome outcome = cycle().runSite("s1");

        assertEquals(Status.CONNECTIVITY_FAILURE, outcome.status());
        assertTrue(store.isAvailable());
        assertTrue(store.getDevice("s1", "a").isPresent());
    }

    @Test
    void protectBulkPassRunsOnlyAfterSuccessfulListing() {
        FakeEventClient events = new FakeEventClient()
                .listing(ProtectModelKind.CAMERA, array(object("id", "cam1")));
        ProtectBulkRefresh protect = new ProtectBulkRefresh(events, store, wallClock, sink);

        resources.fail("sites", new ConnectivityException("down"));
        cycle(protect, executor).run();
        assertTrue(store.getProtectEntity(ProtectModelKind.CAMERA, "cam1").isEmpty());
        assertEquals(0, events.startCount());

        resources.clearFailure("sites");
        cycle(protect, executor).run();
        assertTrue(store.getProtectEntity(ProtectModelKind.CAMERA, "cam1").isPresent());
        assertTrue(events.isPushConnected());
    }
}
