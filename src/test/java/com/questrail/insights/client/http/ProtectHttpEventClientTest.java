package com.questrail.insights.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.client.ProtectCommand;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.time.DeterministicScheduler;
import com.questrail.insights.time.ManualMonotonicClock;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.FakeApiTransport;
import com.questrail.insights.transport.FakePushEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.insights.TestJson.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ProtectHttpEventClientTest
 * -----------------------------------------------------------------------------
 * Command encoding, listing paths, message dispatch and subscription
 * reconnect back-off.
 */
class ProtectHttpEventClientTest {

    private static final String BASE = "/proxy/protect/integration/v1";

    private FakeApiTransport transport;
    private FakePushEndpoint devicesEndpoint;
    private FakePushEndpoint eventsEndpoint;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ProtectHttpEventClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeApiTransport();
        devicesEndpoint = new FakePushEndpoint();
        eventsEndpoint = new FakePushEndpoint();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        client = new ProtectHttpEventClient(transport, "key", devicesEndpoint, eventsEndpoint,
                scheduler, clock, Duration.ofSeconds(1), Duration.ofSeconds(8));
    }

    // -------------------------------------------------------------------------
    // Request / response
    // -------------------------------------------------------------------------

    @Test
    void listingAndDetailUsePluralPaths() {
        transport.respond("GET", BASE + "/cameras", 200, "[{\"id\":\"cam1\"}]")
                .respond("GET", BASE + "/sensors/s%201", 200, "{\"id\":\"s 1\"}");

        JsonNode cameras = client.listResources(ProtectModelKind.CAMERA);
        JsonNode sensor = client.getResource(ProtectModelKind.SENSOR, "s 1");

        assertTrue(cameras.isArray());
        assertEquals("s 1", sensor.path("id").asText());
        assertEquals("key", transport.lastRequest().headers().get("X-API-Key"));
    }

    @Test
    void cameraSettingsArePatched() {
        ApiRequest recording = client.toRequest(new ProtectCommand.SetRecordingMode("cam1", "always"));
        assertEquals("PATCH", recording.method());
        assertEquals(BASE + "/cameras/cam1", recording.path());
        assertEquals(parse("{\"recordingSettings\":{\"mode\":\"always\"}}"), parse(recording.body()));

        assertEquals(parse("{\"hdrType\":\"auto\"}"),
                parse(client.toRequest(new ProtectCommand.SetHdrMode("cam1", "auto")).body()));
        assertEquals(parse("{\"videoMode\":\"highFps\"}"),
                parse(client.toRequest(new ProtectCommand.SetVideoMode("cam1", "highFps")).body()));
        assertEquals(parse("{\"micVolume\":80}"),
                parse(client.toRequest(new ProtectCommand.SetMicVolume("cam1", 80)).body()));
    }

    @Test
    void lightSettingsArePatched() {
        ApiRequest mode = client.toRequest(new ProtectCommand.SetLightMode("l1", "motion"));
        ApiRequest level = client.toRequest(new ProtectCommand.SetLightLevel("l1", 3));

        assertEquals(BASE + "/lights/l1", mode.path());
        assertEquals(parse("{\"lightModeSettings\":{\"mode\":\"motion\"}}"), parse(mode.body()));
        assertEquals(parse("{\"lightDeviceSettings\":{\"ledLevel\":3}}"), parse(level.body()));
    }

    @Test
    void chimeSettingsTargetPairedCameraWhenGiven() {
        ApiRequest paired = client.toRequest(new ProtectCommand.SetChimeVolume("ch1", 50, "cam1"));
        ApiRequest global = client.toRequest(new ProtectCommand.SetChimeRepeatTimes("ch1", 2, null));
        ApiRequest ringtone = client.toRequest(new ProtectCommand.SetChimeRingtone("ch1", "rt9", "cam2"));

        assertEquals(BASE + "/chimes/ch1", paired.path());
        assertEquals(parse("{\"ringSettings\":[{\"cameraId\":\"cam1\",\"volume\":50}]}"), parse(paired.body()));
        assertEquals(parse("{\"repeatTimes\":2}"), parse(global.body()));
        assertEquals(parse("{\"ringSettings\":[{\"cameraId\":\"cam2\",\"ringtoneId\":\"rt9\"}]}"), parse(ringtone.body()));
    }

    @Test
    void actionsArePosted() {
        ApiRequest play = client.toRequest(new ProtectCommand.PlayChimeRingtone("ch1", null));
        assertEquals("POST", play.method());
        assertEquals(BASE + "/chimes/ch1/play", play.path());
        assertEquals(parse("{}"), parse(play.body()));

        assertEquals(parse("{\"ringtoneId\":\"rt1\"}"),
                parse(client.toRequest(new ProtectCommand.PlayChimeRingtone("ch1", "rt1")).body()));

        assertEquals(BASE + "/cameras/cam1/ptz/goto/3",
                client.toRequest(new ProtectCommand.PtzGotoPreset("cam1", 3)).path());
        assertEquals(BASE + "/cameras/cam1/ptz/patrol/start/1",
                client.toRequest(new ProtectCommand.PtzPatrolStart("cam1", 1)).path());
        assertEquals(BASE + "/cameras/cam1/ptz/patrol/stop",
                client.toRequest(new ProtectCommand.PtzPatrolStop("cam1")).path());
    }

    @Test
    void executeSendsTheRequest() {
        transport.respond("PATCH", BASE + "/lights/l1", 200, "{\"id\":\"l1\"}");

        client.execute(new ProtectCommand.SetLightLevel("l1", 6));

        assertEquals("PATCH " + BASE + "/lights/l1", transport.lastRequest().toString());
    }

    // -------------------------------------------------------------------------
    // Push
    // -------------------------------------------------------------------------

    @Test
    void updatesAreDispatchedToTheMatchingCallbacks() {
        List<String> devices = new ArrayList<>();
        List<String> events = new ArrayList<>();
        client.registerDeviceUpdateCallback((kind, obj) -> devices.add(kind + "/" + obj.path("id").asText()));
        client.registerEventUpdateCallback((kind, obj) -> events.add(kind + "/" + obj.path("id").asText()));
        client.startPushConnection();
        devicesEndpoint.simulateConnected();
        eventsEndpoint.simulateConnected();

        devicesEndpoint.simulateMessage("{\"type\":\"update\",\"item\":{\"id\":\"cam1\",\"modelKey\":\"camera\"}}");
        eventsEndpoint.simulateMessage("{\"type\":\"add\",\"item\":{\"id\":\"e1\",\"type\":\"ring\"}}");

        assertEquals(List.of("camera/cam1"), devices);
        assertEquals(List.of("ring/e1"), events);
        assertTrue(client.isPushConnected());
    }

    @Test
    void removeMessagesAndGarbageAreNotForwarded() {
        List<String> devices = new ArrayList<>();
        client.registerDeviceUpdateCallback((kind, obj) -> devices.add(kind));
        client.startPushConnection();

        devicesEndpoint.simulateMessage("{\"type\":\"remove\",\"item\":{\"id\":\"cam1\",\"modelKey\":\"camera\"}}");
        devicesEndpoint.simulateMessage("garbage");

        assertTrue(devices.isEmpty());
    }

    @Test
    void throwingCallbackDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        client.registerDeviceUpdateCallback((kind, obj) -> {
            throw new IllegalStateException("bad callback");
        });
        client.registerDeviceUpdateCallback((kind, obj) -> seen.add(kind));
        client.startPushConnection();

        devicesEndpoint.simulateMessage("{\"type\":\"add\",\"item\":{\"id\":\"l1\",\"modelKey\":\"light\"}}");

        assertEquals(List.of("light"), seen);
    }

    @Test
    void pushConnectedOnlyWhenBothSubscriptionsAreOpen() {
        client.startPushConnection();
        devicesEndpoint.simulateConnected();

        assertFalse(client.isPushConnected());
        assertEquals(1, devicesEndpoint.startCount());
        assertEquals(1, eventsEndpoint.startCount());
    }

    @Test
    void reconnectBacksOffExponentiallyUpToTheCap() {
        client.startPushConnection();
        List<Long> delays = new ArrayList<>();

        for (int i = 0; i < 6; i++) {
            devicesEndpoint.simulateDisconnected(new IOException("reset"));
            long deadline = scheduler.nextDeadlineNanos();
            delays.add(Duration.ofNanos(deadline - clock.nowNanos()).toSeconds());
            clock.advanceNanos(deadline - clock.nowNanos());
            assertEquals(1, scheduler.runDueTasks());
        }

        assertEquals(List.of(1L, 2L, 4L, 8L, 8L, 8L), delays);
        assertEquals(7, devicesEndpoint.startCount());
        assertEquals(1, eventsEndpoint.startCount());
    }

    @Test
    void successfulHandshakeResetsBackoff() {
        assertEquals(Duration.ofSeconds(1), client.backoffFor(0));
        assertEquals(Duration.ofSeconds(4), client.backoffFor(2));
        assertEquals(Duration.ofSeconds(8), client.backoffFor(40));

        client.startPushConnection();
        devicesEndpoint.simulateDisconnected(null);
        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();
        devicesEndpoint.simulateDisconnected(null);
        clock.advance(Duration.ofSeconds(2));
        scheduler.runDueTasks();

        devicesEndpoint.simulateConnected();
        devicesEndpoint.simulateDisconnected(null);

        assertEquals(clock.nowNanos() + Duration.ofSeconds(1).toNanos(), scheduler.nextDeadlineNanos());
    }

    @Test
    void duplicateDisconnectSchedulesOneReconnect() {
        client.startPushConnection();

        eventsEndpoint.simulateDisconnected(null);
        eventsEndpoint.simulateDisconnected(null);

        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void stopCancelsPendingReconnectAndClosesEndpoints() {
        client.startPushConnection();
        devicesEndpoint.simulateDisconnected(null);
        eventsEndpoint.simulateConnected();

        client.stopPushConnection();

        assertEquals(0, scheduler.pendingCount());
        assertEquals(1, devicesEndpoint.stopCount());
        assertEquals(1, eventsEndpoint.stopCount());
        assertFalse(eventsEndpoint.isOpen());

        clock.advance(Duration.ofMinutes(1));
        scheduler.runDueTasks();
        assertEquals(1, devicesEndpoint.startCount());
    }

    @Test
    void startWhileReconnectPendingDoesNotOpenTwice() {
        client.startPushConnection();
        devicesEndpoint.simulateDisconnected(null);

        client.startPushConnection();

        assertEquals(1, devicesEndpoint.startCount());
    }
}
