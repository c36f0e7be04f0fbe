package com.questrail.insights.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.insights.client.DeviceUpdateCallback;
import com.questrail.insights.client.EventClient;
import com.questrail.insights.client.EventUpdateCallback;
import com.questrail.insights.client.ProtectCommand;
import com.questrail.insights.internal.time.Cancellable;
import com.questrail.insights.internal.time.MonotonicClock;
import com.questrail.insights.internal.time.MonotonicScheduler;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.ApiTransport;
import com.questrail.insights.transport.PushEndpoint;
import com.questrail.insights.transport.PushEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ProtectHttpEventClient
 * -----------------------------------------------------------------------------
 * {@link EventClient} over the video/sensor integration API.
 *
 * <h2>Push subscriptions</h2>
 * Two {@link PushEndpoint}s are held: one for device-state messages and one
 * for event messages. Each is reconnected independently after a disconnect,
 * with exponential back-off from {@code initialBackoff} doubling up to
 * {@code maxBackoff}. The back-off resets once a handshake succeeds.
 *
 * <p>{@code remove} messages are not forwarded: stored entities and events are
 * retained until replaced.</p>
 *
 * <p>Callbacks run on the endpoint's delivery thread. A callback that throws is
 * logged; it never reaches the transport.</p>
 */
public final class ProtectHttpEventClient implements EventClient
{
    private static final Logger log = LoggerFactory.getLogger(ProtectHttpEventClient.class);

    static final String BASE_PATH = "/proxy/protect/integration/v1";
    public static final String DEVICES_SUBSCRIPTION_PATH = BASE_PATH + "/subscribe/devices";
    public static final String EVENTS_SUBSCRIPTION_PATH = BASE_PATH + "/subscribe/events";

    private final ApiTransport transport;
    private final ObjectMapper mapper;
    private final RequestGate gate;
    private final Map<String, String> headers;
    private final ProtectPushMessageDecoder decoder;

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    private final Subscription devices;
    private final Subscription events;

    private final List<DeviceUpdateCallback> deviceCallbacks = new CopyOnWriteArrayList<>();
    private final List<EventUpdateCallback> eventCallbacks = new CopyOnWriteArrayList<>();

    private volatile boolean running;

    public ProtectHttpEventClient(ApiTransport transport,
                                  String apiKey,
                                  PushEndpoint devicesEndpoint,
                                  PushEndpoint eventsEndpoint,
                                  MonotonicScheduler scheduler,
                                  MonotonicClock clock,
                                  Duration initialBackoff,
                                  Duration maxBackoff) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = new ObjectMapper();
        this.gate = new RequestGate();
        this.headers = authHeaders(apiKey);
        this.decoder = new ProtectPushMessageDecoder(mapper);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");

        this.devices = new Subscription("devices", devicesEndpoint, ProtectPushMessageDecoder.DEVICE_KIND_FIELD);
        this.events = new Subscription("events", eventsEndpoint, ProtectPushMessageDecoder.EVENT_KIND_FIELD);
    }

    /**
     * Headers every request and subscription handshake carries.
     */
    public static Map<String, String> authHeaders(String apiKey) {
        return Map.of(
                InsightsHttpResourceClient.API_KEY_HEADER, Objects.requireNonNull(apiKey, "apiKey"),
                "Accept", "application/json");
    }

    // -------------------------------------------------------------------------
    // Push
    // -------------------------------------------------------------------------

    @Override
    public void registerDeviceUpdateCallback(DeviceUpdateCallback callback) {
        deviceCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    @Override
    public void registerEventUpdateCallback(EventUpdateCallback callback) {
        eventCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    @Override
    public synchronized void startPushConnection() {
        running = true;
        devices.open();
        events.open();
    }

    @Override
    public synchronized void stopPushConnection() {
        running = false;
        devices.close();
        events.close();
    }

    @Override
    public boolean isPushConnected() {
        return devices.endpoint.isOpen() && events.endpoint.isOpen();
    }

    // -------------------------------------------------------------------------
    // Request / response
    // -------------------------------------------------------------------------

    @Override
    public JsonNode listResources(ProtectModelKind kind) {
        return get("/" + kind.pluralKey());
    }

    @Override
    public JsonNode getResource(ProtectModelKind kind, String id) {
        return get("/" + kind.pluralKey() + "/" + InsightsHttpResourceClient.encode(id));
    }

    @Override
    public void execute(ProtectCommand command) {
        ApiRequest request = toRequest(Objects.requireNonNull(command, "command"));
        log.debug("Executing {} as {}", command, request);
        gate.call(() -> ApiResponses.exchange(transport, mapper, request));
    }

    private JsonNode get(String path) {
        ApiRequest request = ApiRequest.get(BASE_PATH + path, headers);
        return gate.call(() -> ApiResponses.exchange(transport, mapper, request));
    }

    ApiRequest toRequest(ProtectCommand command) {
        String target = BASE_PATH + "/" + command.target().pluralKey() + "/"
                + InsightsHttpResourceClient.encode(command.targetId());
        ObjectNode body = mapper.createObjectNode();

        if (command instanceof ProtectCommand.SetRecordingMode c) {
            body.putObject("recordingSettings").put("mode", c.mode());
        }
        else if (command instanceof ProtectCommand.SetHdrMode c) {
            body.put("hdrType", c.mode());
        }
        else if (command instanceof ProtectCommand.SetVideoMode c) {
            body.put("videoMode", c.mode());
        }
        else if (command instanceof ProtectCommand.SetMicVolume c) {
            body.put("micVolume", c.volume());
        }
        else if (command instanceof ProtectCommand.SetLightMode c) {
            body.putObject("lightModeSettings").put("mode", c.mode());
        }
        else if (command instanceof ProtectCommand.SetLightLevel c) {
            body.putObject("lightDeviceSettings").put("ledLevel", c.level());
        }
        else if (command instanceof ProtectCommand.SetChimeVolume c) {
            ringSetting(body, c.cameraId()).put("volume", c.volume());
        }
        else if (command instanceof ProtectCommand.SetChimeRingtone c) {
            ringSetting(body, c.cameraId()).put("ringtoneId", c.ringtoneId());
        }
        else if (command instanceof ProtectCommand.SetChimeRepeatTimes c) {
            ringSetting(body, c.cameraId()).put("repeatTimes", c.repeatTimes());
        }
        else if (command instanceof ProtectCommand.PlayChimeRingtone c) {
            if (c.ringtoneId() != null) {
                body.put("ringtoneId", c.ringtoneId());
            }
            return ApiRequest.post(target + "/play", headers, body.toString());
        }
        else if (command instanceof ProtectCommand.PtzGotoPreset c) {
            return ApiRequest.post(target + "/ptz/goto/" + c.preset(), headers, "{}");
        }
        else if (command instanceof ProtectCommand.PtzPatrolStart c) {
            return ApiRequest.post(target + "/ptz/patrol/start/" + c.slot(), headers, "{}");
        }
        else if (command instanceof ProtectCommand.PtzPatrolStop) {
            return ApiRequest.post(target + "/ptz/patrol/stop", headers, "{}");
        }
        else {
            throw new IllegalArgumentException("Unsupported command: " + command);
        }
        return ApiRequest.patch(target, headers, body.toString());
    }

    /**
     * Chime settings are per paired camera when one is named, otherwise global.
     */
    private static ObjectNode ringSetting(ObjectNode body, String cameraId) {
        if (cameraId == null) {
            return body;
        }
        ObjectNode setting = body.putArray("ringSettings").addObject();
        setting.put("cameraId", cameraId);
        return setting;
    }

    Duration backoffFor(int attempt) {
        long shift = Math.min(attempt, 30);
        Duration delay = initialBackoff.multipliedBy(1L << shift);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private void dispatch(Subscription subscription, ProtectPushMessage message) {
        if (message.action() == ProtectPushMessage.Action.REMOVE) {
            log.debug("Ignoring remove of {} on {} subscription", message.kind(), subscription.name);
            return;
        }
        if (subscription == devices) {
            for (DeviceUpdateCallback cb : deviceCallbacks) {
                try {
                    cb.onDeviceUpdate(message.kind(), message.item());
                }
                catch (RuntimeException e) {
                    log.error("Device update callback failed for {}", message.kind(), e);
                }
            }
        }
        else {
            for (EventUpdateCallback cb : eventCallbacks) {
                try {
                    cb.onEventUpdate(message.kind(), message.item());
                }
                catch (RuntimeException e) {
                    log.error("Event update callback failed for {}", message.kind(), e);
                }
            }
        }
    }

    /**
     * Subscription
     * -------------------------------------------------------------------------
     * One push endpoint plus its reconnect state.
     */
    private final class Subscription implements PushEndpointListener
    {
        private final String name;
        private final PushEndpoint endpoint;
        private final String kindField;

        private int attempts;
        private Cancellable pendingReconnect;

        Subscription(String name, PushEndpoint endpoint, String kindField) {
            this.name = name;
            this.endpoint = Objects.requireNonNull(endpoint, name + " endpoint");
            this.kindField = kindField;
            endpoint.setListener(this);
        }

        synchronized void open() {
            if (endpoint.isOpen() || pendingReconnect != null) {
                return;
            }
            endpoint.start();
        }

        synchronized void close() {
            if (pendingReconnect != null) {
                pendingReconnect.cancel();
                pendingReconnect = null;
            }
            attempts = 0;
            endpoint.stop();
        }

        @Override
        public synchronized void onConnected() {
            attempts = 0;
            log.info("Push subscription '{}' connected", name);
        }

        @Override
        public synchronized void onDisconnected(Throwable cause) {
            if (!running) {
                log.debug("Push subscription '{}' closed", name);
                return;
            }
            if (pendingReconnect != null) {
                return;
            }
            Duration delay = backoffFor(attempts++);
            log.warn("Push subscription '{}' lost ({}); reconnecting in {} ms",
                    name, cause != null ? cause.getMessage() : "closed", delay.toMillis());
            pendingReconnect = scheduler.scheduleAfter(delay, clock, this::reconnect);
        }

        private synchronized void reconnect() {
            pendingReconnect = null;
            if (running) {
                endpoint.start();
            }
        }

        @Override
        public void onMessage(String text) {
            ProtectPushMessageDecoder.Result result = decoder.decode(text, kindField);
            result.decoded().ifPresentOrElse(
                    message -> dispatch(this, message),
                    () -> log.warn("Dropping {} message: {}", name, result.reason()));
        }
    }
}
