package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.model.ProtectModelKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory EventClient for tests. Push callbacks are delivered on the test
 * thread through {@link #pushDevice} and {@link #pushEvent}.
 */
public final class FakeEventClient implements EventClient {

    private final List<DeviceUpdateCallback> deviceCallbacks = new CopyOnWriteArrayList<>();
    private final List<EventUpdateCallback> eventCallbacks = new CopyOnWriteArrayList<>();

    private final Map<ProtectModelKind, JsonNode> listings = new EnumMap<>(ProtectModelKind.class);
    private final Map<ProtectModelKind, RuntimeException> listingFailures = new EnumMap<>(ProtectModelKind.class);
    private final Map<String, JsonNode> details = new ConcurrentHashMap<>();
    private final List<ProtectCommand> executed = new CopyOnWriteArrayList<>();

    private volatile boolean connected;
    private volatile int startCount;
    private volatile int stopCount;
    private volatile RuntimeException startFailure;

    public synchronized FakeEventClient listing(ProtectModelKind kind, JsonNode body) {
        listings.put(kind, body);
        return this;
    }

    public synchronized FakeEventClient failListing(ProtectModelKind kind, RuntimeException failure) {
        listingFailures.put(kind, failure);
        return this;
    }

    public FakeEventClient detail(ProtectModelKind kind, String id, JsonNode body) {
        details.put(kind.pluralKey() + "/" + id, body);
        return this;
    }

    public FakeEventClient failStart(RuntimeException failure) {
        this.startFailure = failure;
        return this;
    }

    public void pushDevice(String modelKey, JsonNode object) {
        deviceCallbacks.forEach(cb -> cb.onDeviceUpdate(modelKey, object));
    }

    public void pushEvent(String eventKind, JsonNode object) {
        eventCallbacks.forEach(cb -> cb.onEventUpdate(eventKind, object));
    }

    public int deviceCallbackCount() {
        return deviceCallbacks.size();
    }

    public int eventCallbackCount() {
        return eventCallbacks.size();
    }

    public int startCount() {
        return startCount;
    }

    public int stopCount() {
        return stopCount;
    }

    public List<ProtectCommand> executed() {
        return new ArrayList<>(executed);
    }

    @Override
    public void registerDeviceUpdateCallback(DeviceUpdateCallback callback) {
        deviceCallbacks.add(callback);
    }

    @Override
    public void registerEventUpdateCallback(EventUpdateCallback callback) {
        eventCallbacks.add(callback);
    }

    @Override
    public synchronized void startPushConnection() {
        startCount++;
        if (startFailure != null) {
            throw startFailure;
        }
        connected = true;
    }

    @Override
    public synchronized void stopPushConnection() {
        stopCount++;
        connected = false;
    }

    @Override
    public boolean isPushConnected() {
        return connected;
    }

    @Override
    public synchronized JsonNode listResources(ProtectModelKind kind) {
        RuntimeException failure = listingFailures.get(kind);
        if (failure != null) {
            throw failure;
        }
        return listings.get(kind);
    }

    @Override
    public JsonNode getResource(ProtectModelKind kind, String id) {
        JsonNode body = details.get(kind.pluralKey() + "/" + id);
        if (body == null) {
            throw new ResourceNotFoundException(kind.pluralKey() + "/" + id);
        }
        return body;
    }

    @Override
    public void execute(ProtectCommand command) {
        executed.add(command);
    }
}
