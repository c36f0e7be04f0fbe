package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.Site;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory ResourceClient for tests.
 *
 * <p>Every call is identified by a key, e.g. {@code sites},
 * {@code devices:s1}, {@code clients:s1}, {@code info:s1/d1},
 * {@code stats:s1/d1}, {@code command:s1/d1}. A failure registered under a key
 * is thrown by that call until cleared.</p>
 */
public final class FakeResourceClient implements ResourceClient {

    private volatile List<ObjectNode> sites = List.of();
    private final Map<String, List<ObjectNode>> devices = new ConcurrentHashMap<>();
    private final Map<String, List<ObjectNode>> clients = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> infos = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> stats = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    private volatile Consumer<String> beforeCall = key -> {};
    private volatile boolean commandResult = true;

    public FakeResourceClient sites(ObjectNode... objects) {
        this.sites = List.of(objects);
        return this;
    }

    public FakeResourceClient devices(String siteId, ObjectNode... objects) {
        devices.put(siteId, List.of(objects));
        return this;
    }

    public FakeResourceClient clients(String siteId, ObjectNode... objects) {
        clients.put(siteId, List.of(objects));
        return this;
    }

    public FakeResourceClient info(String siteId, String deviceId, JsonNode info) {
        infos.put(siteId + "/" + deviceId, info);
        return this;
    }

    public FakeResourceClient stats(String siteId, String deviceId, JsonNode statistics) {
        stats.put(siteId + "/" + deviceId, statistics);
        return this;
    }

    public FakeResourceClient fail(String key, RuntimeException failure) {
        failures.put(key, failure);
        return this;
    }

    public FakeResourceClient clearFailure(String key) {
        failures.remove(key);
        return this;
    }

    public FakeResourceClient commandResult(boolean result) {
        this.commandResult = result;
        return this;
    }

    /**
     * Hook run at the start of every call, on the calling thread. Used to
     * block a call on a latch.
     */
    public FakeResourceClient beforeCall(Consumer<String> hook) {
        this.beforeCall = hook;
        return this;
    }

    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    public long callCount(String key) {
        return calls.stream().filter(key::equals).count();
    }

    @Override
    public List<Site> listSites() {
        enter("sites");
        List<Site> out = new ArrayList<>();
        sites.forEach(o -> out.add(Site.of(o)));
        return out;
    }

    @Override
    public List<Device> listDevices(String siteId) {
        enter("devices:" + siteId);
        List<Device> out = new ArrayList<>();
        devices.getOrDefault(siteId, List.of()).forEach(o -> out.add(Device.of(siteId, o)));
        return out;
    }

    @Override
    public JsonNode getDeviceInfo(String siteId, String deviceId) {
        String key = siteId + "/" + deviceId;
        enter("info:" + key);
        JsonNode info = infos.get(key);
        if (info == null) {
            throw new ResourceNotFoundException("no info for " + key);
        }
        return info;
    }

    @Override
    public JsonNode getDeviceStats(String siteId, String deviceId) {
        String key = siteId + "/" + deviceId;
        enter("stats:" + key);
        JsonNode s = stats.get(key);
        if (s == null) {
            throw new ResourceNotFoundException("no stats for " + key);
        }
        return s;
    }

    @Override
    public List<NetworkClient> listClients(String siteId) {
        enter("clients:" + siteId);
        List<NetworkClient> out = new ArrayList<>();
        clients.getOrDefault(siteId, List.of()).forEach(o -> out.add(NetworkClient.of(siteId, o)));
        return out;
    }

    @Override
    public boolean sendDeviceCommand(String siteId, String deviceId, DeviceCommand command) {
        enter("command:" + siteId + "/" + deviceId);
        return commandResult;
    }

    private void enter(String key) {
        calls.add(key);
        beforeCall.accept(key);
        RuntimeException failure = failures.get(key);
        if (failure != null) {
            throw failure;
        }
    }
}
