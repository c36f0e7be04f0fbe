package com.questrail.insights.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.insights.client.AuthenticationException;
import com.questrail.insights.client.DeviceCommand;
import com.questrail.insights.client.InsightsApiException;
import com.questrail.insights.client.ResourceClient;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.Site;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.ApiTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * InsightsHttpResourceClient
 * -----------------------------------------------------------------------------
 * {@link ResourceClient} over the network integration API.
 *
 * <h2>Wire conventions</h2>
 * <ul>
 *   <li>All paths live under {@code /proxy/network/integration}.</li>
 *   <li>Every request carries {@code X-API-Key} and {@code Accept: application/json}.</li>
 *   <li>List endpoints answer {@code {"data":[...]}}; a missing {@code data}
 *       member is an empty list.</li>
 *   <li>Statistics and device details are returned as raw objects.</li>
 * </ul>
 *
 * <p>All calls pass through one {@link RequestGate}.</p>
 */
public final class InsightsHttpResourceClient implements ResourceClient
{
    private static final Logger log = LoggerFactory.getLogger(InsightsHttpResourceClient.class);

    static final String BASE_PATH = "/proxy/network/integration";
    static final String API_KEY_HEADER = "X-API-Key";

    private final ApiTransport transport;
    private final ObjectMapper mapper;
    private final RequestGate gate;
    private final Map<String, String> headers;

    public InsightsHttpResourceClient(ApiTransport transport, String apiKey) {
        this(transport, apiKey, new ObjectMapper(), new RequestGate());
    }

    public InsightsHttpResourceClient(ApiTransport transport, String apiKey, ObjectMapper mapper, RequestGate gate) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.headers = Map.of(
                API_KEY_HEADER, Objects.requireNonNull(apiKey, "apiKey"),
                "Accept", "application/json");
    }

    @Override
    public List<Site> listSites() {
        List<Site> sites = list("/v1/sites", Site::of);
        log.debug("Retrieved {} sites", sites.size());
        return sites;
    }

    @Override
    public List<Device> listDevices(String siteId) {
        List<Device> devices = list(site(siteId) + "/devices", obj -> Device.of(siteId, obj));
        log.debug("Retrieved {} devices for site {}", devices.size(), siteId);
        return devices;
    }

    @Override
    public JsonNode getDeviceInfo(String siteId, String deviceId) {
        return get(device(siteId, deviceId));
    }

    @Override
    public JsonNode getDeviceStats(String siteId, String deviceId) {
        return get(device(siteId, deviceId) + "/statistics/latest");
    }

    @Override
    public List<NetworkClient> listClients(String siteId) {
        List<NetworkClient> clients = list(site(siteId) + "/clients", obj -> NetworkClient.of(siteId, obj));
        log.debug("Retrieved {} clients for site {}", clients.size(), siteId);
        return clients;
    }

    @Override
    public boolean sendDeviceCommand(String siteId, String deviceId, DeviceCommand command) {
        Objects.requireNonNull(command, "command");
        String body = ApiResponses.toJson(mapper, Map.of("action", command.action()));
        ApiRequest request = ApiRequest.post(BASE_PATH + device(siteId, deviceId) + "/actions", headers, body);

        JsonNode response = gate.call(() -> ApiResponses.exchange(transport, mapper, request));
        boolean accepted = "OK".equals(response.path("status").asText(null));
        if (accepted) {
            log.info("{} accepted for device {} in site {}", command, deviceId, siteId);
        }
        else {
            log.warn("{} rejected for device {} in site {}: {}", command, deviceId, siteId, response);
        }
        return accepted;
    }

    /**
     * Returns {@code true} iff the site listing succeeds with the configured key.
     */
    public boolean validateCredentials() {
        try {
            listSites();
            return true;
        }
        catch (AuthenticationException e) {
            log.warn("API key validation failed: {}", e.getMessage());
            return false;
        }
        catch (InsightsApiException e) {
            log.warn("API key could not be validated: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode get(String path) {
        ApiRequest request = ApiRequest.get(BASE_PATH + path, headers);
        return gate.call(() -> ApiResponses.exchange(transport, mapper, request));
    }

    private <T> List<T> list(String path, Function<JsonNode, T> factory) {
        JsonNode data = get(path).path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<T> out = new ArrayList<>(data.size());
        for (JsonNode element : data) {
            try {
                out.add(factory.apply(element));
            }
            catch (IllegalArgumentException e) {
                log.warn("Skipping element of {}: {}", path, e.getMessage());
            }
        }
        return List.copyOf(out);
    }

    private static String site(String siteId) {
        return "/v1/sites/" + encode(siteId);
    }

    private static String device(String siteId, String deviceId) {
        return site(siteId) + "/devices/" + encode(deviceId);
    }

    static String encode(String segment) {
        Objects.requireNonNull(segment, "path segment");
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
