package com.questrail.insights.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.client.AuthenticationException;
import com.questrail.insights.client.ConnectivityException;
import com.questrail.insights.client.DeviceCommand;
import com.questrail.insights.client.InsightsApiException;
import com.questrail.insights.client.ResourceNotFoundException;
import com.questrail.insights.model.Device;
import com.questrail.insights.model.NetworkClient;
import com.questrail.insights.model.Site;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.FakeApiTransport;
import com.questrail.insights.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsightsHttpResourceClientTest {

    private static final String SITES = "/proxy/network/integration/v1/sites";

    private FakeApiTransport transport;
    private InsightsHttpResourceClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeApiTransport();
        client = new InsightsHttpResourceClient(transport, "secret-key");
    }

    @Test
    void listSitesReadsDataArrayAndSendsKey() {
        transport.respond("GET", SITES, 200, "{\"data\":[{\"id\":\"s1\",\"name\":\"Home\"},{\"id\":\"s2\"}]}");

        List<Site> sites = client.listSites();

        assertEquals(2, sites.size());
        assertEquals("Home", sites.get(0).name().orElseThrow());
        ApiRequest request = transport.lastRequest();
        assertEquals("secret-key", request.headers().get("X-API-Key"));
        assertEquals("application/json", request.headers().get("Accept"));
        assertFalse(request.hasBody());
    }

    @Test
    void missingDataMemberIsEmptyList() {
        transport.respond("GET", SITES, 200, "{\"count\":0}");

        assertTrue(client.listSites().isEmpty());
    }

    @Test
    void elementsWithoutIdAreSkipped() {
        transport.respond("GET", SITES + "/s1/devices", 200,
                "{\"data\":[{\"name\":\"orphan\"},{\"id\":\"d1\",\"name\":\"Gateway\"}]}");

        List<Device> devices = client.listDevices("s1");

        assertEquals(1, devices.size());
        assertEquals("d1", devices.get(0).id());
        assertEquals("s1", devices.get(0).siteId());
    }

    @Test
    void clientsAreSiteScoped() {
        transport.respond("GET", SITES + "/s1/clients", 200,
                "{\"data\":[{\"id\":\"c1\",\"uplinkDeviceId\":\"d1\"}]}");

        List<NetworkClient> clients = client.listClients("s1");

        assertEquals("d1", clients.get(0).uplinkDeviceId().orElseThrow());
        assertEquals("s1", clients.get(0).siteId());
    }

    @Test
    void deviceInfoAndStatisticsUseDevicePaths() {
        transport.respond("GET", SITES + "/s1/devices/d1", 200, "{\"firmwareVersion\":\"4.0\"}")
                .respond("GET", SITES + "/s1/devices/d1/statistics/latest", 200, "{\"uptimeSec\":5}");

        JsonNode info = client.getDeviceInfo("s1", "d1");
        JsonNode stats = client.getDeviceStats("s1", "d1");

        assertEquals("4.0", info.path("firmwareVersion").asText());
        assertEquals(5, stats.path("uptimeSec").asInt());
    }

    @Test
    void pathSegmentsAreEncoded() {
        transport.respond("GET", SITES + "/my%20site/devices", 200, "{\"data\":[]}");

        assertTrue(client.listDevices("my site").isEmpty());
        assertEquals(SITES + "/my%20site/devices", transport.lastRequest().path());
    }

    @Test
    void statusCodesMapToFailureCategories() {
        transport.respond("GET", SITES, 401, "");
        assertThrows(AuthenticationException.class, client::listSites);

        transport.respond("GET", SITES, 403, "");
        assertThrows(AuthenticationException.class, client::listSites);

        transport.respond("GET", SITES, 503, "");
        assertThrows(ConnectivityException.class, client::listSites);

        transport.respond("GET", SITES, 429, "");
        assertThrows(ConnectivityException.class, client::listSites);

        transport.respond("GET", SITES, 400, "");
        InsightsApiException other = assertThrows(InsightsApiException.class, client::listSites);
        assertFalse(other instanceof ConnectivityException);
        assertFalse(other instanceof AuthenticationException);

        assertThrows(ResourceNotFoundException.class, () -> client.getDeviceStats("s1", "missing"));
    }

    @Test
    void transportFailureIsConnectivity() {
        transport.fail("GET", SITES, new TransportException("connection refused"));

        ConnectivityException e = assertThrows(ConnectivityException.class, client::listSites);
        assertTrue(e.getCause() instanceof TransportException);
    }

    @Test
    void unparseableBodyIsConnectivity() {
        transport.respond("GET", SITES, 200, "<html>gateway</html>");

        assertThrows(ConnectivityException.class, client::listSites);
    }

    @Test
    void restartPostsActionAndReportsAcceptance() {
        String path = SITES + "/s1/devices/d1/actions";
        transport.respond("POST", path, 200, "{\"status\":\"OK\"}");

        assertTrue(client.sendDeviceCommand("s1", "d1", DeviceCommand.RESTART));
        assertEquals("{\"action\":\"RESTART\"}", transport.lastRequest().body());

        transport.respond("POST", path, 200, "{\"status\":\"FAILED\"}");
        assertFalse(client.sendDeviceCommand("s1", "d1", DeviceCommand.RESTART));
    }

    @Test
    void validateCredentialsReflectsSiteListing() {
        transport.respond("GET", SITES, 200, "{\"data\":[]}");
        assertTrue(client.validateCredentials());

        transport.respond("GET", SITES, 401, "");
        assertFalse(client.validateCredentials());
    }

    @Test
    void redactedHeadersMaskTheKey() {
        transport.respond("GET", SITES, 200, "{\"data\":[]}");
        client.listSites();

        assertEquals("****", transport.lastRequest().redactedHeaders().get("X-API-Key"));
        assertEquals("application/json", transport.lastRequest().redactedHeaders().get("Accept"));
    }
}
