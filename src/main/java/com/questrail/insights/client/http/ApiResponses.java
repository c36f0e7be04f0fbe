package com.questrail.insights.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.questrail.insights.client.AuthenticationException;
import com.questrail.insights.client.ConnectivityException;
import com.questrail.insights.client.InsightsApiException;
import com.questrail.insights.client.ResourceNotFoundException;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.ApiResponse;
import com.questrail.insights.transport.ApiTransport;
import com.questrail.insights.transport.TransportException;

/**
 * Status and body handling shared by both HTTP clients.
 */
final class ApiResponses
{
    private ApiResponses() {}

    /**
     * Executes {@code request} and returns the parsed JSON body.
     * An empty body on success parses as a missing node.
     *
     * @throws AuthenticationException    401 or 403
     * @throws ResourceNotFoundException  404
     * @throws ConnectivityException      transport failure, 5xx, or a body that is not JSON
     * @throws InsightsApiException       any other non-2xx status
     */
    static JsonNode exchange(ApiTransport transport, ObjectMapper mapper, ApiRequest request) {
        ApiResponse response;
        try {
            response = transport.execute(request);
        }
        catch (TransportException e) {
            throw new ConnectivityException("Error connecting for " + request + ": " + e.getMessage(), e);
        }

        check(request, response);

        if (response.body().isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(response.body());
        }
        catch (JsonProcessingException e) {
            throw new ConnectivityException("Unparseable response for " + request + ": " + e.getOriginalMessage(), e);
        }
    }

    static void check(ApiRequest request, ApiResponse response) {
        int status = response.status();
        if (response.isSuccess()) {
            return;
        }
        if (status == 401) {
            throw new AuthenticationException("Invalid API key (" + request + ")");
        }
        if (status == 403) {
            throw new AuthenticationException("API key lacks permission (" + request + ")");
        }
        if (status == 404) {
            throw new ResourceNotFoundException("Not found: " + request);
        }
        if (status >= 500 || status == 408 || status == 429) {
            throw new ConnectivityException("HTTP " + status + " for " + request);
        }
        throw new InsightsApiException("HTTP " + status + " for " + request);
    }

    static String toJson(ObjectMapper mapper, Object body) {
        try {
            return mapper.writeValueAsString(body);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to create body", e);
        }
    }
}
