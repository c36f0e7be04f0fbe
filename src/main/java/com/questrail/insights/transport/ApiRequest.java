package com.questrail.insights.transport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP request against the controller host.
 *
 * @param method  HTTP method name, upper case
 * @param path    absolute path including any query, e.g. {@code /proxy/network/integration/v1/sites}
 * @param headers request headers; the transport adds {@code Host} and {@code Content-Length}
 * @param body    UTF-8 request body, {@code null} for none
 */
public record ApiRequest(String method, String path, Map<String, String> headers, String body)
{
    public ApiRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must be absolute: " + path);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ApiRequest get(String path, Map<String, String> headers) {
        return new ApiRequest("GET", path, headers, null);
    }

    public static ApiRequest post(String path, Map<String, String> headers, String body) {
        return new ApiRequest("POST", path, headers, body);
    }

    public static ApiRequest patch(String path, Map<String, String> headers, String body) {
        return new ApiRequest("PATCH", path, headers, body);
    }

    public boolean hasBody() {
        return body != null;
    }

    /** Headers with secret values masked, for logging. */
    public Map<String, String> redactedHeaders() {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> out.put(k, k.toLowerCase().contains("key") || k.equalsIgnoreCase("authorization") ? "****" : v));
        return out;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
