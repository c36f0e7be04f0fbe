package com.questrail.insights.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for one controller host serving both management APIs.
 *
 * <p>{@link #toString()} masks the API key so the record can be logged.</p>
 */
public record ApiEndpointConfig(
    URI host,
    String apiKey,
    Duration connectTimeout,
    Duration requestTimeout,
    boolean insecureTls,
    Duration reconnectInitialBackoff,
    Duration reconnectMaxBackoff
) {
    public ApiEndpointConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(reconnectInitialBackoff, "reconnectInitialBackoff");
        Objects.requireNonNull(reconnectMaxBackoff, "reconnectMaxBackoff");

        String scheme = host.getScheme();
        if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("host must be an http(s) URI: " + host);
        }
        if (host.getHost() == null) {
            throw new IllegalArgumentException("host has no hostname: " + host);
        }
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (reconnectInitialBackoff.isNegative() || reconnectInitialBackoff.isZero()) {
            throw new IllegalArgumentException("reconnectInitialBackoff must be positive");
        }
        if (reconnectMaxBackoff.compareTo(reconnectInitialBackoff) < 0) {
            throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectInitialBackoff");
        }
    }

    public boolean isSecure() {
        return "https".equalsIgnoreCase(host.getScheme());
    }

    public int port() {
        if (host.getPort() != -1) {
            return host.getPort();
        }
        return isSecure() ? 443 : 80;
    }

    /**
     * Resolves {@code path} (absolute, starting with {@code /}) against the host.
     */
    public URI resolve(String path) {
        return host.resolve(path);
    }

    @Override
    public String toString() {
        return "ApiEndpointConfig[host=" + host
                + ", apiKey=****"
                + ", connectTimeout=" + connectTimeout
                + ", requestTimeout=" + requestTimeout
                + ", insecureTls=" + insecureTls
                + ", reconnectBackoff=" + reconnectInitialBackoff + ".." + reconnectMaxBackoff
                + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI host;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private boolean insecureTls = false;
        private Duration reconnectInitialBackoff = Duration.ofSeconds(1);
        private Duration reconnectMaxBackoff = Duration.ofSeconds(60);

        public Builder withHost(URI host) {
            this.host = host;
            return this;
        }

        public Builder withHost(String host) {
            this.host = URI.create(host);
            return this;
        }

        public Builder withApiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder withInsecureTls(boolean insecureTls) {
            this.insecureTls = insecureTls;
            return this;
        }

        public Builder withReconnectBackoff(Duration initial, Duration max) {
            this.reconnectInitialBackoff = initial;
            this.reconnectMaxBackoff = max;
            return this;
        }

        public ApiEndpointConfig build() {
            return new ApiEndpointConfig(host, apiKey, connectTimeout, requestTimeout,
                    insecureTls, reconnectInitialBackoff, reconnectMaxBackoff);
        }
    }
}
