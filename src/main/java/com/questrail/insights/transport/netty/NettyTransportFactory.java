package com.questrail.insights.transport.netty;

import com.questrail.insights.config.ApiEndpointConfig;
import com.questrail.insights.transport.ApiTransport;
import com.questrail.insights.transport.PushEndpoint;
import com.questrail.insights.transport.TransportException;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * NettyTransportFactory
 * =============================================================================
 * Owns the Netty event loop shared by every transport created for one
 * controller host.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. The composition root sees only the
 * {@link ApiTransport} and {@link PushEndpoint} ports.
 *
 * <h2>Lifecycle</h2>
 * Transports created here stay usable until {@link #close()}, which shuts the
 * event loop down.
 */
public final class NettyTransportFactory implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyTransportFactory.class);

    private final ApiEndpointConfig config;
    private final EventLoopGroup group;
    private final SslContext sslContext;

    public NettyTransportFactory(ApiEndpointConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sslContext = config.isSecure() ? buildSslContext(config.insecureTls()) : null;
        this.group = new NioEventLoopGroup(2);
    }

    public ApiTransport apiTransport()
    {
        return new NettyApiTransport(group, sslContext, config);
    }

    /**
     * Creates a WebSocket endpoint for {@code path} on the configured host.
     * The http(s) scheme is mapped to ws(s).
     */
    public PushEndpoint pushEndpoint(String path, Map<String, String> headers)
    {
        URI http = config.resolve(path);
        String scheme = config.isSecure() ? "wss" : "ws";
        URI ws = URI.create(scheme + "://" + http.getRawAuthority() + http.getRawPath()
                + (http.getRawQuery() != null ? "?" + http.getRawQuery() : ""));
        return new NettyWebSocketPushEndpoint(group, sslContext, ws, config.port(), headers, config.connectTimeout());
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    private static SslContext buildSslContext(boolean insecure)
    {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (insecure) {
                log.warn("TLS certificate verification disabled for controller connections");
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            return builder.build();
        }
        catch (SSLException e) {
            throw new TransportException("Unable to initialize TLS", e);
        }
    }
}
