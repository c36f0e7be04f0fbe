package com.questrail.insights.transport.netty;

import com.questrail.insights.transport.PushEndpoint;
import com.questrail.insights.transport.PushEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.*;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketPushEndpoint
 * =============================================================================
 * Netty-backed WebSocket client implementing the {@link PushEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it delivers text frames verbatim
 * and reports lifecycle transitions. It MUST NOT decode messages or reconnect.
 *
 * <p>Fragmented messages are reassembled before delivery. Pings are answered
 * here; they never reach the listener.</p>
 *
 * <h2>Lifecycle</h2>
 * Each {@link #start()} opens a fresh channel with a fresh handshaker. The
 * listener receives exactly one {@code onDisconnected} per started
 * connection, whether the connect, the handshake, or the open connection fails.
 */
final class NettyWebSocketPushEndpoint implements PushEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketPushEndpoint.class);

    private static final int MAX_FRAME_SIZE = 4 * 1024 * 1024;

    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final URI uri;
    private final int port;
    private final Map<String, String> headers;
    private final Duration connectTimeout;

    private volatile PushEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean open;

    NettyWebSocketPushEndpoint(EventLoopGroup group, SslContext sslContext, URI uri, int port,
                               Map<String, String> headers, Duration connectTimeout)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
        this.uri = Objects.requireNonNull(uri, "uri");
        this.port = port;
        this.headers = Map.copyOf(headers);
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public void setListener(PushEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void start()
    {
        PushEndpointListener l = requireListener();

        Channel existing = channel;
        if (existing != null && existing.isOpen()) {
            return;
        }

        HttpHeaders handshakeHeaders = new DefaultHttpHeaders();
        headers.forEach(handshakeHeaders::set);
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, handshakeHeaders, MAX_FRAME_SIZE);

        AtomicBoolean downNotified = new AtomicBoolean();
        String host = uri.getHost();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_SIZE));
                        p.addLast(new SubscriptionHandler(handshaker, downNotified));
                    }
                });

        log.debug("Opening push subscription {}", uri.getPath());

        ChannelFuture f = bootstrap.connect(host, port);
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                notifyDown(l, downNotified, future.cause());
            }
        });
    }

    @Override
    public synchronized void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null && ch.isOpen()) {
            if (open) {
                ch.writeAndFlush(new CloseWebSocketFrame());
            }
            ch.close();
        }
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    private PushEndpointListener requireListener()
    {
        PushEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PushEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(PushEndpointListener l, AtomicBoolean downNotified, Throwable cause)
    {
        open = false;
        if (downNotified.compareAndSet(false, true)) {
            l.onDisconnected(cause);
        }
    }

    /**
     * SubscriptionHandler
     * -------------------------------------------------------------------------
     * Drives the opening handshake, then forwards text frames to the listener.
     */
    private final class SubscriptionHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private final AtomicBoolean downNotified;

        SubscriptionHandler(WebSocketClientHandshaker handshaker, AtomicBoolean downNotified)
        {
            this.handshaker = handshaker;
            this.downNotified = downNotified;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            PushEndpointListener l = listener;
            if (l == null) {
                return;
            }

            if (!handshaker.isHandshakeComplete()) {
                // Throws WebSocketHandshakeException on a non-101 answer; see exceptionCaught.
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                open = true;
                log.debug("Push subscription {} established", uri.getPath());
                l.onConnected();
                return;
            }

            if (msg instanceof TextWebSocketFrame text) {
                l.onMessage(text.text());
            }
            else if (msg instanceof PingWebSocketFrame ping) {
                ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame close) {
                log.debug("Push subscription {} closed by peer ({} {})",
                        uri.getPath(), close.statusCode(), close.reasonText());
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            PushEndpointListener l = listener;
            if (l != null) {
                notifyDown(l, downNotified, null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            PushEndpointListener l = listener;
            if (l != null) {
                notifyDown(l, downNotified, cause);
            }
            ctx.close();
        }
    }
}
