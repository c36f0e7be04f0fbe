package com.questrail.insights.transport.netty;

import com.questrail.insights.config.ApiEndpointConfig;
import com.questrail.insights.transport.ApiRequest;
import com.questrail.insights.transport.ApiResponse;
import com.questrail.insights.transport.ApiTransport;
import com.questrail.insights.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyApiTransport
 * =============================================================================
 * Netty-backed implementation of the {@link ApiTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT
 * interpret status codes, parse JSON, or retry.
 *
 * <p>Each request opens its own connection ({@code Connection: close}). The
 * resource client already serializes calls, so pooling would buy little.
 * The full response is aggregated and copied into a {@code String}; all
 * reference-counted buffers are released internally.</p>
 */
final class NettyApiTransport implements ApiTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyApiTransport.class);

    private static final int MAX_CONTENT_LENGTH = 16 * 1024 * 1024;

    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final ApiEndpointConfig config;

    private volatile boolean closed;

    NettyApiTransport(EventLoopGroup group, SslContext sslContext, ApiEndpointConfig config)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.sslContext = sslContext;
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public ApiResponse execute(ApiRequest request)
    {
        Objects.requireNonNull(request, "request");
        if (closed) {
            throw new TransportException("Transport closed");
        }

        String host = config.host().getHost();
        int port = config.port();
        CompletableFuture<ApiResponse> response = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(new ResponseHandler(response));
                    }
                });

        log.debug("{} {} {}", request.method(), request.path(), request.redactedHeaders());

        ChannelFuture connect = bootstrap.connect(host, port);
        connect.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                response.completeExceptionally(f.cause());
                return;
            }
            f.channel().writeAndFlush(toNetty(request, host)).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) {
                    response.completeExceptionally(w.cause());
                    w.channel().close();
                }
            });
        });

        try {
            return response.get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            throw new TransportException(request + " timed out after " + config.requestTimeout(), e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException(request + " failed: " + cause, cause);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(request + " interrupted", e);
        }
        finally {
            Channel ch = connect.channel();
            if (ch != null && ch.isOpen()) {
                ch.close();
            }
        }
    }

    @Override
    public void close()
    {
        closed = true;
    }

    private static FullHttpRequest toNetty(ApiRequest request, String host)
    {
        ByteBuf content = request.hasBody()
                ? Unpooled.copiedBuffer(request.body(), StandardCharsets.UTF_8)
                : Unpooled.EMPTY_BUFFER;

        FullHttpRequest out = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.valueOf(request.method()), request.path(), content);

        HttpHeaders headers = out.headers();
        headers.set(HttpHeaderNames.HOST, host);
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        request.headers().forEach(headers::set);
        if (request.hasBody()) {
            if (!headers.contains(HttpHeaderNames.CONTENT_TYPE)) {
                headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
            }
            headers.setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        }
        else if (!"GET".equals(request.method())) {
            headers.setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        }
        return out;
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Completes the pending future with the aggregated response, copied out of
     * Netty buffers.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final CompletableFuture<ApiResponse> response;

        ResponseHandler(CompletableFuture<ApiResponse> response)
        {
            this.response = response;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg)
        {
            String body = msg.content().toString(StandardCharsets.UTF_8);
            response.complete(new ApiResponse(msg.status().code(), body));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            response.completeExceptionally(new ClosedChannelException());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            response.completeExceptionally(cause);
            ctx.close();
        }
    }
}
