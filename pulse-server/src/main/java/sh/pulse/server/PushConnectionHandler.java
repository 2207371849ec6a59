// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pulse.core.mux.ConnectionSession;
import sh.pulse.core.mux.SubscriptionMultiplexer;

/**
 * Per-channel handler that hosts one {@link SubscriptionMultiplexer}.
 *
 * <p>
 * The multiplexer is created when the WebSocket handshake completes and uses
 * the channel's event loop as its actor, so inbound messages and teardown are
 * handled one at a time in arrival order. Text frames are passed to
 * {@link SubscriptionMultiplexer#onMessage(String)}; other data frames are
 * ignored. Closing the channel closes the multiplexer.
 *
 * <p>
 * Plain HTTP requests that reach this handler (wrong path) are answered with
 * {@code 404 Not Found}.
 */
final class PushConnectionHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(PushConnectionHandler.class);

    static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final ServerContext context;
    private @Nullable SubscriptionMultiplexer multiplexer;

    PushConnectionHandler(final ServerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            String connectionId = ctx.channel().id().asShortText();
            String remoteAddress = resolveRemoteAddress(
                    handshake.requestHeaders(), ctx.channel().remoteAddress(), context.trustForwardedFor());
            ConnectionSession session = new ConnectionSession(connectionId, remoteAddress);

            multiplexer = SubscriptionMultiplexer.builder(session, new NettyTransport(ctx.channel()))
                    .catalog(context.catalog())
                    .eventSink(context.eventSink())
                    .logSink(context.logSink())
                    .metrics(context.metrics())
                    .codec(context.codec())
                    .actor(ctx.channel().eventLoop())
                    .deliveryExecutor(context.deliveryExecutor())
                    .maxBatchSize(context.maxBatchSize())
                    .build();
            log.debug("WebSocket handshake complete for connection {} from {} on {}",
                    connectionId, remoteAddress, handshake.requestUri());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) {
        if (msg instanceof TextWebSocketFrame text) {
            SubscriptionMultiplexer current = multiplexer;
            if (current == null) {
                log.debug("Dropping text frame received before handshake on {}", ctx.channel().id().asShortText());
                return;
            }
            current.onMessage(text.text());
        } else if (msg instanceof WebSocketFrame frame) {
            log.debug("Ignoring {} on connection {}", frame.getClass().getSimpleName(), ctx.channel().id().asShortText());
        } else if (msg instanceof FullHttpRequest request) {
            log.debug("Rejecting HTTP request for {} on {}", request.uri(), ctx.channel().id().asShortText());
            sendNotFound(ctx);
        } else {
            log.debug("Ignoring unexpected message {} on {}", msg.getClass().getSimpleName(), ctx.channel().id().asShortText());
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        SubscriptionMultiplexer current = multiplexer;
        if (current != null) {
            current.close();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Closing connection {} after channel exception", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }

    @Nullable
    SubscriptionMultiplexer multiplexer() {
        return multiplexer;
    }

    private static void sendNotFound(final ChannelHandlerContext ctx) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.NOT_FOUND,
                Unpooled.copiedBuffer("Not found", StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Returns the client address for logs and event metadata: the first
     * {@code X-Forwarded-For} entry when trusted and present, otherwise the
     * peer address of the socket.
     */
    static String resolveRemoteAddress(
            final @Nullable HttpHeaders headers, final @Nullable SocketAddress peer, final boolean trustForwardedFor) {
        if (trustForwardedFor && headers != null) {
            String forwarded = headers.get(X_FORWARDED_FOR);
            if (forwarded != null) {
                String first = forwarded.split(",", 2)[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        if (peer instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(peer);
    }
}
