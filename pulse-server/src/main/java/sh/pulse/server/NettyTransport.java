// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.util.Objects;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pulse.core.mux.Transport;
import sh.pulse.core.mux.TransportState;

/**
 * {@link Transport} over a Netty WebSocket channel.
 *
 * <p>
 * Writes may come from any thread. Netty queues writes issued outside the
 * event loop in submission order per calling thread, which keeps the envelopes
 * of one subscription ordered.
 */
final class NettyTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(NettyTransport.class);

    private final Channel channel;

    NettyTransport(final Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public TransportState state() {
        if (channel.isActive()) {
            return TransportState.OPEN;
        }
        return channel.isOpen() ? TransportState.CLOSING : TransportState.CLOSED;
    }

    @Override
    public void send(final String text) {
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(future -> {
            if (!future.isSuccess()) {
                log.debug("Write failed on channel {}", channel.id().asShortText(), future.cause());
            }
        });
    }

    @Override
    public String toString() {
        return "NettyTransport[" + channel.id().asShortText() + ", " + state() + "]";
    }
}
