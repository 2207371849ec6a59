// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pulse.core.LogSink;
import sh.pulse.core.PulseMetrics;
import sh.pulse.core.envelope.EnvelopeCodec;
import sh.pulse.core.mux.DomainEventSink;
import sh.pulse.core.mux.StreamCatalog;

/**
 * WebSocket push server built on Netty. Every accepted connection gets its own
 * {@link sh.pulse.core.mux.SubscriptionMultiplexer}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * StreamCatalog catalog = StreamCatalog.builder()
 *         .register("prices", (offset, connection, sessionId) -> prices.since(offset))
 *         .build();
 *
 * try (PushServer server = PushServer.builder(PushServerConfig.withDefaults())
 *         .catalog(catalog)
 *         .eventSink(new DisruptorDomainEventSink(analytics::record))
 *         .start()) {
 *     ...
 * }
 * }</pre>
 *
 * <p>
 * <b>Resource ownership:</b> the event loop group and the delivery executor are
 * shut down by {@link #close()} only if the server created them. Groups and
 * executors passed through {@link PushServerConfig} are left to the caller.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.
 *
 * @since 0.1.0
 */
public final class PushServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PushServer.class);

    private final PushServerConfig config;
    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;
    private final Executor deliveryExecutor;
    /** True if we created the delivery executor internally and are responsible for shutting it down. */
    private final boolean ownsDeliveryExecutor;
    private final Channel serverChannel;
    private final int boundPort;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PushServer(final Builder builder) {
        this.config = builder.config;

        if (config.eventLoopGroup() != null) {
            this.group = config.eventLoopGroup();
            this.ownsEventLoopGroup = false; // External group - caller is responsible for lifecycle
        } else {
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "pulse-netty-io");
                t.setDaemon(true);
                return t;
            };
            this.group = new NioEventLoopGroup(config.ioThreads(), threadFactory);
            this.ownsEventLoopGroup = true;
        }

        if (config.deliveryExecutor() != null) {
            this.deliveryExecutor = config.deliveryExecutor();
            this.ownsDeliveryExecutor = false;
        } else {
            this.deliveryExecutor = PulseExecutors.newDeliveryExecutor(config.deliveryThreads());
            this.ownsDeliveryExecutor = true;
        }

        ServerContext context = new ServerContext(
                builder.catalog,
                builder.eventSink,
                builder.logSink,
                builder.metrics,
                builder.codec,
                deliveryExecutor,
                config.maxBatchSize(),
                config.trustForwardedFor());

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(config.maxFrameSize()));
                        p.addLast(new WebSocketServerProtocolHandler(config.path(), null, true, config.maxFrameSize()));
                        p.addLast(new WebSocketFrameAggregator(config.maxFrameSize()));
                        p.addLast(new PushConnectionHandler(context));
                    }
                });

        try {
            this.serverChannel = bootstrap.bind(config.host(), config.port()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseResources();
            throw new IllegalStateException("Interrupted while binding push server", e);
        } catch (Exception e) {
            releaseResources();
            throw new IllegalStateException(
                    "Failed to bind push server on " + config.host() + ":" + config.port(), e);
        }

        this.boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Push server listening on {}:{}{}", config.host(), boundPort, config.path());
    }

    /**
     * Creates a builder for a server with the given configuration.
     *
     * @param config the server configuration
     * @return a new builder
     */
    public static Builder builder(final PushServerConfig config) {
        return new Builder(config);
    }

    /**
     * Returns the port the server is bound to. Useful when the configured port
     * was 0.
     *
     * @return the bound port
     */
    public int port() {
        return boundPort;
    }

    /**
     * Returns the configuration this server was started with.
     *
     * @return the configuration
     */
    public PushServerConfig config() {
        return config;
    }

    /**
     * Stops accepting connections, closes the server channel and releases owned
     * resources. Closing the event loop group closes every open connection, which
     * tears down their multiplexers. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return; // Already closed
        }

        try {
            serverChannel.close().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing server channel", e);
        } catch (Exception e) {
            log.warn("Error closing server channel", e);
        }

        releaseResources();
        log.info("Push server on port {} closed", boundPort);
    }

    private void releaseResources() {
        // Only shutdown the EventLoopGroup if we created it internally
        if (ownsEventLoopGroup) {
            try {
                group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            } catch (Exception e) {
                log.warn("Error shutting down EventLoopGroup", e);
            }
        }

        // User-provided executors are NOT closed - the caller manages their lifecycle.
        if (ownsDeliveryExecutor && deliveryExecutor instanceof ExecutorService es) {
            try {
                es.shutdown();
                if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                    es.shutdownNow();
                    log.warn("Delivery executor did not terminate gracefully");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                es.shutdownNow();
                log.warn("Interrupted while shutting down delivery executor", e);
            }
        }
    }

    /**
     * Builder for {@link PushServer}.
     */
    public static final class Builder {
        private final PushServerConfig config;
        private StreamCatalog catalog = StreamCatalog.empty();
        private DomainEventSink eventSink = DomainEventSink.noop();
        private LogSink logSink = LogSink.slf4j();
        private PulseMetrics metrics = PulseMetrics.noop();
        private EnvelopeCodec codec = new EnvelopeCodec();

        private Builder(final PushServerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /**
         * Sets the catalog that resolves subscription names. Default: empty.
         */
        public Builder catalog(final StreamCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        /**
         * Sets the domain event sink. Default: discard.
         */
        public Builder eventSink(final DomainEventSink eventSink) {
            this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
            return this;
        }

        /**
         * Sets the connection log sink. Default: {@link LogSink#slf4j()}.
         */
        public Builder logSink(final LogSink logSink) {
            this.logSink = Objects.requireNonNull(logSink, "logSink");
            return this;
        }

        /**
         * Sets the metrics collector. Default: no-op.
         */
        public Builder metrics(final @Nullable PulseMetrics metrics) {
            this.metrics = metrics != null ? metrics : PulseMetrics.noop();
            return this;
        }

        /**
         * Sets the envelope codec, for example one backed by an
         * {@code ObjectMapper} with custom modules for stream payloads.
         */
        public Builder codec(final EnvelopeCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Binds the server.
         *
         * @return the running server
         * @throws IllegalStateException if the address cannot be bound
         */
        public PushServer start() {
            return new PushServer(this);
        }
    }
}
