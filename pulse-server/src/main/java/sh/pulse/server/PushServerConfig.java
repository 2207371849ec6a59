// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.util.concurrent.Executor;

import io.netty.channel.EventLoopGroup;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link PushServer}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * PushServerConfig config = PushServerConfig.builder()
 *         .port(9000)
 *         .path("/push")
 *         .deliveryThreads(4)
 *         .build();
 *
 * PushServer server = PushServer.builder(config).catalog(catalog).start();
 * }</pre>
 *
 * <p>
 * Zero or {@code null} values select the defaults listed below, except for
 * {@code port}, where {@code 0} binds an ephemeral port.
 *
 * @param host              the address to bind. Default: {@code 0.0.0.0}.
 * @param port              the port to bind, 0-65535; 0 picks a free port.
 *                          Default: 8080.
 * @param path              the WebSocket endpoint path, starting with {@code /}.
 *                          Default: {@code /}.
 * @param maxFrameSize      maximum inbound WebSocket message size in bytes.
 *                          Default: 64KB. Maximum: 16MB.
 * @param ioThreads         number of Netty I/O threads. Default: 1. Ignored if
 *                          eventLoopGroup is provided.
 * @param deliveryThreads   number of stream delivery threads. Default: available
 *                          processors. Ignored if deliveryExecutor is provided.
 * @param maxBatchSize      maximum number of items per {@code events} envelope.
 *                          Default: 1024.
 * @param trustForwardedFor whether the first {@code X-Forwarded-For} entry is
 *                          used as the client address. Enable only behind a
 *                          proxy that sets the header.
 * @param eventLoopGroup    externally owned Netty group, or {@code null} to
 *                          create one
 * @param deliveryExecutor  externally owned delivery executor, or {@code null}
 *                          to create one
 * @since 0.1.0
 */
public record PushServerConfig(
        String host,
        int port,
        String path,
        int maxFrameSize,
        int ioThreads,
        int deliveryThreads,
        int maxBatchSize,
        boolean trustForwardedFor,
        @Nullable EventLoopGroup eventLoopGroup,
        @Nullable Executor deliveryExecutor) {

    // Defaults
    static final String DEFAULT_HOST = "0.0.0.0";
    static final int DEFAULT_PORT = 8080;
    static final String DEFAULT_PATH = "/";
    static final int DEFAULT_MAX_FRAME_SIZE = 64 * 1024;    // 64KB
    static final int MAX_FRAME_SIZE_LIMIT = 16 * 1024 * 1024; // 16MB
    static final int DEFAULT_IO_THREADS = 1;
    static final int DEFAULT_MAX_BATCH_SIZE = 1024;

    /**
     * Compact constructor with validation and defaults.
     */
    public PushServerConfig {
        // Apply defaults for zero/null values
        if (host == null)
            host = DEFAULT_HOST;
        if (path == null)
            path = DEFAULT_PATH;
        if (maxFrameSize <= 0)
            maxFrameSize = DEFAULT_MAX_FRAME_SIZE;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (deliveryThreads <= 0)
            deliveryThreads = Runtime.getRuntime().availableProcessors();
        if (maxBatchSize <= 0)
            maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/', got: " + path);
        }
        if (maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                    "maxFrameSize (" + maxFrameSize + ") exceeds maximum allowed (" + MAX_FRAME_SIZE_LIMIT + " bytes / 16MB)");
        }
    }

    /**
     * Creates a configuration with all defaults.
     *
     * @return a new PushServerConfig with default settings
     */
    public static PushServerConfig withDefaults() {
        return builder().build();
    }

    /**
     * Creates a builder for constructing a PushServerConfig.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link PushServerConfig}.
     */
    public static final class Builder {
        private String host = null;
        private int port = DEFAULT_PORT;
        private String path = null;
        private int maxFrameSize = 0;
        private int ioThreads = 0;
        private int deliveryThreads = 0;
        private int maxBatchSize = 0;
        private boolean trustForwardedFor = true;
        private EventLoopGroup eventLoopGroup = null;
        private Executor deliveryExecutor = null;

        private Builder() {
        }

        /**
         * Sets the bind address. Default: {@code 0.0.0.0}.
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Sets the bind port. Default: 8080. Use 0 for an ephemeral port.
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Sets the WebSocket endpoint path. Default: {@code /}.
         */
        public Builder path(String path) {
            this.path = path;
            return this;
        }

        /**
         * Sets the maximum inbound message size.
         * Default: 64KB. Maximum: 16MB.
         *
         * @param bytes the maximum message size in bytes
         */
        public Builder maxFrameSize(int bytes) {
            this.maxFrameSize = bytes;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads.
         * Default: 1. Ignored if eventLoopGroup is provided.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets the number of delivery threads.
         * Default: available processors. Ignored if deliveryExecutor is provided.
         */
        public Builder deliveryThreads(int deliveryThreads) {
            this.deliveryThreads = deliveryThreads;
            return this;
        }

        /**
         * Sets the maximum number of items per batch. Default: 1024.
         */
        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        /**
         * Sets whether {@code X-Forwarded-For} is trusted. Default: true.
         */
        public Builder trustForwardedFor(boolean trustForwardedFor) {
            this.trustForwardedFor = trustForwardedFor;
            return this;
        }

        /**
         * Sets a custom Netty EventLoopGroup.
         * When set, ioThreads is ignored.
         * The caller is responsible for shutting down this group.
         */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = group;
            return this;
        }

        /**
         * Sets a custom delivery executor.
         * When set, deliveryThreads is ignored.
         * The caller is responsible for shutting down this executor.
         */
        public Builder deliveryExecutor(Executor executor) {
            this.deliveryExecutor = executor;
            return this;
        }

        /**
         * Builds the PushServerConfig.
         *
         * @return a new PushServerConfig
         */
        public PushServerConfig build() {
            return new PushServerConfig(
                    host,
                    port,
                    path,
                    maxFrameSize,
                    ioThreads,
                    deliveryThreads,
                    maxBatchSize,
                    trustForwardedFor,
                    eventLoopGroup,
                    deliveryExecutor);
        }
    }
}
