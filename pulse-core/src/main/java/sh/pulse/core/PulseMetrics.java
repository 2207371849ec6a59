// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core;

/**
 * Interface for collecting metrics from the multiplexer and the push server.
 *
 * <p>
 * Implementations can integrate with Micrometer, Prometheus or any custom
 * monitoring solution. By default a no-op implementation is used
 * ({@link #noop()}).
 *
 * <pre>{@code
 * PushServer server = PushServer.builder(config)
 *         .catalog(catalog)
 *         .metrics(new MyMicrometerMetrics(meterRegistry))
 *         .start();
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe; methods
 * are called from connection actors and delivery threads concurrently.
 */
public interface PulseMetrics {

    /**
     * Called when a multiplexer is created for a new connection.
     */
    default void onConnectionOpened() {
    }

    /**
     * Called once when a connection's multiplexer is closed.
     */
    default void onConnectionClosed() {
    }

    /**
     * Called when an inbound message is rejected by the codec.
     *
     * @param reason the decode failure reason
     */
    default void onProtocolError(String reason) {
    }

    /**
     * Called when a subscription is admitted to the table.
     *
     * @param name the stream name
     */
    default void onSubscriptionOpened(String name) {
    }

    /**
     * Called when a subscription leaves the table, for any reason.
     *
     * @param name the stream name
     */
    default void onSubscriptionClosed(String name) {
    }

    /**
     * Called after an envelope was handed to the transport.
     *
     * @param type the envelope type ({@code events}, {@code error}, {@code complete})
     */
    default void onEnvelopeSent(String type) {
    }

    /**
     * Called when an envelope was dropped because the transport was not open
     * or the envelope could not be encoded.
     *
     * @param type the envelope type
     */
    default void onEnvelopeDropped(String type) {
    }

    /**
     * Called when a domain event could not be queued for the sink.
     */
    default void onDomainEventDropped() {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     *
     * @return a no-op PulseMetrics instance
     */
    static PulseMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of PulseMetrics.
 */
enum NoopMetrics implements PulseMetrics {
    INSTANCE
}
