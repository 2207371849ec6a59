// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pulse.core.LogSanitizer;
import sh.pulse.core.LogSink;
import sh.pulse.core.PulseMetrics;
import sh.pulse.core.envelope.DecodeResult;
import sh.pulse.core.envelope.EnvelopeCodec;
import sh.pulse.core.envelope.ErrorPayload;
import sh.pulse.core.envelope.InboundEnvelope;
import sh.pulse.core.envelope.OutboundEnvelope;
import sh.pulse.core.envelope.SubscriptionId;
import sh.pulse.core.error.CatalogException;
import sh.pulse.core.error.CodecException;
import sh.pulse.core.stream.BatchingAdapter;
import sh.pulse.core.stream.Cancellable;
import sh.pulse.core.stream.EventSource;

/**
 * Protocol state machine of one client connection.
 *
 * <p>
 * Turns inbound control messages ({@code hello}, {@code subscribe},
 * {@code unsubscribe}) into independently cancellable, ordered, batched
 * outbound streams that share the connection's {@link Transport}.
 *
 * <p>
 * <strong>Threading:</strong> {@link #onMessage(String)} and {@link #close()}
 * must be called on the connection's actor, one call at a time, in arrival
 * order. The subscription table is only mutated on the actor. Stream delivery
 * runs on the delivery executor; envelopes of one subscription are strictly
 * ordered while envelopes of different subscriptions may interleave.
 *
 * <p>
 * <strong>Cancellation:</strong> once a subscription is cancelled by
 * {@code unsubscribe} or {@link #close()}, no further envelope for it is
 * guaranteed to be sent, but one envelope already in flight may still reach
 * the transport.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * SubscriptionMultiplexer mux = SubscriptionMultiplexer.builder(session, transport)
 *         .catalog(catalog)
 *         .eventSink(sink)
 *         .actor(channel.eventLoop())
 *         .deliveryExecutor(deliveryPool)
 *         .build();
 *
 * mux.onMessage("{\"type\":\"hello\",\"sessionId\":\"s1\"}");
 * ...
 * mux.close();
 * }</pre>
 */
public final class SubscriptionMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionMultiplexer.class);

    private final ConnectionSession session;
    private final Transport transport;
    private final StreamCatalog catalog;
    private final DomainEventSink eventSink;
    private final LogSink logSink;
    private final EnvelopeCodec codec;
    private final BatchingAdapter adapter;
    private final Executor actor;
    private final PulseMetrics metrics;

    private final Map<SubscriptionId, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final InboundEnvelope.Handler dispatcher = new Dispatcher();
    private final ConnectionHandle connectionHandle = new Handle();

    private SubscriptionMultiplexer(final Builder builder) {
        this.session = builder.session;
        this.transport = builder.transport;
        this.catalog = builder.catalog;
        this.eventSink = builder.eventSink;
        this.logSink = builder.logSink;
        this.codec = builder.codec;
        this.adapter = new BatchingAdapter(builder.deliveryExecutor, builder.maxBatchSize);
        this.actor = builder.actor;
        this.metrics = builder.metrics;

        log.debug("Multiplexer created for connection {} from {}", session.connectionId(), session.remoteAddress());
        metrics.onConnectionOpened();
    }

    /**
     * Creates a builder for the given connection.
     *
     * @param session   the connection identity
     * @param transport the outbound side of the connection
     * @return a new builder
     */
    public static Builder builder(final ConnectionSession session, final Transport transport) {
        return new Builder(session, transport);
    }

    /**
     * Handles one inbound text frame. Malformed messages are logged and
     * dropped; nothing is ever sent back for them. Ignored after {@link #close()}.
     *
     * @param text the frame payload
     */
    public void onMessage(final String text) {
        if (closed.get()) {
            log.debug("Ignoring message on closed connection {}", session.connectionId());
            return;
        }

        DecodeResult result = codec.decode(text);
        if (result instanceof DecodeResult.DecodeFailure failure) {
            connectionLog(failure.reason());
            metrics.onProtocolError(failure.reason());
        } else if (result instanceof DecodeResult.Decoded decoded) {
            decoded.envelope().accept(dispatcher);
        }
    }

    /**
     * Tears the connection down: cancels every subscription, clears the table
     * and emits {@code connection-closed}. Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        connectionLog("Closing connection");
        for (Subscription subscription : subscriptions.values()) {
            subscription.cancel();
            metrics.onSubscriptionClosed(subscription.name());
        }
        subscriptions.clear();

        emit(DomainEvent.connectionClosed());
        metrics.onConnectionClosed();
    }

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return {@code true} once closed
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Returns a snapshot of the ids currently in the subscription table.
     *
     * @return the active subscription ids
     */
    public Set<SubscriptionId> activeSubscriptionIds() {
        return Set.copyOf(subscriptions.keySet());
    }

    /**
     * Returns the session of this connection.
     *
     * @return the connection session
     */
    public ConnectionSession session() {
        return session;
    }

    private void onSubscribe(final InboundEnvelope.Subscribe subscribe) {
        SubscriptionId id = subscribe.subscriptionId();
        if (subscriptions.containsKey(id)) {
            connectionLog("subscriptionId sent twice: " + id);
            return;
        }

        String name = subscribe.name();
        connectionLog("subscribing to " + name);

        Optional<StreamFactory> factory;
        try {
            factory = catalog.lookup(name);
        } catch (RuntimeException e) {
            rejectSubscribe(id, new CatalogException(name, "Catalog lookup failed for stream " + name, e));
            return;
        }
        if (factory == null || factory.isEmpty()) {
            send(OutboundEnvelope.error(id, ErrorPayload.NOT_FOUND));
            return;
        }

        final EventSource<?> source;
        try {
            source = factory.get().open(subscribe.offset(), connectionHandle, session.sessionId());
        } catch (RuntimeException e) {
            rejectSubscribe(id, new CatalogException(name, "Stream factory failed for stream " + name, e));
            return;
        }
        if (source == null) {
            rejectSubscribe(id, new CatalogException(name, "Stream factory returned no source for stream " + name));
            return;
        }

        // Insert before starting the source so that a synchronous completion finds its own entry.
        Subscription subscription = new Subscription(id, name);
        subscriptions.put(id, subscription);
        metrics.onSubscriptionOpened(name);

        Cancellable handle = adapter.subscribe(source, new SubscriptionObserver<Object>(this, subscription));
        subscription.activate(handle);
    }

    private void rejectSubscribe(final SubscriptionId id, final CatalogException error) {
        log.warn("Rejecting subscription {} on connection {}: {}",
                id, session.connectionId(), error.getMessage(), error);
        connectionLog(error.getMessage());
        send(OutboundEnvelope.error(id, ErrorPayload.INTERNAL_ERROR));
    }

    private void onUnsubscribe(final InboundEnvelope.Unsubscribe unsubscribe) {
        SubscriptionId id = unsubscribe.subscriptionId();
        Subscription subscription = subscriptions.remove(id);
        if (subscription == null) {
            connectionLog("subscriptionId not found: " + id);
            return;
        }

        connectionLog("unsubscribing from " + subscription.name());
        subscription.cancel();
        metrics.onSubscriptionClosed(subscription.name());
    }

    /**
     * Sends one envelope if the transport is open. Called from the actor and
     * from delivery threads.
     */
    void send(final OutboundEnvelope envelope) {
        TransportState state = transport.state();
        if (state != TransportState.OPEN) {
            connectionLog("Tried to send in transport state: " + state);
            metrics.onEnvelopeDropped(envelope.type());
            return;
        }

        final String text;
        try {
            text = codec.encode(envelope);
        } catch (CodecException e) {
            log.warn("Dropping {} envelope for subscription {} on connection {}",
                    envelope.type(), envelope.subscriptionId(), session.connectionId(), e);
            metrics.onEnvelopeDropped(envelope.type());
            return;
        }

        try {
            transport.send(text);
        } catch (RuntimeException e) {
            log.warn("Transport write failed on connection {}", session.connectionId(), e);
            metrics.onEnvelopeDropped(envelope.type());
            return;
        }
        metrics.onEnvelopeSent(envelope.type());
    }

    void streamFailed(final Subscription subscription, final Throwable error) {
        log.debug("Stream {} failed for subscription {} on connection {}",
                subscription.name(), subscription.id(), session.connectionId(), error);
        connectionLog("stream " + subscription.name() + " failed: " + error);
    }

    /**
     * Removes a subscription that ended on its own. The removal hops to the
     * actor and only removes this exact instance, so an id reused in the
     * meantime is left alone.
     */
    void release(final Subscription subscription) {
        try {
            actor.execute(() -> {
                if (subscriptions.remove(subscription.id(), subscription)) {
                    metrics.onSubscriptionClosed(subscription.name());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Actor rejected removal of subscription {} on connection {}",
                    subscription.id(), session.connectionId(), e);
        }
    }

    private void emit(final DomainEvent event) {
        try {
            eventSink.emit(event, session.meta());
        } catch (RuntimeException e) {
            log.warn("Domain event sink failed for {} on connection {}", event.type(), session.connectionId(), e);
        }
    }

    private void connectionLog(final String message) {
        String line = LogSanitizer.sanitize("[" + session.remoteAddress() + "] " + message);
        try {
            logSink.write(line);
        } catch (RuntimeException e) {
            log.warn("Log sink failed on connection {}", session.connectionId(), e);
        }
    }

    @Override
    public String toString() {
        return "SubscriptionMultiplexer[" + session.connectionId()
                + ", subscriptions=" + subscriptions.size()
                + ", closed=" + closed.get() + "]";
    }

    private final class Dispatcher implements InboundEnvelope.Handler {
        @Override
        public void onHello(final InboundEnvelope.Hello hello) {
            session.sessionId(hello.sessionId());
            emit(DomainEvent.connectionOpen());
            connectionLog("open session " + hello.sessionId());
        }

        @Override
        public void onSubscribe(final InboundEnvelope.Subscribe subscribe) {
            SubscriptionMultiplexer.this.onSubscribe(subscribe);
        }

        @Override
        public void onUnsubscribe(final InboundEnvelope.Unsubscribe unsubscribe) {
            SubscriptionMultiplexer.this.onUnsubscribe(unsubscribe);
        }

        @Override
        public void onUnknown(final InboundEnvelope.Unknown unknown) {
            connectionLog("Received unknown message type " + unknown.type());
        }
    }

    private final class Handle implements ConnectionHandle {
        @Override
        public String connectionId() {
            return session.connectionId();
        }

        @Override
        public String remoteAddress() {
            return session.remoteAddress();
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && transport.state() == TransportState.OPEN;
        }

        @Override
        public String toString() {
            return "ConnectionHandle[" + session.connectionId() + "]";
        }
    }

    /**
     * Builder for {@link SubscriptionMultiplexer}.
     *
     * <p>
     * Defaults: an empty catalog, a no-op domain event sink, the SLF4J log sink,
     * a default {@link EnvelopeCodec}, {@link BatchingAdapter#DEFAULT_MAX_BATCH_SIZE},
     * no-op metrics, and direct execution for both the actor and delivery. Direct
     * execution is meant for tests and single-threaded embedders; servers should
     * supply both executors.
     */
    public static final class Builder {
        private final ConnectionSession session;
        private final Transport transport;
        private StreamCatalog catalog = StreamCatalog.empty();
        private DomainEventSink eventSink = DomainEventSink.noop();
        private LogSink logSink = LogSink.slf4j();
        private EnvelopeCodec codec = new EnvelopeCodec();
        private Executor actor = Runnable::run;
        private Executor deliveryExecutor = Runnable::run;
        private int maxBatchSize = BatchingAdapter.DEFAULT_MAX_BATCH_SIZE;
        private PulseMetrics metrics = PulseMetrics.noop();

        private Builder(final ConnectionSession session, final Transport transport) {
            this.session = Objects.requireNonNull(session, "session");
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder catalog(final StreamCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public Builder eventSink(final DomainEventSink eventSink) {
            this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
            return this;
        }

        public Builder logSink(final LogSink logSink) {
            this.logSink = Objects.requireNonNull(logSink, "logSink");
            return this;
        }

        public Builder codec(final EnvelopeCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Sets the executor that serializes removal of finished subscriptions
         * with message handling. Must be the executor that calls
         * {@link SubscriptionMultiplexer#onMessage(String)} and
         * {@link SubscriptionMultiplexer#close()}.
         */
        public Builder actor(final Executor actor) {
            this.actor = Objects.requireNonNull(actor, "actor");
            return this;
        }

        /**
         * Sets the executor that runs stream delivery.
         */
        public Builder deliveryExecutor(final Executor deliveryExecutor) {
            this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
            return this;
        }

        public Builder maxBatchSize(final int maxBatchSize) {
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("maxBatchSize must be at least 1, got: " + maxBatchSize);
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder metrics(final @Nullable PulseMetrics metrics) {
            this.metrics = metrics != null ? metrics : PulseMetrics.noop();
            return this;
        }

        public SubscriptionMultiplexer build() {
            return new SubscriptionMultiplexer(this);
        }
    }
}
