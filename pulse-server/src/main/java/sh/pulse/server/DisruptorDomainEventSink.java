// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslatorTwoArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pulse.core.PulseMetrics;
import sh.pulse.core.mux.DomainEvent;
import sh.pulse.core.mux.DomainEventSink;
import sh.pulse.core.mux.EventMeta;

/**
 * {@link DomainEventSink} that hands events to a slower downstream sink
 * through an LMAX Disruptor ring buffer.
 *
 * <p>
 * {@link #emit} is called on connection actors (Netty event loops) and never
 * blocks: a full ring buffer drops the event, logs a warning and reports
 * {@link PulseMetrics#onDomainEventDropped()}. The downstream sink runs on a
 * single daemon thread named {@code pulse-domain-events}, so it sees events in
 * publication order and need not be thread-safe.
 *
 * <pre>{@code
 * try (DisruptorDomainEventSink sink = new DisruptorDomainEventSink(analytics::record)) {
 *     PushServer server = PushServer.builder(config).eventSink(sink).start();
 *     ...
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class DisruptorDomainEventSink implements DomainEventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisruptorDomainEventSink.class);

    static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private static final EventTranslatorTwoArg<DomainEventSlot, DomainEvent, EventMeta> TRANSLATOR =
            (slot, sequence, event, meta) -> slot.set(event, meta);

    private final DomainEventSink downstream;
    private final PulseMetrics metrics;
    private final Disruptor<DomainEventSlot> disruptor;
    private final RingBuffer<DomainEventSlot> ringBuffer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a sink with the default ring buffer size and no metrics.
     *
     * @param downstream the sink that receives events on the consumer thread
     */
    public DisruptorDomainEventSink(final DomainEventSink downstream) {
        this(downstream, DEFAULT_RING_BUFFER_SIZE, PulseMetrics.noop());
    }

    /**
     * Creates a sink.
     *
     * @param downstream     the sink that receives events on the consumer thread
     * @param ringBufferSize the ring buffer capacity (must be a power of 2)
     * @param metrics        metrics collector notified of dropped events
     * @throws IllegalArgumentException if ringBufferSize is not a positive power of 2
     */
    public DisruptorDomainEventSink(
            final DomainEventSink downstream, final int ringBufferSize, final PulseMetrics metrics) {
        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (ringBufferSize <= 0 || (ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException("ringBufferSize must be a power of 2, got: " + ringBufferSize);
        }

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "pulse-domain-events");
            t.setDaemon(true);
            return t;
        };

        this.disruptor = new Disruptor<>(
                DomainEventSlot::new,
                ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                new BlockingWaitStrategy());

        this.disruptor.handleEventsWith(this::handleEvent);
        this.disruptor.start();
        this.ringBuffer = disruptor.getRingBuffer();
    }

    @Override
    public void emit(final DomainEvent event, final EventMeta meta) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(meta, "meta");
        if (closed.get()) {
            log.debug("Dropping {} for connection {}: sink is closed", event.type(), meta.connectionId());
            metrics.onDomainEventDropped();
            return;
        }
        if (!ringBuffer.tryPublishEvent(TRANSLATOR, event, meta)) {
            log.warn("Domain event ring buffer full, dropping {} for connection {}",
                    event.type(), meta.connectionId());
            metrics.onDomainEventDropped();
        }
    }

    /**
     * Handle domain event from Disruptor.
     */
    private void handleEvent(final DomainEventSlot slot, final long sequence, final boolean endOfBatch) {
        try {
            downstream.emit(slot.event, slot.meta);
        } catch (RuntimeException e) {
            log.warn("Downstream domain event sink failed for {}", slot.event.type(), e);
        } finally {
            // Clear event data to prevent stale references when Disruptor reuses this slot.
            slot.clear();
        }
    }

    /**
     * Stops accepting events, waits up to five seconds for queued events to reach
     * the downstream sink, then halts the consumer thread. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return; // Already closed
        }
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Domain event sink did not drain within {}s, halting", SHUTDOWN_TIMEOUT_SECONDS, e);
            disruptor.halt();
        }
    }

    /**
     * Ring buffer slot - instances are pre-allocated and reused.
     */
    static final class DomainEventSlot {
        DomainEvent event;
        EventMeta meta;

        void set(final DomainEvent event, final EventMeta meta) {
            this.event = event;
            this.meta = meta;
        }

        void clear() {
            this.event = null;
            this.meta = null;
        }
    }
}
