// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import sh.pulse.core.PulseMetrics;
import sh.pulse.core.mux.DomainEvent;
import sh.pulse.core.mux.EventMeta;

class DisruptorDomainEventSinkTest {

    private static EventMeta meta(String connectionId) {
        return new EventMeta(connectionId, null, "203.0.113.7");
    }

    @Test
    void testEventsReachDownstreamInOrderOnConsumerThread() throws Exception {
        List<String> received = Collections.synchronizedList(new ArrayList<>());
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(3);

        try (DisruptorDomainEventSink sink = new DisruptorDomainEventSink((event, meta) -> {
            received.add(event.type() + ":" + meta.connectionId());
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        })) {
            sink.emit(DomainEvent.connectionOpen(), meta("c1"));
            sink.emit(new DomainEvent("order-placed"), meta("c1"));
            sink.emit(DomainEvent.connectionClosed(), meta("c1"));

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of(
                DomainEvent.CONNECTION_OPEN + ":c1",
                "order-placed:c1",
                DomainEvent.CONNECTION_CLOSED + ":c1"), received);
        assertTrue(threads.stream().allMatch("pulse-domain-events"::equals));
    }

    @Test
    void testFailingDownstreamDoesNotStopConsumer() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        try (DisruptorDomainEventSink sink = new DisruptorDomainEventSink((event, meta) -> {
            if (meta.connectionId().equals("bad")) {
                throw new IllegalStateException("analytics offline");
            }
            latch.countDown();
        })) {
            sink.emit(DomainEvent.connectionOpen(), meta("bad"));
            sink.emit(DomainEvent.connectionOpen(), meta("good"));

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void testFullRingDropsAndReportsMetrics() throws Exception {
        PulseMetrics metrics = mock(PulseMetrics.class);
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        DisruptorDomainEventSink sink = new DisruptorDomainEventSink((event, meta) -> {
            blocked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 2, metrics);
        try {
            sink.emit(DomainEvent.connectionOpen(), meta("c1"));
            assertTrue(blocked.await(5, TimeUnit.SECONDS));

            // Consumer is parked on the first slot; the ring holds two entries.
            for (int i = 0; i < 5; i++) {
                sink.emit(DomainEvent.connectionOpen(), meta("c" + i));
            }

            verify(metrics, atLeastOnce()).onDomainEventDropped();
        } finally {
            release.countDown();
            sink.close();
        }
    }

    @Test
    void testEmitAfterCloseIsDropped() {
        PulseMetrics metrics = mock(PulseMetrics.class);
        List<DomainEvent> received = Collections.synchronizedList(new ArrayList<>());
        DisruptorDomainEventSink sink = new DisruptorDomainEventSink((event, meta) -> received.add(event), 8, metrics);

        sink.close();
        sink.close();
        sink.emit(DomainEvent.connectionOpen(), meta("c1"));

        verify(metrics).onDomainEventDropped();
        assertTrue(received.isEmpty());
    }

    @Test
    void testRejectsRingSizeThatIsNotPowerOfTwo() {
        assertThrows(IllegalArgumentException.class,
                () -> new DisruptorDomainEventSink((event, meta) -> { }, 1000, PulseMetrics.noop()));
        assertThrows(IllegalArgumentException.class,
                () -> new DisruptorDomainEventSink((event, meta) -> { }, 0, PulseMetrics.noop()));
    }
}
