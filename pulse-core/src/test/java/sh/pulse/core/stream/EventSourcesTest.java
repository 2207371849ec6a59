// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Flow;

import org.junit.jupiter.api.Test;

class EventSourcesTest {

    /** Publisher that records demand and cancellation and lets the test push items. */
    static final class TestPublisher implements Flow.Publisher<Integer> {
        Flow.Subscriber<? super Integer> subscriber;
        long requested;
        boolean cancelled;

        @Override
        public void subscribe(Flow.Subscriber<? super Integer> subscriber) {
            this.subscriber = subscriber;
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    requested += n;
                }

                @Override
                public void cancel() {
                    cancelled = true;
                }
            });
        }
    }

    @Test
    void testOfIsMaterialized() {
        MaterializedSource<String> source = EventSources.of("a", "b");
        assertEquals(List.of("a", "b"), source.items());
    }

    @Test
    void testFromIterableTakesSnapshot() {
        List<Integer> backing = new ArrayList<>(List.of(1, 2));
        MaterializedSource<Integer> source = EventSources.fromIterable(backing);
        backing.add(3);

        assertEquals(List.of(1, 2), source.items());
        assertThrows(UnsupportedOperationException.class, () -> source.items().add(4));
    }

    @Test
    void testMaterializedSubscribeEmitsItemsThenCompletes() {
        RecordingEventObserver<String> observer = new RecordingEventObserver<>();
        EventSources.of("x", "y").subscribe(observer);

        assertEquals(List.of("x", "y"), observer.items);
        assertEquals(1, observer.completions);
    }

    @Test
    void testFailedSignalsError() {
        IllegalStateException failure = new IllegalStateException("nope");
        RecordingEventObserver<Object> observer = new RecordingEventObserver<>();

        EventSources.failed(failure).subscribe(observer);

        assertEquals(List.of(failure), observer.errors);
        assertTrue(observer.items.isEmpty());
    }

    @Test
    void testFromPublisherRequestsUnboundedAndForwardsSignals() {
        TestPublisher publisher = new TestPublisher();
        RecordingEventObserver<Integer> observer = new RecordingEventObserver<>();

        EventSources.fromPublisher(publisher).subscribe(observer);
        assertEquals(Long.MAX_VALUE, publisher.requested);

        publisher.subscriber.onNext(1);
        publisher.subscriber.onNext(2);
        publisher.subscriber.onComplete();

        assertEquals(List.of(1, 2), observer.items);
        assertEquals(1, observer.completions);
    }

    @Test
    void testFromPublisherCancelPropagates() {
        TestPublisher publisher = new TestPublisher();
        RecordingEventObserver<Integer> observer = new RecordingEventObserver<>();

        Cancellable handle = EventSources.fromPublisher(publisher).subscribe(observer);
        handle.cancel();
        publisher.subscriber.onNext(1);

        assertTrue(publisher.cancelled);
        assertTrue(observer.items.isEmpty());
    }

    @Test
    void testFromPublisherCancelsSecondSubscription() {
        TestPublisher publisher = new TestPublisher();
        EventSources.fromPublisher(publisher).subscribe(new RecordingEventObserver<>());
        Flow.Subscriber<? super Integer> subscriber = publisher.subscriber;

        boolean[] secondCancelled = {false};
        subscriber.onSubscribe(new Flow.Subscription() {
            @Override
            public void request(long n) {
                fail("second subscription must not be requested from");
            }

            @Override
            public void cancel() {
                secondCancelled[0] = true;
            }
        });

        assertTrue(secondCancelled[0]);
        assertFalse(publisher.cancelled);
    }
}
