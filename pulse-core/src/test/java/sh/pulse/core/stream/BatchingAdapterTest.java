// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class BatchingAdapterTest {

    /** Queues tasks until the test runs them, so bursts can be observed. */
    static final class ManualExecutor implements Executor {
        private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
            }
        }

        int pending() {
            return tasks.size();
        }
    }

    static final class RecordingObserver<T> implements BatchObserver<T> {
        final List<List<T>> batches = Collections.synchronizedList(new ArrayList<>());
        final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger completions = new AtomicInteger();
        final CountDownLatch terminated = new CountDownLatch(1);

        @Override
        public void onBatch(List<? extends T> batch) {
            batches.add(new ArrayList<>(batch));
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
            terminated.countDown();
        }

        @Override
        public void onComplete() {
            completions.incrementAndGet();
            terminated.countDown();
        }

        List<T> items() {
            List<T> all = new ArrayList<>();
            synchronized (batches) {
                batches.forEach(all::addAll);
            }
            return all;
        }
    }

    private final ManualExecutor executor = new ManualExecutor();
    private final BatchingAdapter adapter = new BatchingAdapter(executor);

    @Test
    void testMaterializedSourceIsDeliveredAsOneBatchWithoutSubscribing() {
        MaterializedSource<String> source = new MaterializedSource<>() {
            @Override
            public List<String> items() {
                return List.of("a", "b", "c");
            }

            @Override
            public Cancellable subscribe(EventObserver<? super String> observer) {
                throw new AssertionError("materialized sources must not be subscribed to");
            }
        };
        RecordingObserver<String> observer = new RecordingObserver<>();

        adapter.subscribe(source, observer);
        assertTrue(observer.batches.isEmpty(), "delivery happens on the executor");

        executor.runAll();
        assertEquals(List.of(List.of("a", "b", "c")), observer.batches);
        assertEquals(1, observer.completions.get());
        assertTrue(observer.errors.isEmpty());
    }

    @Test
    void testMaterializedSourceIgnoresMaxBatchSize() {
        BatchingAdapter small = new BatchingAdapter(executor, 2);
        RecordingObserver<Integer> observer = new RecordingObserver<>();

        small.subscribe(EventSources.of(1, 2, 3, 4, 5), observer);
        executor.runAll();

        assertEquals(List.of(List.of(1, 2, 3, 4, 5)), observer.batches);
    }

    @Test
    void testEmptyMaterializedSourceSendsOneEmptyBatch() {
        RecordingObserver<Object> observer = new RecordingObserver<>();

        adapter.subscribe(EventSources.empty(), observer);
        executor.runAll();

        assertEquals(List.of(List.of()), observer.batches);
        assertEquals(1, observer.completions.get());
    }

    @Test
    void testCancelledMaterializedSourceDeliversNothing() {
        RecordingObserver<String> observer = new RecordingObserver<>();

        Cancellable handle = adapter.subscribe(EventSources.of("a"), observer);
        handle.cancel();
        executor.runAll();

        assertTrue(observer.batches.isEmpty());
        assertEquals(0, observer.completions.get());
    }

    @Test
    void testBurstIsCoalescedIntoOneBatch() {
        EventBroadcaster<Integer> source = new EventBroadcaster<>();
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        adapter.subscribe(source, observer);

        source.publish(1);
        source.publish(2);
        source.publish(3);
        assertEquals(1, executor.pending(), "one drain task per burst");
        executor.runAll();

        source.publish(4);
        executor.runAll();

        source.complete();
        executor.runAll();

        assertEquals(List.of(List.of(1, 2, 3), List.of(4)), observer.batches);
        assertEquals(1, observer.completions.get());
    }

    @Test
    void testBatchesAreCappedAtMaxBatchSize() {
        BatchingAdapter small = new BatchingAdapter(executor, 2);
        EventBroadcaster<Integer> source = new EventBroadcaster<>();
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        small.subscribe(source, observer);

        for (int i = 1; i <= 5; i++) {
            source.publish(i);
        }
        source.complete();
        executor.runAll();

        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), observer.batches);
        assertEquals(1, observer.completions.get());
    }

    @Test
    void testErrorIsDeliveredAfterPendingItems() {
        EventBroadcaster<String> source = new EventBroadcaster<>();
        RecordingObserver<String> observer = new RecordingObserver<>();
        adapter.subscribe(source, observer);

        IllegalStateException failure = new IllegalStateException("boom");
        source.publish("a");
        source.fail(failure);
        executor.runAll();

        assertEquals(List.of(List.of("a")), observer.batches);
        assertEquals(List.of(failure), observer.errors);
        assertEquals(0, observer.completions.get());
    }

    @Test
    void testOnlyFirstTerminalSignalIsDelivered() {
        EventSource<Integer> misbehaving = observer -> {
            observer.onNext(1);
            observer.onComplete();
            observer.onError(new IllegalStateException("late"));
            observer.onNext(2);
            observer.onComplete();
            return Cancellable.noop();
        };
        RecordingObserver<Integer> observer = new RecordingObserver<>();

        adapter.subscribe(misbehaving, observer);
        executor.runAll();

        assertEquals(List.of(1), observer.items());
        assertEquals(1, observer.completions.get());
        assertTrue(observer.errors.isEmpty());
    }

    @Test
    void testCancelStopsDeliveryAndReleasesSource() {
        EventBroadcaster<Integer> source = new EventBroadcaster<>();
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        Cancellable handle = adapter.subscribe(source, observer);
        assertEquals(1, source.observerCount());

        source.publish(1);
        handle.cancel();
        source.publish(2);
        source.complete();
        executor.runAll();

        assertTrue(observer.batches.isEmpty());
        assertEquals(0, observer.completions.get());
        assertEquals(0, source.observerCount());
    }

    @Test
    void testCancelIsIdempotent() {
        AtomicInteger upstreamCancels = new AtomicInteger();
        EventSource<Integer> source = observer -> upstreamCancels::incrementAndGet;
        Cancellable handle = adapter.subscribe(source, new RecordingObserver<>());

        handle.cancel();
        handle.cancel();

        assertEquals(1, upstreamCancels.get());
    }

    @Test
    void testSourceThrowingOnSubscribeIsDeliveredAsError() {
        IllegalStateException failure = new IllegalStateException("cannot open");
        EventSource<Integer> source = observer -> {
            throw failure;
        };
        RecordingObserver<Integer> observer = new RecordingObserver<>();

        adapter.subscribe(source, observer);
        executor.runAll();

        assertEquals(List.of(failure), observer.errors);
        assertTrue(observer.batches.isEmpty());
    }

    @Test
    void testFailingObserverCancelsSourceAndReceivesError() {
        EventBroadcaster<Integer> source = new EventBroadcaster<>();
        List<Throwable> errors = new ArrayList<>();
        RuntimeException failure = new RuntimeException("observer broke");
        BatchObserver<Integer> observer = new BatchObserver<>() {
            @Override
            public void onBatch(List<? extends Integer> batch) {
                throw failure;
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }

            @Override
            public void onComplete() {
                fail("completion after observer failure");
            }
        };
        adapter.subscribe(source, observer);

        source.publish(1);
        executor.runAll();
        source.complete();
        executor.runAll();

        assertEquals(List.of(failure), errors);
        assertEquals(0, source.observerCount());
    }

    @Test
    void testNullItemsAreForwarded() {
        EventBroadcaster<String> source = new EventBroadcaster<>();
        RecordingObserver<String> observer = new RecordingObserver<>();
        adapter.subscribe(source, observer);

        source.publish("a");
        source.publish(null);
        source.publish("b");
        executor.runAll();

        assertEquals(Arrays.asList("a", null, "b"), observer.items());
    }

    @Test
    void testRejectedDrainCancelsSource() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("shut down");
        };
        EventBroadcaster<Integer> source = new EventBroadcaster<>();
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        new BatchingAdapter(rejecting).subscribe(source, observer);

        source.publish(1);

        assertEquals(0, source.observerCount());
        assertTrue(observer.batches.isEmpty());
    }

    @Test
    void testOrderIsPreservedUnderConcurrentDelivery() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            BatchingAdapter concurrent = new BatchingAdapter(pool, 64);
            EventBroadcaster<Integer> source = new EventBroadcaster<>();
            RecordingObserver<Integer> observer = new RecordingObserver<>();
            concurrent.subscribe(source, observer);

            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < 10_000; i++) {
                source.publish(i);
                expected.add(i);
            }
            source.complete();

            assertTrue(observer.terminated.await(10, TimeUnit.SECONDS));
            assertEquals(expected, observer.items());
            assertEquals(1, observer.completions.get());
            synchronized (observer.batches) {
                for (List<Integer> batch : observer.batches) {
                    assertFalse(batch.isEmpty());
                    assertTrue(batch.size() <= 64);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testRejectsInvalidMaxBatchSize() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new BatchingAdapter(executor, 0));
        assertTrue(ex.getMessage().contains("maxBatchSize"));
    }
}
