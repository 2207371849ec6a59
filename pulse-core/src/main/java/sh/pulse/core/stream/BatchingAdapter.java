// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw {@link EventSource} into a stream of batches suitable for
 * transmission.
 *
 * <p>
 * <strong>Pass-through mode:</strong> a {@link MaterializedSource} is never
 * subscribed to. Its {@link MaterializedSource#items() items} are delivered as
 * exactly one batch, followed by completion.
 *
 * <p>
 * <strong>Batching mode:</strong> every other source is subscribed to. Items
 * are queued as they arrive and a drain task on the delivery executor emits
 * everything queued at the moment it runs (at most {@code maxBatchSize} items
 * per batch). A burst of items emitted faster than the executor picks up the
 * drain collapses into a single batch; a slow trickle is delivered one item per
 * batch. This is the same smart-batching idea as a Disruptor's end-of-batch
 * flag, without a dedicated consumer thread per stream.
 *
 * <p>
 * <strong>Guarantees</strong> (batching mode):
 * <ul>
 * <li>Concatenating all batches in order reproduces the source's items in
 * order, with no loss or duplication.</li>
 * <li>Batches are never empty.</li>
 * <li>Completion or error is delivered only after every earlier item, and at
 * most once.</li>
 * <li>Calls to the {@link BatchObserver} are serial: at most one drain task per
 * stream runs at a time.</li>
 * <li>After {@link Cancellable#cancel()} returns, nothing more is delivered
 * except a batch that was already being handed to the observer.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> instances hold no per-stream state and may be shared.
 */
public final class BatchingAdapter {

    private static final Logger log = LoggerFactory.getLogger(BatchingAdapter.class);

    /** Default upper bound on the number of items in one batch. */
    public static final int DEFAULT_MAX_BATCH_SIZE = 1024;

    private final Executor executor;
    private final int maxBatchSize;

    /**
     * Creates an adapter with {@link #DEFAULT_MAX_BATCH_SIZE}.
     *
     * @param executor the executor that runs drain tasks
     */
    public BatchingAdapter(final Executor executor) {
        this(executor, DEFAULT_MAX_BATCH_SIZE);
    }

    /**
     * Creates an adapter.
     *
     * @param executor     the executor that runs drain tasks
     * @param maxBatchSize the maximum number of items per batch
     * @throws IllegalArgumentException if maxBatchSize is less than 1
     */
    public BatchingAdapter(final Executor executor, final int maxBatchSize) {
        this.executor = Objects.requireNonNull(executor, "executor");
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got: " + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Subscribes to the source and delivers its items to the observer in batches.
     *
     * @param source   the raw source
     * @param observer the batch observer
     * @param <T>      the item type
     * @return a handle that stops delivery and cancels the source
     */
    public <T> Cancellable subscribe(final EventSource<T> source, final BatchObserver<? super T> observer) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(observer, "observer");

        if (source instanceof MaterializedSource<T> materialized) {
            return deliverMaterialized(materialized, observer);
        }

        BatchingSubscriber<T> subscriber = new BatchingSubscriber<>(observer, executor, maxBatchSize);
        final Cancellable upstream;
        try {
            upstream = source.subscribe(subscriber);
        } catch (RuntimeException e) {
            subscriber.onError(e);
            return subscriber;
        }
        subscriber.setUpstream(upstream != null ? upstream : Cancellable.noop());
        return subscriber;
    }

    private <T> Cancellable deliverMaterialized(
            final MaterializedSource<T> source, final BatchObserver<? super T> observer) {
        List<T> batch = Collections.unmodifiableList(new ArrayList<>(source.items()));
        AtomicBoolean cancelled = new AtomicBoolean(false);
        Runnable delivery = () -> {
            if (cancelled.get()) {
                return;
            }
            try {
                observer.onBatch(batch);
            } catch (RuntimeException e) {
                if (!cancelled.getAndSet(true)) {
                    signalError(observer, e);
                }
                return;
            }
            if (!cancelled.getAndSet(true)) {
                signalComplete(observer);
            }
        };
        try {
            executor.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected materialized batch of {} items", batch.size(), e);
            cancelled.set(true);
        }
        return () -> cancelled.set(true);
    }

    private static void signalError(final BatchObserver<?> observer, final Throwable error) {
        try {
            observer.onError(error);
        } catch (RuntimeException e) {
            log.warn("Batch observer failed while handling error", e);
        }
    }

    private static void signalComplete(final BatchObserver<?> observer) {
        try {
            observer.onComplete();
        } catch (RuntimeException e) {
            log.warn("Batch observer failed while handling completion", e);
        }
    }

    /**
     * Per-stream queue plus a serial drain loop. {@code wip} counts pending drain
     * requests; only the caller that moves it from 0 schedules a task, and the
     * task keeps draining until every request it observed has been served.
     */
    private static final class BatchingSubscriber<T> implements EventObserver<T>, Cancellable, Runnable {

        /** Stand-in for null items, which the queue cannot hold. */
        private static final Object NULL_ITEM = new Object();

        private final BatchObserver<? super T> downstream;
        private final Executor executor;
        private final int maxBatchSize;

        private final ConcurrentLinkedQueue<Object> queue = new ConcurrentLinkedQueue<>();
        private final AtomicInteger wip = new AtomicInteger();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicReference<Cancellable> upstream = new AtomicReference<>();

        // error is written before the volatile write to done and read after reading it
        private @Nullable Throwable error;
        private volatile boolean done;

        // confined to the drain loop
        private boolean terminated;

        BatchingSubscriber(final BatchObserver<? super T> downstream, final Executor executor, final int maxBatchSize) {
            this.downstream = downstream;
            this.executor = executor;
            this.maxBatchSize = maxBatchSize;
        }

        void setUpstream(final Cancellable handle) {
            upstream.compareAndSet(null, handle);
            if (cancelled.get()) {
                handle.cancel();
            }
        }

        @Override
        public void onNext(final T item) {
            if (done || cancelled.get()) {
                return;
            }
            queue.offer(item != null ? item : NULL_ITEM);
            schedule();
        }

        @Override
        public void onError(final Throwable throwable) {
            if (done || cancelled.get()) {
                return;
            }
            error = throwable;
            done = true;
            schedule();
        }

        @Override
        public void onComplete() {
            if (done || cancelled.get()) {
                return;
            }
            done = true;
            schedule();
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                Cancellable handle = upstream.get();
                if (handle != null) {
                    handle.cancel();
                }
                schedule();
            }
        }

        private void schedule() {
            if (wip.getAndIncrement() != 0) {
                return;
            }
            try {
                executor.execute(this);
            } catch (RejectedExecutionException e) {
                log.warn("Delivery executor rejected drain task, cancelling stream", e);
                if (cancelled.compareAndSet(false, true)) {
                    Cancellable handle = upstream.get();
                    if (handle != null) {
                        handle.cancel();
                    }
                }
                queue.clear();
            }
        }

        @Override
        public void run() {
            int missed = 1;
            for (;;) {
                drain();
                missed = wip.addAndGet(-missed);
                if (missed == 0) {
                    return;
                }
            }
        }

        private void drain() {
            for (;;) {
                if (terminated || cancelled.get()) {
                    queue.clear();
                    return;
                }

                // Read done before polling: every item offered before done was set is then visible.
                boolean sourceDone = done;
                List<T> batch = pollBatch();

                if (!batch.isEmpty()) {
                    try {
                        downstream.onBatch(Collections.unmodifiableList(batch));
                    } catch (RuntimeException e) {
                        terminated = true;
                        cancelUpstream();
                        signalError(downstream, e);
                        return;
                    }
                    continue;
                }

                if (sourceDone) {
                    terminated = true;
                    Throwable failure = error;
                    if (failure != null) {
                        signalError(downstream, failure);
                    } else {
                        signalComplete(downstream);
                    }
                }
                return;
            }
        }

        private void cancelUpstream() {
            cancelled.set(true);
            Cancellable handle = upstream.get();
            if (handle != null) {
                handle.cancel();
            }
        }

        @SuppressWarnings("unchecked")
        private List<T> pollBatch() {
            List<T> batch = new ArrayList<>();
            Object next;
            while (batch.size() < maxBatchSize && (next = queue.poll()) != null) {
                batch.add(next == NULL_ITEM ? null : (T) next);
            }
            return batch;
        }
    }
}
