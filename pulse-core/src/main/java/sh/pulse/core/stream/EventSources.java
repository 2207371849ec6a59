// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory methods for common {@link EventSource}s.
 *
 * <pre>{@code
 * StreamCatalog catalog = StreamCatalog.builder()
 *         .register("motd", (offset, connection, sessionId) -> EventSources.of("hello"))
 *         .register("ticks", (offset, connection, sessionId) -> EventSources.fromPublisher(tickPublisher))
 *         .build();
 * }</pre>
 */
public final class EventSources {

    private EventSources() {
        // Utility class
    }

    /**
     * Returns a materialized source of the given items.
     *
     * @param items the items, in order
     * @param <T>   the item type
     * @return a source delivered as a single batch
     */
    @SafeVarargs
    public static <T> MaterializedSource<T> of(final T... items) {
        return fromIterable(Arrays.asList(items));
    }

    /**
     * Returns a materialized source holding a snapshot of the given items.
     * Later changes to {@code items} are not reflected.
     *
     * @param items the items, in order
     * @param <T>   the item type
     * @return a source delivered as a single batch
     */
    public static <T> MaterializedSource<T> fromIterable(final Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items");
        List<T> copy = new ArrayList<>();
        items.forEach(copy::add);
        return new ListSource<>(Collections.unmodifiableList(copy));
    }

    /**
     * Returns a materialized source with no items.
     *
     * @param <T> the item type
     * @return an empty source
     */
    public static <T> MaterializedSource<T> empty() {
        return new ListSource<>(List.of());
    }

    /**
     * Returns a source that fails immediately on subscription.
     *
     * @param error the failure to signal
     * @param <T>   the item type
     * @return a failing source
     */
    public static <T> EventSource<T> failed(final Throwable error) {
        Objects.requireNonNull(error, "error");
        return observer -> {
            observer.onError(error);
            return Cancellable.noop();
        };
    }

    /**
     * Adapts a {@link Flow.Publisher}. The adapter requests an unbounded number
     * of items; cancelling the returned handle cancels the Flow subscription.
     *
     * @param publisher the publisher to adapt
     * @param <T>       the item type
     * @return a source backed by the publisher
     */
    public static <T> EventSource<T> fromPublisher(final Flow.Publisher<? extends T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return observer -> {
            PublisherSubscriber<T> subscriber = new PublisherSubscriber<>(observer);
            publisher.subscribe(subscriber);
            return subscriber;
        };
    }

    private record ListSource<T>(List<T> items) implements MaterializedSource<T> {
    }

    private static final class PublisherSubscriber<T> implements Flow.Subscriber<T>, Cancellable {
        private final EventObserver<? super T> observer;
        private final AtomicReference<Flow.Subscription> upstream = new AtomicReference<>();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        PublisherSubscriber(final EventObserver<? super T> observer) {
            this.observer = observer;
        }

        @Override
        public void onSubscribe(final Flow.Subscription subscription) {
            if (!upstream.compareAndSet(null, subscription)) {
                // Reactive Streams rule 2.5: a second subscription must be cancelled
                subscription.cancel();
                return;
            }
            if (cancelled.get()) {
                subscription.cancel();
                return;
            }
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(final T item) {
            if (!cancelled.get()) {
                observer.onNext(item);
            }
        }

        @Override
        public void onError(final Throwable error) {
            if (!cancelled.get()) {
                observer.onError(error);
            }
        }

        @Override
        public void onComplete() {
            if (!cancelled.get()) {
                observer.onComplete();
            }
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                Flow.Subscription subscription = upstream.get();
                if (subscription != null) {
                    subscription.cancel();
                }
            }
        }
    }
}
