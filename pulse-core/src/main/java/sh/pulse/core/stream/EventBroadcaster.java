// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A hot event source that fans published items out to every current observer.
 *
 * <p>
 * Observers only see items published after they subscribed. Once the
 * broadcaster has completed or failed, further publications are ignored and
 * new observers receive the terminal signal immediately.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe. Publication is
 * serialized, so each observer sees signals one at a time and in publication
 * order.
 *
 * <pre>{@code
 * EventBroadcaster<Quote> quotes = new EventBroadcaster<>();
 * catalog.register("quotes", (offset, connection, sessionId) -> quotes);
 * quotes.publish(new Quote("ACME", 12.5));
 * }</pre>
 *
 * @param <T> the item type
 */
public final class EventBroadcaster<T> implements EventSource<T> {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final CopyOnWriteArrayList<EventObserver<? super T>> observers = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private boolean terminated;
    private @Nullable Throwable failure;

    @Override
    public Cancellable subscribe(final EventObserver<? super T> observer) {
        Objects.requireNonNull(observer, "observer");
        synchronized (lock) {
            if (terminated) {
                if (failure != null) {
                    observer.onError(failure);
                } else {
                    observer.onComplete();
                }
                return Cancellable.noop();
            }
            observers.add(observer);
        }
        return () -> observers.remove(observer);
    }

    /**
     * Delivers an item to every current observer. Ignored after termination.
     *
     * @param item the item to publish
     */
    public void publish(final T item) {
        synchronized (lock) {
            if (terminated) {
                return;
            }
            for (EventObserver<? super T> observer : observers) {
                try {
                    observer.onNext(item);
                } catch (RuntimeException e) {
                    log.warn("Observer failed while receiving item, removing it", e);
                    observers.remove(observer);
                }
            }
        }
    }

    /**
     * Completes every current and future observer.
     */
    public void complete() {
        synchronized (lock) {
            if (terminated) {
                return;
            }
            terminated = true;
            try {
                for (EventObserver<? super T> observer : observers) {
                    try {
                        observer.onComplete();
                    } catch (RuntimeException e) {
                        log.warn("Observer failed while receiving completion", e);
                    }
                }
            } finally {
                observers.clear();
            }
        }
    }

    /**
     * Fails every current and future observer.
     *
     * @param error the failure to signal
     */
    public void fail(final Throwable error) {
        Objects.requireNonNull(error, "error");
        synchronized (lock) {
            if (terminated) {
                return;
            }
            terminated = true;
            failure = error;
            try {
                for (EventObserver<? super T> observer : observers) {
                    try {
                        observer.onError(error);
                    } catch (RuntimeException e) {
                        log.warn("Observer failed while receiving error", e);
                    }
                }
            } finally {
                observers.clear();
            }
        }
    }

    /**
     * Returns the number of observers currently subscribed.
     *
     * @return the observer count
     */
    public int observerCount() {
        return observers.size();
    }
}
