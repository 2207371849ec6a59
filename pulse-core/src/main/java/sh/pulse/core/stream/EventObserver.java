// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

/**
 * Receives the items of an {@link EventSource}, one at a time.
 *
 * <p>
 * Sources call these methods serially (never concurrently), emit zero or more
 * items, then at most one of {@link #onError} or {@link #onComplete}.
 *
 * @param <T> the item type
 */
public interface EventObserver<T> {

    void onNext(T item);

    void onError(Throwable error);

    void onComplete();
}
