// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

/**
 * An asynchronous, possibly unbounded sequence of items that may end with
 * completion or an error.
 *
 * <p>
 * <strong>Contract:</strong>
 * <ul>
 * <li>{@link #subscribe} may emit synchronously, before it returns, or later
 * from any thread.</li>
 * <li>Signals to one observer are serial and follow
 * {@code onNext* (onError | onComplete)?}.</li>
 * <li>After the returned handle is cancelled the source should stop emitting;
 * a signal already in flight may still arrive.</li>
 * </ul>
 *
 * <p>
 * Sources whose whole content is known up front should implement
 * {@link MaterializedSource}, which lets the {@link BatchingAdapter} send them
 * as a single batch.
 *
 * @param <T> the item type
 * @see EventSources
 */
@FunctionalInterface
public interface EventSource<T> {

    /**
     * Starts delivering items to the observer.
     *
     * @param observer the observer to signal
     * @return a handle that stops delivery
     */
    Cancellable subscribe(EventObserver<? super T> observer);
}
