// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import java.util.List;

/**
 * Capability of an {@link EventSource} whose content is a complete, static
 * list of items.
 *
 * <p>
 * The {@link BatchingAdapter} checks for this interface and delivers
 * {@link #items()} as exactly one batch, without subscribing.
 *
 * @param <T> the item type
 */
public interface MaterializedSource<T> extends EventSource<T> {

    /**
     * Returns every item of this source, in order.
     *
     * @return the items
     */
    List<T> items();

    @Override
    default Cancellable subscribe(final EventObserver<? super T> observer) {
        for (T item : items()) {
            observer.onNext(item);
        }
        observer.onComplete();
        return Cancellable.noop();
    }
}
