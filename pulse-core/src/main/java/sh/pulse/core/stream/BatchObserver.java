// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

import java.util.List;

/**
 * Receives the output of the {@link BatchingAdapter}.
 *
 * <p>
 * Calls are serial and ordered: zero or more {@link #onBatch} calls followed by
 * at most one terminal call. Concatenating every batch in order reproduces the
 * source's item sequence exactly.
 *
 * @param <T> the item type
 */
public interface BatchObserver<T> {

    /**
     * Delivers one batch. Batches are non-empty, except for the single batch of
     * a {@link MaterializedSource} built from an empty list.
     *
     * @param batch the items, in source order; unmodifiable
     */
    void onBatch(List<? extends T> batch);

    void onError(Throwable error);

    void onComplete();
}
