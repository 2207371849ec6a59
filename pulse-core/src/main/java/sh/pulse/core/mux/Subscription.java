// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;

import sh.pulse.core.envelope.SubscriptionId;
import sh.pulse.core.stream.Cancellable;

/**
 * A live binding from a client-chosen id to one batched event source.
 *
 * <p>
 * Lifecycle is {@code PENDING -> ACTIVE -> DONE}. A subscription enters the
 * table as {@code PENDING} before its source starts, becomes {@code ACTIVE}
 * once the cancel handle is known, and ends in {@code DONE} on cancel, error
 * or completion, whichever comes first. Only the first transition to
 * {@code DONE} wins, so at most one terminal envelope is ever sent.
 */
final class Subscription {

    enum State {
        PENDING,
        ACTIVE,
        DONE
    }

    private final SubscriptionId id;
    private final String name;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private volatile @Nullable Cancellable handle;

    Subscription(final SubscriptionId id, final String name) {
        this.id = id;
        this.name = name;
    }

    SubscriptionId id() {
        return id;
    }

    String name() {
        return name;
    }

    State state() {
        return state.get();
    }

    boolean isDone() {
        return state.get() == State.DONE;
    }

    /**
     * Attaches the cancel handle. If the subscription already ended while the
     * source was starting, the handle is released immediately.
     */
    void activate(final Cancellable cancelHandle) {
        this.handle = cancelHandle;
        if (!state.compareAndSet(State.PENDING, State.ACTIVE)) {
            cancelHandle.cancel();
        }
    }

    /**
     * Stops delivery. Idempotent.
     *
     * @return {@code true} if this call ended the subscription
     */
    boolean cancel() {
        if (state.getAndSet(State.DONE) == State.DONE) {
            return false;
        }
        Cancellable current = handle;
        if (current != null) {
            current.cancel();
        }
        return true;
    }

    /**
     * Marks the subscription as ended by its source.
     *
     * @return {@code true} if this call ended the subscription and the caller
     *         owns the terminal envelope
     */
    boolean finish() {
        State current = state.get();
        while (current != State.DONE) {
            if (state.compareAndSet(current, State.DONE)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    @Override
    public String toString() {
        return "Subscription[" + id + ", " + name + ", " + state.get() + "]";
    }
}
