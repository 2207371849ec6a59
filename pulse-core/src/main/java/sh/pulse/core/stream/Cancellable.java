// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.stream;

/**
 * Handle that stops delivery from an event source.
 *
 * <p>
 * Implementations must be idempotent and safe to call from any thread,
 * including concurrently with an in-flight delivery. No signal is guaranteed
 * to be suppressed until {@link #cancel()} has returned; one signal already
 * being delivered may still arrive.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Stops further delivery. Calling this more than once has no effect.
     */
    void cancel();

    /**
     * Returns a handle that does nothing.
     *
     * @return a no-op cancellable
     */
    static Cancellable noop() {
        return () -> {
        };
    }
}
