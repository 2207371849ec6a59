// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

/**
 * Receives domain events emitted by multiplexers.
 *
 * <p>
 * {@link #emit} is called on the connection's actor, so implementations should
 * hand the event off quickly. Exceptions are caught and logged by the caller
 * and never affect the connection.
 */
@FunctionalInterface
public interface DomainEventSink {

    void emit(DomainEvent event, EventMeta meta);

    /**
     * Returns a sink that discards every event.
     *
     * @return a no-op sink
     */
    static DomainEventSink noop() {
        return (event, meta) -> {
        };
    }
}
