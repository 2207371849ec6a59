// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.Objects;

/**
 * A business-level occurrence forwarded to the {@link DomainEventSink}.
 *
 * @param type the event type, for example {@value #CONNECTION_OPEN}
 */
public record DomainEvent(String type) {

    public static final String CONNECTION_OPEN = "connection-open";
    public static final String CONNECTION_CLOSED = "connection-closed";

    public DomainEvent {
        Objects.requireNonNull(type, "type");
    }

    public static DomainEvent connectionOpen() {
        return new DomainEvent(CONNECTION_OPEN);
    }

    public static DomainEvent connectionClosed() {
        return new DomainEvent(CONNECTION_CLOSED);
    }
}
