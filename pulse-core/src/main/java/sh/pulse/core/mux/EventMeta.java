// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Connection metadata attached to a {@link DomainEvent}, captured when the
 * event is emitted.
 *
 * @param connectionId the server-assigned connection id
 * @param sessionId    the client's session id, or {@code null} before any {@code hello}
 * @param ipAddress    the client address
 */
public record EventMeta(String connectionId, @Nullable String sessionId, String ipAddress) {

    public EventMeta {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(ipAddress, "ipAddress");
    }
}
