// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Identity of one client connection: a server-assigned connection id, the
 * remote address, and the session id most recently announced by the client's
 * {@code hello}.
 *
 * <p>
 * The session id is written on the connection's actor and may be read from
 * any thread.
 */
public final class ConnectionSession {

    private final String connectionId;
    private final String remoteAddress;
    private volatile @Nullable String sessionId;

    public ConnectionSession(final String connectionId, final String remoteAddress) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
    }

    public String connectionId() {
        return connectionId;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public @Nullable String sessionId() {
        return sessionId;
    }

    /**
     * Replaces the session id. A later {@code hello} overwrites an earlier one.
     */
    void sessionId(final String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    }

    /**
     * Returns a snapshot of this session for domain event metadata.
     *
     * @return the current metadata
     */
    public EventMeta meta() {
        return new EventMeta(connectionId, sessionId, remoteAddress);
    }

    @Override
    public String toString() {
        return "ConnectionSession[" + connectionId + ", " + remoteAddress + ", session=" + sessionId + "]";
    }
}
