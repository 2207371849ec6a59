// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.math.BigDecimal;

import org.jspecify.annotations.Nullable;

import sh.pulse.core.stream.EventSource;

/**
 * Opens the event source behind one named stream.
 *
 * <p>
 * Returning {@code null} or throwing is a catalog contract violation. The
 * multiplexer logs it and answers the subscribe request with a
 * {@code 500 Internal Server Error} envelope; the connection stays open.
 */
@FunctionalInterface
public interface StreamFactory {

    /**
     * Opens a source for one subscription.
     *
     * @param offset     the position requested by the client, any finite number
     * @param connection the requesting connection
     * @param sessionId  the session id announced by the client, if any
     * @return the source to stream from
     */
    @Nullable
    EventSource<?> open(BigDecimal offset, ConnectionHandle connection, @Nullable String sessionId);
}
