// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

/**
 * Read-only view of a client connection, handed to {@link StreamFactory}
 * implementations.
 */
public interface ConnectionHandle {

    /**
     * Returns the server-assigned identifier of the connection.
     *
     * @return the connection id
     */
    String connectionId();

    /**
     * Returns the client address used in logs and domain event metadata.
     *
     * @return the remote address
     */
    String remoteAddress();

    /**
     * Returns whether the connection still accepts outbound envelopes.
     *
     * @return {@code true} while the transport is open
     */
    boolean isOpen();
}
