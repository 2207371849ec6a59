// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

/**
 * The outbound half of a client connection, as seen by the multiplexer.
 *
 * <p>
 * The multiplexer checks {@link #state()} before every write and drops the
 * envelope if the transport is not {@link TransportState#OPEN}. Writes are
 * never retried.
 *
 * <p>
 * <strong>Thread Safety:</strong> {@link #send(String)} is called from
 * delivery threads, concurrently for different subscriptions.
 * Implementations must preserve the order of calls made from a single thread.
 */
public interface Transport {

    /**
     * Returns the current liveness of the connection.
     *
     * @return the transport state
     */
    TransportState state();

    /**
     * Writes one text frame.
     *
     * @param text the encoded envelope
     */
    void send(String text);
}
