// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

/**
 * Liveness of a {@link Transport}. Only {@link #OPEN} accepts writes.
 */
public enum TransportState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
