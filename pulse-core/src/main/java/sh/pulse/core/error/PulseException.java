// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.error;

/**
 * Base runtime exception for all Pulse failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * PulseException
 * ├── {@link CodecException} - envelope encoding failures
 * ├── {@link StreamException} - stream failures carrying a client-visible error
 * └── {@link CatalogException} - stream catalog contract violations
 * </pre>
 *
 * <p>
 * None of these is fatal to a connection: the multiplexer logs them and, where
 * the failure is scoped to a subscription, reports it to the client as an
 * {@code error} envelope.
 *
 * @since 0.1.0
 */
public sealed class PulseException extends RuntimeException
        permits CodecException,
        StreamException,
        CatalogException {

    public PulseException(final String message) {
        super(message);
    }

    public PulseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
