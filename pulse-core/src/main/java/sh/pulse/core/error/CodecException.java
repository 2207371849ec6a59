// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.error;

/**
 * Thrown when an outbound envelope cannot be serialized, typically because a
 * batch item is not representable as JSON.
 *
 * @since 0.1.0
 */
public final class CodecException extends PulseException {

    public CodecException(final String message) {
        super(message);
    }

    public CodecException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
