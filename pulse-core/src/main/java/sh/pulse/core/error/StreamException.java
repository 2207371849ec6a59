// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.error;

/**
 * Failure of a subscribed event stream that should be reported to the client
 * with a specific code and message.
 *
 * <p>
 * Event sources signal this through {@code onError} when the failure is
 * meaningful to the client (for example an offset that is no longer
 * retained). Any other {@link Throwable} reaching a subscription is reported
 * as {@link #INTERNAL_ERROR_CODE} with a generic message, so server internals
 * never leak onto the wire.
 *
 * <pre>{@code
 * observer.onError(new StreamException(410, "Offset expired"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class StreamException extends PulseException {

    /** Code reported when a stream name is not in the catalog. */
    public static final int NOT_FOUND_CODE = 404;

    /** Code reported for any failure that is not a {@code StreamException}. */
    public static final int INTERNAL_ERROR_CODE = 500;

    private final int code;

    public StreamException(final int code, final String message) {
        super(message);
        this.code = code;
    }

    public StreamException(final int code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the client-visible error code.
     *
     * @return the error code
     */
    public int code() {
        return code;
    }
}
