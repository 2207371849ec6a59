// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.util.Objects;

import sh.pulse.core.error.StreamException;

/**
 * The {@code error} object carried by an error envelope.
 *
 * @param code    numeric error code (HTTP-like: 404, 500, ...)
 * @param message human-readable message
 */
public record ErrorPayload(int code, String message) {

    /** Reported when a stream name is not in the catalog. */
    public static final ErrorPayload NOT_FOUND =
            new ErrorPayload(StreamException.NOT_FOUND_CODE, "Not found");

    /** Reported for catalog contract violations and unexpected stream failures. */
    public static final ErrorPayload INTERNAL_ERROR =
            new ErrorPayload(StreamException.INTERNAL_ERROR_CODE, "Internal Server Error");

    public ErrorPayload {
        Objects.requireNonNull(message, "message");
    }

    /**
     * Maps a stream failure to its client-visible payload.
     *
     * <p>
     * A {@link StreamException} keeps its code and message. Anything else maps to
     * {@link #INTERNAL_ERROR}.
     *
     * @param error the failure signalled by a stream
     * @return the payload to send to the client
     */
    public static ErrorPayload from(final Throwable error) {
        if (error instanceof StreamException streamError) {
            String message = streamError.getMessage();
            return new ErrorPayload(streamError.code(), message != null ? message : "");
        }
        return INTERNAL_ERROR;
    }
}
