// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.error;

/**
 * Thrown when a stream factory breaks the catalog contract: it returned no
 * source, or failed while opening one.
 *
 * <p>
 * This is a server-side defect, not a client error. The client only ever sees
 * a generic {@code 500 Internal Server Error} for the affected subscription.
 *
 * @since 0.1.0
 */
public final class CatalogException extends PulseException {

    private final String streamName;

    public CatalogException(final String streamName, final String message) {
        super(message);
        this.streamName = streamName;
    }

    public CatalogException(final String streamName, final String message, final Throwable cause) {
        super(message, cause);
        this.streamName = streamName;
    }

    /**
     * Returns the name of the stream whose factory misbehaved.
     *
     * @return the stream name
     */
    public String streamName() {
        return streamName;
    }
}
