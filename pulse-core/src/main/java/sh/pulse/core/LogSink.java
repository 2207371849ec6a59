// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Destination for connection-scoped diagnostic lines.
 *
 * <p>
 * The multiplexer writes lines already prefixed with the connection's remote
 * address, for example {@code [203.0.113.7] subscribing to prices}. The
 * default sink forwards them to SLF4J; embedders can route them anywhere else.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe. Lines
 * from the same connection may be written from the connection's actor and from
 * delivery threads.
 */
@FunctionalInterface
public interface LogSink {

    /** Name of the SLF4J logger used by {@link #slf4j()}. */
    String CONNECTION_LOGGER = "sh.pulse.connection";

    /**
     * Writes one diagnostic line.
     *
     * @param line the formatted line, without a trailing newline
     */
    void write(String line);

    /**
     * Returns a sink that logs at INFO on the {@value #CONNECTION_LOGGER} logger.
     *
     * @return the default sink
     */
    static LogSink slf4j() {
        return slf4j(LoggerFactory.getLogger(CONNECTION_LOGGER));
    }

    /**
     * Returns a sink that logs at INFO on the given logger.
     *
     * @param logger the target logger
     * @return a sink backed by the logger
     */
    static LogSink slf4j(final Logger logger) {
        Objects.requireNonNull(logger, "logger");
        return line -> logger.info("{}", line);
    }
}
