// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves subscription names to stream factories.
 *
 * <pre>{@code
 * StreamCatalog catalog = StreamCatalog.builder()
 *         .register("prices", (offset, connection, sessionId) -> prices.since(offset))
 *         .register("motd", (offset, connection, sessionId) -> EventSources.of("welcome"))
 *         .build();
 * }</pre>
 */
@FunctionalInterface
public interface StreamCatalog {

    /**
     * Looks up the factory for a stream name.
     *
     * @param name the name requested by the client
     * @return the factory, or empty if the name is unknown
     */
    Optional<StreamFactory> lookup(String name);

    /**
     * Returns an immutable catalog holding a copy of the given map.
     *
     * @param factories factories by stream name
     * @return the catalog
     */
    static StreamCatalog of(final Map<String, StreamFactory> factories) {
        return new MapStreamCatalog(factories);
    }

    /**
     * Returns a catalog with no streams.
     *
     * @return an empty catalog
     */
    static StreamCatalog empty() {
        return of(Map.of());
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for immutable map-backed catalogs.
     */
    final class Builder {
        private final Map<String, StreamFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a stream.
         *
         * @param name    the stream name
         * @param factory the factory
         * @return this builder
         * @throws IllegalArgumentException if the name is already registered
         */
        public Builder register(final String name, final StreamFactory factory) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(factory, "factory");
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Stream already registered: " + name);
            }
            return this;
        }

        public StreamCatalog build() {
            return new MapStreamCatalog(factories);
        }
    }
}
