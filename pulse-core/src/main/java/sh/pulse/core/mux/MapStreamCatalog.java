// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link StreamCatalog} backed by a map copy.
 */
final class MapStreamCatalog implements StreamCatalog {

    private final Map<String, StreamFactory> factories;

    MapStreamCatalog(final Map<String, StreamFactory> factories) {
        this.factories = Map.copyOf(factories);
    }

    @Override
    public Optional<StreamFactory> lookup(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(name));
    }

    @Override
    public String toString() {
        return "StreamCatalog" + factories.keySet();
    }
}
