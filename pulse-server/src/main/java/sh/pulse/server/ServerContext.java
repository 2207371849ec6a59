// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.util.Objects;
import java.util.concurrent.Executor;

import sh.pulse.core.LogSink;
import sh.pulse.core.PulseMetrics;
import sh.pulse.core.envelope.EnvelopeCodec;
import sh.pulse.core.mux.DomainEventSink;
import sh.pulse.core.mux.StreamCatalog;

/**
 * Collaborators shared by every connection of one {@link PushServer}.
 */
record ServerContext(
        StreamCatalog catalog,
        DomainEventSink eventSink,
        LogSink logSink,
        PulseMetrics metrics,
        EnvelopeCodec codec,
        Executor deliveryExecutor,
        int maxBatchSize,
        boolean trustForwardedFor) {

    ServerContext {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(eventSink, "eventSink");
        Objects.requireNonNull(logSink, "logSink");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }
}
