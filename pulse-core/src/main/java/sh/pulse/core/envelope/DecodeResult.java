// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.util.Objects;

/**
 * Outcome of {@link EnvelopeCodec#decode(String)}: either a validated envelope
 * or a human-readable reason why the input was rejected.
 */
public sealed interface DecodeResult {

    static Decoded decoded(final InboundEnvelope envelope) {
        return new Decoded(envelope);
    }

    static DecodeFailure failure(final String reason) {
        return new DecodeFailure(reason);
    }

    /**
     * @param envelope the validated envelope
     */
    record Decoded(InboundEnvelope envelope) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(envelope, "envelope");
        }
    }

    /**
     * @param reason why the payload was rejected, suitable for logging
     */
    record DecodeFailure(String reason) implements DecodeResult {
        public DecodeFailure {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
