// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A control message received from the client.
 *
 * <p>
 * Only messages that passed shape validation in {@link EnvelopeCodec} are
 * promoted to this model. A well-formed message with an unrecognised
 * {@code type} becomes {@link Unknown} so that it is handled explicitly rather
 * than falling through a default branch.
 *
 * <p>
 * Dispatch goes through {@link #accept(Handler)}, which makes every new
 * variant a compile error in each handler until it is dealt with.
 */
public sealed interface InboundEnvelope {

    /**
     * Returns the wire {@code type} tag.
     *
     * @return the type tag
     */
    String type();

    /**
     * Dispatches this envelope to the matching handler method.
     *
     * @param handler the handler
     */
    void accept(Handler handler);

    /**
     * Exhaustive handler over all inbound variants.
     */
    interface Handler {
        void onHello(Hello hello);

        void onSubscribe(Subscribe subscribe);

        void onUnsubscribe(Unsubscribe unsubscribe);

        void onUnknown(Unknown unknown);
    }

    /**
     * Opens (or re-opens) the logical session of this connection.
     *
     * @param sessionId the client's session identifier
     */
    record Hello(String sessionId) implements InboundEnvelope {
        public Hello {
            Objects.requireNonNull(sessionId, "sessionId");
        }

        @Override
        public String type() {
            return "hello";
        }

        @Override
        public void accept(final Handler handler) {
            handler.onHello(this);
        }
    }

    /**
     * Requests a new subscription to a named stream.
     *
     * @param subscriptionId the client-chosen id
     * @param name           the stream name to resolve in the catalog
     * @param offset         the position to start streaming from
     */
    record Subscribe(SubscriptionId subscriptionId, String name, BigDecimal offset) implements InboundEnvelope {
        public Subscribe {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(offset, "offset");
        }

        @Override
        public String type() {
            return "subscribe";
        }

        @Override
        public void accept(final Handler handler) {
            handler.onSubscribe(this);
        }
    }

    /**
     * Cancels an existing subscription.
     *
     * @param subscriptionId the id given in the original subscribe
     */
    record Unsubscribe(SubscriptionId subscriptionId) implements InboundEnvelope {
        public Unsubscribe {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
        }

        @Override
        public String type() {
            return "unsubscribe";
        }

        @Override
        public void accept(final Handler handler) {
            handler.onUnsubscribe(this);
        }
    }

    /**
     * A well-formed message whose type tag is not part of the protocol.
     *
     * @param type the unrecognised type tag
     */
    record Unknown(String type) implements InboundEnvelope {
        public Unknown {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public void accept(final Handler handler) {
            handler.onUnknown(this);
        }
    }
}
