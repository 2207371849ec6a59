// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.util.List;
import java.util.Objects;

/**
 * A message sent to the client, always scoped to one subscription.
 */
public sealed interface OutboundEnvelope {

    /**
     * Returns the wire {@code type} tag.
     *
     * @return the type tag
     */
    String type();

    /**
     * Returns the subscription this envelope belongs to.
     *
     * @return the subscription id
     */
    SubscriptionId subscriptionId();

    static Events events(final SubscriptionId subscriptionId, final List<?> batch) {
        return new Events(subscriptionId, batch);
    }

    static Failure error(final SubscriptionId subscriptionId, final ErrorPayload error) {
        return new Failure(subscriptionId, error);
    }

    static Complete complete(final SubscriptionId subscriptionId) {
        return new Complete(subscriptionId);
    }

    /**
     * One batch of stream items.
     *
     * @param subscriptionId the owning subscription
     * @param batch          the items, in source order
     */
    record Events(SubscriptionId subscriptionId, List<?> batch) implements OutboundEnvelope {
        public Events {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
            Objects.requireNonNull(batch, "batch");
        }

        @Override
        public String type() {
            return "events";
        }
    }

    /**
     * Terminal failure of a subscription, or rejection of a subscribe request.
     *
     * @param subscriptionId the owning subscription
     * @param error          the error code and message
     */
    record Failure(SubscriptionId subscriptionId, ErrorPayload error) implements OutboundEnvelope {
        public Failure {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String type() {
            return "error";
        }
    }

    /**
     * Normal end of a subscription's stream.
     *
     * @param subscriptionId the owning subscription
     */
    record Complete(SubscriptionId subscriptionId) implements OutboundEnvelope {
        public Complete {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
        }

        @Override
        public String type() {
            return "complete";
        }
    }
}
