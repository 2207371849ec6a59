// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.mux;

import java.util.List;

import sh.pulse.core.envelope.ErrorPayload;
import sh.pulse.core.envelope.OutboundEnvelope;
import sh.pulse.core.stream.BatchObserver;

/**
 * Turns one subscription's batches and terminal signal into outbound envelopes.
 * Nothing is sent once the subscription is {@code DONE}.
 */
final class SubscriptionObserver<T> implements BatchObserver<T> {

    private final SubscriptionMultiplexer multiplexer;
    private final Subscription subscription;

    SubscriptionObserver(final SubscriptionMultiplexer multiplexer, final Subscription subscription) {
        this.multiplexer = multiplexer;
        this.subscription = subscription;
    }

    @Override
    public void onBatch(final List<? extends T> batch) {
        if (subscription.isDone()) {
            return;
        }
        multiplexer.send(OutboundEnvelope.events(subscription.id(), batch));
    }

    @Override
    public void onError(final Throwable error) {
        if (!subscription.finish()) {
            return;
        }
        multiplexer.streamFailed(subscription, error);
        multiplexer.send(OutboundEnvelope.error(subscription.id(), ErrorPayload.from(error)));
        multiplexer.release(subscription);
    }

    @Override
    public void onComplete() {
        if (!subscription.finish()) {
            return;
        }
        multiplexer.send(OutboundEnvelope.complete(subscription.id()));
        multiplexer.release(subscription);
    }
}
