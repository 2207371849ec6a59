// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core.envelope;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Client-chosen identifier of a subscription, unique within one connection at
 * any instant.
 *
 * <p>
 * The wire format allows any finite JSON number. Values are kept without
 * trailing zeros, so {@code 7} and {@code 7.0} name the same subscription
 * while {@code 1.5} and {@code 1e20} are ids of their own.
 *
 * @param value the numeric identifier, normalized
 */
public record SubscriptionId(BigDecimal value) {

    public SubscriptionId {
        Objects.requireNonNull(value, "value");
        value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    public static SubscriptionId of(final long value) {
        return new SubscriptionId(BigDecimal.valueOf(value));
    }

    public static SubscriptionId of(final BigDecimal value) {
        return new SubscriptionId(value);
    }

    /**
     * Returns whether the id is a whole number.
     *
     * @return {@code true} for ids such as {@code 7} or {@code 1e20}
     */
    public boolean isIntegral() {
        return value.scale() <= 0;
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
