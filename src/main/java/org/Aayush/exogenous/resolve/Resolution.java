package org.Aayush.exogenous.resolve;

import java.util.Objects;

/**
 * Value picked by {@link FallbackResolver} together with the tier that supplied it.
 *
 * @param tier answering tier.
 * @param value selected rows.
 * @param <V> row-collection type.
 */
public record Resolution<V>(SourceTier tier, V value) {
    public Resolution {
        Objects.requireNonNull(tier, "tier");
    }
}
