package org.Aayush.exogenous.resolve;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable three-tier partition of one reference table, keyed by coarse key.
 *
 * @param specific rows of the active model by key.
 * @param aggregated cross-model aggregates by key.
 * @param global last-resort rows.
 * @param <V> row-collection type.
 */
public record TieredTable<V>(Map<String, V> specific, Map<String, V> aggregated, V global) {
    public TieredTable {
        specific = Map.copyOf(Objects.requireNonNull(specific, "specific"));
        aggregated = Map.copyOf(Objects.requireNonNull(aggregated, "aggregated"));
        Objects.requireNonNull(global, "global");
    }

    /**
     * Partition whose only source is the global tier.
     *
     * @param global last-resort rows.
     * @param <V> row-collection type.
     * @return tiered table with empty key-indexed tiers.
     */
    public static <V> TieredTable<V> globalOnly(V global) {
        return new TieredTable<>(Map.of(), Map.of(), global);
    }
}
