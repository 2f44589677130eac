package org.Aayush.exogenous.resolve;

import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Picks the most specific non-empty rows for a key across three tiers.
 *
 * <p>Resolution order:</p>
 * <ol>
 * <li>{@link SourceTier#SPECIFIC} rows for the key, when present and non-empty.</li>
 * <li>{@link SourceTier#AGGREGATED} rows, when the key is indexed and the selection is non-empty.</li>
 * <li>{@link SourceTier#GLOBAL} rows, unconditionally.</li>
 * </ol>
 *
 * <p>An aggregated index hit whose selection is empty falls through to the global tier.
 * Stateless apart from the emptiness predicate; safe for concurrent use.</p>
 *
 * @param <V> row-collection type.
 */
public final class FallbackResolver<V> {
    private final Predicate<? super V> emptiness;

    /**
     * @param emptiness returns true when a selection holds no usable rows.
     */
    public FallbackResolver(Predicate<? super V> emptiness) {
        this.emptiness = Objects.requireNonNull(emptiness, "emptiness");
    }

    /**
     * Resolves a key against a pre-partitioned table.
     *
     * @param key lookup key.
     * @param table tiered partition.
     * @return selected rows and answering tier.
     */
    public Resolution<V> resolve(String key, TieredTable<V> table) {
        Objects.requireNonNull(table, "table");
        return resolve(key, table.specific(), table.aggregated(), table.global());
    }

    /**
     * Resolves a key against three tables ordered by specificity.
     *
     * @param key lookup key.
     * @param specific most specific table.
     * @param aggregated cross-model table.
     * @param global last-resort rows, returned unfiltered.
     * @return selected rows and answering tier.
     */
    public Resolution<V> resolve(String key, Map<String, V> specific, Map<String, V> aggregated, V global) {
        Objects.requireNonNull(key, "key");
        V specificRows = specific.get(key);
        if (specificRows != null && !emptiness.test(specificRows)) {
            return new Resolution<>(SourceTier.SPECIFIC, specificRows);
        }
        if (aggregated.containsKey(key)) {
            V aggregatedRows = aggregated.get(key);
            if (aggregatedRows != null && !emptiness.test(aggregatedRows)) {
                return new Resolution<>(SourceTier.AGGREGATED, aggregatedRows);
            }
        }
        return new Resolution<>(SourceTier.GLOBAL, global);
    }
}
