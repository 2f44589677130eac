package org.Aayush.exogenous.series;

import it.unimi.dsi.fastutil.ints.Int2DoubleMap;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Per-period growth factor source consumed by {@link SeriesBuilder}.
 */
@FunctionalInterface
public interface GrowthLookup {

    /**
     * @param periodIndex zero-based period index relative to the start year.
     * @return annual growth factor for the period, or empty when no row covers it.
     */
    OptionalDouble factor(int periodIndex);

    /**
     * Adapts a period-indexed primitive map.
     *
     * @param factorsByPeriod growth factor by period index.
     * @return lookup backed by the map.
     */
    static GrowthLookup of(Int2DoubleMap factorsByPeriod) {
        Objects.requireNonNull(factorsByPeriod, "factorsByPeriod");
        return periodIndex -> factorsByPeriod.containsKey(periodIndex)
                ? OptionalDouble.of(factorsByPeriod.get(periodIndex))
                : OptionalDouble.empty();
    }

    /**
     * @param factor growth factor applied to every period.
     * @return constant lookup.
     */
    static GrowthLookup constant(double factor) {
        OptionalDouble value = OptionalDouble.of(factor);
        return periodIndex -> value;
    }
}
