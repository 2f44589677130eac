package org.Aayush.exogenous.table;

import it.unimi.dsi.fastutil.doubles.DoubleArrays;
import it.unimi.dsi.fastutil.doubles.DoubleCollection;
import it.unimi.dsi.fastutil.doubles.DoubleIterator;
import lombok.experimental.UtilityClass;

/**
 * Median aggregation used to collapse values reported by several models for the same key.
 *
 * <p>{@code NaN} inputs are skipped. Even counts average the two middle values.
 * An input with no non-NaN value yields {@code NaN}.</p>
 */
@UtilityClass
public class Median {

    /**
     * @param values candidate values, in any order.
     * @return median of the non-NaN values, or {@code NaN} when none remain.
     */
    public static double of(DoubleCollection values) {
        double[] finite = new double[values.size()];
        int size = 0;
        DoubleIterator iterator = values.iterator();
        while (iterator.hasNext()) {
            double value = iterator.nextDouble();
            if (!Double.isNaN(value)) {
                finite[size++] = value;
            }
        }
        if (size == 0) {
            return Double.NaN;
        }
        DoubleArrays.quickSort(finite, 0, size);
        int mid = size / 2;
        if ((size & 1) == 1) {
            return finite[mid];
        }
        return (finite[mid - 1] + finite[mid]) / 2.0;
    }
}
