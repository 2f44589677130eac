package org.Aayush.exogenous.series;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Compounds a baseline value into a dense annual series.
 *
 * <p>Recurrence: {@code value[start] = baseline} and, for every later year {@code y},
 * {@code value[y] = value[y - 1] * g(floor((y - 1 - start) / periodLength))}. The factor of the
 * period holding the previous year is applied, so years {@code start + 1 .. start + periodLength}
 * all compound with period 0.</p>
 *
 * <p>A {@code NaN} baseline, or a period whose growth factor is absent or {@code NaN}, tags the
 * series missing from that year onward instead of failing the query.</p>
 */
@Slf4j
public final class SeriesBuilder {

    /**
     * Builds one annual series.
     *
     * @param baseline value at {@code startYear}.
     * @param growthLookup per-period annual growth factor.
     * @param startYear first year.
     * @param stopYear last year, inclusive.
     * @param periodLength years covered by one growth factor.
     * @return series of length {@code stopYear - startYear + 1}.
     */
    public AnnualSeries build(
            double baseline,
            GrowthLookup growthLookup,
            int startYear,
            int stopYear,
            int periodLength
    ) {
        Objects.requireNonNull(growthLookup, "growthLookup");
        if (stopYear < startYear) {
            throw new IllegalArgumentException("stopYear " + stopYear + " precedes startYear " + startYear);
        }
        if (periodLength < 1) {
            throw new IllegalArgumentException("periodLength must be >= 1, got " + periodLength);
        }

        int length = stopYear - startYear + 1;
        double[] values = new double[length];
        int missingFrom = AnnualSeries.NONE_MISSING;

        values[0] = baseline;
        if (Double.isNaN(baseline)) {
            missingFrom = 0;
        }
        for (int i = 1; i < length; i++) {
            if (missingFrom != AnnualSeries.NONE_MISSING) {
                values[i] = Double.NaN;
                continue;
            }
            int periodIndex = Math.floorDiv(i - 1, periodLength);
            OptionalDouble factor = growthLookup.factor(periodIndex);
            if (factor.isEmpty() || Double.isNaN(factor.getAsDouble())) {
                missingFrom = i;
                values[i] = Double.NaN;
                log.warn("No usable growth factor for period {} (year {}); series missing from {}",
                        periodIndex, startYear + i, startYear + i);
                continue;
            }
            values[i] = values[i - 1] * factor.getAsDouble();
        }
        return new AnnualSeries(startYear, values, missingFrom);
    }
}
