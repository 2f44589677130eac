package org.Aayush.exogenous.provider;

import org.Aayush.exogenous.series.AnnualSeries;

/**
 * Source of dense annual series keyed by hierarchical region id.
 *
 * <p>Implementations memoize per key: repeated calls return the same series instance.</p>
 */
public interface RegionProvider {

    /**
     * @param region hierarchical region id or coarse key.
     * @return annual series from {@link #startYear()} to {@link #stopYear()}.
     */
    AnnualSeries getTimeseries(String region);

    int startYear();

    int stopYear();

    /**
     * @return active scenario id.
     */
    String scenario();
}
