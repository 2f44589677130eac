package org.Aayush.exogenous.cache;

import org.Aayush.exogenous.series.AnnualSeries;

/**
 * Point-in-time view over per-region annual series.
 */
public interface SpaceTimeProvider {

    /**
     * @param region hierarchical region id.
     * @param year calendar year.
     * @return value for the region in that year.
     */
    double getValue(String region, int year);

    /**
     * @param region hierarchical region id.
     * @param year calendar year.
     * @return true when the value for that year is tagged missing.
     */
    boolean isMissing(String region, int year);

    /**
     * @param region hierarchical region id.
     * @return full annual series of the region.
     */
    AnnualSeries getTimeseries(String region);

    int startYear();
}
