package org.Aayush.exogenous.cache;

import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.provider.RegionProvider;
import org.Aayush.exogenous.series.AnnualSeries;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Write-once per-region cache answering point-in-time queries from a {@link RegionProvider}.
 *
 * <p>Each region's series is fetched at most once, even under concurrent first access, and is
 * never evicted. Years before the start year clamp to the first value; years after the stop
 * year are rejected with {@link ProjectionException#REASON_YEAR_ABOVE_HORIZON}.</p>
 */
public final class SpaceTimeCache implements SpaceTimeProvider {
    private final RegionProvider provider;
    private final ConcurrentMap<String, AnnualSeries> seriesByRegion = new ConcurrentHashMap<>();

    /**
     * Creates an empty cache over one provider.
     *
     * @param provider wrapped region provider.
     */
    public SpaceTimeCache(RegionProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public double getValue(String region, int year) {
        AnnualSeries series = getTimeseries(region);
        return series.get(indexOf(series, year));
    }

    @Override
    public boolean isMissing(String region, int year) {
        AnnualSeries series = getTimeseries(region);
        return series.isMissing(indexOf(series, year));
    }

    /**
     * Returns the cached series, populating the cache on first access.
     */
    @Override
    public AnnualSeries getTimeseries(String region) {
        Objects.requireNonNull(region, "region");
        return seriesByRegion.computeIfAbsent(region, provider::getTimeseries);
    }

    @Override
    public int startYear() {
        return provider.startYear();
    }

    /**
     * @return wrapped provider.
     */
    public RegionProvider provider() {
        return provider;
    }

    /**
     * Returns current cache size in cached regions.
     */
    public int cachedRegions() {
        return seriesByRegion.size();
    }

    private int indexOf(AnnualSeries series, int year) {
        int startYear = provider.startYear();
        if (year < startYear) {
            return 0;
        }
        int index = year - startYear;
        if (index >= series.length()) {
            throw new ProjectionException(
                    ProjectionException.REASON_YEAR_ABOVE_HORIZON,
                    "year " + year + " is after the last projected year " + series.stopYear()
            );
        }
        return index;
    }
}
