package org.Aayush.exogenous.table;

import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.key.EntityKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Rescales downscaled regional population so each country sums to an external country total.
 *
 * <p>Rows are expected to share one observation year. A country without a total keeps its regional
 * values (scale factor 1), which is only accepted for countries whose regions sum to at most
 * {@link #MISSING_TOTAL_LIMIT} people unless the check is skipped.</p>
 */
@Slf4j
public final class CountryTotalRescaler {

    /**
     * Largest regional population a country may have while lacking a country total.
     */
    public static final double MISSING_TOTAL_LIMIT = 1e6;

    private final Object2DoubleOpenHashMap<String> totalByCountry;
    private final boolean skipMissingTotalCheck;

    /**
     * @param countryTotals population total per coarse key.
     * @param skipMissingTotalCheck accept large countries without a total.
     */
    public CountryTotalRescaler(Object2DoubleMap<String> countryTotals, boolean skipMissingTotalCheck) {
        this.totalByCountry = new Object2DoubleOpenHashMap<>(Objects.requireNonNull(countryTotals, "countryTotals"));
        this.skipMissingTotalCheck = skipMissingTotalCheck;
    }

    /**
     * Creates a rescaler that rejects large countries without a total.
     *
     * @param countryTotals population total per coarse key.
     */
    public CountryTotalRescaler(Object2DoubleMap<String> countryTotals) {
        this(countryTotals, false);
    }

    /**
     * Returns rescaled copies of the rows, in input order.
     *
     * @param rows regional population of one year.
     * @return rows whose per-country sums match the country totals.
     * @throws ProjectionException when a country above {@link #MISSING_TOTAL_LIMIT} has no total.
     */
    public List<RegionPopulationRow> rescale(Collection<RegionPopulationRow> rows) {
        Objects.requireNonNull(rows, "rows");
        Object2DoubleOpenHashMap<String> regionalSum = new Object2DoubleOpenHashMap<>();
        for (RegionPopulationRow row : rows) {
            regionalSum.addTo(EntityKey.coarse(row.fineKey()), row.population());
        }

        Object2DoubleOpenHashMap<String> factorByCountry = new Object2DoubleOpenHashMap<>(regionalSum.size());
        for (Object2DoubleMap.Entry<String> entry : regionalSum.object2DoubleEntrySet()) {
            factorByCountry.put(entry.getKey(), scaleFactor(entry.getKey(), entry.getDoubleValue()));
        }

        List<RegionPopulationRow> rescaled = new ArrayList<>(rows.size());
        for (RegionPopulationRow row : rows) {
            double factor = factorByCountry.getDouble(EntityKey.coarse(row.fineKey()));
            rescaled.add(new RegionPopulationRow(row.fineKey(), row.year(), row.population() * factor));
        }
        return rescaled;
    }

    private double scaleFactor(String country, double regionalSum) {
        if (!totalByCountry.containsKey(country) || Double.isNaN(totalByCountry.getDouble(country))) {
            if (!skipMissingTotalCheck && regionalSum > MISSING_TOTAL_LIMIT) {
                throw new ProjectionException(
                        ProjectionException.REASON_COUNTRY_TOTAL_MISSING,
                        "no country total for " + country + " with regional population " + regionalSum
                );
            }
            log.warn("No country total for {}; keeping regional population unscaled", country);
            return 1.0;
        }
        if (regionalSum == 0.0) {
            log.warn("Regions of {} sum to zero; keeping regional population unscaled", country);
            return 1.0;
        }
        return totalByCountry.getDouble(country) / regionalSum;
    }
}
