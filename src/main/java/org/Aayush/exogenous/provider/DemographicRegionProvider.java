package org.Aayush.exogenous.provider;

import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleMaps;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.key.EntityKey;
import org.Aayush.exogenous.resolve.FallbackResolver;
import org.Aayush.exogenous.resolve.Resolution;
import org.Aayush.exogenous.resolve.SourceTier;
import org.Aayush.exogenous.resolve.TieredTable;
import org.Aayush.exogenous.series.AnnualSeries;
import org.Aayush.exogenous.series.GrowthLookup;
import org.Aayush.exogenous.series.SeriesBuilder;
import org.Aayush.exogenous.table.RegionPopulationRow;
import org.Aayush.exogenous.table.ScenarioPopulationRow;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Population provider growing downscaled regional baselines with country scenario trajectories.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Baselines are read at region granularity; a region without rows gets a {@code NaN}
 * placeholder and its series is tagged missing.</li>
 * <li>Country growth is the ratio of each year's scenario population to the start-year
 * population, converted to annual per-period factors so compounding lands on the scenario
 * trajectory at every period boundary.</li>
 * <li>Countries absent from the scenario table do not grow.</li>
 * </ul>
 */
@Slf4j
public final class DemographicRegionProvider implements RegionProvider {

    /**
     * Growth factor used for countries without scenario rows.
     */
    public static final double NO_GROWTH = 1.0;

    private static final FallbackResolver<Int2DoubleMap> GROWTH_RESOLVER = new FallbackResolver<>(Int2DoubleMap::isEmpty);

    private final ProviderConfig config;
    private final Object2DoubleOpenHashMap<String> baselineByRegion;
    private final Map<String, Int2DoubleMap> cumulativeFactorByCountry;
    private final TieredTable<Int2DoubleMap> growthTiers;
    private final SeriesBuilder seriesBuilder = new SeriesBuilder();
    private final ConcurrentMap<String, AnnualSeries> seriesByRegion = new ConcurrentHashMap<>();

    /**
     * Indexes regional baselines and derives country growth for one scenario.
     *
     * @param config provider configuration; {@code model} is ignored.
     * @param regionRows downscaled regional population.
     * @param scenarioRows country population projections for every scenario.
     * @throws ProjectionException when the scenario has no projection rows.
     */
    public DemographicRegionProvider(
            ProviderConfig config,
            Collection<RegionPopulationRow> regionRows,
            Collection<ScenarioPopulationRow> scenarioRows
    ) {
        this.config = Objects.requireNonNull(config, "config").validate(false);
        this.baselineByRegion = indexBaselines(config.getStartYear(), Objects.requireNonNull(regionRows, "regionRows"));
        this.cumulativeFactorByCountry = cumulativeFactors(config, Objects.requireNonNull(scenarioRows, "scenarioRows"));

        Map<String, Int2DoubleMap> growthByCountry = new LinkedHashMap<>();
        cumulativeFactorByCountry.forEach((country, cumulative) ->
                growthByCountry.put(country, annualFactors(cumulative, config)));
        this.growthTiers = new TieredTable<>(growthByCountry, Map.of(), constantFactors(config));
        log.info("Demographic provider bound: scenario={}, years={}..{}, regions={}, countries={}",
                config.getScenario(), config.getStartYear(), config.getStopYear(),
                baselineByRegion.size(), cumulativeFactorByCountry.size());
    }

    /**
     * Returns the population series of a hierarchical region.
     *
     * @param region hierarchical region id.
     */
    @Override
    public AnnualSeries getTimeseries(String region) {
        Objects.requireNonNull(region, "region");
        return seriesByRegion.computeIfAbsent(region, this::computeRegionSeries);
    }

    /**
     * Population of a country in a scenario year relative to its start-year population.
     *
     * @param countryKey coarse key.
     * @param year scenario year.
     * @return cumulative factor, or empty when the country or year is not in the scenario table.
     */
    public OptionalDouble cumulativeFactor(String countryKey, int year) {
        Int2DoubleMap factors = cumulativeFactorByCountry.get(countryKey);
        if (factors == null || !factors.containsKey(year)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(factors.get(year));
    }

    /**
     * Reports which tier answers the growth lookup for a country.
     *
     * @param countryKey coarse key.
     */
    public SourceTier growthTier(String countryKey) {
        return GROWTH_RESOLVER.resolve(countryKey, growthTiers).tier();
    }

    @Override
    public int startYear() {
        return config.getStartYear();
    }

    @Override
    public int stopYear() {
        return config.getStopYear();
    }

    @Override
    public String scenario() {
        return config.getScenario();
    }

    private AnnualSeries computeRegionSeries(String region) {
        String country = EntityKey.coarse(region);
        double baseline = baselineByRegion.getDouble(region);
        if (!baselineByRegion.containsKey(region)) {
            log.warn("No population baseline for region {}; series will be tagged missing", region);
        }
        Resolution<Int2DoubleMap> growth = GROWTH_RESOLVER.resolve(country, growthTiers);
        log.debug("Region {} resolved growth from {}", region, growth.tier());
        return seriesBuilder.build(
                baseline,
                GrowthLookup.of(growth.value()),
                config.getStartYear(),
                config.getStopYear(),
                config.getPeriodLength()
        );
    }

    private static Object2DoubleOpenHashMap<String> indexBaselines(int startYear, Collection<RegionPopulationRow> rows) {
        Object2DoubleOpenHashMap<String> baselines = new Object2DoubleOpenHashMap<>(rows.size());
        baselines.defaultReturnValue(Double.NaN);
        Object2DoubleOpenHashMap<String> startYearHits = new Object2DoubleOpenHashMap<>();
        for (RegionPopulationRow row : rows) {
            if (!baselines.containsKey(row.fineKey())) {
                baselines.put(row.fineKey(), row.population());
            }
            if (row.year() == startYear && !startYearHits.containsKey(row.fineKey())) {
                startYearHits.put(row.fineKey(), row.population());
            }
        }
        baselines.putAll(startYearHits);
        baselines.trim();
        return baselines;
    }

    private static Map<String, Int2DoubleMap> cumulativeFactors(ProviderConfig config, Collection<ScenarioPopulationRow> rows) {
        Map<String, Int2DoubleOpenHashMap> populationByCountry = new LinkedHashMap<>();
        for (ScenarioPopulationRow row : rows) {
            if (!config.getScenario().equals(row.scenario())) {
                continue;
            }
            populationByCountry.computeIfAbsent(row.coarseKey(), key -> new Int2DoubleOpenHashMap())
                    .putIfAbsent(row.year(), row.population());
        }
        if (populationByCountry.isEmpty()) {
            throw new ProjectionException(
                    ProjectionException.REASON_SCENARIO_NOT_FOUND,
                    "no population projection rows for scenario " + config.getScenario()
            );
        }

        Map<String, Int2DoubleMap> factors = new LinkedHashMap<>();
        populationByCountry.forEach((country, byYear) -> {
            boolean hasBase = byYear.containsKey(config.getStartYear());
            double base = byYear.get(config.getStartYear());
            Int2DoubleOpenHashMap relative = new Int2DoubleOpenHashMap(byYear.size());
            for (Int2DoubleMap.Entry entry : byYear.int2DoubleEntrySet()) {
                relative.put(entry.getIntKey(), hasBase ? entry.getDoubleValue() / base : NO_GROWTH);
            }
            relative.putIfAbsent(config.getStartYear(), NO_GROWTH);
            factors.put(country, Int2DoubleMaps.unmodifiable(relative));
        });
        return Map.copyOf(factors);
    }

    private static Int2DoubleMap annualFactors(Int2DoubleMap cumulative, ProviderConfig config) {
        int periodLength = config.getPeriodLength();
        Int2DoubleOpenHashMap annual = new Int2DoubleOpenHashMap();
        for (int period = 0; period <= lastPeriod(config); period++) {
            int from = config.getStartYear() + period * periodLength;
            int to = from + periodLength;
            if (!cumulative.containsKey(from) || !cumulative.containsKey(to)) {
                continue;
            }
            double ratio = cumulative.get(to) / cumulative.get(from);
            annual.put(period, Math.pow(ratio, 1.0 / periodLength));
        }
        return Int2DoubleMaps.unmodifiable(annual);
    }

    private static Int2DoubleMap constantFactors(ProviderConfig config) {
        Int2DoubleOpenHashMap constant = new Int2DoubleOpenHashMap();
        for (int period = 0; period <= lastPeriod(config); period++) {
            constant.put(period, NO_GROWTH);
        }
        return Int2DoubleMaps.unmodifiable(constant);
    }

    private static int lastPeriod(ProviderConfig config) {
        int span = config.getStopYear() - config.getStartYear();
        if (span == 0) {
            return -1;
        }
        return Math.floorDiv(span - 1, config.getPeriodLength());
    }
}
