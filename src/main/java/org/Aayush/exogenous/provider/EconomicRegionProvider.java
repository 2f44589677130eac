package org.Aayush.exogenous.provider;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleMaps;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.key.EntityKey;
import org.Aayush.exogenous.resolve.FallbackResolver;
import org.Aayush.exogenous.resolve.Resolution;
import org.Aayush.exogenous.resolve.TieredTable;
import org.Aayush.exogenous.series.AnnualSeries;
import org.Aayush.exogenous.series.GrowthLookup;
import org.Aayush.exogenous.series.SeriesBuilder;
import org.Aayush.exogenous.table.AdjustmentRow;
import org.Aayush.exogenous.table.BaselineRow;
import org.Aayush.exogenous.table.GrowthRow;
import org.Aayush.exogenous.table.Median;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * GDP-per-capita provider selecting the best available source per country.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Baseline and growth come from the active model, else the cross-model median for the
 * country, else the global median.</li>
 * <li>Country series are scaled to hierarchical regions by a nightlight ratio: no row keeps the
 * country series, a {@code NaN} or zero ratio applies {@link #DEGENERATE_ADJUSTMENT}.</li>
 * <li>Partitions are built once at construction; country and region series are memoized and
 * computed at most once per key.</li>
 * </ul>
 */
@Slf4j
public final class EconomicRegionProvider implements RegionProvider {

    /**
     * Share of the country value assigned to a region whose nightlight ratio is absent or zero.
     */
    public static final double DEGENERATE_ADJUSTMENT = 0.8;

    private static final FallbackResolver<DoubleList> BASELINE_RESOLVER = new FallbackResolver<>(DoubleList::isEmpty);
    private static final FallbackResolver<Int2DoubleMap> GROWTH_RESOLVER = new FallbackResolver<>(Int2DoubleMap::isEmpty);

    private final ProviderConfig config;
    private final TieredTable<DoubleList> baselineTiers;
    private final TieredTable<Int2DoubleMap> growthTiers;
    private final Object2DoubleOpenHashMap<String> ratioByRegion;
    private final SeriesBuilder seriesBuilder = new SeriesBuilder();
    private final ConcurrentMap<String, AnnualSeries> seriesByCountry = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AnnualSeries> seriesByRegion = new ConcurrentHashMap<>();

    /**
     * Partitions the reference tables for one model and scenario.
     *
     * @param config provider configuration; {@code model} is required.
     * @param baselineRows country baselines for every model, scenario and year.
     * @param growthRows country growth factors for every model, scenario and period.
     * @param adjustmentRows nightlight ratios by hierarchical region.
     * @throws ProjectionException when the scenario or model has no rows to draw from.
     */
    public EconomicRegionProvider(
            ProviderConfig config,
            Collection<BaselineRow> baselineRows,
            Collection<GrowthRow> growthRows,
            Collection<AdjustmentRow> adjustmentRows
    ) {
        this.config = Objects.requireNonNull(config, "config").validate(true);
        this.baselineTiers = partitionBaseline(config, Objects.requireNonNull(baselineRows, "baselineRows"));
        this.growthTiers = partitionGrowth(config, Objects.requireNonNull(growthRows, "growthRows"));
        this.ratioByRegion = indexRatios(Objects.requireNonNull(adjustmentRows, "adjustmentRows"));
        log.info("Economic provider bound: model={}, scenario={}, years={}..{}, baselineCountries={}, growthCountries={}, regionRatios={}",
                config.getModel(), config.getScenario(), config.getStartYear(), config.getStopYear(),
                baselineTiers.specific().size(), growthTiers.specific().size(), ratioByRegion.size());
    }

    /**
     * Returns the GDP-per-capita series of a hierarchical region.
     *
     * @param region hierarchical region id (for example {@code ZWE.2.2}) or country code.
     */
    @Override
    public AnnualSeries getTimeseries(String region) {
        Objects.requireNonNull(region, "region");
        return seriesByRegion.computeIfAbsent(region, this::computeRegionSeries);
    }

    /**
     * Returns the unadjusted country series.
     *
     * @param countryKey coarse key.
     */
    public AnnualSeries getCountryTimeseries(String countryKey) {
        Objects.requireNonNull(countryKey, "countryKey");
        return seriesByCountry.computeIfAbsent(countryKey, this::computeCountrySeries);
    }

    /**
     * Reports which tiers answer the baseline and growth lookups for a country.
     *
     * @param countryKey coarse key.
     */
    public SourceSelection sourceSelection(String countryKey) {
        return new SourceSelection(
                BASELINE_RESOLVER.resolve(countryKey, baselineTiers).tier(),
                GROWTH_RESOLVER.resolve(countryKey, growthTiers).tier()
        );
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

    /**
     * @return active model qualifier.
     */
    public String model() {
        return config.getModel();
    }

    private AnnualSeries computeRegionSeries(String region) {
        AnnualSeries countrySeries = getCountryTimeseries(EntityKey.coarse(region));
        if (!ratioByRegion.containsKey(region)) {
            return countrySeries;
        }
        double ratio = ratioByRegion.getDouble(region);
        if (Double.isNaN(ratio) || ratio == 0.0) {
            log.debug("Region {} has no usable nightlight ratio; applying {}", region, DEGENERATE_ADJUSTMENT);
            return countrySeries.scale(DEGENERATE_ADJUSTMENT);
        }
        return countrySeries.scale(ratio);
    }

    private AnnualSeries computeCountrySeries(String countryKey) {
        Resolution<DoubleList> baseline = BASELINE_RESOLVER.resolve(countryKey, baselineTiers);
        Resolution<Int2DoubleMap> growth = GROWTH_RESOLVER.resolve(countryKey, growthTiers);
        log.debug("Country {} resolved baseline from {} and growth from {}", countryKey, baseline.tier(), growth.tier());
        return seriesBuilder.build(
                baseline.value().getDouble(0),
                GrowthLookup.of(growth.value()),
                config.getStartYear(),
                config.getStopYear(),
                config.getPeriodLength()
        );
    }

    private static TieredTable<DoubleList> partitionBaseline(ProviderConfig config, Collection<BaselineRow> rows) {
        Map<String, DoubleArrayList> specific = new LinkedHashMap<>();
        Map<String, DoubleArrayList> anyModel = new LinkedHashMap<>();
        DoubleArrayList all = new DoubleArrayList();
        for (BaselineRow row : rows) {
            if (!config.getScenario().equals(row.scenario()) || row.year() != config.getStartYear()) {
                continue;
            }
            all.add(row.value());
            anyModel.computeIfAbsent(row.coarseKey(), key -> new DoubleArrayList()).add(row.value());
            if (config.getModel().equals(row.model())) {
                specific.computeIfAbsent(row.coarseKey(), key -> new DoubleArrayList()).add(row.value());
            }
        }
        if (all.isEmpty()) {
            throw new ProjectionException(
                    ProjectionException.REASON_SCENARIO_NOT_FOUND,
                    "no baseline rows for scenario " + config.getScenario() + " in year " + config.getStartYear()
            );
        }

        Map<String, DoubleList> specificTier = new LinkedHashMap<>();
        specific.forEach((key, values) -> specificTier.put(key, DoubleLists.unmodifiable(values)));
        Map<String, DoubleList> aggregatedTier = new LinkedHashMap<>();
        anyModel.forEach((key, values) -> aggregatedTier.put(key, DoubleLists.singleton(Median.of(values))));
        return new TieredTable<>(specificTier, aggregatedTier, DoubleLists.singleton(Median.of(all)));
    }

    private static TieredTable<Int2DoubleMap> partitionGrowth(ProviderConfig config, Collection<GrowthRow> rows) {
        int startYear = config.getStartYear();
        int periodLength = config.getPeriodLength();

        Map<String, Int2DoubleOpenHashMap> specific = new LinkedHashMap<>();
        Map<String, Map<Integer, DoubleArrayList>> anyModelByYear = new LinkedHashMap<>();
        Map<Integer, DoubleArrayList> activeModelByYear = new LinkedHashMap<>();
        boolean scenarioSeen = false;
        for (GrowthRow row : rows) {
            if (!config.getScenario().equals(row.scenario())) {
                continue;
            }
            scenarioSeen = true;
            anyModelByYear
                    .computeIfAbsent(row.coarseKey(), key -> new LinkedHashMap<>())
                    .computeIfAbsent(row.year(), year -> new DoubleArrayList())
                    .add(row.growth());
            if (config.getModel().equals(row.model())) {
                specific.computeIfAbsent(row.coarseKey(), key -> new Int2DoubleOpenHashMap())
                        .putIfAbsent(row.periodIndex(startYear, periodLength), row.growth());
                activeModelByYear.computeIfAbsent(row.year(), year -> new DoubleArrayList()).add(row.growth());
            }
        }
        if (!scenarioSeen) {
            throw new ProjectionException(
                    ProjectionException.REASON_SCENARIO_NOT_FOUND,
                    "no growth rows for scenario " + config.getScenario()
            );
        }
        if (activeModelByYear.isEmpty()) {
            throw new ProjectionException(
                    ProjectionException.REASON_MODEL_NOT_FOUND,
                    "no growth rows for model " + config.getModel() + " in scenario " + config.getScenario()
            );
        }

        Map<String, Int2DoubleMap> specificTier = new LinkedHashMap<>();
        specific.forEach((key, factors) -> specificTier.put(key, Int2DoubleMaps.unmodifiable(factors)));
        Map<String, Int2DoubleMap> aggregatedTier = new LinkedHashMap<>();
        anyModelByYear.forEach((key, byYear) ->
                aggregatedTier.put(key, medianByPeriod(byYear, startYear, periodLength)));
        return new TieredTable<>(specificTier, aggregatedTier, medianByPeriod(activeModelByYear, startYear, periodLength));
    }

    private static Int2DoubleMap medianByPeriod(Map<Integer, DoubleArrayList> valuesByYear, int startYear, int periodLength) {
        Int2DoubleOpenHashMap factors = new Int2DoubleOpenHashMap(valuesByYear.size());
        for (Map.Entry<Integer, DoubleArrayList> entry : valuesByYear.entrySet()) {
            factors.putIfAbsent((entry.getKey() - startYear) / periodLength, Median.of(entry.getValue()));
        }
        return Int2DoubleMaps.unmodifiable(factors);
    }

    private static Object2DoubleOpenHashMap<String> indexRatios(Collection<AdjustmentRow> rows) {
        Object2DoubleOpenHashMap<String> ratios = new Object2DoubleOpenHashMap<>(rows.size());
        for (AdjustmentRow row : rows) {
            if (!ratios.containsKey(row.fineKey())) {
                ratios.put(row.fineKey(), row.ratio());
            }
        }
        ratios.trim();
        return ratios;
    }
}
