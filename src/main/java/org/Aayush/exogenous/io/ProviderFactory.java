package org.Aayush.exogenous.io;

import lombok.experimental.UtilityClass;
import org.Aayush.exogenous.provider.DemographicRegionProvider;
import org.Aayush.exogenous.provider.EconomicRegionProvider;
import org.Aayush.exogenous.provider.ProviderConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds region providers from reference tables on disk.
 */
@UtilityClass
public class ProviderFactory {
    public static final String DEFAULT_DOWNSCALING_PRODUCT = "landscan";
    public static final int DEFAULT_DOWNSCALING_YEAR = 2022;

    /**
     * Reads GDP-per-capita tables and binds an economic provider.
     *
     * @param config provider configuration; {@code model} is required.
     * @param growthPath growth CSV ({@code model, scenario, iso, year, growth}).
     * @param baselinePath baseline CSV ({@code model, scenario, iso, year, value}).
     * @param nightlightsPath nightlight ratio CSV ({@code hierid, gdppc_ratio}).
     * @return bound provider.
     */
    public static EconomicRegionProvider readEconomicProvider(
            ProviderConfig config,
            Path growthPath,
            Path baselinePath,
            Path nightlightsPath
    ) {
        CsvTableReader reader = new CsvTableReader();
        return new EconomicRegionProvider(
                config,
                reader.readBaseline(Objects.requireNonNull(baselinePath, "baselinePath")),
                reader.readGrowth(Objects.requireNonNull(growthPath, "growthPath")),
                reader.readAdjustments(Objects.requireNonNull(nightlightsPath, "nightlightsPath"))
        );
    }

    /**
     * Reads population tables laid out under a projection root and binds a demographic provider.
     *
     * <p>Regional population is read from
     * {@code <root>/<product>/<downscalingYear>/scaled/ir_pop.csv} and scenario population from
     * {@code <root>/SSP/cleaned_SSP_data.csv}.</p>
     *
     * @param config provider configuration.
     * @param projectionRoot processed population directory.
     * @param downscalingProduct product used to downscale scenario projections.
     * @param downscalingYear year of the downscaling product.
     * @return bound provider.
     */
    public static DemographicRegionProvider readDemographicProvider(
            ProviderConfig config,
            Path projectionRoot,
            String downscalingProduct,
            int downscalingYear
    ) {
        Path root = Objects.requireNonNull(projectionRoot, "projectionRoot");
        Path regionPath = root
                .resolve(Objects.requireNonNull(downscalingProduct, "downscalingProduct"))
                .resolve(Integer.toString(downscalingYear))
                .resolve("scaled")
                .resolve("ir_pop.csv");
        Path scenarioPath = root.resolve("SSP").resolve("cleaned_SSP_data.csv");

        CsvTableReader reader = new CsvTableReader();
        return new DemographicRegionProvider(
                config,
                reader.readRegionPopulation(regionPath),
                reader.readScenarioPopulation(scenarioPath)
        );
    }

    /**
     * Same as {@link #readDemographicProvider(ProviderConfig, Path, String, int)} with the
     * default downscaling product and year.
     */
    public static DemographicRegionProvider readDemographicProvider(ProviderConfig config, Path projectionRoot) {
        return readDemographicProvider(config, projectionRoot, DEFAULT_DOWNSCALING_PRODUCT, DEFAULT_DOWNSCALING_YEAR);
    }
}
