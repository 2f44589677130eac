package org.Aayush.exogenous.testutil;

import org.Aayush.exogenous.table.AdjustmentRow;
import org.Aayush.exogenous.table.BaselineRow;
import org.Aayush.exogenous.table.GrowthRow;
import org.Aayush.exogenous.table.RegionPopulationRow;
import org.Aayush.exogenous.table.ScenarioPopulationRow;

import java.util.List;

/**
 * Shared reference tables for provider and cache tests.
 *
 * <p>Economic tables (scenario {@code SSP3}, active model {@code low}, years 2010..2020):</p>
 * <ul>
 * <li>{@code USA}: reported by {@code low}; baseline 100, growth 1.05 then 1.02.</li>
 * <li>{@code FRA}: reported by {@code high} and {@code mid} only; median baseline 100, growth 1.02.</li>
 * <li>{@code DEU}: baseline only, reported by three other models as 90, 100 and 110.</li>
 * <li>{@code CHN}, {@code IND}: reported by {@code low}; they shape the global growth median
 * of 1.07 then 1.04.</li>
 * <li>Global baseline median over every SSP3/2010 row is 95.</li>
 * </ul>
 */
public final class ProjectionFixtureFactory {
    public static final String SCENARIO = "SSP3";
    public static final String MODEL = "low";
    public static final int START_YEAR = 2010;
    public static final int STOP_YEAR = 2020;

    public static final String POP_SCENARIO = "SSP2";
    public static final int POP_START_YEAR = 2020;
    public static final int POP_STOP_YEAR = 2030;

    private ProjectionFixtureFactory() {
    }

    public static List<BaselineRow> baselineRows() {
        return List.of(
                new BaselineRow(MODEL, SCENARIO, "USA", 2010, 100.0),
                new BaselineRow(MODEL, SCENARIO, "USA", 2015, 999.0),
                new BaselineRow(MODEL, "SSP2", "USA", 2010, 555.0),
                new BaselineRow("high", SCENARIO, "FRA", 2010, 90.0),
                new BaselineRow("mid", SCENARIO, "FRA", 2010, 110.0),
                new BaselineRow("high", SCENARIO, "DEU", 2010, 90.0),
                new BaselineRow("mid", SCENARIO, "DEU", 2010, 100.0),
                new BaselineRow("ref", SCENARIO, "DEU", 2010, 110.0),
                new BaselineRow(MODEL, SCENARIO, "CHN", 2010, 50.0),
                new BaselineRow(MODEL, SCENARIO, "IND", 2010, 20.0)
        );
    }

    public static List<GrowthRow> growthRows() {
        return List.of(
                new GrowthRow(MODEL, SCENARIO, "USA", 2010, 1.05),
                new GrowthRow(MODEL, SCENARIO, "USA", 2015, 1.02),
                new GrowthRow(MODEL, "SSP2", "USA", 2010, 3.0),
                new GrowthRow("high", SCENARIO, "FRA", 2010, 1.01),
                new GrowthRow("high", SCENARIO, "FRA", 2015, 1.01),
                new GrowthRow("mid", SCENARIO, "FRA", 2010, 1.03),
                new GrowthRow("mid", SCENARIO, "FRA", 2015, 1.03),
                new GrowthRow(MODEL, SCENARIO, "CHN", 2010, 1.07),
                new GrowthRow(MODEL, SCENARIO, "CHN", 2015, 1.04),
                new GrowthRow(MODEL, SCENARIO, "IND", 2010, 1.09),
                new GrowthRow(MODEL, SCENARIO, "IND", 2015, 1.06)
        );
    }

    public static List<AdjustmentRow> adjustmentRows() {
        return List.of(
                new AdjustmentRow("USA.1.1", 0.5),
                new AdjustmentRow("USA.2.1", 0.0),
                new AdjustmentRow("USA.3.1", Double.NaN),
                new AdjustmentRow("USA.4.1", 1.25)
        );
    }

    /**
     * Regional population: {@code KEN.1.1} at the start year, {@code KEN.2.1} only in 2022,
     * {@code UGA.1}, {@code TZA.1} and {@code ETH.1} with single rows.
     */
    public static List<RegionPopulationRow> regionPopulationRows() {
        return List.of(
                new RegionPopulationRow("KEN.1.1", 2020, 1000.0),
                new RegionPopulationRow("KEN.2.1", 2022, 500.0),
                new RegionPopulationRow("UGA.1", 2020, 300.0),
                new RegionPopulationRow("TZA.1", 2020, 200.0),
                new RegionPopulationRow("ETH.1", 2020, 10.0)
        );
    }

    /**
     * Scenario population: {@code KEN} grows 10% per period, {@code UGA} lacks a start-year
     * value, {@code ETH} stops after 2025, {@code TZA} is absent.
     */
    public static List<ScenarioPopulationRow> scenarioPopulationRows() {
        return List.of(
                new ScenarioPopulationRow("KEN", 2020, POP_SCENARIO, 100.0),
                new ScenarioPopulationRow("KEN", 2025, POP_SCENARIO, 110.0),
                new ScenarioPopulationRow("KEN", 2030, POP_SCENARIO, 121.0),
                new ScenarioPopulationRow("KEN", 2025, "SSP5", 400.0),
                new ScenarioPopulationRow("UGA", 2025, POP_SCENARIO, 50.0),
                new ScenarioPopulationRow("UGA", 2030, POP_SCENARIO, 60.0),
                new ScenarioPopulationRow("ETH", 2020, POP_SCENARIO, 100.0),
                new ScenarioPopulationRow("ETH", 2025, POP_SCENARIO, 120.0)
        );
    }
}
