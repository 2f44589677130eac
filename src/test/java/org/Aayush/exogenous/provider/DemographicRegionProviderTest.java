package org.Aayush.exogenous.provider;

import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.resolve.SourceTier;
import org.Aayush.exogenous.series.AnnualSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.Aayush.exogenous.testutil.ProjectionFixtureFactory.POP_SCENARIO;
import static org.Aayush.exogenous.testutil.ProjectionFixtureFactory.POP_START_YEAR;
import static org.Aayush.exogenous.testutil.ProjectionFixtureFactory.POP_STOP_YEAR;
import static org.Aayush.exogenous.testutil.ProjectionFixtureFactory.regionPopulationRows;
import static org.Aayush.exogenous.testutil.ProjectionFixtureFactory.scenarioPopulationRows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DemographicRegionProvider Tests")
class DemographicRegionProviderTest {
    private static final double EPS = 1e-6;

    private DemographicRegionProvider provider;

    @BeforeEach
    void setUp() {
        ProviderConfig config = ProviderConfig.builder()
                .scenario(POP_SCENARIO)
                .startYear(POP_START_YEAR)
                .stopYear(POP_STOP_YEAR)
                .build();
        provider = new DemographicRegionProvider(config, regionPopulationRows(), scenarioPopulationRows());
    }

    @Test
    @DisplayName("Cumulative factors are relative to the start-year population")
    void testCumulativeFactors() {
        assertEquals(1.0, provider.cumulativeFactor("KEN", 2020).getAsDouble(), EPS);
        assertEquals(1.1, provider.cumulativeFactor("KEN", 2025).getAsDouble(), EPS);
        assertEquals(1.21, provider.cumulativeFactor("KEN", 2030).getAsDouble(), EPS);
        assertTrue(provider.cumulativeFactor("KEN", 2035).isEmpty());
        assertTrue(provider.cumulativeFactor("TZA", 2025).isEmpty());
    }

    @Test
    @DisplayName("Missing start-year population defaults every factor to 1")
    void testMissingStartYearMeansNoGrowth() {
        assertEquals(1.0, provider.cumulativeFactor("UGA", 2025).getAsDouble());
        assertEquals(1.0, provider.cumulativeFactor("UGA", 2030).getAsDouble());

        AnnualSeries uga = provider.getTimeseries("UGA.1");
        for (int i = 0; i < uga.length(); i++) {
            assertEquals(300.0, uga.get(i), EPS);
        }
    }

    @Test
    @DisplayName("Regional series lands on the scenario trajectory at period boundaries")
    void testTrajectoryAtPeriodBoundaries() {
        AnnualSeries ken = provider.getTimeseries("KEN.1.1");

        assertEquals(11, ken.length());
        assertEquals(1000.0, ken.get(0), EPS);
        assertEquals(1100.0, ken.get(5), EPS);
        assertEquals(1210.0, ken.get(10), EPS);
        assertTrue(ken.get(1) > 1000.0 && ken.get(1) < ken.get(2));
        assertEquals(SourceTier.SPECIFIC, provider.growthTier("KEN"));
    }

    @Test
    @DisplayName("Region without a start-year row uses its first row as baseline")
    void testBaselineFromOtherYear() {
        assertEquals(500.0, provider.getTimeseries("KEN.2.1").get(0), EPS);
    }

    @Test
    @DisplayName("Country absent from the scenario table does not grow")
    void testDefaultTier() {
        AnnualSeries tza = provider.getTimeseries("TZA.1");
        assertEquals(200.0, tza.get(0), EPS);
        assertEquals(200.0, tza.get(10), EPS);
        assertEquals(SourceTier.GLOBAL, provider.growthTier("TZA"));
    }

    @Test
    @DisplayName("Region without a baseline is tagged missing instead of failing")
    void testMissingBaseline() {
        AnnualSeries missing = provider.getTimeseries("KEN.9");
        assertEquals(0, missing.missingFromIndex());
        assertTrue(missing.isMissing(0));
        assertTrue(missing.isMissing(10));
    }

    @Test
    @DisplayName("Scenario trajectory ending early tags later years missing")
    void testTruncatedTrajectory() {
        AnnualSeries eth = provider.getTimeseries("ETH.1");
        assertEquals(12.0, eth.get(5), EPS);
        assertFalse(eth.isMissing(5));
        assertTrue(eth.isMissing(6));
        assertEquals(2026, eth.missingFromYear().getAsInt());
    }

    @Test
    @DisplayName("Repeated queries return the memoized instance")
    void testMemoized() {
        assertSame(provider.getTimeseries("KEN.1.1"), provider.getTimeseries("KEN.1.1"));
    }

    @Test
    @DisplayName("Default demographic config spans 2020..2100 in five-year periods")
    void testDefaultConfig() {
        ProviderConfig config = ProviderConfig.demographic(POP_SCENARIO);
        DemographicRegionProvider defaults =
                new DemographicRegionProvider(config, regionPopulationRows(), scenarioPopulationRows());
        assertEquals(2020, defaults.startYear());
        assertEquals(2100, defaults.stopYear());
        assertEquals(POP_SCENARIO, defaults.scenario());
        assertEquals(81, defaults.getTimeseries("TZA.1").length());
    }

    @Test
    @DisplayName("Unknown scenario fails construction")
    void testUnknownScenario() {
        ProjectionException ex = assertThrows(ProjectionException.class,
                () -> new DemographicRegionProvider(
                        ProviderConfig.demographic("SSP9"), regionPopulationRows(), scenarioPopulationRows()));
        assertEquals(ProjectionException.REASON_SCENARIO_NOT_FOUND, ex.reasonCode());
    }
}
