package org.Aayush.exogenous.table;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import org.Aayush.exogenous.ProjectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("CountryTotalRescaler Tests")
class CountryTotalRescalerTest {
    private static final double EPS = 1e-6;

    private static Object2DoubleOpenHashMap<String> totals() {
        Object2DoubleOpenHashMap<String> totals = new Object2DoubleOpenHashMap<>();
        totals.put("KEN", 3000.0);
        return totals;
    }

    @Test
    @DisplayName("Regions are scaled so each country sums to its total")
    void testRegionsSumToCountryTotal() {
        List<RegionPopulationRow> rows = List.of(
                new RegionPopulationRow("KEN.1.1", 2022, 1000.0),
                new RegionPopulationRow("KEN.2.1", 2022, 500.0)
        );
        List<RegionPopulationRow> rescaled = new CountryTotalRescaler(totals()).rescale(rows);

        assertEquals(2, rescaled.size());
        assertEquals("KEN.1.1", rescaled.get(0).fineKey());
        assertEquals(2000.0, rescaled.get(0).population(), EPS);
        assertEquals(1000.0, rescaled.get(1).population(), EPS);
        assertEquals(2022, rescaled.get(1).year());
    }

    @Test
    @DisplayName("Small country without a total keeps its regional values")
    void testMissingTotalKeepsValues() {
        List<RegionPopulationRow> rows = List.of(new RegionPopulationRow("TUV.1", 2022, 11_000.0));
        List<RegionPopulationRow> rescaled = new CountryTotalRescaler(totals()).rescale(rows);

        assertEquals(11_000.0, rescaled.get(0).population(), EPS);
    }

    @Test
    @DisplayName("Large country without a total is rejected unless the check is skipped")
    void testLargeMissingTotal() {
        List<RegionPopulationRow> rows = List.of(
                new RegionPopulationRow("ETH.1", 2022, 900_000.0),
                new RegionPopulationRow("ETH.2", 2022, 900_000.0)
        );

        ProjectionException ex = assertThrows(ProjectionException.class,
                () -> new CountryTotalRescaler(totals()).rescale(rows));
        assertEquals(ProjectionException.REASON_COUNTRY_TOTAL_MISSING, ex.reasonCode());

        List<RegionPopulationRow> kept = new CountryTotalRescaler(totals(), true).rescale(rows);
        assertEquals(900_000.0, kept.get(1).population(), EPS);
    }
}
