package org.Aayush.exogenous.table;

/**
 * One projected annual growth factor reported by a model for a coarse key and period start year.
 *
 * @param model model qualifier.
 * @param scenario scenario id.
 * @param coarseKey country code.
 * @param year first calendar year of the period.
 * @param growth multiplicative annual growth factor over the period.
 */
public record GrowthRow(String model, String scenario, String coarseKey, int year, double growth) {

    /**
     * Period index of this row relative to a start year.
     *
     * <p>Uses Java integer division, which truncates toward zero for years before the start.</p>
     *
     * @param startYear configured first year.
     * @param periodLength years per period.
     * @return period index.
     */
    public int periodIndex(int startYear, int periodLength) {
        return (year - startYear) / periodLength;
    }
}
