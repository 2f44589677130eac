package org.Aayush.exogenous.table;

/**
 * One reference-year value reported by a model for a coarse key.
 *
 * @param model model qualifier (for example {@code low} or {@code high}).
 * @param scenario scenario id (for example {@code SSP3}).
 * @param coarseKey country code.
 * @param year calendar year of the observation.
 * @param value observed value.
 */
public record BaselineRow(String model, String scenario, String coarseKey, int year, double value) {
}
