package org.Aayush.exogenous.table;

/**
 * Country-level population projected under one scenario.
 *
 * @param coarseKey country code.
 * @param year projection year.
 * @param scenario scenario id.
 * @param population head count.
 */
public record ScenarioPopulationRow(String coarseKey, int year, String scenario, double population) {
}
