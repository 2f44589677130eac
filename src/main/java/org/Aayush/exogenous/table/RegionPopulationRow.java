package org.Aayush.exogenous.table;

/**
 * Downscaled population of one hierarchical region.
 *
 * @param fineKey hierarchical region id.
 * @param year observation year.
 * @param population head count.
 */
public record RegionPopulationRow(String fineKey, int year, double population) {
}
