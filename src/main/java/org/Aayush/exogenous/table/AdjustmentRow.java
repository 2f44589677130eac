package org.Aayush.exogenous.table;

/**
 * Nightlight-derived ratio scaling a country series to one hierarchical region.
 *
 * @param fineKey hierarchical region id.
 * @param ratio dimensionless ratio; may be {@code NaN}.
 */
public record AdjustmentRow(String fineKey, double ratio) {
}
