package org.Aayush.exogenous.provider;

import org.Aayush.exogenous.resolve.SourceTier;

/**
 * Tiers that answered the baseline and growth lookups for one coarse key.
 *
 * @param baseline tier of the baseline value.
 * @param growth tier of the growth series.
 */
public record SourceSelection(SourceTier baseline, SourceTier growth) {
}
