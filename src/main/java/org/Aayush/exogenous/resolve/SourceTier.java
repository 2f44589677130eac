package org.Aayush.exogenous.resolve;

/**
 * Reference-data tiers in priority order, most specific first.
 */
public enum SourceTier {
    /**
     * Rows reported by the active model for the requested key.
     */
    SPECIFIC,
    /**
     * Median across every model reporting the requested key.
     */
    AGGREGATED,
    /**
     * Unconditional last-resort series shared by every key.
     */
    GLOBAL
}
