package com.poolpulse.indexer.modules.valuation;

/**
 * How the two token sides of an event combine into one USD figure.
 */
public enum UsdAggregation {
    /**
     * Swaps: both sides describe the same trade, so their mean is the trade size.
     */
    AVERAGE,
    /**
     * Liquidity events: both sides are capital moved, so they add up.
     */
    SUM
}
