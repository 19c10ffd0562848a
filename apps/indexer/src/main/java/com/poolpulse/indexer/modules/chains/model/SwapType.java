package com.poolpulse.indexer.modules.chains.model;

/**
 * Trade direction seen from the pool's token0.
 */
public enum SwapType {
    BUY,
    SELL
}
