package com.poolpulse.indexer.modules.chains.model;

public enum LiquidityEventType {
    MINT,
    BURN,
    COLLECT;

    /**
     * Mint and Burn change a position; Collect only withdraws owed tokens.
     */
    public boolean isLiquidityChange() {
        return this == MINT || this == BURN;
    }
}
