package com.poolpulse.indexer.modules.chains.events;

import com.poolpulse.indexer.modules.chains.model.RawLiquidityEvent;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;

/**
 * Receives decoded pool events from the listener's worker pool.
 */
public interface PoolEventHandler {

    void onSwap(RawSwapEvent event);

    void onLiquidityEvent(RawLiquidityEvent event);
}
