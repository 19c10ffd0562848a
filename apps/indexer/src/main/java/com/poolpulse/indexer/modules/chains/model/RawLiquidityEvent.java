package com.poolpulse.indexer.modules.chains.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Decoded Mint, Burn or Collect log.
 */
@Value
@Builder
public class RawLiquidityEvent {
    LogMetadata metadata;
    LiquidityEventType type;
    String owner;

    /**
     * Mint sender or Collect recipient. Burn logs carry none.
     */
    String sender;

    /**
     * Position liquidity added or removed. Zero for Collect.
     */
    BigInteger liquidityDelta;
    int tickLower;
    int tickUpper;
    BigInteger amount0;
    BigInteger amount1;
}
