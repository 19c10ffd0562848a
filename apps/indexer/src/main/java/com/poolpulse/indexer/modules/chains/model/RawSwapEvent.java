package com.poolpulse.indexer.modules.chains.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Decoded Swap log.
 */
@Value
@Builder
public class RawSwapEvent {
    LogMetadata metadata;
    String sender;
    String recipient;
    BigInteger amount0;
    BigInteger amount1;
    BigInteger sqrtPriceX96;
    BigInteger liquidity;
    int tick;
}
