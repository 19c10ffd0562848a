package com.poolpulse.indexer.modules.snapshot;

import lombok.Value;

import java.math.BigInteger;

/**
 * On-chain pool state at one block.
 */
@Value
public class PoolState {
    BigInteger sqrtPriceX96;
    int tick;
    BigInteger liquidity;
    long blockNumber;
}
