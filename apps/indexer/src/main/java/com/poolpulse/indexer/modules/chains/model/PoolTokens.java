package com.poolpulse.indexer.modules.chains.model;

import lombok.Value;

/**
 * token0/token1 pair of the monitored pool.
 */
@Value
public class PoolTokens {
    TokenInfo token0;
    TokenInfo token1;
}
