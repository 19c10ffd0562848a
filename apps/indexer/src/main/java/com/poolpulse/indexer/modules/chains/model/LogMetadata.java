package com.poolpulse.indexer.modules.chains.model;

import lombok.Value;

/**
 * Position of a log on chain. (txHash, logIndex) is the natural key of every stored event.
 */
@Value
public class LogMetadata {
    String transactionHash;
    long blockNumber;
    int logIndex;
}
