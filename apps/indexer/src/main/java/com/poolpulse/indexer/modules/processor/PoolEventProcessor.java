package com.poolpulse.indexer.modules.processor;

import com.poolpulse.indexer.modules.chains.model.LogMetadata;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.rpc.ChainRpcClient;
import com.poolpulse.indexer.modules.valuation.ValuationService;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.time.Instant;
import java.util.Optional;

/**
 * Shared chain lookups of the event processors. Token metadata is set once at startup.
 */
public abstract class PoolEventProcessor {

    protected final ChainRpcClient rpcClient;
    protected final ValuationService valuationService;

    private volatile PoolTokens tokens;

    protected PoolEventProcessor(ChainRpcClient rpcClient, ValuationService valuationService) {
        this.rpcClient = rpcClient;
        this.valuationService = valuationService;
    }

    public void setTokenInfo(PoolTokens tokens) {
        this.tokens = tokens;
    }

    /**
     * @throws IllegalStateException if {@link #setTokenInfo} was never called
     */
    protected PoolTokens requireTokens() {
        PoolTokens current = tokens;
        if (current == null || current.getToken0() == null || current.getToken1() == null) {
            throw new IllegalStateException("Token info not set; call setTokenInfo() before processing events");
        }
        return current;
    }

    protected Instant blockTimestamp(LogMetadata metadata) {
        return rpcClient.getBlockTimestamp(metadata.getBlockNumber());
    }

    protected Optional<TransactionReceipt> receipt(LogMetadata metadata) {
        return rpcClient.getTransactionReceipt(metadata.getTransactionHash());
    }

    /**
     * The account that signed the transaction, or the fallback when the receipt is unknown.
     */
    protected static String originOf(Optional<TransactionReceipt> receipt, String fallback) {
        return receipt.map(TransactionReceipt::getFrom)
                .filter(from -> !from.isBlank())
                .orElse(fallback);
    }

    protected static String lower(String address) {
        return address != null ? address.toLowerCase() : null;
    }
}
