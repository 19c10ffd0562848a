package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.modules.chains.model.SwapType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One event's contribution to one account.
 */
@Value
@Builder
public class AccountActivity {

    String address;
    Instant timestamp;

    /**
     * Set for swaps only. Liquidity events add volume without counting as a transaction.
     */
    SwapType swapType;

    /**
     * Null when the event could not be valued.
     */
    BigDecimal usdValue;

    boolean liquidityProvider;

    public boolean isTransaction() {
        return swapType != null;
    }

    public BigDecimal usdOrZero() {
        return usdValue != null ? usdValue : BigDecimal.ZERO;
    }
}
