package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.entity.UserStats;
import com.poolpulse.indexer.entity.UserType;
import com.poolpulse.indexer.modules.chains.model.SwapType;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Pure merge of an account row with one activity. The datastore upsert applies the same rules
 * in a single statement; this class builds its insert row and drives the full resync.
 */
public class UserStatsMerger {

    private final BigDecimal whaleUsd;
    private final BigDecimal retailUsd;

    public UserStatsMerger(BigDecimal whaleUsd, BigDecimal retailUsd) {
        this.whaleUsd = whaleUsd;
        this.retailUsd = retailUsd;
    }

    public BigDecimal getWhaleUsd() {
        return whaleUsd;
    }

    public BigDecimal getRetailUsd() {
        return retailUsd;
    }

    /**
     * The activity applied to an account with no history.
     */
    public UserStats contribution(AccountActivity activity) {
        return merge(UserStats.empty(activity.getAddress()), activity);
    }

    /**
     * @return a new row; {@code existing} is left untouched
     */
    public UserStats merge(UserStats existing, AccountActivity activity) {
        BigDecimal usd = activity.usdOrZero();

        UserStats merged = UserStats.empty(existing.getAddress());
        merged.setId(existing.getId());
        merged.setTotalTransactions(nz(existing.getTotalTransactions()) + (activity.isTransaction() ? 1 : 0));
        merged.setBuyTransactions(nz(existing.getBuyTransactions())
                + (activity.getSwapType() == SwapType.BUY ? 1 : 0));
        merged.setSellTransactions(nz(existing.getSellTransactions())
                + (activity.getSwapType() == SwapType.SELL ? 1 : 0));
        merged.setTotalVolumeUsd(nz(existing.getTotalVolumeUsd()).add(usd));
        merged.setLargestTransactionUsd(largest(existing.getLargestTransactionUsd(), usd));
        merged.setFirstTransactionAt(earliest(existing.getFirstTransactionAt(), activity.getTimestamp()));
        merged.setLastTransactionAt(latest(existing.getLastTransactionAt(), activity.getTimestamp()));

        boolean wasProvider = Boolean.TRUE.equals(existing.getLiquidityProvider());
        merged.setLiquidityProvider(wasProvider || activity.isLiquidityProvider());
        merged.setTotalLiquidityProvidedUsd(nz(existing.getTotalLiquidityProvidedUsd())
                .add(activity.isLiquidityProvider() ? usd : BigDecimal.ZERO));
        merged.setUserType(classify(existing.getUserType(), wasProvider || activity.isLiquidityProvider(), usd));
        return merged;
    }

    /**
     * LP is sticky. Above the whale threshold an account becomes WHALE, overriding any other
     * type. Otherwise an existing type is kept, and an unclassified account below the retail
     * threshold becomes RETAIL.
     */
    public UserType classify(UserType existingType, boolean liquidityProvider, BigDecimal usdValue) {
        BigDecimal usd = usdValue != null ? usdValue : BigDecimal.ZERO;
        if (existingType == UserType.LP || liquidityProvider) {
            return UserType.LP;
        }
        if (usd.compareTo(whaleUsd) > 0) {
            return UserType.WHALE;
        }
        if (existingType != null) {
            return existingType;
        }
        if (usd.compareTo(retailUsd) < 0) {
            return UserType.RETAIL;
        }
        return null;
    }

    private static BigDecimal largest(BigDecimal existing, BigDecimal incoming) {
        if (incoming.signum() <= 0) {
            return existing;
        }
        return existing == null || incoming.compareTo(existing) > 0 ? incoming : existing;
    }

    private static Instant earliest(Instant existing, Instant incoming) {
        if (existing == null) {
            return incoming;
        }
        return incoming != null && incoming.isBefore(existing) ? incoming : existing;
    }

    private static Instant latest(Instant existing, Instant incoming) {
        if (existing == null) {
            return incoming;
        }
        return incoming != null && incoming.isAfter(existing) ? incoming : existing;
    }

    private static int nz(Integer value) {
        return value != null ? value : 0;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
