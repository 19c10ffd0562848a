package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.modules.chains.model.SwapType;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Single-pass fold of the priced swaps of one bucket, in chain order.
 * An empty input gives an all-zero rollup; carry-forward is up to the caller.
 */
@Getter
public final class BucketRollup {

    private BigDecimal openPrice = BigDecimal.ZERO;
    private BigDecimal highPrice = BigDecimal.ZERO;
    private BigDecimal lowPrice = BigDecimal.ZERO;
    private BigDecimal closePrice = BigDecimal.ZERO;

    private int totalTransactions;
    private int buyTransactions;
    private int sellTransactions;

    private BigDecimal volumeToken0 = BigDecimal.ZERO;
    private BigDecimal volumeToken1 = BigDecimal.ZERO;
    private BigDecimal volumeUsd = BigDecimal.ZERO;
    private BigDecimal feesToken0 = BigDecimal.ZERO;
    private BigDecimal feesToken1 = BigDecimal.ZERO;
    private BigDecimal feesUsd = BigDecimal.ZERO;

    private final Set<String> addresses = new HashSet<>();
    private final Set<String> senders = new HashSet<>();

    private BigInteger minLiquidity;
    private BigInteger maxLiquidity;
    private BigInteger avgLiquidity;

    /**
     * Largest USD value, null when no swap was valued above zero.
     */
    private BigDecimal largestTransactionUsd;
    private int whaleTransactions;

    private BucketRollup() {
    }

    public static BucketRollup of(List<SwapEvent> swaps, BigDecimal feeRate, BigDecimal whaleThreshold) {
        BucketRollup rollup = new BucketRollup();
        if (swaps.isEmpty()) {
            return rollup;
        }

        boolean opened = false;
        BigDecimal minPositive = null;
        BigInteger liquiditySum = BigInteger.ZERO;
        int liquidityCount = 0;

        for (SwapEvent swap : swaps) {
            BigDecimal price = swap.getPriceToken0();
            if (price != null) {
                if (!opened) {
                    rollup.openPrice = price;
                    rollup.highPrice = price;
                    opened = true;
                }
                rollup.closePrice = price;
                if (price.compareTo(rollup.highPrice) > 0) {
                    rollup.highPrice = price;
                }
                if (price.signum() > 0 && (minPositive == null || price.compareTo(minPositive) < 0)) {
                    minPositive = price;
                }
            }

            rollup.totalTransactions++;
            if (swap.getSwapType() == SwapType.BUY) {
                rollup.buyTransactions++;
            } else if (swap.getSwapType() == SwapType.SELL) {
                rollup.sellTransactions++;
            }

            rollup.volumeToken0 = rollup.volumeToken0.add(abs(swap.getAmount0Readable()));
            rollup.volumeToken1 = rollup.volumeToken1.add(abs(swap.getAmount1Readable()));

            BigDecimal usd = swap.getUsdValue();
            if (usd != null) {
                rollup.volumeUsd = rollup.volumeUsd.add(usd);
                if (usd.signum() > 0 && (rollup.largestTransactionUsd == null
                        || usd.compareTo(rollup.largestTransactionUsd) > 0)) {
                    rollup.largestTransactionUsd = usd;
                }
                if (usd.compareTo(whaleThreshold) > 0) {
                    rollup.whaleTransactions++;
                }
            }

            if (swap.getSender() != null) {
                rollup.addresses.add(swap.getSender());
                rollup.senders.add(swap.getSender());
            }
            if (swap.getRecipient() != null) {
                rollup.addresses.add(swap.getRecipient());
            }

            BigInteger liquidity = swap.getLiquidity();
            if (liquidity != null) {
                liquiditySum = liquiditySum.add(liquidity);
                liquidityCount++;
                rollup.minLiquidity = rollup.minLiquidity == null ? liquidity : rollup.minLiquidity.min(liquidity);
                rollup.maxLiquidity = rollup.maxLiquidity == null ? liquidity : rollup.maxLiquidity.max(liquidity);
            }
        }

        rollup.lowPrice = minPositive != null ? minPositive : rollup.openPrice;
        if (liquidityCount > 0) {
            rollup.avgLiquidity = liquiditySum.divide(BigInteger.valueOf(liquidityCount));
        }

        rollup.feesToken0 = fee(rollup.volumeToken0, feeRate);
        rollup.feesToken1 = fee(rollup.volumeToken1, feeRate);
        rollup.feesUsd = fee(rollup.volumeUsd, feeRate);
        return rollup;
    }

    public boolean isEmpty() {
        return totalTransactions == 0;
    }

    public int getUniqueAddresses() {
        return addresses.size();
    }

    public int getUniqueSenders() {
        return senders.size();
    }

    /**
     * Addresses of this bucket absent from {@code previous}.
     */
    public int countNewAddresses(Set<String> previous) {
        return (int) addresses.stream().filter(Objects::nonNull).filter(a -> !previous.contains(a)).count();
    }

    private static BigDecimal abs(BigDecimal value) {
        return value != null ? value.abs() : BigDecimal.ZERO;
    }

    private static BigDecimal fee(BigDecimal volume, BigDecimal feeRate) {
        return volume.multiply(feeRate);
    }
}
