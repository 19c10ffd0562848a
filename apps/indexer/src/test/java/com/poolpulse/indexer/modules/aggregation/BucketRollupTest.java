package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.modules.chains.model.SwapType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BucketRollupTest {

    private static final BigDecimal FEE_RATE = new BigDecimal("0.0005");
    private static final BigDecimal WHALE = new BigDecimal("10000");

    @Test
    void foldsPricesInChainOrder() {
        List<SwapEvent> swaps = List.of(
                swap("3.00", SwapType.BUY, "100", "0xa", "0xb", 10),
                swap("3.60", SwapType.SELL, "20000", "0xb", "0xc", 30),
                swap("2.90", SwapType.BUY, null, "0xa", "0xa", 20),
                swap("3.10", SwapType.SELL, "50", "0xd", "0xb", 40));

        BucketRollup rollup = BucketRollup.of(swaps, FEE_RATE, WHALE);

        assertEquals(new BigDecimal("3.00"), rollup.getOpenPrice());
        assertEquals(new BigDecimal("3.60"), rollup.getHighPrice());
        assertEquals(new BigDecimal("2.90"), rollup.getLowPrice());
        assertEquals(new BigDecimal("3.10"), rollup.getClosePrice());
        assertTrue(rollup.getLowPrice().compareTo(rollup.getOpenPrice()) <= 0);
        assertTrue(rollup.getHighPrice().compareTo(rollup.getClosePrice()) >= 0);

        assertEquals(4, rollup.getTotalTransactions());
        assertEquals(2, rollup.getBuyTransactions());
        assertEquals(2, rollup.getSellTransactions());
        assertEquals(0, new BigDecimal("20150").compareTo(rollup.getVolumeUsd()));
        assertEquals(0, new BigDecimal("10.075").compareTo(rollup.getFeesUsd()));
        assertEquals(0, new BigDecimal("20000").compareTo(rollup.getLargestTransactionUsd()));
        assertEquals(1, rollup.getWhaleTransactions());

        assertEquals(4, rollup.getUniqueAddresses());
        assertEquals(3, rollup.getUniqueSenders());
        assertEquals(BigInteger.valueOf(10), rollup.getMinLiquidity());
        assertEquals(BigInteger.valueOf(40), rollup.getMaxLiquidity());
        assertEquals(BigInteger.valueOf(25), rollup.getAvgLiquidity());
    }

    @Test
    void zeroPriceIsIgnoredForLow() {
        List<SwapEvent> swaps = List.of(
                swap("2.00", SwapType.BUY, "1", "0xa", "0xa", 1),
                swap("0", SwapType.SELL, "1", "0xa", "0xa", 1),
                swap("2.50", SwapType.BUY, "1", "0xa", "0xa", 1));

        BucketRollup rollup = BucketRollup.of(swaps, FEE_RATE, WHALE);

        assertEquals(new BigDecimal("2.00"), rollup.getLowPrice());
        assertEquals(new BigDecimal("2.50"), rollup.getHighPrice());
    }

    @Test
    void emptyBucketIsAllZeros() {
        BucketRollup rollup = BucketRollup.of(List.of(), FEE_RATE, WHALE);

        assertTrue(rollup.isEmpty());
        assertEquals(BigDecimal.ZERO, rollup.getOpenPrice());
        assertEquals(BigDecimal.ZERO, rollup.getClosePrice());
        assertEquals(0, rollup.getUniqueAddresses());
        assertNull(rollup.getLargestTransactionUsd());
        assertNull(rollup.getAvgLiquidity());
    }

    @Test
    void newAddressesExcludePreviousOnes() {
        BucketRollup rollup = BucketRollup.of(List.of(
                swap("1", SwapType.BUY, "1", "0xa", "0xb", 1),
                swap("1", SwapType.BUY, "1", "0xc", "0xa", 1)), FEE_RATE, WHALE);

        assertEquals(2, rollup.countNewAddresses(Set.of("0xa")));
        assertEquals(0, rollup.countNewAddresses(Set.of("0xa", "0xb", "0xc")));
    }

    static SwapEvent swap(String price, SwapType type, String usd, String sender, String recipient, long liquidity) {
        SwapEvent swap = new SwapEvent();
        swap.setPriceToken0(new BigDecimal(price));
        swap.setSwapType(type);
        swap.setUsdValue(usd != null ? new BigDecimal(usd) : null);
        swap.setSender(sender);
        swap.setRecipient(recipient);
        swap.setLiquidity(BigInteger.valueOf(liquidity));
        swap.setAmount0Readable(BigDecimal.ONE);
        swap.setAmount1Readable(new BigDecimal("3"));
        return swap;
    }
}
