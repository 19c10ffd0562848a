package com.poolpulse.indexer.modules.valuation;

import com.poolpulse.indexer.modules.chains.model.SwapType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PriceMathTest {

    private static final BigInteger Q96 = BigInteger.TWO.pow(96);

    @Test
    void unitSqrtPriceIsPriceOne() {
        assertEquals(1.0, PriceMath.priceFromSqrtPrice(Q96), 0.0);
    }

    @Test
    void priceTimesInverseIsOne() {
        BigInteger[] inputs = {
                Q96.divide(BigInteger.valueOf(7)),
                Q96.multiply(BigInteger.valueOf(3)),
                new BigInteger("1771845812700903892492222464"),
                new BigInteger("4339505179874779489431521786")
        };
        for (BigInteger sqrtPrice : inputs) {
            double price = PriceMath.priceFromSqrtPrice(sqrtPrice);
            assertEquals(1.0, price * PriceMath.inversePrice(price), 1e-12);
        }
    }

    @Test
    void inverseOfZeroIsNull() {
        assertNull(PriceMath.inversePrice(0));
    }

    @Test
    void readableAmountDropsSignAndScales() {
        assertEquals(0, new BigDecimal("1").compareTo(
                PriceMath.readableAmount(new BigInteger("-1000000000000000000"), 18)));
        assertEquals(0, new BigDecimal("2.5").compareTo(
                PriceMath.readableAmount(BigInteger.valueOf(2_500_000), 6)));
    }

    @Test
    void positiveAmount0IsSell() {
        assertEquals(SwapType.SELL, PriceMath.classifySwapDirection(BigInteger.ONE));
        assertEquals(SwapType.BUY, PriceMath.classifySwapDirection(BigInteger.valueOf(-1)));
        assertEquals(SwapType.BUY, PriceMath.classifySwapDirection(BigInteger.ZERO));
    }
}
