package com.poolpulse.indexer.modules.valuation;

import com.poolpulse.indexer.modules.chains.model.SwapType;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Pool price and amount conversions.
 */
public final class PriceMath {

    /**
     * 2^96, exactly representable as a double.
     */
    private static final double Q96 = Math.pow(2, 96);

    private PriceMath() {
    }

    /**
     * Price of token0 in token1 raw units: (sqrtPriceX96 / 2^96)^2.
     */
    public static double priceFromSqrtPrice(BigInteger sqrtPriceX96) {
        double ratio = sqrtPriceX96.doubleValue() / Q96;
        return ratio * ratio;
    }

    /**
     * Price of token1 in token0 raw units. Null when the price is zero or not finite.
     */
    public static Double inversePrice(double price) {
        if (price <= 0 || !Double.isFinite(price)) {
            return null;
        }
        double inverse = 1.0 / price;
        return Double.isFinite(inverse) ? inverse : null;
    }

    /**
     * |rawAmount| / 10^decimals, exact.
     */
    public static BigDecimal readableAmount(BigInteger rawAmount, int decimals) {
        if (rawAmount == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(rawAmount.abs()).movePointLeft(decimals);
    }

    /**
     * Positive amount0 means the pool received token0, i.e. the trader sold it.
     */
    public static SwapType classifySwapDirection(BigInteger amount0) {
        return amount0 != null && amount0.signum() > 0 ? SwapType.SELL : SwapType.BUY;
    }

    public static BigDecimal toDecimal(Double value) {
        return value == null || !Double.isFinite(value) ? null : BigDecimal.valueOf(value);
    }
}
