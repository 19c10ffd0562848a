package com.poolpulse.indexer.entity;

import java.math.BigDecimal;

/**
 * OHLC fields shared by hourly and daily rollup rows.
 */
public interface PriceBucket {

    BigDecimal getOpenPrice();

    BigDecimal getClosePrice();

    Integer getTotalTransactions();

    void setOpenPrice(BigDecimal price);

    void setHighPrice(BigDecimal price);

    void setLowPrice(BigDecimal price);

    void setClosePrice(BigDecimal price);

    /**
     * Fill OHLC of a bucket without swaps with the previous close.
     */
    default void carryForward(BigDecimal previousClose) {
        setOpenPrice(previousClose);
        setHighPrice(previousClose);
        setLowPrice(previousClose);
        setClosePrice(previousClose);
    }
}
