package com.poolpulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily OHLC and volume bucket. One row per date.
 */
@Data
@Entity
@Table(name = "daily_stats")
public class DailyStats implements PriceBucket {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private LocalDate date;

    @Column(name = "open_price", nullable = false)
    private BigDecimal openPrice = BigDecimal.ZERO;

    @Column(name = "high_price", nullable = false)
    private BigDecimal highPrice = BigDecimal.ZERO;

    @Column(name = "low_price", nullable = false)
    private BigDecimal lowPrice = BigDecimal.ZERO;

    @Column(name = "close_price", nullable = false)
    private BigDecimal closePrice = BigDecimal.ZERO;

    @Column(name = "total_transactions", nullable = false)
    private Integer totalTransactions = 0;

    @Column(name = "buy_transactions", nullable = false)
    private Integer buyTransactions = 0;

    @Column(name = "sell_transactions", nullable = false)
    private Integer sellTransactions = 0;

    @Column(name = "volume_token0", nullable = false)
    private BigDecimal volumeToken0 = BigDecimal.ZERO;

    @Column(name = "volume_token1", nullable = false)
    private BigDecimal volumeToken1 = BigDecimal.ZERO;

    @Column(name = "volume_usd", nullable = false)
    private BigDecimal volumeUsd = BigDecimal.ZERO;

    @Column(name = "fees_token0", nullable = false)
    private BigDecimal feesToken0 = BigDecimal.ZERO;

    @Column(name = "fees_token1", nullable = false)
    private BigDecimal feesToken1 = BigDecimal.ZERO;

    @Column(name = "fees_usd", nullable = false)
    private BigDecimal feesUsd = BigDecimal.ZERO;

    @Column(name = "unique_addresses", nullable = false)
    private Integer uniqueAddresses = 0;

    /**
     * Addresses absent from the previous day's swaps.
     */
    @Column(name = "new_addresses", nullable = false)
    private Integer newAddresses = 0;

    @Column(name = "avg_tvl_usd")
    private BigDecimal avgTvlUsd;

    @Column(name = "end_tvl_usd")
    private BigDecimal endTvlUsd;

    @Column(name = "whale_transactions", nullable = false)
    private Integer whaleTransactions = 0;

    @Column(name = "largest_transaction_usd")
    private BigDecimal largestTransactionUsd;
}
