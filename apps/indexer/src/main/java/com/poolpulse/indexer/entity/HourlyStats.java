package com.poolpulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Hourly OHLC and volume bucket. One row per hour_start.
 */
@Data
@Entity
@Table(name = "hourly_stats")
public class HourlyStats implements PriceBucket {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "hour_start", nullable = false, unique = true)
    private Instant hourStart;

    @Column(name = "hour_end", nullable = false)
    private Instant hourEnd;

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

    @Column(name = "unique_senders", nullable = false)
    private Integer uniqueSenders = 0;

    @Column(name = "avg_liquidity", precision = 78)
    private BigInteger avgLiquidity;

    @Column(name = "min_liquidity", precision = 78)
    private BigInteger minLiquidity;

    @Column(name = "max_liquidity", precision = 78)
    private BigInteger maxLiquidity;
}
