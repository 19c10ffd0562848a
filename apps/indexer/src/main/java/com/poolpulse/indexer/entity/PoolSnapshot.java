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
 * Hourly pool state. One row per snapshot_time.
 */
@Data
@Entity
@Table(name = "pool_snapshots")
public class PoolSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "snapshot_time", nullable = false, unique = true)
    private Instant snapshotTime;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @Column(name = "sqrt_price_x96", nullable = false, precision = 78)
    private BigInteger sqrtPriceX96;

    @Column(nullable = false)
    private Integer tick;

    @Column(nullable = false, precision = 78)
    private BigInteger liquidity;

    @Column(name = "price_token0")
    private BigDecimal priceToken0;

    @Column(name = "price_token1")
    private BigDecimal priceToken1;

    @Column(name = "tvl_usd")
    private BigDecimal tvlUsd;

    @Column(name = "token0_balance")
    private BigDecimal token0Balance;

    @Column(name = "token1_balance")
    private BigDecimal token1Balance;

    @Column(name = "volume_24h_usd")
    private BigDecimal volume24hUsd;

    @Column(name = "fees_24h_usd")
    private BigDecimal fees24hUsd;

    @Column(name = "transactions_24h")
    private Integer transactions24h;
}
