package com.poolpulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-account activity. One row per address, never deleted.
 */
@Data
@Entity
@Table(name = "user_stats")
public class UserStats {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 42)
    private String address;

    @Column(name = "total_transactions", nullable = false)
    private Integer totalTransactions = 0;

    @Column(name = "buy_transactions", nullable = false)
    private Integer buyTransactions = 0;

    @Column(name = "sell_transactions", nullable = false)
    private Integer sellTransactions = 0;

    @Column(name = "total_volume_usd", nullable = false)
    private BigDecimal totalVolumeUsd = BigDecimal.ZERO;

    @Column(name = "largest_transaction_usd")
    private BigDecimal largestTransactionUsd;

    @Column(name = "first_transaction_at")
    private Instant firstTransactionAt;

    @Column(name = "last_transaction_at")
    private Instant lastTransactionAt;

    @Column(name = "is_liquidity_provider")
    private Boolean liquidityProvider = false;

    @Column(name = "total_liquidity_provided_usd")
    private BigDecimal totalLiquidityProvidedUsd = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", length = 20)
    private UserType userType;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private Instant updatedAt;

    public static UserStats empty(String address) {
        UserStats stats = new UserStats();
        stats.setAddress(address);
        return stats;
    }
}
