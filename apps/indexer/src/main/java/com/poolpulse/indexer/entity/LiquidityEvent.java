package com.poolpulse.indexer.entity;

import com.poolpulse.indexer.modules.chains.model.LiquidityEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Valued Mint, Burn or Collect event. Natural key (transaction_hash, log_index).
 */
@Data
@Entity
@Table(name = "liquidity_events", uniqueConstraints = @UniqueConstraint(columnNames = {"transaction_hash", "log_index"}))
public class LiquidityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "transaction_hash", nullable = false, length = 66)
    private String transactionHash;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @Column(name = "block_timestamp", nullable = false)
    private Instant blockTimestamp;

    @Column(name = "log_index", nullable = false)
    private Integer logIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 10)
    private LiquidityEventType eventType;

    @Column(nullable = false, length = 42)
    private String owner;

    @Column(length = 42)
    private String sender;

    @Column(name = "liquidity_delta", nullable = false, precision = 78)
    private BigInteger liquidityDelta;

    @Column(name = "tick_lower", nullable = false)
    private Integer tickLower;

    @Column(name = "tick_upper", nullable = false)
    private Integer tickUpper;

    @Column(nullable = false, precision = 78)
    private BigInteger amount0;

    @Column(nullable = false, precision = 78)
    private BigInteger amount1;

    @Column(name = "amount0_readable")
    private BigDecimal amount0Readable;

    @Column(name = "amount1_readable")
    private BigDecimal amount1Readable;

    @Column(name = "usd_value")
    private BigDecimal usdValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
