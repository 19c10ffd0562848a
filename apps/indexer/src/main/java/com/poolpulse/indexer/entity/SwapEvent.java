package com.poolpulse.indexer.entity;

import com.poolpulse.indexer.modules.chains.model.SwapType;
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
 * Valued Swap event. Natural key (transaction_hash, log_index).
 */
@Data
@Entity
@Table(name = "swaps", uniqueConstraints = @UniqueConstraint(columnNames = {"transaction_hash", "log_index"}))
public class SwapEvent {

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

    @Column(nullable = false, length = 42)
    private String sender;

    @Column(nullable = false, length = 42)
    private String recipient;

    @Column(nullable = false, precision = 78)
    private BigInteger amount0;

    @Column(nullable = false, precision = 78)
    private BigInteger amount1;

    @Column(name = "sqrt_price_x96", nullable = false, precision = 78)
    private BigInteger sqrtPriceX96;

    @Column(nullable = false, precision = 78)
    private BigInteger liquidity;

    @Column(nullable = false)
    private Integer tick;

    @Column(name = "amount0_readable")
    private BigDecimal amount0Readable;

    @Column(name = "amount1_readable")
    private BigDecimal amount1Readable;

    /**
     * token0 priced in token1.
     */
    @Column(name = "price_token0")
    private BigDecimal priceToken0;

    /**
     * token1 priced in token0.
     */
    @Column(name = "price_token1")
    private BigDecimal priceToken1;

    @Enumerated(EnumType.STRING)
    @Column(name = "swap_type", nullable = false, length = 4)
    private SwapType swapType;

    @Column(name = "usd_value")
    private BigDecimal usdValue;

    @Column(name = "gas_used")
    private Long gasUsed;

    @Column(name = "gas_price")
    private BigInteger gasPrice;

    /**
     * gas_used * gas_price in native units.
     */
    @Column(name = "transaction_fee")
    private BigDecimal transactionFee;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
