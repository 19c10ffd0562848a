package com.poolpulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Processing latency of one pool event.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "event_metrics")
public class EventMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * swap, mint, burn or collect.
     */
    @Column(name = "event_type", nullable = false, length = 10)
    private String eventType;

    /**
     * Block time of the event.
     */
    @Column(name = "event_timestamp", nullable = false)
    private Instant eventTimestamp;

    @Column(name = "transaction_hash", nullable = false, length = 66)
    private String transactionHash;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @Column(name = "processing_start", nullable = false)
    private Instant processingStart;

    @Column(name = "processing_end", nullable = false)
    private Instant processingEnd;

    @Column(name = "storage_start", nullable = false)
    private Instant storageStart;

    @Column(name = "storage_end", nullable = false)
    private Instant storageEnd;

    @Column(name = "processing_latency_ms", nullable = false)
    private Long processingLatencyMs;

    @Column(name = "storage_latency_ms", nullable = false)
    private Long storageLatencyMs;

    @Column(name = "total_latency_ms", nullable = false)
    private Long totalLatencyMs;

    @Column(nullable = false)
    private Boolean success;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
