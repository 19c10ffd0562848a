package com.poolpulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row of one integrity check run.
 */
@Data
@Entity
@Table(name = "integrity_checks")
public class IntegrityCheck {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "check_type", nullable = false, length = 50)
    private String checkType;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private Boolean passed;

    @Column(name = "issues_count", nullable = false)
    private Integer issuesCount = 0;

    /**
     * Issues and details serialized as JSON.
     */
    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
