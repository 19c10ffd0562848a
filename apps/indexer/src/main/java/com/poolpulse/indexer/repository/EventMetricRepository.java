package com.poolpulse.indexer.repository;

import com.poolpulse.indexer.entity.EventMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface EventMetricRepository extends JpaRepository<EventMetric, UUID> {

    @Query(value = """
            SELECT COUNT(*) AS "totalEvents",
                   COUNT(*) FILTER (WHERE success = true) AS "successfulEvents",
                   COUNT(*) FILTER (WHERE success = false) AS "failedEvents",
                   AVG(processing_latency_ms) AS "avgProcessingLatencyMs",
                   AVG(storage_latency_ms) AS "avgStorageLatencyMs",
                   AVG(total_latency_ms) AS "avgTotalLatencyMs",
                   EXTRACT(EPOCH FROM (MAX(event_timestamp) - MIN(event_timestamp))) AS "spanSeconds"
            FROM event_metrics
            WHERE event_timestamp >= :start AND event_timestamp <= :end
            """, nativeQuery = true)
    MetricsAggregate aggregateBetween(@Param("start") Instant start, @Param("end") Instant end);

    interface MetricsAggregate {
        Long getTotalEvents();

        Long getSuccessfulEvents();

        Long getFailedEvents();

        Double getAvgProcessingLatencyMs();

        Double getAvgStorageLatencyMs();

        Double getAvgTotalLatencyMs();

        Double getSpanSeconds();
    }
}
