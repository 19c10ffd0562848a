package com.poolpulse.indexer.modules.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Throughput and latency summary over a set of processed events.
 */
@Value
@Builder
public class SystemMetrics {
    Instant timestamp;
    long totalEvents;
    long successfulEvents;
    long failedEvents;
    long avgProcessingLatencyMs;
    long avgStorageLatencyMs;
    long avgTotalLatencyMs;
    double errorRate;
    double eventsPerSecond;
}
