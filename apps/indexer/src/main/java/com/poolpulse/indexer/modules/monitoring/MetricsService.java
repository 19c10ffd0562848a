package com.poolpulse.indexer.modules.monitoring;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.EventMetric;
import com.poolpulse.indexer.repository.EventMetricRepository;
import com.poolpulse.indexer.service.EventStorageService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Buffers per-event metrics and writes them in batches.
 *
 * <p>The buffer is flushed on a fixed delay and as soon as it reaches the flush threshold.
 * A failed batch goes back to the front of the buffer, so nothing is dropped while the
 * datastore is unavailable and the buffer may grow without bound meanwhile.
 */
@Slf4j
@Service
public class MetricsService {

    private final EventStorageService storageService;
    private final EventMetricRepository metricRepository;
    private final Clock clock;
    private final int flushThreshold;
    private final int recentWindow;

    private final Object lock = new Object();
    private final Deque<EventMetric> buffer = new ArrayDeque<>();
    private final Deque<EventMetric> recent = new ArrayDeque<>();
    private volatile boolean stopped;

    public MetricsService(EventStorageService storageService,
                          EventMetricRepository metricRepository,
                          PoolPulseProperties properties,
                          Clock clock) {
        this.storageService = storageService;
        this.metricRepository = metricRepository;
        this.clock = clock;
        this.flushThreshold = properties.getMetrics().getFlushThreshold();
        this.recentWindow = properties.getMetrics().getRecentWindow();
    }

    /**
     * Derive the latencies and buffer the metric.
     * Total latency runs from the chain timestamp, so it includes propagation and queueing.
     */
    public void recordEvent(EventMetric metric) {
        metric.setProcessingLatencyMs(millisBetween(metric.getProcessingStart(), metric.getProcessingEnd()));
        metric.setStorageLatencyMs(millisBetween(metric.getStorageStart(), metric.getStorageEnd()));
        metric.setTotalLatencyMs(millisBetween(metric.getEventTimestamp(), metric.getStorageEnd()));

        boolean full;
        synchronized (lock) {
            buffer.addLast(metric);
            recent.addLast(metric);
            while (recent.size() > recentWindow) {
                recent.removeFirst();
            }
            full = buffer.size() >= flushThreshold;
        }
        if (full) {
            flush();
        }
    }

    @Scheduled(fixedDelayString = "${poolpulse.metrics.flush-interval-ms:30000}")
    public void scheduledFlush() {
        if (!stopped) {
            flush();
        }
    }

    /**
     * Write the buffered metrics.
     *
     * @return number of metrics written
     */
    public int flush() {
        List<EventMetric> batch;
        synchronized (lock) {
            if (buffer.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(buffer);
            buffer.clear();
        }

        try {
            storageService.saveMetrics(batch);
            log.info("Flushed {} event metrics", batch.size());
            return batch.size();
        } catch (RuntimeException e) {
            log.error("Failed to flush {} event metrics, re-queued: {}", batch.size(), e.getMessage());
            synchronized (lock) {
                for (int i = batch.size() - 1; i >= 0; i--) {
                    buffer.addFirst(batch.get(i));
                }
            }
            return 0;
        }
    }

    public int getBufferedCount() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /**
     * Summary of the most recent {@code limit} metrics held in memory, empty when none were recorded.
     */
    public Optional<SystemMetrics> getSystemMetrics(int limit) {
        List<EventMetric> window;
        synchronized (lock) {
            List<EventMetric> all = new ArrayList<>(recent);
            window = all.subList(Math.max(0, all.size() - limit), all.size());
        }
        if (window.isEmpty()) {
            return Optional.empty();
        }

        long total = window.size();
        long successful = window.stream().filter(m -> Boolean.TRUE.equals(m.getSuccess())).count();
        double processing = window.stream().mapToLong(m -> nz(m.getProcessingLatencyMs())).average().orElse(0);
        double storage = window.stream().mapToLong(m -> nz(m.getStorageLatencyMs())).average().orElse(0);
        double totalLatency = window.stream().mapToLong(m -> nz(m.getTotalLatencyMs())).average().orElse(0);

        long spanMs = millisBetween(window.get(0).getEventTimestamp(), window.get(window.size() - 1).getEventTimestamp());
        double eventsPerSecond = spanMs > 0 ? total * 1000.0 / spanMs : 0;

        return Optional.of(SystemMetrics.builder()
                .timestamp(clock.instant())
                .totalEvents(total)
                .successfulEvents(successful)
                .failedEvents(total - successful)
                .avgProcessingLatencyMs(Math.round(processing))
                .avgStorageLatencyMs(Math.round(storage))
                .avgTotalLatencyMs(Math.round(totalLatency))
                .errorRate((double) (total - successful) / total)
                .eventsPerSecond(eventsPerSecond)
                .build());
    }

    /**
     * Summary of the persisted metrics in [start, end]. Null bounds default to the last hour.
     */
    public SystemMetrics getAggregatedMetrics(Instant start, Instant end) {
        Instant to = end != null ? end : clock.instant();
        Instant from = start != null ? start : to.minus(Duration.ofHours(1));

        EventMetricRepository.MetricsAggregate row = metricRepository.aggregateBetween(from, to);
        long total = row != null && row.getTotalEvents() != null ? row.getTotalEvents() : 0;
        long failed = row != null && row.getFailedEvents() != null ? row.getFailedEvents() : 0;
        long successful = row != null && row.getSuccessfulEvents() != null ? row.getSuccessfulEvents() : 0;
        double span = row != null && row.getSpanSeconds() != null ? row.getSpanSeconds() : 0;

        return SystemMetrics.builder()
                .timestamp(clock.instant())
                .totalEvents(total)
                .successfulEvents(successful)
                .failedEvents(failed)
                .avgProcessingLatencyMs(row != null ? round(row.getAvgProcessingLatencyMs()) : 0)
                .avgStorageLatencyMs(row != null ? round(row.getAvgStorageLatencyMs()) : 0)
                .avgTotalLatencyMs(row != null ? round(row.getAvgTotalLatencyMs()) : 0)
                .errorRate(total > 0 ? (double) failed / total : 0)
                .eventsPerSecond(span > 0 ? total / span : 0)
                .build();
    }

    /**
     * Stop the periodic flush and write whatever is still buffered.
     */
    @PreDestroy
    public void shutdown() {
        stopped = true;
        int written = flush();
        if (written > 0) {
            log.info("Final metrics flush wrote {} metrics", written);
        }
    }

    private static long millisBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0;
        }
        return Duration.between(from, to).toMillis();
    }

    private static long round(Double value) {
        return value != null ? Math.round(value) : 0;
    }

    private static long nz(Long value) {
        return value != null ? value : 0;
    }
}
