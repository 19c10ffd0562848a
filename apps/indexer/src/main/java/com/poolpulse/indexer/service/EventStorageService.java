package com.poolpulse.indexer.service;

import com.poolpulse.indexer.entity.DailyStats;
import com.poolpulse.indexer.entity.EventMetric;
import com.poolpulse.indexer.entity.HourlyStats;
import com.poolpulse.indexer.entity.IntegrityCheck;
import com.poolpulse.indexer.entity.LiquidityEvent;
import com.poolpulse.indexer.entity.PoolSnapshot;
import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.entity.UserStats;
import com.poolpulse.indexer.repository.DailyStatsRepository;
import com.poolpulse.indexer.repository.EventMetricRepository;
import com.poolpulse.indexer.repository.HourlyStatsRepository;
import com.poolpulse.indexer.repository.IntegrityCheckRepository;
import com.poolpulse.indexer.repository.LiquidityEventRepository;
import com.poolpulse.indexer.repository.PoolSnapshotRepository;
import com.poolpulse.indexer.repository.PriceHistoryRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import com.poolpulse.indexer.repository.UserStatsRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Single write path to the datastore. Every write is one upsert keyed on the row's natural key.
 *
 * <p>Raw events are inserted and silently ignored on key conflict. Aggregates overwrite their
 * non-key fields. Account rows are merged field by field inside the statement.
 */
@Service
public class EventStorageService {

    private static final Logger logger = LoggerFactory.getLogger(EventStorageService.class);

    private final SwapEventRepository swapRepository;
    private final LiquidityEventRepository liquidityRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final PoolSnapshotRepository snapshotRepository;
    private final HourlyStatsRepository hourlyStatsRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final UserStatsRepository userStatsRepository;
    private final EventMetricRepository metricRepository;
    private final IntegrityCheckRepository integrityCheckRepository;
    private final Tracer tracer;

    public EventStorageService(SwapEventRepository swapRepository,
                               LiquidityEventRepository liquidityRepository,
                               PriceHistoryRepository priceHistoryRepository,
                               PoolSnapshotRepository snapshotRepository,
                               HourlyStatsRepository hourlyStatsRepository,
                               DailyStatsRepository dailyStatsRepository,
                               UserStatsRepository userStatsRepository,
                               EventMetricRepository metricRepository,
                               IntegrityCheckRepository integrityCheckRepository,
                               Tracer tracer) {
        this.swapRepository = swapRepository;
        this.liquidityRepository = liquidityRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.snapshotRepository = snapshotRepository;
        this.hourlyStatsRepository = hourlyStatsRepository;
        this.dailyStatsRepository = dailyStatsRepository;
        this.userStatsRepository = userStatsRepository;
        this.metricRepository = metricRepository;
        this.integrityCheckRepository = integrityCheckRepository;
        this.tracer = tracer;
    }

    /**
     * @return true if a new row was written, false for a redelivered duplicate
     */
    @Transactional
    public boolean saveSwap(SwapEvent swap) {
        boolean inserted = traced("EventStorageService.saveSwap", swap.getTransactionHash(),
                () -> swapRepository.insertIgnoringDuplicate(swap)) > 0;
        if (!inserted) {
            logger.debug("Duplicate swap ignored: tx={}, logIndex={}", swap.getTransactionHash(), swap.getLogIndex());
        }
        return inserted;
    }

    @Transactional
    public boolean saveLiquidityEvent(LiquidityEvent event) {
        boolean inserted = traced("EventStorageService.saveLiquidityEvent", event.getTransactionHash(),
                () -> liquidityRepository.insertIgnoringDuplicate(event)) > 0;
        if (!inserted) {
            logger.debug("Duplicate {} ignored: tx={}, logIndex={}",
                    event.getEventType(), event.getTransactionHash(), event.getLogIndex());
        }
        return inserted;
    }

    @Transactional
    public void savePricePoint(Instant timestamp, long blockNumber, BigDecimal price) {
        traced("EventStorageService.savePricePoint", null,
                () -> priceHistoryRepository.upsert(timestamp, blockNumber, price));
    }

    @Transactional
    public void saveSnapshot(PoolSnapshot snapshot) {
        traced("EventStorageService.saveSnapshot", null, () -> snapshotRepository.upsert(snapshot));
    }

    @Transactional
    public void saveHourlyStats(HourlyStats stats) {
        traced("EventStorageService.saveHourlyStats", null, () -> hourlyStatsRepository.upsert(stats));
    }

    @Transactional
    public void saveDailyStats(DailyStats stats) {
        traced("EventStorageService.saveDailyStats", null, () -> dailyStatsRepository.upsert(stats));
    }

    /**
     * Merge one account activity atomically. {@code activityRow} is the activity applied to an
     * empty account; {@code usdValue} drives the classification of an existing row.
     */
    @Transactional
    public void mergeUserActivity(UserStats activityRow, BigDecimal usdValue,
                                  BigDecimal whaleUsd, BigDecimal retailUsd) {
        traced("EventStorageService.mergeUserActivity", null,
                () -> userStatsRepository.mergeActivity(activityRow, usdValue, whaleUsd, retailUsd));
    }

    @Transactional
    public void replaceUserStats(List<UserStats> rows) {
        traced("EventStorageService.replaceUserStats", null, () -> {
            int written = 0;
            for (UserStats row : rows) {
                written += userStatsRepository.replace(row);
            }
            return written;
        });
    }

    @Transactional
    public void saveMetrics(List<EventMetric> metrics) {
        traced("EventStorageService.saveMetrics", null, () -> metricRepository.saveAll(metrics).size());
    }

    @Transactional
    public void saveIntegrityCheck(IntegrityCheck check) {
        traced("EventStorageService.saveIntegrityCheck", null, () -> {
            integrityCheckRepository.save(check);
            return 1;
        });
    }

    private int traced(String spanName, String txHash, Supplier<Integer> write) {
        Span span = tracer.spanBuilder(spanName)
                .setAttribute("tx.hash", txHash != null ? txHash : "")
                .startSpan();
        try {
            return write.get();
        } catch (RuntimeException e) {
            logger.error("{} failed: {}", spanName, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
