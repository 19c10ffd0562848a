package com.poolpulse.indexer.modules.pipeline;

import com.poolpulse.indexer.entity.EventMetric;
import com.poolpulse.indexer.entity.LiquidityEvent;
import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.modules.aggregation.UserStatsService;
import com.poolpulse.indexer.modules.chains.events.PoolEventHandler;
import com.poolpulse.indexer.modules.chains.model.LogMetadata;
import com.poolpulse.indexer.modules.chains.model.RawLiquidityEvent;
import com.poolpulse.indexer.modules.chains.model.RawSwapEvent;
import com.poolpulse.indexer.modules.monitoring.MetricsService;
import com.poolpulse.indexer.modules.processor.LiquidityProcessor;
import com.poolpulse.indexer.modules.processor.SwapProcessor;
import com.poolpulse.indexer.service.EventStorageService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-event flow: process, store the raw row, store the price point, update account stats,
 * record the metric. A failing event is logged and recorded as a failed metric; it never
 * reaches the subscription.
 */
@Component
public class EventPipeline implements PoolEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(EventPipeline.class);

    private final SwapProcessor swapProcessor;
    private final LiquidityProcessor liquidityProcessor;
    private final EventStorageService storageService;
    private final UserStatsService userStatsService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Tracer tracer;

    public EventPipeline(SwapProcessor swapProcessor,
                         LiquidityProcessor liquidityProcessor,
                         EventStorageService storageService,
                         UserStatsService userStatsService,
                         MetricsService metricsService,
                         Clock clock,
                         Tracer tracer) {
        this.swapProcessor = swapProcessor;
        this.liquidityProcessor = liquidityProcessor;
        this.storageService = storageService;
        this.userStatsService = userStatsService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.tracer = tracer;
    }

    @Override
    public void onSwap(RawSwapEvent event) {
        LogMetadata metadata = event.getMetadata();
        Span span = startSpan("EventPipeline.onSwap", metadata);
        Instant processingStart = clock.instant();
        Instant blockTime = null;
        try {
            SwapEvent swap = swapProcessor.process(event);
            blockTime = swap.getBlockTimestamp();
            Instant processingEnd = clock.instant();

            Instant storageStart = clock.instant();
            if (storageService.saveSwap(swap)) {
                if (swap.getPriceToken0() != null) {
                    storePricePoint(swap);
                }
                updateAccounts(() -> userStatsService.updateFromSwap(swap), metadata);
            }
            Instant storageEnd = clock.instant();

            metricsService.recordEvent(metric("swap", metadata, blockTime,
                    processingStart, processingEnd, storageStart, storageEnd, null));
            logger.info("Swap stored: tx={}, logIndex={}, type={}, usd={}",
                    metadata.getTransactionHash(), metadata.getLogIndex(), swap.getSwapType(), swap.getUsdValue());
        } catch (Exception e) {
            fail("swap", metadata, blockTime, processingStart, e, span);
        } finally {
            span.end();
        }
    }

    @Override
    public void onLiquidityEvent(RawLiquidityEvent event) {
        LogMetadata metadata = event.getMetadata();
        String type = event.getType().name().toLowerCase();
        Span span = startSpan("EventPipeline.onLiquidityEvent", metadata);
        Instant processingStart = clock.instant();
        Instant blockTime = null;
        try {
            LiquidityEvent liquidityEvent = liquidityProcessor.process(event);
            blockTime = liquidityEvent.getBlockTimestamp();
            Instant processingEnd = clock.instant();

            Instant storageStart = clock.instant();
            if (storageService.saveLiquidityEvent(liquidityEvent)) {
                updateAccounts(() -> userStatsService.updateFromLiquidityEvent(liquidityEvent), metadata);
            }
            Instant storageEnd = clock.instant();

            metricsService.recordEvent(metric(type, metadata, blockTime,
                    processingStart, processingEnd, storageStart, storageEnd, null));
            logger.info("{} stored: tx={}, logIndex={}, usd={}", event.getType(),
                    metadata.getTransactionHash(), metadata.getLogIndex(), liquidityEvent.getUsdValue());
        } catch (Exception e) {
            fail(type, metadata, blockTime, processingStart, e, span);
        } finally {
            span.end();
        }
    }

    private void storePricePoint(SwapEvent swap) {
        try {
            storageService.savePricePoint(swap.getBlockTimestamp(), swap.getBlockNumber(), swap.getPriceToken0());
        } catch (RuntimeException e) {
            logger.warn("Price point not stored for tx {}: {}", swap.getTransactionHash(), e.getMessage());
        }
    }

    private void updateAccounts(Runnable update, LogMetadata metadata) {
        try {
            update.run();
        } catch (RuntimeException e) {
            logger.error("Account stats update failed for tx {}: {}", metadata.getTransactionHash(), e.getMessage(), e);
        }
    }

    private void fail(String type, LogMetadata metadata, Instant blockTime, Instant processingStart,
                      Exception e, Span span) {
        logger.error("Failed to process {} tx={}, logIndex={}: {}",
                type, metadata.getTransactionHash(), metadata.getLogIndex(), e.getMessage(), e);
        span.recordException(e);
        Instant now = clock.instant();
        metricsService.recordEvent(metric(type, metadata, blockTime, processingStart, now, now, now, e));
    }

    private EventMetric metric(String type, LogMetadata metadata, Instant blockTime,
                               Instant processingStart, Instant processingEnd,
                               Instant storageStart, Instant storageEnd, Exception error) {
        return EventMetric.builder()
                .eventType(type)
                .eventTimestamp(blockTime != null ? blockTime : processingStart)
                .transactionHash(metadata.getTransactionHash())
                .blockNumber(metadata.getBlockNumber())
                .processingStart(processingStart)
                .processingEnd(processingEnd)
                .storageStart(storageStart)
                .storageEnd(storageEnd)
                .success(error == null)
                .errorMessage(error != null ? String.valueOf(error.getMessage()) : null)
                .build();
    }

    private Span startSpan(String name, LogMetadata metadata) {
        return tracer.spanBuilder(name)
                .setAttribute("tx.hash", metadata.getTransactionHash())
                .setAttribute("block.number", metadata.getBlockNumber())
                .setAttribute("log.index", metadata.getLogIndex())
                .startSpan();
    }
}
