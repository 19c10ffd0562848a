package com.poolpulse.indexer.config;

import com.poolpulse.indexer.modules.chains.events.PoolEventListener;
import com.poolpulse.indexer.modules.chains.model.PoolTokens;
import com.poolpulse.indexer.modules.chains.rpc.TokenMetadataLoader;
import com.poolpulse.indexer.modules.monitoring.MetricsService;
import com.poolpulse.indexer.modules.processor.LiquidityProcessor;
import com.poolpulse.indexer.modules.processor.SwapProcessor;
import com.poolpulse.indexer.modules.scheduler.StatsScheduler;
import com.poolpulse.indexer.modules.snapshot.PoolSnapshotService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup and shutdown sequence of the indexer.
 */
@Component
public class IndexerBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(IndexerBootstrap.class);

    private final PoolPulseProperties properties;
    private final TokenMetadataLoader tokenMetadataLoader;
    private final SwapProcessor swapProcessor;
    private final LiquidityProcessor liquidityProcessor;
    private final PoolSnapshotService snapshotService;
    private final StatsScheduler statsScheduler;
    private final PoolEventListener eventListener;
    private final MetricsService metricsService;

    public IndexerBootstrap(PoolPulseProperties properties,
                            TokenMetadataLoader tokenMetadataLoader,
                            SwapProcessor swapProcessor,
                            LiquidityProcessor liquidityProcessor,
                            PoolSnapshotService snapshotService,
                            StatsScheduler statsScheduler,
                            PoolEventListener eventListener,
                            MetricsService metricsService) {
        this.properties = properties;
        this.tokenMetadataLoader = tokenMetadataLoader;
        this.swapProcessor = swapProcessor;
        this.liquidityProcessor = liquidityProcessor;
        this.snapshotService = snapshotService;
        this.statsScheduler = statsScheduler;
        this.eventListener = eventListener;
        this.metricsService = metricsService;
    }

    /**
     * Load the pool tokens, hand them to every consumer, start the scheduler and attach the pool.
     *
     * @throws IllegalStateException if no pool address is configured
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getBootstrap().isEnabled()) {
            logger.info("Indexer bootstrap disabled");
            return;
        }
        String pool = properties.getPool().getAddress();
        if (pool == null || pool.isBlank()) {
            throw new IllegalStateException("poolpulse.pool.address is not configured");
        }

        PoolTokens tokens = tokenMetadataLoader.loadPoolTokens(pool);
        swapProcessor.setTokenInfo(tokens);
        liquidityProcessor.setTokenInfo(tokens);
        snapshotService.setTokenInfo(tokens);

        statsScheduler.start();
        eventListener.attach(pool);
        logger.info("Indexer running for pool {}", pool);
    }

    @PreDestroy
    public void onShutdown() {
        logger.info("Shutting down indexer");
        eventListener.detach(null);
        statsScheduler.stop();
        metricsService.shutdown();
    }
}
