package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.HourlyStats;
import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.repository.HourlyStatsRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hourly OHLC, volume and liquidity rollup recomputed from stored swaps.
 */
@Slf4j
@Service
public class HourlyStatsService {

    private static final Duration HOUR = Duration.ofHours(1);

    private final SwapEventRepository swapRepository;
    private final HourlyStatsRepository hourlyStatsRepository;
    private final PoolPulseProperties properties;

    public HourlyStatsService(SwapEventRepository swapRepository,
                              HourlyStatsRepository hourlyStatsRepository,
                              PoolPulseProperties properties) {
        this.swapRepository = swapRepository;
        this.hourlyStatsRepository = hourlyStatsRepository;
        this.properties = properties;
    }

    /**
     * Roll up [hourStart, hourStart + 1h). A bucket without swaps is all zeros.
     */
    public HourlyStats calculateHourlyStats(Instant hourStart) {
        Instant hourEnd = hourStart.plus(HOUR);
        List<SwapEvent> swaps = swapRepository.findPricedBetween(hourStart, hourEnd);
        if (swaps.isEmpty()) {
            log.warn("No swaps in hour starting {}", hourStart);
        }

        BucketRollup rollup = BucketRollup.of(swaps,
                properties.getAggregation().getFeeRate(),
                properties.getAggregation().getWhaleTransactionUsd());

        HourlyStats stats = new HourlyStats();
        stats.setHourStart(hourStart);
        stats.setHourEnd(hourEnd);
        stats.setOpenPrice(rollup.getOpenPrice());
        stats.setHighPrice(rollup.getHighPrice());
        stats.setLowPrice(rollup.getLowPrice());
        stats.setClosePrice(rollup.getClosePrice());
        stats.setTotalTransactions(rollup.getTotalTransactions());
        stats.setBuyTransactions(rollup.getBuyTransactions());
        stats.setSellTransactions(rollup.getSellTransactions());
        stats.setVolumeToken0(rollup.getVolumeToken0());
        stats.setVolumeToken1(rollup.getVolumeToken1());
        stats.setVolumeUsd(rollup.getVolumeUsd());
        stats.setFeesToken0(rollup.getFeesToken0());
        stats.setFeesToken1(rollup.getFeesToken1());
        stats.setFeesUsd(rollup.getFeesUsd());
        stats.setUniqueAddresses(rollup.getUniqueAddresses());
        stats.setUniqueSenders(rollup.getUniqueSenders());
        stats.setAvgLiquidity(rollup.getAvgLiquidity());
        stats.setMinLiquidity(rollup.getMinLiquidity());
        stats.setMaxLiquidity(rollup.getMaxLiquidity());

        log.info("Hourly stats for {}: transactions={}, volumeUsd={}, OHLC=[{}, {}, {}, {}]",
                hourStart, stats.getTotalTransactions(), stats.getVolumeUsd(),
                stats.getOpenPrice(), stats.getHighPrice(), stats.getLowPrice(), stats.getClosePrice());
        return stats;
    }

    /**
     * Close of the stored previous hour, else the last swap price before {@code hourStart}.
     */
    public Optional<BigDecimal> previousClosePrice(Instant hourStart) {
        Optional<BigDecimal> stored = hourlyStatsRepository.findByHourStart(hourStart.minus(HOUR))
                .map(HourlyStats::getClosePrice)
                .filter(price -> price.signum() > 0);
        if (stored.isPresent()) {
            return stored;
        }
        return swapRepository.findLatestPriceBefore(hourStart);
    }
}
