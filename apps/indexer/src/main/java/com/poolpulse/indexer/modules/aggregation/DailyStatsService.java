package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.DailyStats;
import com.poolpulse.indexer.entity.SwapEvent;
import com.poolpulse.indexer.repository.DailyStatsRepository;
import com.poolpulse.indexer.repository.PoolSnapshotRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Daily rollup: hourly fields plus new addresses, whale count and pool TVL.
 *
 * <p>New addresses are counted against the previous day only, so an account that skips a
 * day is counted as new again when it returns.
 */
@Slf4j
@Service
public class DailyStatsService {

    private final SwapEventRepository swapRepository;
    private final DailyStatsRepository dailyStatsRepository;
    private final PoolSnapshotRepository snapshotRepository;
    private final PoolPulseProperties properties;

    public DailyStatsService(SwapEventRepository swapRepository,
                             DailyStatsRepository dailyStatsRepository,
                             PoolSnapshotRepository snapshotRepository,
                             PoolPulseProperties properties) {
        this.swapRepository = swapRepository;
        this.dailyStatsRepository = dailyStatsRepository;
        this.snapshotRepository = snapshotRepository;
        this.properties = properties;
    }

    public DailyStats calculateDailyStats(LocalDate date) {
        ZoneId zone = ZoneId.of(properties.getAggregation().getZone());
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();

        List<SwapEvent> swaps = swapRepository.findPricedBetween(dayStart, dayEnd);
        DailyStats stats = new DailyStats();
        stats.setDate(date);
        if (swaps.isEmpty()) {
            log.warn("No swaps on {}", date);
            return stats;
        }

        BucketRollup rollup = BucketRollup.of(swaps,
                properties.getAggregation().getFeeRate(),
                properties.getAggregation().getWhaleTransactionUsd());

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
        stats.setNewAddresses(rollup.countNewAddresses(previousDayAddresses(date, zone)));
        stats.setWhaleTransactions(rollup.getWhaleTransactions());
        stats.setLargestTransactionUsd(rollup.getLargestTransactionUsd());

        PoolSnapshotRepository.TvlSummary tvl = snapshotRepository.summarizeTvl(dayStart, dayEnd);
        if (tvl != null) {
            stats.setAvgTvlUsd(tvl.getAvgTvlUsd());
            stats.setEndTvlUsd(tvl.getEndTvlUsd());
        }

        log.info("Daily stats for {}: transactions={}, volumeUsd={}, newAddresses={}, whales={}",
                date, stats.getTotalTransactions(), stats.getVolumeUsd(),
                stats.getNewAddresses(), stats.getWhaleTransactions());
        return stats;
    }

    /**
     * Close of the stored previous day, else the last swap price before the day starts.
     */
    public Optional<BigDecimal> previousClosePrice(LocalDate date) {
        Optional<BigDecimal> stored = dailyStatsRepository.findByDate(date.minusDays(1))
                .map(DailyStats::getClosePrice)
                .filter(price -> price.signum() > 0);
        if (stored.isPresent()) {
            return stored;
        }
        ZoneId zone = ZoneId.of(properties.getAggregation().getZone());
        return swapRepository.findLatestPriceBefore(date.atStartOfDay(zone).toInstant());
    }

    private Set<String> previousDayAddresses(LocalDate date, ZoneId zone) {
        Instant start = date.minusDays(1).atStartOfDay(zone).toInstant();
        Instant end = date.atStartOfDay(zone).toInstant();
        Set<String> addresses = new HashSet<>();
        for (SwapEvent swap : swapRepository.findBetween(start, end)) {
            if (swap.getSender() != null) {
                addresses.add(swap.getSender());
            }
            if (swap.getRecipient() != null) {
                addresses.add(swap.getRecipient());
            }
        }
        return addresses;
    }
}
