package com.poolpulse.indexer.modules.aggregation;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.HourlyStats;
import com.poolpulse.indexer.modules.chains.model.SwapType;
import com.poolpulse.indexer.repository.HourlyStatsRepository;
import com.poolpulse.indexer.repository.SwapEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HourlyStatsServiceTest {

    private static final Instant HOUR = Instant.parse("2024-03-01T10:00:00Z");

    private SwapEventRepository swapRepository;
    private HourlyStatsRepository hourlyStatsRepository;
    private HourlyStatsService service;

    @BeforeEach
    void setUp() {
        swapRepository = mock(SwapEventRepository.class);
        hourlyStatsRepository = mock(HourlyStatsRepository.class);
        service = new HourlyStatsService(swapRepository, hourlyStatsRepository, new PoolPulseProperties());
    }

    @Test
    void rollsUpSwapsOfTheHour() {
        when(swapRepository.findPricedBetween(HOUR, HOUR.plusSeconds(3600))).thenReturn(List.of(
                BucketRollupTest.swap("3.40", SwapType.BUY, "1000", "0xa", "0xb", 100),
                BucketRollupTest.swap("3.45", SwapType.SELL, "3000", "0xc", "0xb", 200)));

        HourlyStats stats = service.calculateHourlyStats(HOUR);

        assertEquals(HOUR, stats.getHourStart());
        assertEquals(HOUR.plusSeconds(3600), stats.getHourEnd());
        assertEquals(new BigDecimal("3.40"), stats.getOpenPrice());
        assertEquals(new BigDecimal("3.45"), stats.getClosePrice());
        assertEquals(2, stats.getTotalTransactions());
        assertEquals(0, new BigDecimal("2").compareTo(stats.getFeesUsd()));
        assertEquals(3, stats.getUniqueAddresses());
        assertEquals(2, stats.getUniqueSenders());
    }

    @Test
    void emptyHourIsZero() {
        when(swapRepository.findPricedBetween(HOUR, HOUR.plusSeconds(3600))).thenReturn(List.of());

        HourlyStats stats = service.calculateHourlyStats(HOUR);

        assertEquals(0, stats.getTotalTransactions());
        assertEquals(BigDecimal.ZERO, stats.getClosePrice());
    }

    @Test
    void previousCloseComesFromStoredHour() {
        HourlyStats previous = new HourlyStats();
        previous.setClosePrice(new BigDecimal("3.45"));
        when(hourlyStatsRepository.findByHourStart(HOUR.minusSeconds(3600))).thenReturn(Optional.of(previous));

        assertEquals(Optional.of(new BigDecimal("3.45")), service.previousClosePrice(HOUR));
        verify(swapRepository, never()).findLatestPriceBefore(HOUR);
    }

    @Test
    void previousCloseFallsBackToLastSwapPrice() {
        HourlyStats zeroRow = new HourlyStats();
        when(hourlyStatsRepository.findByHourStart(HOUR.minusSeconds(3600))).thenReturn(Optional.of(zeroRow));
        when(swapRepository.findLatestPriceBefore(HOUR)).thenReturn(Optional.of(new BigDecimal("3.30")));

        assertEquals(Optional.of(new BigDecimal("3.30")), service.previousClosePrice(HOUR));
    }
}
