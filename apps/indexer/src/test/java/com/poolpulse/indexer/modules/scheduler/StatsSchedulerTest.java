package com.poolpulse.indexer.modules.scheduler;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.DailyStats;
import com.poolpulse.indexer.entity.HourlyStats;
import com.poolpulse.indexer.modules.aggregation.DailyStatsService;
import com.poolpulse.indexer.modules.aggregation.HourlyStatsService;
import com.poolpulse.indexer.modules.monitoring.IntegrityService;
import com.poolpulse.indexer.modules.snapshot.PoolSnapshotService;
import com.poolpulse.indexer.service.EventStorageService;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatsSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:17:42Z");
    private static final Instant NEXT_HOUR = Instant.parse("2024-03-01T11:00:00Z");
    private static final Instant NEXT_DAY = Instant.parse("2024-03-02T00:00:00Z");

    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private PoolSnapshotService snapshotService;
    private HourlyStatsService hourlyStatsService;
    private DailyStatsService dailyStatsService;
    private IntegrityService integrityService;
    private EventStorageService storageService;
    private StatsScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        snapshotService = mock(PoolSnapshotService.class);
        hourlyStatsService = mock(HourlyStatsService.class);
        dailyStatsService = mock(DailyStatsService.class);
        integrityService = mock(IntegrityService.class);
        storageService = mock(EventStorageService.class);
        scheduler = new StatsScheduler(taskScheduler, snapshotService, hourlyStatsService, dailyStatsService,
                integrityService, storageService, new PoolPulseProperties(), Clock.fixed(NOW, ZoneOffset.UTC),
                OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    void boundariesAreAlignedToTheClock() {
        assertEquals(NEXT_HOUR, scheduler.nextHourBoundary(NOW));
        assertEquals(NEXT_DAY, scheduler.nextDayBoundary(NOW));
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), scheduler.nextHourBoundary(NEXT_HOUR));
    }

    @Test
    void startArmsBothJobsOnceAndStopCancelsThem() {
        scheduler.start();
        scheduler.start();

        SchedulerStatus status = scheduler.getStatus();
        assertTrue(status.isRunning());
        assertEquals(NEXT_HOUR, status.getNextHourlyRun());
        assertEquals(NEXT_DAY, status.getNextDailyRun());
        verify(taskScheduler).schedule(any(Runnable.class), eq(NEXT_HOUR));
        verify(taskScheduler).schedule(any(Runnable.class), eq(NEXT_DAY));

        scheduler.stop();

        verify(future, times(2)).cancel(false);
        status = scheduler.getStatus();
        assertEquals(SchedulerState.STOPPED, status.getState());
        assertFalse(status.isRunning());
        assertNull(status.getNextHourlyRun());
    }

    @Test
    void firstHourlyRunReArmsAtFixedRate() {
        when(hourlyStatsService.calculateHourlyStats(any())).thenReturn(new HourlyStats());
        scheduler.start();
        ArgumentCaptor<Runnable> firstRun = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(firstRun.capture(), eq(NEXT_HOUR));

        firstRun.getValue().run();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NEXT_HOUR.plus(Duration.ofHours(1))), eq(Duration.ofHours(1)));
        verify(storageService).saveHourlyStats(any());
    }

    @Test
    void timersRollUpTheBucketTheyWereArmedForRegardlessOfTheClock() {
        // The clock still reads 10:17 when the 11:00 timer fires, as with an early or late tick.
        when(hourlyStatsService.calculateHourlyStats(any())).thenReturn(new HourlyStats());
        scheduler.start();
        ArgumentCaptor<Runnable> firstRun = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(firstRun.capture(), eq(NEXT_HOUR));

        firstRun.getValue().run();

        verify(hourlyStatsService).calculateHourlyStats(Instant.parse("2024-03-01T10:00:00Z"));
        verify(snapshotService).createSnapshot(NEXT_HOUR);

        ArgumentCaptor<Runnable> repeating = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(repeating.capture(), any(Instant.class), any(Duration.class));
        repeating.getValue().run();
        repeating.getValue().run();

        verify(hourlyStatsService).calculateHourlyStats(Instant.parse("2024-03-01T11:00:00Z"));
        verify(hourlyStatsService).calculateHourlyStats(Instant.parse("2024-03-01T12:00:00Z"));
        verify(snapshotService).createSnapshot(Instant.parse("2024-03-01T13:00:00Z"));
        assertEquals(Instant.parse("2024-03-01T14:00:00Z"), scheduler.getStatus().getNextHourlyRun());
    }

    @Test
    void dailyTimerRollsUpTheDayBeforeItsBoundary() {
        when(dailyStatsService.calculateDailyStats(any())).thenReturn(new DailyStats());
        scheduler.start();
        ArgumentCaptor<Runnable> firstRun = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(firstRun.capture(), eq(NEXT_DAY));

        firstRun.getValue().run();

        verify(dailyStatsService).calculateDailyStats(LocalDate.of(2024, 3, 1));
        ArgumentCaptor<Runnable> repeating = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(repeating.capture(),
                eq(Instant.parse("2024-03-03T00:00:00Z")), eq(Duration.ofDays(1)));

        repeating.getValue().run();

        verify(dailyStatsService).calculateDailyStats(LocalDate.of(2024, 3, 2));
        verify(integrityService, times(2)).checkDataIntegrity();
    }

    @Test
    void firstRunAfterStopDoesNotReArm() {
        when(hourlyStatsService.calculateHourlyStats(any())).thenReturn(new HourlyStats());
        scheduler.start();
        ArgumentCaptor<Runnable> firstRun = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(firstRun.capture(), eq(NEXT_HOUR));
        scheduler.stop();

        firstRun.getValue().run();

        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void emptyHourCarriesPreviousCloseForward() {
        Instant hourStart = Instant.parse("2024-03-01T09:00:00Z");
        when(hourlyStatsService.calculateHourlyStats(hourStart)).thenReturn(new HourlyStats());
        when(hourlyStatsService.previousClosePrice(hourStart)).thenReturn(Optional.of(new BigDecimal("3.45")));

        scheduler.runHourlyNow();

        ArgumentCaptor<HourlyStats> captor = ArgumentCaptor.forClass(HourlyStats.class);
        verify(storageService).saveHourlyStats(captor.capture());
        HourlyStats stats = captor.getValue();
        assertEquals(new BigDecimal("3.45"), stats.getOpenPrice());
        assertEquals(new BigDecimal("3.45"), stats.getHighPrice());
        assertEquals(new BigDecimal("3.45"), stats.getLowPrice());
        assertEquals(new BigDecimal("3.45"), stats.getClosePrice());
        verify(snapshotService).createSnapshot(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void snapshotFailureStillRollsUpTheHour() {
        when(snapshotService.createSnapshot(any())).thenThrow(new IllegalStateException("Token info not set"));
        when(hourlyStatsService.calculateHourlyStats(any())).thenReturn(new HourlyStats());

        scheduler.runHourlyNow();

        verify(storageService).saveHourlyStats(any());
    }

    @Test
    void activeBucketKeepsItsOwnPrices() {
        HourlyStats stats = new HourlyStats();
        stats.setTotalTransactions(2);
        stats.setClosePrice(new BigDecimal("3.10"));

        StatsScheduler.applyCarryForward(stats, () -> Optional.of(new BigDecimal("3.45")));

        assertEquals(new BigDecimal("3.10"), stats.getClosePrice());
    }

    @Test
    void dailyJobRollsUpYesterdayThenChecksIntegrity() {
        LocalDate yesterday = LocalDate.of(2024, 2, 29);
        when(dailyStatsService.calculateDailyStats(yesterday)).thenThrow(new IllegalStateException("db down"));

        scheduler.runDailyNow();

        verify(storageService, never()).saveDailyStats(any(DailyStats.class));
        verify(integrityService).checkDataIntegrity();
    }
}
