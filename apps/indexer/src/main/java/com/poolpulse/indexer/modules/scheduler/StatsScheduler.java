package com.poolpulse.indexer.modules.scheduler;

import com.poolpulse.indexer.config.PoolPulseProperties;
import com.poolpulse.indexer.entity.DailyStats;
import com.poolpulse.indexer.entity.HourlyStats;
import com.poolpulse.indexer.entity.PriceBucket;
import com.poolpulse.indexer.modules.aggregation.DailyStatsService;
import com.poolpulse.indexer.modules.aggregation.HourlyStatsService;
import com.poolpulse.indexer.modules.monitoring.IntegrityService;
import com.poolpulse.indexer.modules.snapshot.PoolSnapshotService;
import com.poolpulse.indexer.service.EventStorageService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Runs the hourly and daily jobs on wall-clock boundaries.
 *
 * <p>Each job is first armed as a one-shot at the next boundary; that run re-arms the job at a
 * fixed rate of one period, so the schedule starts exactly on the boundary. Stopping cancels
 * both timers without interrupting a job in flight.
 */
@Component
public class StatsScheduler {

    private static final Logger logger = LoggerFactory.getLogger(StatsScheduler.class);
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final TaskScheduler taskScheduler;
    private final PoolSnapshotService snapshotService;
    private final HourlyStatsService hourlyStatsService;
    private final DailyStatsService dailyStatsService;
    private final IntegrityService integrityService;
    private final EventStorageService storageService;
    private final Clock clock;
    private final ZoneId zone;
    private final Tracer tracer;

    private SchedulerState state = SchedulerState.IDLE;
    private long generation;
    private ScheduledFuture<?> hourlyTimer;
    private ScheduledFuture<?> dailyTimer;
    private Instant nextHourlyRun;
    private Instant nextDailyRun;

    public StatsScheduler(@Qualifier("statsTaskScheduler") TaskScheduler taskScheduler,
                          PoolSnapshotService snapshotService,
                          HourlyStatsService hourlyStatsService,
                          DailyStatsService dailyStatsService,
                          IntegrityService integrityService,
                          EventStorageService storageService,
                          PoolPulseProperties properties,
                          Clock clock,
                          Tracer tracer) {
        this.taskScheduler = taskScheduler;
        this.snapshotService = snapshotService;
        this.hourlyStatsService = hourlyStatsService;
        this.dailyStatsService = dailyStatsService;
        this.integrityService = integrityService;
        this.storageService = storageService;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getAggregation().getZone());
        this.tracer = tracer;
    }

    /**
     * Arm both jobs. Calling start while running is a no-op; calling it after stop restarts.
     */
    public synchronized void start() {
        if (state == SchedulerState.RUNNING) {
            logger.warn("Stats scheduler already running");
            return;
        }
        Instant now = clock.instant();
        Instant hourBoundary = nextHourBoundary(now);
        Instant dayBoundary = nextDayBoundary(now);
        long armed = ++generation;
        nextHourlyRun = hourBoundary;
        nextDailyRun = dayBoundary;

        hourlyTimer = taskScheduler.schedule(() -> firstRun(true, hourBoundary, armed), hourBoundary);
        dailyTimer = taskScheduler.schedule(() -> firstRun(false, dayBoundary, armed), dayBoundary);
        state = SchedulerState.RUNNING;
        logger.info("Stats scheduler started: first hourly run at {}, first daily run at {}",
                nextHourlyRun, nextDailyRun);
    }

    public synchronized void stop() {
        if (state != SchedulerState.RUNNING) {
            return;
        }
        cancel(hourlyTimer);
        cancel(dailyTimer);
        hourlyTimer = null;
        dailyTimer = null;
        nextHourlyRun = null;
        nextDailyRun = null;
        state = SchedulerState.STOPPED;
        logger.info("Stats scheduler stopped");
    }

    public synchronized SchedulerStatus getStatus() {
        return new SchedulerStatus(state, nextHourlyRun, nextDailyRun);
    }

    /**
     * Snapshot the pool, then roll up the hour before the current one.
     */
    public void runHourlyNow() {
        Instant currentHour = truncateToHour(clock.instant());
        runHourlyJob(currentHour.minus(HOUR), currentHour);
    }

    /**
     * Roll up yesterday, then run the integrity checks.
     */
    public void runDailyNow() {
        runDailyJob(LocalDate.ofInstant(clock.instant(), zone).minusDays(1));
    }

    void runHourlyJob(Instant hourStart, Instant snapshotTime) {
        Span span = tracer.spanBuilder("StatsScheduler.hourlyJob")
                .setAttribute("hour.start", hourStart.toString())
                .startSpan();
        try {
            try {
                snapshotService.createSnapshot(snapshotTime);
            } catch (RuntimeException e) {
                logger.error("Pool snapshot failed: {}", e.getMessage(), e);
                span.recordException(e);
            }

            HourlyStats stats = hourlyStatsService.calculateHourlyStats(hourStart);
            applyCarryForward(stats, () -> hourlyStatsService.previousClosePrice(hourStart));
            storageService.saveHourlyStats(stats);
            logger.info("Hourly job done for {}", hourStart);
        } catch (Exception e) {
            logger.error("Hourly job failed for {}: {}", hourStart, e.getMessage(), e);
            span.recordException(e);
        } finally {
            span.end();
        }
    }

    void runDailyJob(LocalDate date) {
        Span span = tracer.spanBuilder("StatsScheduler.dailyJob")
                .setAttribute("date", date.toString())
                .startSpan();
        try {
            try {
                DailyStats stats = dailyStatsService.calculateDailyStats(date);
                applyCarryForward(stats, () -> dailyStatsService.previousClosePrice(date));
                storageService.saveDailyStats(stats);
                logger.info("Daily stats stored for {}", date);
            } catch (RuntimeException e) {
                logger.error("Daily rollup failed for {}: {}", date, e.getMessage(), e);
                span.recordException(e);
            }
            integrityService.checkDataIntegrity();
        } catch (Exception e) {
            logger.error("Daily job failed for {}: {}", date, e.getMessage(), e);
            span.recordException(e);
        } finally {
            span.end();
        }
    }

    static void applyCarryForward(PriceBucket bucket, Supplier<Optional<BigDecimal>> previousClose) {
        if (bucket.getTotalTransactions() != null && bucket.getTotalTransactions() > 0) {
            return;
        }
        previousClose.get().ifPresent(bucket::carryForward);
    }

    private void firstRun(boolean hourly, Instant boundary, long armed) {
        Instant next = followingBoundary(hourly, boundary);
        runAtBoundary(hourly, boundary, next);
        synchronized (this) {
            if (state != SchedulerState.RUNNING || generation != armed) {
                return;
            }
            BoundaryRun repeating = new BoundaryRun(hourly, next);
            if (hourly) {
                hourlyTimer = taskScheduler.scheduleAtFixedRate(repeating, next, HOUR);
            } else {
                dailyTimer = taskScheduler.scheduleAtFixedRate(repeating, next, DAY);
            }
        }
    }

    /**
     * Run the job for the boundary the timer was armed for. The bucket never depends on when
     * the timer actually fired relative to the wall clock.
     */
    private void runAtBoundary(boolean hourly, Instant boundary, Instant next) {
        if (hourly) {
            runHourlyJob(boundary.minus(HOUR), boundary);
        } else {
            runDailyJob(LocalDate.ofInstant(boundary, zone).minusDays(1));
        }
        synchronized (this) {
            if (state == SchedulerState.RUNNING) {
                if (hourly) {
                    nextHourlyRun = next;
                } else {
                    nextDailyRun = next;
                }
            }
        }
    }

    Instant followingBoundary(boolean hourly, Instant boundary) {
        return hourly ? boundary.plus(HOUR) : nextDayBoundary(boundary);
    }

    /**
     * Fixed-rate run that advances its own boundary by one period per execution.
     * Executions of one fixed-rate task never overlap.
     */
    private final class BoundaryRun implements Runnable {

        private final boolean hourly;
        private Instant boundary;

        private BoundaryRun(boolean hourly, Instant firstBoundary) {
            this.hourly = hourly;
            this.boundary = firstBoundary;
        }

        @Override
        public void run() {
            Instant current = boundary;
            boundary = followingBoundary(hourly, current);
            runAtBoundary(hourly, current, boundary);
        }
    }

    private Instant truncateToHour(Instant instant) {
        return ZonedDateTime.ofInstant(instant, zone).truncatedTo(ChronoUnit.HOURS).toInstant();
    }

    Instant nextHourBoundary(Instant now) {
        return truncateToHour(now).plus(HOUR);
    }

    Instant nextDayBoundary(Instant now) {
        return LocalDate.ofInstant(now, zone).plusDays(1).atStartOfDay(zone).toInstant();
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
