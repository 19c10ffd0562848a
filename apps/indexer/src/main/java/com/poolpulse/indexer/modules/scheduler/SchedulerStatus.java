package com.poolpulse.indexer.modules.scheduler;

import lombok.Value;

import java.time.Instant;

@Value
public class SchedulerStatus {
    SchedulerState state;
    Instant nextHourlyRun;
    Instant nextDailyRun;

    public boolean isRunning() {
        return state == SchedulerState.RUNNING;
    }
}
