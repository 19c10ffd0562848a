package com.poolpulse.indexer.modules.scheduler;

public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPED
}
