package com.tempo.scheduler;

public enum SchedulerState {
    CREATED,
    RUNNING,
    STOPPED
}
