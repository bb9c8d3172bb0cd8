package com.whereq.conductor.model;

public enum ScheduleInterval {
    IMMEDIATE,
    FUTURE,
    HOURLY,
    DAILY,
    WEEKLY,
    CUSTOM;

    public boolean isOneOff() {
        return this == IMMEDIATE || this == FUTURE;
    }
}
