package com.autopilot.scheduler.model;

public enum TriggerKind {
    SCHEDULED,
    CATCH_UP,
    MANUAL
}
