package com.autopilot.scheduler.model;

public enum JobStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
