package com.autopilot.action.service;

import java.time.Duration;

/**
 * Пауза между попытками. В тестах подменяется, чтобы не ждать реальное время.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;
}
