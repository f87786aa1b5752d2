package com.autopilot.connector.model;

import lombok.Builder;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

@Builder
public record TaskRecord(
        String id,
        String title,
        String assigneeName,
        String assigneeEmail,
        TaskStatus status,
        LocalDateTime createdAt,
        LocalDateTime dueAt,
        LocalDateTime completedAt
) {

    public enum TaskStatus {
        TODO, IN_PROGRESS, DONE
    }

    public boolean isDone() {
        return status == TaskStatus.DONE;
    }

    /**
     * Время выполнения в днях, только для завершенных задач с известными датами.
     */
    public Optional<Double> cycleTimeDays() {
        if (!isDone() || createdAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(createdAt, completedAt).toHours() / 24.0);
    }
}
