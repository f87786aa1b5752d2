package com.autopilot.agent.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Итог одного запуска агента. Успех и длительность вычисляются, а не хранятся.
 */
public record AgentRunResult(
        String agent,
        UUID tenantId,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        List<Map<String, Object>> actionsTaken,
        String kpiName,
        double kpiValue,
        List<String> errors
) {

    public AgentRunResult {
        actionsTaken = actionsTaken == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(actionsTaken));
        errors = errors == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(errors));
        kpiName = kpiName == null ? "" : kpiName;
    }

    public boolean success() {
        return errors.isEmpty();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
