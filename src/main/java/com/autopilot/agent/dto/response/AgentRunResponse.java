package com.autopilot.agent.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AgentRunResponse(
        String agent,
        UUID tenantId,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        Long durationMs,
        String kpiName,
        Double kpiValue,
        Integer actionsCount,
        List<Map<String, Object>> actionsTaken,
        List<String> errors,
        boolean success
) {
}
