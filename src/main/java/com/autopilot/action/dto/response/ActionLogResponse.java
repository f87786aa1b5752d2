package com.autopilot.action.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record ActionLogResponse(
        UUID id,
        String actionType,
        String level,
        String agent,
        UUID pendingActionId,
        Map<String, Object> payload,
        String status,
        Map<String, Object> result,
        String error,
        Integer attempts,
        LocalDateTime executedAt
) {
}
