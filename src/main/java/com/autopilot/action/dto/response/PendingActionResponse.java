package com.autopilot.action.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record PendingActionResponse(
        UUID id,
        String actionType,
        String level,
        String agent,
        String description,
        Map<String, Object> payload,
        Map<String, Object> preview,
        String status,
        LocalDateTime createdAt,
        LocalDateTime executedAt,
        Map<String, Object> result,
        String error,
        Integer attempts
) {
}
