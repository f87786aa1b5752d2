package com.autopilot.event.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record EventResponse(
        Long id,
        String eventType,
        UUID tenantId,
        Map<String, Object> payload,
        boolean processed,
        LocalDateTime createdAt,
        LocalDateTime processedAt
) {
}
