package com.autopilot.tenant.dto.response;

import java.time.LocalDateTime;
import java.util.UUID;

public record ConfigAdjustmentResponse(
        UUID id,
        String agent,
        String parameter,
        String oldValue,
        String newValue,
        String reason,
        LocalDateTime adjustedAt
) {
}
