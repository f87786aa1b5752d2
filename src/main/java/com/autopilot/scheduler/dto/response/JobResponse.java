package com.autopilot.scheduler.dto.response;

import java.time.LocalDateTime;

public record JobResponse(
        String id,
        String kind,
        String agent,
        String cron,
        String zone,
        LocalDateTime nextFireAt,
        LocalDateTime lastFiredAt,
        String lastStatus
) {
}
