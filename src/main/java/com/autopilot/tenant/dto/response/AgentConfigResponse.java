package com.autopilot.tenant.dto.response;

import java.util.Map;
import java.util.UUID;

public record AgentConfigResponse(
        UUID tenantId,
        String agent,
        boolean enabled,
        Map<String, Object> settings
) {
}
