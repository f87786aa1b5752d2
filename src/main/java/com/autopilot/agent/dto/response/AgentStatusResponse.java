package com.autopilot.agent.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record AgentStatusResponse(
        UUID tenantId,
        long pendingActions,
        List<AgentState> agents
) {

    public record AgentState(
            String agent,
            boolean enabled,
            LocalDateTime lastRunAt,
            Boolean lastRunSuccess,
            String kpiName,
            Double kpiValue,
            List<String> lastErrors
    ) {
    }
}
