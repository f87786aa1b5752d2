package com.autopilot.agent.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Отчет о работе агентов за период, с предложениями по перекалибровке.
 * Предложения не применяются автоматически, а через PATCH /tenants/{tenantId}/agents/{agent}/config.
 */
public record AgentPerformanceResponse(
        UUID tenantId,
        LocalDateTime analyzedAt,
        int periodDays,
        List<AgentPerformance> agents
) {

    public record AgentPerformance(
            String agent,
            boolean enabled,
            int runs,
            int failedRuns,
            double successRate,
            long avgDurationMs,
            String kpiName,
            Double latestKpi,
            Double previousKpi,
            Double kpiTrend,
            int actionsSucceeded,
            int actionsFailed,
            int actionsQueued,
            int actionsRejected,
            List<Recommendation> recommendations
    ) {
    }

    public record Recommendation(
            String parameter,
            Object current,
            Object suggested,
            String reason
    ) {
    }
}
