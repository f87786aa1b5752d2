package com.autopilot.agent.runtime;

import com.autopilot.agent.model.AgentRun;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.repository.AgentRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Запись итогов запусков в agent_runs. Ошибка записи не влияет на результат запуска.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRunRecorder {

    private final AgentRunRepository agentRunRepository;

    public void record(AgentRunResult result) {
        try {
            agentRunRepository.save(AgentRun.builder()
                    .agent(result.agent())
                    .tenantId(result.tenantId())
                    .startedAt(result.startedAt())
                    .finishedAt(result.finishedAt())
                    .durationMs(result.duration().toMillis())
                    .kpiName(result.kpiName())
                    .kpiValue(result.kpiValue())
                    .actionsCount(result.actionsTaken().size())
                    .errors(result.errors())
                    .success(result.success())
                    .build());
        } catch (Exception e) {
            log.error("[{}] Ошибка записи запуска для тенанта {}: {}",
                    result.agent(), result.tenantId(), e.getMessage(), e);
        }
    }

    /**
     * KPI последнего успешного запуска агента для тенанта.
     */
    public OptionalDouble previousKpi(UUID tenantId, String agent) {
        try {
            return agentRunRepository.findFirstByTenantIdAndAgentAndSuccessTrueOrderByStartedAtDesc(tenantId, agent)
                    .filter(run -> run.getKpiValue() != null)
                    .map(run -> OptionalDouble.of(run.getKpiValue()))
                    .orElse(OptionalDouble.empty());
        } catch (Exception e) {
            log.error("[{}] Ошибка чтения предыдущего KPI для тенанта {}: {}", agent, tenantId, e.getMessage(), e);
            return OptionalDouble.empty();
        }
    }
}
