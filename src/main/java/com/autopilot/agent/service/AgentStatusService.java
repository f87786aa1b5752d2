package com.autopilot.agent.service;

import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.agent.dto.response.AgentRunResponse;
import com.autopilot.agent.dto.response.AgentStatusResponse;
import com.autopilot.agent.model.AgentRun;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.repository.AgentRunRepository;
import com.autopilot.tenant.service.TenantConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AgentStatusService {

    private final AgentRunRepository agentRunRepository;
    private final PendingActionRepository pendingActionRepository;
    private final TenantConfigService tenantConfigService;

    @Transactional(readOnly = true)
    public AgentStatusResponse getStatus(UUID tenantId) {
        log.debug("Получение статуса агентов тенанта: {}", tenantId);
        List<AgentStatusResponse.AgentState> agents = Arrays.stream(AgentType.values())
                .map(type -> toState(type, tenantId))
                .toList();
        long pending = pendingActionRepository.countByTenantIdAndStatus(tenantId, ActionStatus.PENDING);
        return new AgentStatusResponse(tenantId, pending, agents);
    }

    @Transactional(readOnly = true)
    public Page<AgentRunResponse> getRuns(UUID tenantId, AgentType type, Pageable pageable) {
        Page<AgentRun> runs = type != null
                ? agentRunRepository.findByTenantIdAndAgentOrderByStartedAtDesc(tenantId, type.agentName(), pageable)
                : agentRunRepository.findByTenantIdOrderByStartedAtDesc(tenantId, pageable);
        return runs.map(this::toRunResponse);
    }

    public AgentRunResponse toRunResponse(AgentRunResult result) {
        return new AgentRunResponse(
                result.agent(),
                result.tenantId(),
                result.startedAt(),
                result.finishedAt(),
                result.duration().toMillis(),
                result.kpiName(),
                result.kpiValue(),
                result.actionsTaken().size(),
                result.actionsTaken(),
                result.errors(),
                result.success()
        );
    }

    private AgentStatusResponse.AgentState toState(AgentType type, UUID tenantId) {
        boolean enabled = tenantConfigService.isAgentEnabled(tenantId, type);
        Optional<AgentRun> last = agentRunRepository.findFirstByTenantIdAndAgentOrderByStartedAtDesc(
                tenantId, type.agentName());
        return new AgentStatusResponse.AgentState(
                type.agentName(),
                enabled,
                last.map(AgentRun::getStartedAt).orElse(null),
                last.map(AgentRun::getSuccess).orElse(null),
                last.map(AgentRun::getKpiName).orElse(type.kpiName()),
                last.map(AgentRun::getKpiValue).orElse(null),
                last.map(AgentRun::getErrors).orElse(List.of())
        );
    }

    private AgentRunResponse toRunResponse(AgentRun run) {
        return new AgentRunResponse(
                run.getAgent(),
                run.getTenantId(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getDurationMs(),
                run.getKpiName(),
                run.getKpiValue(),
                run.getActionsCount(),
                List.of(),
                run.getErrors(),
                Boolean.TRUE.equals(run.getSuccess())
        );
    }
}
