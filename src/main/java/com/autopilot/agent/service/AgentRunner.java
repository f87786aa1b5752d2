package com.autopilot.agent.service;

import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.runtime.AgentContext;
import com.autopilot.agent.runtime.AgentFactory;
import com.autopilot.config.SchedulerProperties;
import com.autopilot.exception.AgentBusyException;
import com.autopilot.exception.AgentDisabledException;
import com.autopilot.lock.DistributedLockService;
import com.autopilot.tenant.service.TenantConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Запуск агента для одного тенанта с его текущими настройками.
 * Используется планировщиком и ручным запуском из API.
 * Пара (агент, тенант) выполняется не более чем в одном запуске одновременно.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentRunner {

    private static final String LOCK_PREFIX = "agent:";

    private final TenantConfigService tenantConfigService;
    private final AgentFactory agentFactory;
    private final DistributedLockService lockService;
    private final SchedulerProperties properties;

    /**
     * Ручной запуск.
     *
     * @throws AgentDisabledException агент отключен для тенанта
     * @throws AgentBusyException     агент уже выполняется для этого тенанта
     */
    public AgentRunResult run(AgentType type, UUID tenantId) {
        if (!tenantConfigService.isAgentEnabled(tenantId, type)) {
            throw new AgentDisabledException("Агент " + type.agentName() + " отключен для тенанта " + tenantId);
        }
        return runExclusively(type, tenantId)
                .orElseThrow(() -> new AgentBusyException(
                        "Агент " + type.agentName() + " уже выполняется для тенанта " + tenantId));
    }

    /**
     * Запуск по расписанию: отключенный или уже выполняющийся агент пропускается.
     */
    public Optional<AgentRunResult> runIfEnabled(AgentType type, UUID tenantId) {
        if (!tenantConfigService.isAgentEnabled(tenantId, type)) {
            log.info("[{}] Отключен для тенанта {}, пропускаем", type.agentName(), tenantId);
            return Optional.empty();
        }
        return runExclusively(type, tenantId);
    }

    private Optional<AgentRunResult> runExclusively(AgentType type, UUID tenantId) {
        String lockKey = LOCK_PREFIX + type.agentName() + ":" + tenantId;
        Optional<String> token = lockService.tryLock(lockKey, properties.getAgentLockTtl());
        if (token.isEmpty()) {
            log.warn("[{}] Уже выполняется для тенанта {}, запуск пропущен", type.agentName(), tenantId);
            return Optional.empty();
        }

        try {
            Map<String, Object> config = tenantConfigService.getAgentConfig(tenantId, type);
            return Optional.of(agentFactory.create(type, new AgentContext(tenantId, config)).run());
        } finally {
            lockService.releaseLock(lockKey, token.get());
        }
    }
}
