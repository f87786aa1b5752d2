package com.autopilot.tenant.service;

import com.autopilot.agent.model.AgentType;
import com.autopilot.exception.ResourceNotFoundException;
import com.autopilot.tenant.model.ConfigAdjustment;
import com.autopilot.tenant.model.Tenant;
import com.autopilot.tenant.repository.ConfigAdjustmentRepository;
import com.autopilot.tenant.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Профиль тенанта: настройки агентов поверх значений по умолчанию.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantConfigService {

    private static final String ENABLED = "enabled";

    private final TenantRepository tenantRepository;
    private final ConfigAdjustmentRepository adjustmentRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Map<String, Object> getAgentConfig(UUID tenantId, AgentType agentType) {
        return mergedConfig(findTenant(tenantId), agentType);
    }

    @Transactional(readOnly = true)
    public boolean isAgentEnabled(UUID tenantId, AgentType agentType) {
        return isEnabled(mergedConfig(findTenant(tenantId), agentType));
    }

    /**
     * Тенанты, у которых включен хотя бы один агент. Порядок стабилен: по дате создания.
     */
    @Transactional(readOnly = true)
    public List<Tenant> findActiveTenants() {
        return tenantRepository.findAllByOrderByCreatedAtAsc().stream()
                .filter(tenant -> Arrays.stream(AgentType.values())
                        .anyMatch(type -> isEnabled(mergedConfig(tenant, type))))
                .toList();
    }

    /**
     * Все тенанты, включая тех, у кого отключены все агенты.
     */
    @Transactional(readOnly = true)
    public List<Tenant> findAllTenants() {
        return tenantRepository.findAllByOrderByCreatedAtAsc();
    }

    /**
     * Записывает ключи в настройки агента. Повторный вызов с теми же значениями ничего не меняет.
     */
    @Transactional
    public void updateAgentConfig(UUID tenantId, AgentType agentType, Map<String, Object> updates) {
        Tenant tenant = findTenant(tenantId);
        Map<String, Object> current = new LinkedHashMap<>(storedConfig(tenant, agentType));

        boolean changed = updates.entrySet().stream()
                .anyMatch(entry -> !current.containsKey(entry.getKey())
                        || !Objects.equals(current.get(entry.getKey()), entry.getValue()));
        if (!changed) {
            log.debug("Настройки {} тенанта {} уже актуальны", agentType.agentName(), tenantId);
            return;
        }

        current.putAll(updates);
        Map<String, Object> configs = tenant.getAgentConfigs() != null
                ? new LinkedHashMap<>(tenant.getAgentConfigs())
                : new LinkedHashMap<>();
        configs.put(agentType.agentName(), current);
        tenant.setAgentConfigs(configs);
        tenantRepository.save(tenant);

        log.info("Настройки {} обновлены для тенанта {}: {}", agentType.agentName(), tenantId, updates.keySet());
    }

    /**
     * Ручная перекалибровка одного параметра с записью в журнал изменений.
     */
    @Transactional
    public ConfigAdjustment adjust(UUID tenantId, AgentType agentType, String parameter, Object value, String reason) {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("Не указан параметр");
        }
        if (value == null) {
            throw new IllegalArgumentException("Не указано значение параметра " + parameter);
        }

        Object oldValue = getAgentConfig(tenantId, agentType).get(parameter);
        updateAgentConfig(tenantId, agentType, Map.of(parameter, value));

        ConfigAdjustment adjustment = adjustmentRepository.save(ConfigAdjustment.builder()
                .tenantId(tenantId)
                .agent(agentType.agentName())
                .parameter(parameter)
                .oldValue(oldValue != null ? String.valueOf(oldValue) : null)
                .newValue(String.valueOf(value))
                .reason(reason)
                .adjustedAt(LocalDateTime.now(clock))
                .build());

        log.info("Параметр {}.{} тенанта {} изменен: {} -> {}",
                agentType.agentName(), parameter, tenantId, oldValue, value);
        return adjustment;
    }

    @Transactional(readOnly = true)
    public List<ConfigAdjustment> getAdjustmentHistory(UUID tenantId) {
        findTenant(tenantId);
        return adjustmentRepository.findByTenantIdOrderByAdjustedAtDesc(tenantId);
    }

    private Tenant findTenant(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Тенант не найден: " + tenantId));
    }

    private static Map<String, Object> mergedConfig(Tenant tenant, AgentType agentType) {
        Map<String, Object> merged = new LinkedHashMap<>(agentType.defaults());
        merged.putAll(storedConfig(tenant, agentType));
        return merged;
    }

    private static Map<String, Object> storedConfig(Tenant tenant, AgentType agentType) {
        Map<String, Object> configs = tenant.getAgentConfigs();
        if (configs == null) {
            return Map.of();
        }
        Object raw = configs.get(agentType.agentName());
        if (!(raw instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static boolean isEnabled(Map<String, Object> config) {
        Object enabled = config.get(ENABLED);
        if (enabled instanceof Boolean flag) {
            return flag;
        }
        return enabled == null || !"false".equalsIgnoreCase(String.valueOf(enabled));
    }
}
