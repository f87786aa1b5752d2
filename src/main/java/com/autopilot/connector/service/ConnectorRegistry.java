package com.autopilot.connector.service;

import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.ConnectorProvider;
import com.autopilot.connector.model.ConnectorCredential;
import com.autopilot.connector.repository.ConnectorCredentialRepository;
import com.autopilot.tenant.model.Tenant;
import com.autopilot.tenant.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Подключенный инструмент тенанта по категории.
 * Возвращает пустой Optional, если инструмент не подключен, не поддерживается или не отвечает.
 */
@Slf4j
@Service
public class ConnectorRegistry {

    private final Map<String, ConnectorProvider> providers = new LinkedHashMap<>();
    private final TenantRepository tenantRepository;
    private final ConnectorCredentialRepository credentialRepository;

    public ConnectorRegistry(ObjectProvider<ConnectorProvider> connectorProviders,
                             TenantRepository tenantRepository,
                             ConnectorCredentialRepository credentialRepository) {
        this.tenantRepository = tenantRepository;
        this.credentialRepository = credentialRepository;
        connectorProviders.orderedStream().forEach(provider ->
                providers.put(provider.toolName().toLowerCase(Locale.ROOT), provider));
        log.info("Зарегистрировано коннекторов: {} {}", providers.size(), providers.keySet());
    }

    public Optional<Connector> forTenant(UUID tenantId, ConnectorCategory category) {
        try {
            Optional<String> tool = tenantRepository.findById(tenantId)
                    .flatMap(tenant -> toolName(tenant, category));
            if (tool.isEmpty()) {
                log.debug("У тенанта {} нет подключенного инструмента {}", tenantId, category.key());
                return Optional.empty();
            }

            ConnectorProvider provider = providers.get(tool.get());
            if (provider == null) {
                log.warn("Инструмент {} ({}) не поддерживается", tool.get(), category.key());
                return Optional.empty();
            }

            Map<String, Object> credentials = credentialRepository.findByTenantIdAndTool(tenantId, tool.get())
                    .map(ConnectorCredential::getCredentials)
                    .orElse(Map.of());

            Connector connector = provider.create(tenantId, credentials);
            if (!connector.connect()) {
                log.warn("[{}] Не удалось подключиться для тенанта {}", connector.sourceName(), tenantId);
                return Optional.empty();
            }
            return Optional.of(connector);
        } catch (Exception e) {
            log.error("Ошибка получения коннектора {} для тенанта {}: {}",
                    category.key(), tenantId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Категории, для которых у тенанта указан инструмент (без проверки подключения).
     */
    public List<ConnectorCategory> connectedCategories(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .map(tenant -> Arrays.stream(ConnectorCategory.values())
                        .filter(category -> toolName(tenant, category).isPresent())
                        .toList())
                .orElse(List.of());
    }

    private static Optional<String> toolName(Tenant tenant, ConnectorCategory category) {
        Map<String, Object> tools = tenant.getToolsConnected();
        if (tools == null) {
            return Optional.empty();
        }
        Object entry = tools.get(category.key());
        if (entry instanceof Map<?, ?> map) {
            entry = map.get("name");
        }
        if (entry == null || String.valueOf(entry).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(entry).trim().toLowerCase(Locale.ROOT));
    }
}
