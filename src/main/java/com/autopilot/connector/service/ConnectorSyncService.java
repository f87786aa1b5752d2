package com.autopilot.connector.service;

import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.model.ConnectorSyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ночная синхронизация инструментов тенанта, до запуска агентов.
 * Подключается к каждому указанному инструменту и читает его данные,
 * чтобы сломанные учетные данные обнаружились до утренних задач.
 *
 * Порядок: CRM, бухгалтерия, платежи, задачи. Почта не синхронизируется.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectorSyncService {

    private static final List<ConnectorCategory> SYNC_ORDER = List.of(
            ConnectorCategory.CRM,
            ConnectorCategory.FINANCE,
            ConnectorCategory.PAYMENTS,
            ConnectorCategory.PROJECT
    );

    private final ConnectorRegistry connectorRegistry;

    public ConnectorSyncResult sync(UUID tenantId) {
        List<ConnectorCategory> connected = connectorRegistry.connectedCategories(tenantId);
        Map<String, Integer> records = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        for (ConnectorCategory category : SYNC_ORDER) {
            if (!connected.contains(category)) {
                continue;
            }

            Optional<Connector> connector = connectorRegistry.forTenant(tenantId, category);
            if (connector.isEmpty()) {
                failures.add(category.key() + ": нет подключения");
                continue;
            }

            try {
                fetch(connector.get(), category, records);
            } catch (Exception e) {
                log.error("[sync] {} ({}) для тенанта {}: {}",
                        category.key(), connector.get().sourceName(), tenantId, e.getMessage(), e);
                failures.add(category.key() + ": " + e.getMessage());
            }
        }

        ConnectorSyncResult result = new ConnectorSyncResult(tenantId, records, failures);
        if (result.success()) {
            log.info("[sync] Тенант {}: прочитано объектов {} {}", tenantId, result.total(), records);
        } else {
            log.warn("[sync] Тенант {}: прочитано объектов {}, ошибки: {}", tenantId, result.total(), failures);
        }
        return result;
    }

    private static void fetch(Connector connector, ConnectorCategory category, Map<String, Integer> records) {
        switch (category) {
            case CRM -> {
                records.put("crm.deals", connector.fetchDeals().size());
                records.put("crm.contacts", connector.fetchContacts().size());
            }
            case FINANCE -> {
                records.put("finance.invoices", connector.fetchInvoices().size());
                records.put("finance.expenses", connector.fetchExpenses().size());
            }
            case PAYMENTS -> records.put("payments.invoices", connector.fetchInvoices().size());
            case PROJECT -> records.put("project.tasks", connector.fetchTasks().size());
            default -> log.debug("[sync] Категория {} не синхронизируется", category.key());
        }
    }
}
