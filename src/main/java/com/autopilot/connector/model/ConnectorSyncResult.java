package com.autopilot.connector.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Итог синхронизации инструментов одного тенанта.
 *
 * @param records  "категория.объекты" -> число прочитанных записей, например "crm.deals" -> 42
 * @param failures инструменты, к которым не удалось подключиться или прочитать данные
 */
public record ConnectorSyncResult(UUID tenantId, Map<String, Integer> records, List<String> failures) {

    public ConnectorSyncResult {
        records = records == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(records));
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean success() {
        return failures.isEmpty();
    }

    public int total() {
        return records.values().stream().mapToInt(Integer::intValue).sum();
    }
}
