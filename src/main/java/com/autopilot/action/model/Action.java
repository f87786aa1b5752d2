package com.autopilot.action.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Предлагаемое агентом действие с побочным эффектом. Неизменяемо.
 */
@Builder
public record Action(
        ActionType type,
        ActionLevel level,
        UUID tenantId,
        String agent,
        Map<String, Object> payload,
        String description,
        Map<String, Object> preview
) {

    public Action {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(agent, "agent");
        payload = freeze(payload);
        preview = preview == null ? null : freeze(preview);
        description = description == null ? "" : description;
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
