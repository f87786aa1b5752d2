package com.autopilot.event.handler;

import com.autopilot.event.model.EventType;

import java.util.Map;
import java.util.UUID;

/**
 * Реакция на событие. Событие может быть доставлено повторно,
 * поэтому обработчик должен быть идемпотентным.
 */
public interface EventHandler {

    EventType eventType();

    void handle(UUID tenantId, Map<String, Object> payload);

    default String name() {
        return getClass().getSimpleName();
    }
}
