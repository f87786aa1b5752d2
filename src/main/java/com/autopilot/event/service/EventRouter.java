package com.autopilot.event.service;

import com.autopilot.event.handler.EventHandler;
import com.autopilot.event.model.AgentEvent;
import com.autopilot.event.model.EventType;
import com.autopilot.event.repository.EventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Шина событий между агентами поверх таблицы events.
 * Агенты не вызывают друг друга напрямую: один публикует событие,
 * обработчики других агентов получают его при следующем drain.
 *
 * Таблица маршрутов собирается один раз при старте и дальше не меняется.
 */
@Slf4j
@Service
public class EventRouter {

    private final EventRepository eventRepository;
    private final Clock clock;
    private final Map<EventType, List<EventHandler>> routes;

    public EventRouter(EventRepository eventRepository, List<EventHandler> handlers, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;

        EnumMap<EventType, List<EventHandler>> table = new EnumMap<>(EventType.class);
        for (EventHandler handler : handlers) {
            table.computeIfAbsent(handler.eventType(), type -> new ArrayList<>()).add(handler);
        }
        table.replaceAll((type, list) -> List.copyOf(list));
        this.routes = Collections.unmodifiableMap(table);

        routes.forEach((type, list) -> log.info("Маршрут {} -> {}", type.value(),
                list.stream().map(EventHandler::name).toList()));
    }

    /**
     * Добавляет необработанное событие. Ошибка записи логируется, возвращается false.
     */
    public boolean publish(EventType type, UUID tenantId, Map<String, Object> payload) {
        try {
            AgentEvent saved = eventRepository.save(AgentEvent.builder()
                    .eventType(type.value())
                    .tenantId(tenantId)
                    .payload(payload != null ? payload : Map.of())
                    .processed(false)
                    .build());
            log.info("Событие {} опубликовано для тенанта {} (id: {})", type.value(), tenantId, saved.getId());
            return true;
        } catch (Exception e) {
            log.error("Ошибка публикации события {} для тенанта {}: {}", type.value(), tenantId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Обрабатывает необработанные события тенанта в порядке публикации.
     * Каждый обработчик вызывается независимо, событие помечается обработанным
     * после всех попыток, в том числе когда обработчиков нет.
     *
     * @return сколько событий помечено обработанным в этом проходе
     */
    public int drain(UUID tenantId) {
        List<AgentEvent> events;
        try {
            events = eventRepository.findByTenantIdAndProcessedFalseOrderByCreatedAtAscIdAsc(tenantId);
        } catch (Exception e) {
            log.error("Ошибка чтения событий тенанта {}: {}", tenantId, e.getMessage(), e);
            return 0;
        }

        int processed = 0;
        for (AgentEvent event : events) {
            dispatch(tenantId, event);

            try {
                if (eventRepository.markProcessed(event.getId(), LocalDateTime.now(clock)) > 0) {
                    processed++;
                } else {
                    log.debug("Событие {} уже обработано другим проходом", event.getId());
                }
            } catch (Exception e) {
                log.error("Не удалось пометить событие {} обработанным: {}", event.getId(), e.getMessage(), e);
                break;
            }
        }

        if (processed > 0) {
            log.info("Обработано событий для тенанта {}: {}", tenantId, processed);
        }
        return processed;
    }

    public List<EventHandler> handlersFor(EventType type) {
        return routes.getOrDefault(type, List.of());
    }

    private void dispatch(UUID tenantId, AgentEvent event) {
        Optional<EventType> type = EventType.fromValue(event.getEventType());
        if (type.isEmpty()) {
            log.warn("Неизвестный тип события {} (id: {}), событие будет закрыто без обработки",
                    event.getEventType(), event.getId());
            return;
        }

        List<EventHandler> handlers = handlersFor(type.get());
        if (handlers.isEmpty()) {
            log.debug("Для события {} нет обработчиков", type.get().value());
            return;
        }

        Map<String, Object> payload = event.getPayload() != null ? event.getPayload() : Map.of();
        for (EventHandler handler : handlers) {
            try {
                log.info("{} -> {} для тенанта {}", type.get().value(), handler.name(), tenantId);
                handler.handle(tenantId, payload);
            } catch (Exception e) {
                log.error("Ошибка обработчика {} на событии {} (id: {}): {}",
                        handler.name(), type.get().value(), event.getId(), e.getMessage(), e);
            }
        }
    }
}
