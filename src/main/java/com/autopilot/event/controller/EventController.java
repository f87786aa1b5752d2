package com.autopilot.event.controller;

import com.autopilot.event.dto.response.EventResponse;
import com.autopilot.event.model.AgentEvent;
import com.autopilot.event.repository.EventRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Журнал событий между агентами")
public class EventController {

    private final EventRepository eventRepository;

    @Operation(summary = "События тенанта", description = "Новые сверху. Фильтр processed необязателен")
    @GetMapping
    public ResponseEntity<Page<EventResponse>> getEvents(
            @RequestParam UUID tenantId,
            @RequestParam(required = false) Boolean processed,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Page<EventResponse> events = eventRepository.findByTenantId(tenantId, processed, PageRequest.of(page, size))
                .map(this::toResponse);
        return ResponseEntity.ok(events);
    }

    private EventResponse toResponse(AgentEvent event) {
        return new EventResponse(
                event.getId(),
                event.getEventType(),
                event.getTenantId(),
                event.getPayload(),
                Boolean.TRUE.equals(event.getProcessed()),
                event.getCreatedAt(),
                event.getProcessedAt()
        );
    }
}
