package com.autopilot.event.repository;

import com.autopilot.event.model.AgentEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class EventRepositoryTest {

    @Autowired
    private EventRepository eventRepository;

    private AgentEvent save(UUID tenantId, String type) {
        return eventRepository.save(AgentEvent.builder()
                .eventType(type)
                .tenantId(tenantId)
                .payload(Map.of("confidence", 0.25))
                .build());
    }

    @Test
    void shouldReturnUnprocessedEventsInPublicationOrder() {
        // Arrange
        UUID tenantId = UUID.randomUUID();
        AgentEvent first = save(tenantId, "forecast_updated");
        AgentEvent second = save(tenantId, "cash_forecast_updated");
        save(UUID.randomUUID(), "cac_updated");

        // Act
        List<AgentEvent> pending = eventRepository.findByTenantIdAndProcessedFalseOrderByCreatedAtAscIdAsc(tenantId);

        // Assert
        assertEquals(List.of(first.getId(), second.getId()), pending.stream().map(AgentEvent::getId).toList());
    }

    @Test
    void shouldMarkEventProcessedOnlyOnce() {
        // Arrange
        UUID tenantId = UUID.randomUUID();
        AgentEvent event = save(tenantId, "forecast_updated");
        LocalDateTime now = LocalDateTime.of(2025, 3, 10, 6, 15);

        // Act
        int first = eventRepository.markProcessed(event.getId(), now);
        int second = eventRepository.markProcessed(event.getId(), now.plusMinutes(1));

        // Assert
        assertEquals(1, first);
        assertEquals(0, second);
        AgentEvent stored = eventRepository.findById(event.getId()).orElseThrow();
        assertTrue(stored.getProcessed());
        assertEquals(now, stored.getProcessedAt());
        assertTrue(eventRepository.findByTenantIdAndProcessedFalseOrderByCreatedAtAscIdAsc(tenantId).isEmpty());
        assertEquals(1, eventRepository.findByTenantId(tenantId, true, PageRequest.of(0, 10)).getTotalElements());
        assertEquals(0, eventRepository.findByTenantId(tenantId, false, PageRequest.of(0, 10)).getTotalElements());
    }
}
