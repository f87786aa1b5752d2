package com.autopilot.agent.impl;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.ActionType;
import com.autopilot.action.service.ActionDispatcher;
import com.autopilot.action.service.ActionExecutor;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.runtime.AgentContext;
import com.autopilot.agent.runtime.AgentRunRecorder;
import com.autopilot.agent.runtime.AgentSupport;
import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.model.InvoiceRecord;
import com.autopilot.connector.model.InvoiceRecord.InvoiceStatus;
import com.autopilot.connector.service.ConnectorRegistry;
import com.autopilot.event.model.EventType;
import com.autopilot.event.service.EventRouter;
import com.autopilot.llm.service.DraftingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CashPredictabilityAgentTest {

    @Mock
    private ActionExecutor executor;

    @Mock
    private ActionDispatcher dispatcher;

    @Mock
    private EventRouter eventRouter;

    @Mock
    private ConnectorRegistry connectorRegistry;

    @Mock
    private DraftingService drafting;

    @Mock
    private AgentRunRecorder recorder;

    @Mock
    private Connector finance;

    private AgentSupport support;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T05:00:00Z"), ZoneOffset.UTC);
        support = new AgentSupport(executor, dispatcher, eventRouter, connectorRegistry, drafting, recorder, clock);
    }

    private static InvoiceRecord invoice(String id, double amount, LocalDate dueAt, InvoiceStatus status) {
        return InvoiceRecord.builder()
                .id(id)
                .number("INV-" + id)
                .clientName("Клиент " + id)
                .clientEmail(id + "@client.io")
                .amount(amount)
                .status(status)
                .issuedAt(dueAt.minusDays(30))
                .dueAt(dueAt)
                .build();
    }

    private CashPredictabilityAgent agent(Map<String, Object> config) {
        return new CashPredictabilityAgent(new AgentContext(tenantId, config), support);
    }

    @Test
    void shouldQueueReminderEscalateAndPublishForecast() {
        // Arrange
        when(connectorRegistry.forTenant(tenantId, ConnectorCategory.FINANCE)).thenReturn(Optional.of(finance));
        when(finance.fetchInvoices()).thenReturn(List.of(
                invoice("7", 1000, LocalDate.of(2025, 3, 3), InvoiceStatus.SENT),
                invoice("37", 3000, LocalDate.of(2025, 2, 1), InvoiceStatus.OVERDUE),
                invoice("2", 500, LocalDate.of(2025, 3, 8), InvoiceStatus.SENT),
                invoice("paid", 900, LocalDate.of(2025, 2, 1), InvoiceStatus.PAID),
                invoice("future", 2000, LocalDate.of(2025, 3, 20), InvoiceStatus.SENT)));
        when(drafting.draft(anyMap(), anyString())).thenReturn("Добрый день, напоминаем об оплате");
        when(drafting.generate(anyMap(), anyString())).thenReturn("Позвонить клиенту 37");
        when(executor.run(any(Action.class), isNull())).thenAnswer(invocation -> {
            Action action = invocation.getArgument(0);
            return new ActionResult(UUID.randomUUID(), action.type().value(), ActionStatus.PENDING,
                    LocalDateTime.now(), Map.of(), "", 0);
        });
        when(eventRouter.publish(eq(EventType.CASH_FORECAST_UPDATED), eq(tenantId), anyMap())).thenReturn(true);

        // Act
        AgentRunResult result = agent(Map.of(
                "reminder_day_1", 1, "reminder_day_2", 7, "reminder_day_3", 15,
                "escalation_day", 30, "ceo_email", "ceo@acme.io",
                "cash_balance", 100000, "monthly_burn", 30000, "cash_critical_threshold", 55000)).run();

        // Assert
        assertTrue(result.success());
        assertEquals("overdue_ratio", result.kpiName());
        assertEquals(0.69, result.kpiValue());
        assertEquals(2, result.actionsTaken().size());

        ArgumentCaptor<Action> actions = ArgumentCaptor.forClass(Action.class);
        verify(executor, times(2)).run(actions.capture(), isNull());
        Action reminder = actions.getAllValues().get(0);
        assertEquals(ActionType.SEND_INVOICE_REMINDER, reminder.type());
        assertEquals(ActionLevel.B, reminder.level());
        assertEquals("7@client.io", reminder.payload().get("client_email"));
        Action brief = actions.getAllValues().get(1);
        assertEquals(ActionType.ESCALATION_BRIEF, brief.type());
        assertEquals(ActionLevel.C, brief.level());
        assertEquals("ceo@acme.io", brief.payload().get("to"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventRouter).publish(eq(EventType.CASH_FORECAST_UPDATED), eq(tenantId), payload.capture());
        assertEquals(45, payload.getValue().get("days_until_critical"));
        assertEquals(3, payload.getValue().get("overdue_count"));
        assertEquals(4500.0, payload.getValue().get("overdue_total"));
        verifyNoInteractions(dispatcher);
        verify(recorder).record(result);
    }

    @Test
    void shouldSkipWhenFinanceNotConnected() {
        // Arrange
        when(connectorRegistry.forTenant(tenantId, ConnectorCategory.FINANCE)).thenReturn(Optional.empty());

        // Act
        AgentRunResult result = agent(Map.of()).run();

        // Assert
        assertTrue(result.success());
        assertTrue(result.actionsTaken().isEmpty());
        verifyNoInteractions(executor, eventRouter);
    }

    @Test
    void shouldOmitRunwayWithoutBurn() {
        // Act
        Optional<Integer> days = agent(Map.of("cash_balance", 50000, "monthly_burn", 0)).daysUntilCritical();

        // Assert
        assertTrue(days.isEmpty());
    }

    @Test
    void shouldClampRunwayAtZeroBelowThreshold() {
        // Act
        Optional<Integer> days = agent(Map.of("cash_balance", 10000, "monthly_burn", 30000,
                "cash_critical_threshold", 20000)).daysUntilCritical();

        // Assert
        assertEquals(Optional.of(0), days);
    }
}
