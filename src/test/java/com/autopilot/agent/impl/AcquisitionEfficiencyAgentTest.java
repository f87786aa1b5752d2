package com.autopilot.agent.impl;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.ActionType;
import com.autopilot.action.service.ActionDispatcher;
import com.autopilot.action.service.ActionExecutor;
import com.autopilot.action.service.ActionOperation;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.runtime.AgentContext;
import com.autopilot.agent.runtime.AgentRunRecorder;
import com.autopilot.agent.runtime.AgentSupport;
import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.model.DealRecord;
import com.autopilot.connector.model.DealRecord.DealStatus;
import com.autopilot.connector.model.ExpenseRecord;
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
import java.util.OptionalDouble;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AcquisitionEfficiencyAgentTest {

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
    private Connector crm;

    @Mock
    private Connector finance;

    private AgentSupport support;
    private UUID tenantId;
    private Map<String, Object> config;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T07:00:00Z"), ZoneOffset.UTC);
        support = new AgentSupport(executor, dispatcher, eventRouter, connectorRegistry, drafting, recorder, clock);
        config = Map.of(
                "cac_anomaly_threshold", 0.30,
                "marketing_expense_categories", List.of("Ads", "events"),
                "ceo_email", "ceo@acme.io",
                "period_days", 90);

        when(connectorRegistry.forTenant(tenantId, ConnectorCategory.CRM)).thenReturn(Optional.of(crm));
        when(connectorRegistry.forTenant(tenantId, ConnectorCategory.FINANCE)).thenReturn(Optional.of(finance));
        when(finance.fetchExpenses()).thenReturn(List.of(
                expense(2000, "ads", "LinkedIn", LocalDate.of(2025, 2, 10)),
                expense(1000, "events", "linkedin", LocalDate.of(2025, 1, 15)),
                expense(500, "office", "linkedin", LocalDate.of(2025, 2, 10)),
                expense(9000, "ads", "linkedin", LocalDate.of(2024, 10, 1))));
        when(crm.fetchDeals()).thenReturn(List.of(
                won("1", "linkedin", LocalDateTime.of(2025, 2, 1, 10, 0)),
                won("2", "linkedin", LocalDateTime.of(2025, 2, 20, 10, 0)),
                won("3", "referral", LocalDateTime.of(2025, 2, 25, 10, 0)),
                won("old", "referral", LocalDateTime.of(2024, 9, 1, 10, 0))));
        when(eventRouter.publish(eq(EventType.CAC_UPDATED), eq(tenantId), anyMap())).thenReturn(true);
    }

    private static ExpenseRecord expense(double amount, String category, String channel, LocalDate date) {
        return ExpenseRecord.builder().id(channel + date).amount(amount).category(category)
                .channel(channel).date(date).build();
    }

    private static DealRecord won(String id, String source, LocalDateTime closedAt) {
        return DealRecord.builder().id(id).title("Сделка " + id).amount(10000).status(DealStatus.WON)
                .closedAt(closedAt).source(source).build();
    }

    @Test
    void shouldComputeCacBySourceAndPublish() {
        // Arrange
        when(recorder.previousKpi(tenantId, "acquisition_efficiency")).thenReturn(OptionalDouble.of(950.0));

        // Act
        AgentRunResult result = new AcquisitionEfficiencyAgent(new AgentContext(tenantId, config), support).run();

        // Assert
        assertTrue(result.success());
        assertEquals("blended_cac", result.kpiName());
        assertEquals(1000.0, result.kpiValue());
        assertTrue(result.actionsTaken().isEmpty());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventRouter).publish(eq(EventType.CAC_UPDATED), eq(tenantId), payload.capture());
        assertEquals(Map.of("linkedin", 1500.0, "referral", 0.0), payload.getValue().get("cac_by_source"));
        assertEquals("referral", payload.getValue().get("top_source"));
        verifyNoInteractions(executor);
    }

    @Test
    void shouldEmailCeoOnCacSpike() {
        // Arrange
        ActionOperation operation = () -> Map.of("ok", true);
        when(recorder.previousKpi(tenantId, "acquisition_efficiency")).thenReturn(OptionalDouble.of(500.0));
        when(drafting.explain(anyMap(), anyString())).thenReturn("CAC вырос из-за LinkedIn");
        when(dispatcher.operationFor(eq(ActionType.SEND_EMAIL), eq(tenantId), anyMap())).thenReturn(operation);
        when(executor.run(any(Action.class), eq(operation))).thenReturn(new ActionResult(null, "send_email",
                ActionStatus.SUCCESS, LocalDateTime.now(), Map.of("ok", true), "", 1));

        // Act
        AgentRunResult result = new AcquisitionEfficiencyAgent(new AgentContext(tenantId, config), support).run();

        // Assert
        assertTrue(result.success());
        assertEquals(1, result.actionsTaken().size());
        ArgumentCaptor<Action> action = ArgumentCaptor.forClass(Action.class);
        verify(executor).run(action.capture(), eq(operation));
        assertEquals(ActionLevel.A, action.getValue().level());
        assertEquals("ceo@acme.io", action.getValue().payload().get("to"));
    }

    @Test
    void shouldNotAlertOnFirstRun() {
        // Arrange
        when(recorder.previousKpi(tenantId, "acquisition_efficiency")).thenReturn(OptionalDouble.empty());

        // Act
        AgentRunResult result = new AcquisitionEfficiencyAgent(new AgentContext(tenantId, config), support).run();

        // Assert
        assertTrue(result.actionsTaken().isEmpty());
        verifyNoInteractions(drafting, executor);
    }
}
