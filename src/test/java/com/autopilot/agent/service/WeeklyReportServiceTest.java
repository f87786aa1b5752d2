package com.autopilot.agent.service;

import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.repository.ActionLogRepository;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.agent.model.AgentRun;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.repository.AgentRunRepository;
import com.autopilot.llm.service.DraftingService;
import com.autopilot.notification.service.NotificationService;
import com.autopilot.tenant.model.Tenant;
import com.autopilot.tenant.repository.TenantRepository;
import com.autopilot.tenant.service.TenantConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WeeklyReportServiceTest {

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private TenantConfigService tenantConfigService;

    @Mock
    private AgentRunRepository agentRunRepository;

    @Mock
    private PendingActionRepository pendingActionRepository;

    @Mock
    private ActionLogRepository actionLogRepository;

    @Mock
    private DraftingService draftingService;

    @Mock
    private NotificationService notificationService;

    private WeeklyReportService weeklyReportService;
    private UUID tenantId;
    private LocalDateTime weekAgo;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T05:30:00Z"), ZoneOffset.UTC);
        weeklyReportService = new WeeklyReportService(tenantRepository, tenantConfigService, agentRunRepository,
                pendingActionRepository, actionLogRepository, draftingService, notificationService, clock);
        tenantId = UUID.randomUUID();
        weekAgo = LocalDateTime.of(2025, 3, 3, 5, 30);
    }

    private AgentRun run(Double kpi, boolean success) {
        return AgentRun.builder()
                .agent("cash_predictability")
                .tenantId(tenantId)
                .startedAt(LocalDateTime.of(2025, 3, 7, 5, 0))
                .finishedAt(LocalDateTime.of(2025, 3, 7, 5, 1))
                .kpiName("overdue_ratio")
                .kpiValue(kpi)
                .success(success)
                .build();
    }

    @Test
    void shouldSendWeeklyReportToCeo() {
        // Arrange
        when(tenantRepository.findById(tenantId))
                .thenReturn(Optional.of(Tenant.builder().id(tenantId).name("Acme").build()));
        when(tenantConfigService.getAgentConfig(tenantId, AgentType.CASH_PREDICTABILITY))
                .thenReturn(Map.of("ceo_email", "ceo@acme.io"));
        when(agentRunRepository.findByTenantIdAndAgentAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
                tenantId, "cash_predictability", weekAgo)).thenReturn(List.of(run(0.25, true), run(0.3, false)));
        when(actionLogRepository.countByTenantIdAndStatusAndExecutedAtGreaterThanEqual(
                tenantId, ActionStatus.SUCCESS, weekAgo)).thenReturn(5L);
        when(pendingActionRepository.countByTenantIdAndStatus(tenantId, ActionStatus.PENDING)).thenReturn(3L);
        when(draftingService.explain(any(), any())).thenReturn("Просрочка снизилась, начните с двух счетов клиента X.");
        when(notificationService.sendEmail(eq("ceo@acme.io"), any(), any())).thenReturn(true);

        // Act
        boolean sent = weeklyReportService.send(tenantId);

        // Assert
        assertTrue(sent);
        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationService).sendEmail(eq("ceo@acme.io"), subject.capture(), body.capture());
        assertEquals("Еженедельный отчет Acme: 10.03.2025", subject.getValue());
        assertTrue(body.getValue().contains("cash_predictability: overdue_ratio = 0.25, запусков 2, с ошибками 1"));
        assertTrue(body.getValue().contains("process_clarity: нет запусков за неделю"));
        assertTrue(body.getValue().contains("Выполнено действий: 5"));
        assertTrue(body.getValue().contains("Ждут вашего решения: 3"));
        assertTrue(body.getValue().contains("Просрочка снизилась"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> summary = ArgumentCaptor.forClass(Map.class);
        verify(draftingService).explain(summary.capture(), any());
        assertEquals(0.25, summary.getValue().get("overdue_ratio"));
        assertEquals(3L, summary.getValue().get("actions_pending"));
    }

    @Test
    void shouldNotSendWithoutCeoEmail() {
        // Arrange
        when(tenantRepository.findById(tenantId))
                .thenReturn(Optional.of(Tenant.builder().id(tenantId).name("Acme").build()));
        when(tenantConfigService.getAgentConfig(eq(tenantId), any())).thenReturn(Map.of("ceo_email", ""));

        // Act
        boolean sent = weeklyReportService.send(tenantId);

        // Assert
        assertFalse(sent);
        verify(tenantConfigService, times(3)).getAgentConfig(eq(tenantId), any());
        verifyNoInteractions(notificationService, agentRunRepository, draftingService);
    }

    @Test
    void shouldReportFailureWhenMailIsNotSent() {
        // Arrange
        when(tenantRepository.findById(tenantId))
                .thenReturn(Optional.of(Tenant.builder().id(tenantId).name("Acme").build()));
        when(tenantConfigService.getAgentConfig(tenantId, AgentType.CASH_PREDICTABILITY)).thenReturn(Map.of());
        when(tenantConfigService.getAgentConfig(tenantId, AgentType.ACQUISITION_EFFICIENCY))
                .thenReturn(Map.of("ceo_email", "founder@acme.io"));
        when(draftingService.explain(any(), any())).thenReturn("");
        when(notificationService.sendEmail(eq("founder@acme.io"), any(), any())).thenReturn(false);

        // Act
        boolean sent = weeklyReportService.send(tenantId);

        // Assert
        assertFalse(sent);
        verify(tenantConfigService, never()).getAgentConfig(tenantId, AgentType.REVENUE_VELOCITY);
    }

    @Test
    void shouldFailForUnknownTenant() {
        // Arrange
        when(tenantRepository.findById(tenantId)).thenReturn(Optional.empty());

        // Act & Assert
        assertFalse(weeklyReportService.send(tenantId));
        verifyNoInteractions(notificationService);
    }
}
