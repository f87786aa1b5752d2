package com.autopilot.action.service;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.ActionType;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.repository.ActionLogRepository;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.config.ExecutorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActionExecutorTest {

    @Mock
    private PendingActionRepository pendingActionRepository;

    @Mock
    private ActionAuditLogger auditLogger;

    private final List<Duration> sleeps = new ArrayList<>();
    private ActionExecutor executor;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T08:00:00Z"), ZoneOffset.UTC);
        executor = new ActionExecutor(pendingActionRepository, auditLogger, new ExecutorProperties(),
                sleeps::add, clock);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Action action(ActionType type, ActionLevel level) {
        return Action.builder()
                .type(type)
                .level(level)
                .tenantId(tenantId)
                .agent("process_clarity")
                .payload(Map.of("to", "ops@acme.io"))
                .description("Напоминание о сроке")
                .build();
    }

    private PendingAction pending(UUID id, ActionLevel level, ActionStatus status) {
        return PendingAction.builder()
                .id(id)
                .actionType(ActionType.SEND_INVOICE_REMINDER.value())
                .level(level)
                .tenantId(tenantId)
                .agent("cash_predictability")
                .payload(Map.of("client_email", "billing@client.io"))
                .description("Напоминание по счету")
                .status(status)
                .build();
    }

    @Test
    void shouldRetryAndFailAfterThreeAttempts() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        ActionOperation alwaysFails = () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("SMTP недоступен");
        };

        // Act
        ActionResult result = executor.run(action(ActionType.SEND_EMAIL, ActionLevel.A), alwaysFails);

        // Assert
        assertEquals(ActionStatus.FAILED, result.status());
        assertEquals(3, result.attempts());
        assertEquals(3, calls.get());
        assertEquals("SMTP недоступен", result.error());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(3)), sleeps);
        verify(auditLogger, times(3)).recordFailedAttempt(any(), isNull(), anyInt(), eq("SMTP недоступен"), any());
        verify(auditLogger).recordResult(any(), eq(result));
        verifyNoInteractions(pendingActionRepository);
    }

    @Test
    void shouldSucceedOnThirdAttempt() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        ActionOperation flaky = () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RuntimeException("timeout");
            }
            return Map.of("message_id", "m-1");
        };

        // Act
        ActionResult result = executor.run(action(ActionType.SEND_EMAIL, ActionLevel.A), flaky);

        // Assert
        assertEquals(ActionStatus.SUCCESS, result.status());
        assertEquals(3, result.attempts());
        assertEquals("m-1", result.result().get("message_id"));
        assertEquals("", result.error());
    }

    @Test
    void shouldWrapNonMapOperationResult() {
        // Act
        ActionResult result = executor.run(action(ActionType.SEND_EMAIL, ActionLevel.A), () -> "sent");

        // Assert
        assertEquals(ActionStatus.SUCCESS, result.status());
        assertEquals(1, result.attempts());
        assertEquals(Map.of("value", "sent"), result.result());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldFailWithoutOperationForLevelA() {
        // Act
        ActionResult result = executor.run(action(ActionType.SEND_EMAIL, ActionLevel.A), null);

        // Assert
        assertEquals(ActionStatus.FAILED, result.status());
        assertEquals(0, result.attempts());
        assertFalse(result.error().isEmpty());
    }

    @Test
    void shouldQueueLevelBWithoutCallingOperation() {
        // Arrange
        UUID savedId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();
        when(pendingActionRepository.save(any(PendingAction.class))).thenAnswer(invocation -> {
            PendingAction toSave = invocation.getArgument(0);
            toSave.setId(savedId);
            return toSave;
        });

        // Act
        ActionResult result = executor.run(action(ActionType.SEND_INVOICE_REMINDER, ActionLevel.B), () -> {
            calls.incrementAndGet();
            return null;
        });

        // Assert
        assertEquals(ActionStatus.PENDING, result.status());
        assertEquals(savedId, result.pendingActionId());
        assertEquals(0, result.attempts());
        assertEquals(true, result.result().get("queued"));
        assertEquals(0, calls.get());
        verify(pendingActionRepository).save(argThat(p ->
                p.getStatus() == ActionStatus.PENDING && p.getLevel() == ActionLevel.B));
    }

    @Test
    void shouldQueueLevelCAsBrief() {
        // Arrange
        when(pendingActionRepository.save(any(PendingAction.class))).thenAnswer(invocation -> {
            PendingAction toSave = invocation.getArgument(0);
            toSave.setId(UUID.randomUUID());
            return toSave;
        });

        // Act
        ActionResult result = executor.run(action(ActionType.ESCALATION_BRIEF, ActionLevel.C), null);

        // Assert
        assertEquals(ActionStatus.PENDING, result.status());
        assertEquals(Map.of("brief_ready", true), result.result());
    }

    @Test
    void shouldReturnFailedWhenQueueSaveFails() {
        // Arrange
        when(pendingActionRepository.save(any(PendingAction.class)))
                .thenThrow(new RuntimeException("connection refused"));

        // Act
        ActionResult result = executor.run(action(ActionType.SEND_INVOICE_REMINDER, ActionLevel.B), null);

        // Assert
        assertEquals(ActionStatus.FAILED, result.status());
        assertNull(result.pendingActionId());
        assertTrue(result.error().contains("connection refused"));
    }

    @Test
    void shouldKeepOutcomeWhenAuditWriteFails() {
        // Arrange
        ActionLogRepository actionLogRepository = mock(ActionLogRepository.class);
        when(actionLogRepository.save(any())).thenThrow(new RuntimeException("audit down"));
        ActionExecutor withBrokenAudit = new ActionExecutor(pendingActionRepository,
                new ActionAuditLogger(actionLogRepository), new ExecutorProperties(), sleeps::add, Clock.systemUTC());

        // Act
        ActionResult result = withBrokenAudit.run(action(ActionType.SEND_EMAIL, ActionLevel.A),
                () -> Map.of("ok", true));

        // Assert
        assertEquals(ActionStatus.SUCCESS, result.status());
        assertEquals(1, result.attempts());
        verify(actionLogRepository).save(any());
    }

    @Test
    void shouldExecuteApprovedAction() {
        // Arrange
        UUID id = UUID.randomUUID();
        PendingAction stored = pending(id, ActionLevel.B, ActionStatus.PENDING);
        when(pendingActionRepository.findById(id)).thenReturn(Optional.of(stored));
        when(pendingActionRepository.compareAndSetStatus(id, ActionStatus.PENDING, ActionStatus.RUNNING, null))
                .thenReturn(1);

        // Act
        ActionResult result = executor.approve(id, () -> Map.of("ok", true));

        // Assert
        assertEquals(ActionStatus.SUCCESS, result.status());
        assertEquals(id, result.pendingActionId());
        assertEquals(Map.of("ok", true), result.result());
        assertEquals(1, result.attempts());
        assertEquals(ActionStatus.SUCCESS, stored.getStatus());
        assertEquals(1, stored.getAttempts());
        assertNotNull(stored.getExecutedAt());
        verify(pendingActionRepository).save(stored);
    }

    @Test
    void shouldRefuseSecondApproval() {
        // Arrange
        UUID id = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();
        PendingAction stored = pending(id, ActionLevel.B, ActionStatus.PENDING);
        when(pendingActionRepository.findById(id)).thenReturn(Optional.of(stored));
        when(pendingActionRepository.compareAndSetStatus(id, ActionStatus.PENDING, ActionStatus.RUNNING, null))
                .thenReturn(1, 0);
        ActionOperation operation = () -> {
            calls.incrementAndGet();
            return Map.of("sent", true);
        };

        // Act
        ActionResult first = executor.approve(id, operation);
        ActionResult second = executor.approve(id, operation);

        // Assert
        assertEquals(ActionStatus.SUCCESS, first.status());
        assertTrue(first.isSuccess());
        assertEquals(ActionStatus.REFUSED, second.status());
        assertFalse(second.isSuccess());
        assertEquals(0, second.attempts());
        assertTrue(second.error().contains("SUCCESS"));
        assertEquals(1, calls.get());
        verify(pendingActionRepository, times(1)).save(stored);
    }

    @Test
    void shouldNotExecuteAfterReject() {
        // Arrange
        UUID id = UUID.randomUUID();
        PendingAction cancelled = pending(id, ActionLevel.B, ActionStatus.CANCELLED);
        when(pendingActionRepository.compareAndSetStatus(eq(id), eq(ActionStatus.PENDING),
                eq(ActionStatus.CANCELLED), any())).thenReturn(1);
        when(pendingActionRepository.compareAndSetStatus(id, ActionStatus.PENDING, ActionStatus.RUNNING, null))
                .thenReturn(0);
        when(pendingActionRepository.findById(id)).thenReturn(Optional.of(cancelled));
        AtomicInteger calls = new AtomicInteger();

        // Act
        executor.reject(id);
        ActionResult result = executor.approve(id, () -> {
            calls.incrementAndGet();
            return null;
        });

        // Assert
        assertEquals(ActionStatus.REFUSED, result.status());
        assertTrue(result.error().contains("CANCELLED"));
        assertEquals(0, calls.get());
        verify(auditLogger).recordPendingOutcome(eq(cancelled),
                argThat(r -> r.status() == ActionStatus.CANCELLED));
    }

    @Test
    void shouldRefuseApprovalOfBrief() {
        // Arrange
        UUID id = UUID.randomUUID();
        when(pendingActionRepository.findById(id))
                .thenReturn(Optional.of(pending(id, ActionLevel.C, ActionStatus.PENDING)));

        // Act
        ActionResult result = executor.approve(id, () -> Map.of("ok", true));

        // Assert
        assertEquals(ActionStatus.REFUSED, result.status());
        assertEquals(0, result.attempts());
        verify(pendingActionRepository, never()).compareAndSetStatus(any(), any(), any(), any());
    }

    @Test
    void shouldFailApprovalOfUnknownId() {
        // Arrange
        UUID id = UUID.randomUUID();
        when(pendingActionRepository.findById(id)).thenReturn(Optional.empty());

        // Act
        ActionResult result = executor.approve(id, () -> Map.of("ok", true));

        // Assert
        assertEquals(ActionStatus.FAILED, result.status());
        assertEquals(0, result.attempts());
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        // Arrange
        ExecutorProperties properties = new ExecutorProperties();
        ActionExecutor interruptible = new ActionExecutor(pendingActionRepository, auditLogger, properties,
                delay -> {
                    throw new InterruptedException();
                }, Clock.systemUTC());
        AtomicInteger calls = new AtomicInteger();

        // Act
        ActionResult result = interruptible.run(action(ActionType.SEND_EMAIL, ActionLevel.A), () -> {
            calls.incrementAndGet();
            throw new RuntimeException("boom");
        });

        // Assert
        assertEquals(ActionStatus.FAILED, result.status());
        assertEquals(1, calls.get());
        assertEquals(1, result.attempts());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void shouldCompleteBriefOnce() {
        // Arrange
        UUID id = UUID.randomUUID();
        PendingAction brief = pending(id, ActionLevel.C, ActionStatus.PENDING);
        when(pendingActionRepository.findById(id)).thenReturn(Optional.of(brief));
        when(pendingActionRepository.compareAndSetStatus(eq(id), eq(ActionStatus.PENDING),
                eq(ActionStatus.SUCCESS), any())).thenReturn(1);

        // Act
        ActionResult result = executor.complete(id);

        // Assert
        assertEquals(ActionStatus.SUCCESS, result.status());
        assertEquals(true, result.result().get("handled_manually"));
        verify(auditLogger).recordPendingOutcome(brief, result);
    }
}
