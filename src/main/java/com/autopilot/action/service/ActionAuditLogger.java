package com.autopilot.action.service;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLog;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.repository.ActionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Пишет журнал action_logs. Ошибка записи журнала никогда не меняет результат действия.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionAuditLogger {

    private final ActionLogRepository actionLogRepository;

    public void recordResult(Action action, ActionResult result) {
        save(ActionLog.builder()
                .actionType(action.type().value())
                .level(action.level())
                .tenantId(action.tenantId())
                .agent(action.agent())
                .pendingActionId(result.pendingActionId())
                .payload(action.payload())
                .status(result.status())
                .result(result.result())
                .error(result.error())
                .attempts(result.attempts())
                .executedAt(result.timestamp())
                .build());
    }

    public void recordFailedAttempt(Action action, UUID pendingActionId, int attempt, String error,
                                    LocalDateTime at) {
        save(ActionLog.builder()
                .actionType(action.type().value())
                .level(action.level())
                .tenantId(action.tenantId())
                .agent(action.agent())
                .pendingActionId(pendingActionId)
                .payload(action.payload())
                .status(ActionStatus.RUNNING)
                .result(Map.of())
                .error(error)
                .attempts(attempt)
                .executedAt(at)
                .build());
    }

    /**
     * Итог решения человека по сохраненной записи (отклонение, ручное закрытие брифа).
     */
    public void recordPendingOutcome(PendingAction pending, ActionResult result) {
        save(ActionLog.builder()
                .actionType(pending.getActionType())
                .level(pending.getLevel())
                .tenantId(pending.getTenantId())
                .agent(pending.getAgent())
                .pendingActionId(pending.getId())
                .payload(pending.getPayload())
                .status(result.status())
                .result(result.result())
                .error(result.error())
                .attempts(result.attempts())
                .executedAt(result.timestamp())
                .build());
    }

    private void save(ActionLog entry) {
        try {
            actionLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Ошибка записи журнала действий ({} для тенанта {}, статус {}): {}",
                    entry.getActionType(), entry.getTenantId(), entry.getStatus(), e.getMessage(), e);
        }
    }
}
