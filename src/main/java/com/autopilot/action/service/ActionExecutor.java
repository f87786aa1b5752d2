package com.autopilot.action.service;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.ActionType;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.config.ExecutorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Единственная точка, через которую агенты влияют на внешний мир.
 *
 * <ul>
 *     <li>уровень A: выполняется сразу, с повторами и экспоненциальной паузой;</li>
 *     <li>уровень B: сохраняется в pending_actions и ждет подтверждения человека;</li>
 *     <li>уровень C: сохраняется как бриф, выполняет человек.</li>
 * </ul>
 *
 * Методы не бросают исключений: любая ошибка превращается в статус {@link ActionResult}.
 * Транзакции здесь нет намеренно: каждая запись в БД - отдельная операция.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionExecutor {

    private final PendingActionRepository pendingActionRepository;
    private final ActionAuditLogger auditLogger;
    private final ExecutorProperties properties;
    private final BackoffSleeper sleeper;
    private final Clock clock;

    public ActionResult run(Action action, ActionOperation operation) {
        return switch (action.level()) {
            case A -> executeWithRetry(action, operation, null);
            case B -> queue(action, Map.of("queued", true, "description", action.description()));
            case C -> queue(action, Map.of("brief_ready", true));
        };
    }

    /**
     * Выполняет подтвержденное человеком действие уровня B.
     * Успешно выполнить одну запись можно не более одного раза: повторный вызов для записи,
     * которая уже не в статусе PENDING, возвращает {@link ActionStatus#REFUSED} без вызова операции,
     * текущий статус записи указывается в error.
     */
    public ActionResult approve(UUID pendingActionId, ActionOperation operation) {
        PendingAction pending;
        try {
            Optional<PendingAction> found = pendingActionRepository.findById(pendingActionId);
            if (found.isEmpty()) {
                log.error("Отложенное действие не найдено: {}", pendingActionId);
                return new ActionResult(pendingActionId, "unknown", ActionStatus.FAILED, now(), Map.of(),
                        "Отложенное действие не найдено: " + pendingActionId, 0);
            }
            pending = found.get();

            if (pending.getLevel() != ActionLevel.B) {
                return refusal(pending, "Действие уровня " + pending.getLevel() + " система не выполняет");
            }

            int claimed = pendingActionRepository.compareAndSetStatus(
                    pendingActionId, ActionStatus.PENDING, ActionStatus.RUNNING, null);
            if (claimed == 0) {
                ActionStatus current = pendingActionRepository.findById(pendingActionId)
                        .map(PendingAction::getStatus)
                        .orElse(pending.getStatus());
                log.warn("Повторное согласование действия {}: статус уже {}", pendingActionId, current);
                return refusal(pending, "Действие больше не ожидает решения (статус " + current + ")");
            }
        } catch (Exception e) {
            log.error("Ошибка чтения отложенного действия {}: {}", pendingActionId, e.getMessage(), e);
            return new ActionResult(pendingActionId, "unknown", ActionStatus.FAILED, now(), Map.of(),
                    describe(e), 0);
        }

        Optional<Action> action = toAction(pending);
        ActionResult result;
        if (action.isEmpty()) {
            result = new ActionResult(pendingActionId, pending.getActionType(), ActionStatus.FAILED, now(),
                    Map.of(), "Неизвестный тип действия: " + pending.getActionType(), 0);
            auditLogger.recordPendingOutcome(pending, result);
        } else {
            log.info("[{}] {} подтверждено человеком (id: {})",
                    pending.getAgent(), pending.getActionType(), pendingActionId);
            result = executeWithRetry(action.get(), operation, pendingActionId);
        }

        writeBack(pendingActionId, result);
        return result;
    }

    /**
     * Отклонение человеком. Идемпотентно: повторный вызов ничего не меняет.
     */
    public void reject(UUID pendingActionId) {
        try {
            LocalDateTime at = now();
            int updated = pendingActionRepository.compareAndSetStatus(
                    pendingActionId, ActionStatus.PENDING, ActionStatus.CANCELLED, at);
            if (updated > 0) {
                log.info("Действие отклонено человеком: {}", pendingActionId);
                pendingActionRepository.findById(pendingActionId).ifPresent(pending ->
                        auditLogger.recordPendingOutcome(pending, new ActionResult(pendingActionId,
                                pending.getActionType(), ActionStatus.CANCELLED, at, Map.of(), "", 0)));
                return;
            }

            pendingActionRepository.findById(pendingActionId).ifPresentOrElse(
                    pending -> {
                        if (pending.getStatus() == ActionStatus.CANCELLED) {
                            log.debug("Действие {} уже отклонено", pendingActionId);
                        } else {
                            log.warn("Действие {} нельзя отклонить в статусе {}", pendingActionId, pending.getStatus());
                        }
                    },
                    () -> log.warn("Отклонение: действие не найдено: {}", pendingActionId));
        } catch (Exception e) {
            log.error("Ошибка отклонения действия {}: {}", pendingActionId, e.getMessage(), e);
        }
    }

    /**
     * Человек отметил бриф уровня C как выполненный вручную.
     */
    public ActionResult complete(UUID pendingActionId) {
        try {
            Optional<PendingAction> found = pendingActionRepository.findById(pendingActionId);
            if (found.isEmpty()) {
                return new ActionResult(pendingActionId, "unknown", ActionStatus.FAILED, now(), Map.of(),
                        "Отложенное действие не найдено: " + pendingActionId, 0);
            }
            PendingAction pending = found.get();
            if (pending.getLevel() != ActionLevel.C) {
                return refusal(pending, "Вручную закрываются только брифы уровня C");
            }

            LocalDateTime at = now();
            int updated = pendingActionRepository.compareAndSetStatus(
                    pendingActionId, ActionStatus.PENDING, ActionStatus.SUCCESS, at);
            if (updated == 0) {
                ActionStatus current = pendingActionRepository.findById(pendingActionId)
                        .map(PendingAction::getStatus)
                        .orElse(pending.getStatus());
                return refusal(pending, "Бриф больше не ожидает решения (статус " + current + ")");
            }

            ActionResult result = new ActionResult(pendingActionId, pending.getActionType(), ActionStatus.SUCCESS,
                    at, Map.of("handled_manually", true), "", 0);
            auditLogger.recordPendingOutcome(pending, result);
            log.info("Бриф {} закрыт человеком", pendingActionId);
            return result;
        } catch (Exception e) {
            log.error("Ошибка закрытия брифа {}: {}", pendingActionId, e.getMessage(), e);
            return new ActionResult(pendingActionId, "unknown", ActionStatus.FAILED, now(), Map.of(),
                    describe(e), 0);
        }
    }

    private ActionResult executeWithRetry(Action action, ActionOperation operation, UUID pendingActionId) {
        String type = action.type().value();
        if (operation == null) {
            ActionResult failed = new ActionResult(pendingActionId, type, ActionStatus.FAILED, now(), Map.of(),
                    "Для действия не передана операция", 0);
            auditLogger.recordResult(action, failed);
            return failed;
        }

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        int attemptsMade = 0;
        String lastError = "";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attemptsMade = attempt;
            try {
                log.info("[{}] {}: попытка {}/{}", action.agent(), type, attempt, maxAttempts);
                Object value = operation.execute();

                ActionResult result = new ActionResult(pendingActionId, type, ActionStatus.SUCCESS, now(),
                        toResultMap(value), "", attempt);
                auditLogger.recordResult(action, result);
                return result;
            } catch (Exception e) {
                lastError = describe(e);
                log.warn("[{}] {}: неудачная попытка {}: {}", action.agent(), type, attempt, lastError);
                auditLogger.recordFailedAttempt(action, pendingActionId, attempt, lastError, now());

                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (attempt < maxAttempts && !pause(attempt)) {
                    break;
                }
            }
        }

        ActionResult failed = new ActionResult(pendingActionId, type, ActionStatus.FAILED, now(), Map.of(),
                lastError, attemptsMade);
        auditLogger.recordResult(action, failed);
        log.error("[{}] {}: окончательная ошибка после {} попыток: {}",
                action.agent(), type, attemptsMade, lastError);
        return failed;
    }

    private boolean pause(int attempt) {
        Duration delay = properties.backoffAfter(attempt);
        log.info("Повтор через {} мс", delay.toMillis());
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ожидание повтора прервано, дальнейшие попытки отменены");
            return false;
        }
    }

    private ActionResult queue(Action action, Map<String, Object> resultPayload) {
        String type = action.type().value();
        LocalDateTime at = now();
        PendingAction saved;
        try {
            saved = pendingActionRepository.save(PendingAction.builder()
                    .actionType(type)
                    .level(action.level())
                    .tenantId(action.tenantId())
                    .agent(action.agent())
                    .payload(action.payload())
                    .description(action.description())
                    .preview(action.preview())
                    .status(ActionStatus.PENDING)
                    .build());
        } catch (Exception e) {
            log.error("[{}] {}: не удалось поставить в очередь: {}", action.agent(), type, e.getMessage(), e);
            ActionResult failed = new ActionResult(null, type, ActionStatus.FAILED, at, Map.of(),
                    "Не удалось сохранить отложенное действие: " + describe(e), 0);
            auditLogger.recordResult(action, failed);
            return failed;
        }

        ActionResult result = new ActionResult(saved.getId(), type, ActionStatus.PENDING, at, resultPayload, "", 0);
        auditLogger.recordResult(action, result);
        log.info("[{}] {}: уровень {}, ждет решения человека (id: {})",
                action.agent(), type, action.level(), saved.getId());
        return result;
    }

    private void writeBack(UUID pendingActionId, ActionResult result) {
        try {
            PendingAction stored = pendingActionRepository.findById(pendingActionId)
                    .orElseThrow(() -> new IllegalStateException("запись исчезла"));
            stored.setStatus(result.status());
            stored.setExecutedAt(result.timestamp());
            stored.setResult(result.result());
            stored.setError(result.error());
            stored.setAttempts(result.attempts());
            pendingActionRepository.save(stored);
        } catch (Exception e) {
            log.error("Не удалось записать итог {} для отложенного действия {}: {}",
                    result.status(), pendingActionId, e.getMessage(), e);
        }
    }

    private ActionResult refusal(PendingAction pending, String reason) {
        return new ActionResult(pending.getId(), pending.getActionType(), ActionStatus.REFUSED, now(), Map.of(),
                reason, 0);
    }

    private Optional<Action> toAction(PendingAction pending) {
        return ActionType.fromValue(pending.getActionType())
                .map(type -> Action.builder()
                        .type(type)
                        .level(pending.getLevel())
                        .tenantId(pending.getTenantId())
                        .agent(pending.getAgent())
                        .payload(pending.getPayload())
                        .description(pending.getDescription())
                        .preview(pending.getPreview())
                        .build());
    }

    private static Map<String, Object> toResultMap(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), item));
            return copy;
        }
        return Map.of("value", value);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null && !e.getMessage().isBlank()
                ? e.getMessage()
                : e.getClass().getSimpleName();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
