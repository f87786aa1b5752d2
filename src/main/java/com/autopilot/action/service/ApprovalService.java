package com.autopilot.action.service;

import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.exception.ActionNotPendingException;
import com.autopilot.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Решения человека по отложенным действиям, вызываются из API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalService {

    private final PendingActionRepository pendingActionRepository;
    private final ActionDispatcher actionDispatcher;
    private final ActionExecutor actionExecutor;

    public ActionResult approve(UUID tenantId, UUID pendingActionId) {
        PendingAction pending = findPending(tenantId, pendingActionId);
        if (pending.getStatus() != ActionStatus.PENDING) {
            throw new ActionNotPendingException(
                    "Действие " + pendingActionId + " уже в статусе " + pending.getStatus());
        }
        if (pending.getLevel() != ActionLevel.B) {
            throw new ActionNotPendingException(
                    "Действие уровня " + pending.getLevel() + " выполняет человек, закройте его вручную");
        }

        ActionOperation operation = actionDispatcher.resolve(pending);
        ActionResult result = actionExecutor.approve(pendingActionId, operation);
        if (result.status() == ActionStatus.REFUSED) {
            // решение уже принято параллельно
            throw new ActionNotPendingException(result.error());
        }

        log.info("Действие {} согласовано, итог: {}", pendingActionId, result.status());
        return result;
    }

    public PendingAction reject(UUID tenantId, UUID pendingActionId) {
        PendingAction pending = findPending(tenantId, pendingActionId);
        if (pending.getStatus() == ActionStatus.CANCELLED) {
            return pending;
        }
        if (pending.getStatus() != ActionStatus.PENDING) {
            throw new ActionNotPendingException(
                    "Действие " + pendingActionId + " уже в статусе " + pending.getStatus());
        }

        actionExecutor.reject(pendingActionId);
        return findPending(tenantId, pendingActionId);
    }

    public ActionResult complete(UUID tenantId, UUID pendingActionId) {
        PendingAction pending = findPending(tenantId, pendingActionId);
        if (pending.getLevel() != ActionLevel.C) {
            throw new ActionNotPendingException("Вручную закрываются только брифы уровня C");
        }
        if (pending.getStatus() != ActionStatus.PENDING) {
            throw new ActionNotPendingException(
                    "Бриф " + pendingActionId + " уже в статусе " + pending.getStatus());
        }

        ActionResult result = actionExecutor.complete(pendingActionId);
        if (result.status() != ActionStatus.SUCCESS) {
            throw new ActionNotPendingException(result.error());
        }
        return result;
    }

    private PendingAction findPending(UUID tenantId, UUID pendingActionId) {
        return pendingActionRepository.findByIdAndTenantId(pendingActionId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Отложенное действие не найдено: " + pendingActionId));
    }
}
