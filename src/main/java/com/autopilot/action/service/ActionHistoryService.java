package com.autopilot.action.service;

import com.autopilot.action.dto.response.ActionLogResponse;
import com.autopilot.action.dto.response.PendingActionResponse;
import com.autopilot.action.model.ActionLog;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.repository.ActionLogRepository;
import com.autopilot.action.repository.PendingActionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ActionHistoryService {

    private final PendingActionRepository pendingActionRepository;
    private final ActionLogRepository actionLogRepository;

    @Transactional(readOnly = true)
    public Page<PendingActionResponse> getPendingActions(UUID tenantId, Pageable pageable) {
        log.debug("Получение ожидающих действий тенанта: {}", tenantId);
        return pendingActionRepository.findByTenantIdAndStatus(tenantId, ActionStatus.PENDING, pageable)
                .map(this::toPendingActionResponse);
    }

    @Transactional(readOnly = true)
    public Page<ActionLogResponse> getLogs(UUID tenantId, Pageable pageable) {
        return actionLogRepository.findAllByTenantId(tenantId, pageable).map(this::toActionLogResponse);
    }

    @Transactional(readOnly = true)
    public Page<ActionLogResponse> getLogsWithFilters(
            UUID tenantId,
            String status,
            String actionType,
            String agent,
            LocalDateTime from,
            LocalDateTime to,
            Pageable pageable) {
        log.debug("Журнал действий тенанта {} с фильтрами: status={}, actionType={}, agent={}, from={}, to={}",
                tenantId, status, actionType, agent, from, to);

        ActionStatus statusFilter = status != null ? parseStatus(status) : null;
        return actionLogRepository.findByTenantIdWithFilters(
                        tenantId, statusFilter, actionType, agent, from, to, pageable)
                .map(this::toActionLogResponse);
    }

    private static ActionStatus parseStatus(String status) {
        try {
            return ActionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Неизвестный статус: " + status, e);
        }
    }

    private PendingActionResponse toPendingActionResponse(PendingAction action) {
        return new PendingActionResponse(
                action.getId(),
                action.getActionType(),
                action.getLevel().name(),
                action.getAgent(),
                action.getDescription(),
                action.getPayload(),
                action.getPreview(),
                action.getStatus().name().toLowerCase(Locale.ROOT),
                action.getCreatedAt(),
                action.getExecutedAt(),
                action.getResult(),
                action.getError(),
                action.getAttempts()
        );
    }

    private ActionLogResponse toActionLogResponse(ActionLog entry) {
        return new ActionLogResponse(
                entry.getId(),
                entry.getActionType(),
                entry.getLevel() != null ? entry.getLevel().name() : null,
                entry.getAgent(),
                entry.getPendingActionId(),
                entry.getPayload(),
                entry.getStatus().name().toLowerCase(Locale.ROOT),
                entry.getResult(),
                entry.getError(),
                entry.getAttempts(),
                entry.getExecutedAt()
        );
    }

    public PendingActionResponse toResponse(PendingAction action) {
        return toPendingActionResponse(action);
    }
}
