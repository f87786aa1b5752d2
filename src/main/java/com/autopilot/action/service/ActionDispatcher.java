package com.autopilot.action.service;

import com.autopilot.action.model.ActionType;
import com.autopilot.action.model.PendingAction;
import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.service.ConnectorRegistry;
import com.autopilot.exception.UnknownActionTypeException;
import com.autopilot.notification.service.NotificationService;
import com.autopilot.util.Payloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Строит вызов внешнего мира по типу действия и его payload.
 * Для отложенных действий операция восстанавливается из сохраненной записи.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionDispatcher {

    private static final String DEFAULT_REMINDER_SUBJECT = "Напоминание об оплате";

    private final NotificationService notificationService;
    private final ConnectorRegistry connectorRegistry;

    public ActionOperation resolve(PendingAction pendingAction) {
        ActionType type = ActionType.fromValue(pendingAction.getActionType())
                .orElseThrow(() -> new UnknownActionTypeException(
                        "Неизвестный тип действия: " + pendingAction.getActionType()));
        return operationFor(type, pendingAction.getTenantId(), pendingAction.getPayload());
    }

    public ActionOperation operationFor(ActionType type, UUID tenantId, Map<String, Object> payload) {
        if (!type.isDispatchable()) {
            throw new UnknownActionTypeException(
                    "Действие " + type.value() + " выполняет только человек");
        }

        return switch (type) {
            case SEND_EMAIL, SEND_NURTURE_EMAIL -> sendEmail(
                    Payloads.getString(payload, type == ActionType.SEND_EMAIL ? "to" : "contact_email", ""),
                    Payloads.getString(payload, "subject", ""),
                    Payloads.getString(payload, "body", ""));
            case SEND_INVOICE_REMINDER -> sendEmail(
                    Payloads.getString(payload, "client_email", ""),
                    Payloads.getString(payload, "subject", DEFAULT_REMINDER_SUBJECT),
                    Payloads.getString(payload, "email_body", ""));
            case TAG_DEAL -> {
                String dealId = Payloads.getString(payload, "deal_id", "");
                Map<String, Object> fields = Payloads.getMap(payload, "fields");
                yield () -> {
                    Connector crm = crm(tenantId);
                    return ActionOperation.ofBoolean("Обновление сделки " + dealId,
                            () -> crm.updateDeal(dealId, fields)).execute();
                };
            }
            case ADD_DEAL_NOTE -> {
                String dealId = Payloads.getString(payload, "deal_id", "");
                String note = Payloads.getString(payload, "note", "");
                yield () -> {
                    Connector crm = crm(tenantId);
                    return ActionOperation.ofBoolean("Заметка к сделке " + dealId,
                            () -> crm.addNote(dealId, note)).execute();
                };
            }
            default -> throw new UnknownActionTypeException("Нет обработчика для действия " + type.value());
        };
    }

    private ActionOperation sendEmail(String to, String subject, String body) {
        return ActionOperation.ofBoolean("Отправка письма " + to,
                () -> notificationService.sendEmail(to, subject, body));
    }

    private Connector crm(UUID tenantId) {
        return connectorRegistry.forTenant(tenantId, ConnectorCategory.CRM)
                .orElseThrow(() -> new ActionOperationException("CRM не подключена для тенанта " + tenantId));
    }
}
