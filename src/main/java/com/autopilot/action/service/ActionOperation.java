package com.autopilot.action.service;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Вызов, который реально меняет внешний мир (письмо, обновление CRM и т.д.).
 * Любое исключение считается неудачной попыткой.
 */
@FunctionalInterface
public interface ActionOperation {

    /**
     * @return Map станет результатом как есть, null - пустым результатом, остальное - {"value": ...}
     */
    Object execute() throws Exception;

    /**
     * Оборачивает вызов коннектора или уведомления, который сообщает об ошибке через false.
     */
    static ActionOperation ofBoolean(String description, BooleanSupplier call) {
        return () -> {
            if (!call.getAsBoolean()) {
                throw new ActionOperationException(description + ": вызов вернул false");
            }
            return Map.of("ok", true);
        };
    }
}
