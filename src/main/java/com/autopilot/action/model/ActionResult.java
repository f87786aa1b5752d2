package com.autopilot.action.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Итог обработки действия исполнителем.
 *
 * @param pendingActionId id записи pending_actions для уровней B/C и для согласованных действий, иначе null
 * @param attempts        сколько раз реально вызывалась операция (0, если не вызывалась)
 */
public record ActionResult(
        UUID pendingActionId,
        String actionType,
        ActionStatus status,
        LocalDateTime timestamp,
        Map<String, Object> result,
        String error,
        int attempts
) {

    public ActionResult {
        result = result == null || result.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        error = error == null ? "" : error;
    }

    public boolean isSuccess() {
        return status == ActionStatus.SUCCESS;
    }
}
