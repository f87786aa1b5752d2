package com.autopilot.action.dto.response;

import com.autopilot.action.model.ActionResult;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public record ActionResultResponse(
        UUID pendingActionId,
        String actionType,
        String status,
        LocalDateTime timestamp,
        Map<String, Object> result,
        String error,
        int attempts
) {

    public static ActionResultResponse from(ActionResult result) {
        return new ActionResultResponse(
                result.pendingActionId(),
                result.actionType(),
                result.status().name().toLowerCase(Locale.ROOT),
                result.timestamp(),
                result.result(),
                result.error(),
                result.attempts()
        );
    }
}
