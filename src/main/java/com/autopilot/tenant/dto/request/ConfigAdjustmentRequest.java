package com.autopilot.tenant.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ConfigAdjustmentRequest(
        @NotBlank(message = "Параметр обязателен")
        String parameter,

        @NotNull(message = "Значение обязательно")
        Object value,

        String reason
) {
}
