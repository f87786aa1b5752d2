package com.autopilot.connector.model;

import lombok.Builder;

import java.time.LocalDate;

/**
 * channel - канал привлечения, к которому относится расход (совпадает с DealRecord.source).
 */
@Builder
public record ExpenseRecord(
        String id,
        double amount,
        String vendor,
        String category,
        String channel,
        LocalDate date
) {
}
