package com.autopilot.connector.model;

import lombok.Builder;

import java.time.LocalDate;

@Builder
public record InvoiceRecord(
        String id,
        String number,
        String clientName,
        String clientEmail,
        double amount,
        double amountPaid,
        InvoiceStatus status,
        LocalDate issuedAt,
        LocalDate dueAt,
        LocalDate paidAt
) {

    public enum InvoiceStatus {
        DRAFT, SENT, PAID, OVERDUE
    }

    public double outstanding() {
        return Math.max(0, amount - amountPaid);
    }

    public boolean isOpen() {
        return status != InvoiceStatus.PAID && status != InvoiceStatus.DRAFT && outstanding() > 0;
    }

    public long daysOverdue(LocalDate today) {
        if (!isOpen() || dueAt == null || !today.isAfter(dueAt)) {
            return 0;
        }
        return today.toEpochDay() - dueAt.toEpochDay();
    }
}
