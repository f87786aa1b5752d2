package com.autopilot.connector.model;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record DealRecord(
        String id,
        String title,
        double amount,
        String stage,
        double probability,
        DealStatus status,
        LocalDateTime createdAt,
        LocalDateTime lastActivityAt,
        LocalDateTime expectedCloseDate,
        LocalDateTime closedAt,
        String ownerName,
        String ownerEmail,
        String source
) {

    public enum DealStatus {
        ACTIVE, WON, LOST
    }

    public boolean isOpen() {
        return status == null || status == DealStatus.ACTIVE;
    }

    public boolean isWon() {
        return status == DealStatus.WON;
    }
}
