package com.autopilot.connector.model;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record ContactRecord(
        String id,
        String email,
        String firstName,
        String lastName,
        String companyName,
        String source,
        LocalDateTime createdAt
) {
}
