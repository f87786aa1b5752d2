package com.autopilot.tenant.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ручная перекалибровка параметра агента.
 */
@Entity
@Table(name = "config_adjustments", indexes = {
        @Index(name = "idx_config_adjustments_tenant", columnList = "tenant_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigAdjustment {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "agent", nullable = false, length = 100)
    private String agent;

    @Column(name = "parameter", nullable = false, length = 100)
    private String parameter;

    @Column(name = "old_value", columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "adjusted_at", nullable = false)
    private LocalDateTime adjustedAt;
}
