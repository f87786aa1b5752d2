package com.autopilot.action.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "pending_actions", indexes = {
        @Index(name = "idx_pending_actions_tenant_status", columnList = "tenant_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingAction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "action_type", nullable = false, length = 100)
    private String actionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 1)
    private ActionLevel level;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "agent", nullable = false, length = 100)
    private String agent;

    @Column(name = "payload")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "preview")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> preview;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Column(name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> result;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "attempts")
    private Integer attempts;
}
