package com.autopilot.action.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Строка журнала аудита. Только вставка: каждая попытка и каждый итоговый статус пишутся отдельной строкой.
 */
@Entity
@Table(name = "action_logs", indexes = {
        @Index(name = "idx_action_logs_tenant_executed", columnList = "tenant_id, executed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionLog {

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

    @Column(name = "pending_action_id")
    private UUID pendingActionId;

    @Column(name = "payload")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActionStatus status;

    @Column(name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> result;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "attempts", nullable = false)
    private Integer attempts;

    @Column(name = "executed_at", nullable = false)
    private LocalDateTime executedAt;
}
