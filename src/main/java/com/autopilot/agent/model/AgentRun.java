package com.autopilot.agent.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "agent_runs", indexes = {
        @Index(name = "idx_agent_runs_tenant_agent", columnList = "tenant_id, agent, started_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentRun {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "agent", nullable = false, length = 100)
    private String agent;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at", nullable = false)
    private LocalDateTime finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "kpi_name", length = 100)
    private String kpiName;

    @Column(name = "kpi_value")
    private Double kpiValue;

    @Column(name = "actions_count")
    private Integer actionsCount;

    @Column(name = "errors")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> errors;

    @Column(name = "success", nullable = false)
    private Boolean success;
}
