package com.autopilot.scheduler.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Одно срабатывание задачи. Время хранится в часовом поясе планировщика.
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_job_executions_job_fired", columnList = "job_id, fired_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecution {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, length = 100)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_kind", nullable = false, length = 20)
    private TriggerKind triggerKind;

    @Column(name = "fired_at", nullable = false)
    private LocalDateTime firedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "tenants_processed")
    @Builder.Default
    private Integer tenantsProcessed = 0;

    @Column(name = "tenants_failed")
    @Builder.Default
    private Integer tenantsFailed = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;
}
