package com.autopilot.scheduler.dto.response;

import com.autopilot.scheduler.model.JobExecution;

import java.time.LocalDateTime;
import java.util.UUID;

public record JobExecutionResponse(
        UUID id,
        String jobId,
        String triggerKind,
        LocalDateTime firedAt,
        LocalDateTime finishedAt,
        Integer tenantsProcessed,
        Integer tenantsFailed,
        String status,
        String error
) {

    public static JobExecutionResponse from(JobExecution execution) {
        return new JobExecutionResponse(
                execution.getId(),
                execution.getJobId(),
                execution.getTriggerKind().name(),
                execution.getFiredAt(),
                execution.getFinishedAt(),
                execution.getTenantsProcessed(),
                execution.getTenantsFailed(),
                execution.getStatus().name(),
                execution.getError()
        );
    }
}
