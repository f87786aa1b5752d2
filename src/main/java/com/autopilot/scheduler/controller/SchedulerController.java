package com.autopilot.scheduler.controller;

import com.autopilot.scheduler.dto.response.JobExecutionResponse;
import com.autopilot.scheduler.dto.response.JobResponse;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobExecution;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.repository.JobExecutionRepository;
import com.autopilot.scheduler.service.AgentScheduler;
import com.autopilot.scheduler.service.JobCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/scheduler")
@RequiredArgsConstructor
@Tag(name = "Scheduler", description = "Расписание агентов")
public class SchedulerController {

    private final JobCatalog jobCatalog;
    private final AgentScheduler agentScheduler;
    private final JobExecutionRepository jobExecutionRepository;
    private final Clock clock;

    @Operation(summary = "Задачи расписания", description = "Cron, следующее срабатывание и итог последнего")
    @GetMapping("/jobs")
    public ResponseEntity<List<JobResponse>> getJobs() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(jobCatalog.zone()));
        List<JobResponse> jobs = jobCatalog.jobs().stream()
                .map(job -> toResponse(job, now))
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @Operation(summary = "Запустить задачу вне расписания", description = "Для всех активных тенантов")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Задача выполнена"),
            @ApiResponse(responseCode = "400", description = "Неизвестная задача"),
            @ApiResponse(responseCode = "409", description = "Задача уже выполняется")
    })
    @PostMapping("/jobs/{jobId}/run")
    public ResponseEntity<JobExecutionResponse> runJob(@PathVariable String jobId) {
        log.info("Ручной запуск задачи {}", jobId);
        return agentScheduler.fire(jobId, TriggerKind.MANUAL)
                .map(execution -> ResponseEntity.ok(JobExecutionResponse.from(execution)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    private JobResponse toResponse(JobDefinition job, ZonedDateTime now) {
        Optional<JobExecution> last = jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc(job.id());
        ZonedDateTime next = job.cron().next(now);
        return new JobResponse(
                job.id(),
                job.kind().name(),
                job.agentType() != null ? job.agentType().agentName() : null,
                job.expression(),
                jobCatalog.zone().getId(),
                next != null ? next.toLocalDateTime() : null,
                last.map(JobExecution::getFiredAt).orElse(null),
                last.map(execution -> execution.getStatus().name()).orElse(null)
        );
    }
}
