package com.autopilot.scheduler.service;

import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.service.AgentRunner;
import com.autopilot.agent.service.WeeklyReportService;
import com.autopilot.config.SchedulerProperties;
import com.autopilot.connector.service.ConnectorSyncService;
import com.autopilot.event.service.EventRouter;
import com.autopilot.lock.DistributedLockService;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobExecution;
import com.autopilot.scheduler.model.JobKind;
import com.autopilot.scheduler.model.JobStatus;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.repository.JobExecutionRepository;
import com.autopilot.tenant.model.Tenant;
import com.autopilot.tenant.service.TenantConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Выполнение одного срабатывания задачи: тенанты по очереди, ошибка одного тенанта не останавливает остальных.
 * Маршрутизатор обходит всех тенантов, остальные задачи только активных.
 * Одновременно выполняется не больше одного экземпляра задачи (блокировка в Redis).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentScheduler {

    private static final String LOCK_PREFIX = "scheduler:";

    private final TenantConfigService tenantConfigService;
    private final AgentRunner agentRunner;
    private final EventRouter eventRouter;
    private final WeeklyReportService weeklyReportService;
    private final ConnectorSyncService connectorSyncService;
    private final DistributedLockService lockService;
    private final JobExecutionRepository jobExecutionRepository;
    private final JobCatalog jobCatalog;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * @return запись о срабатывании или пусто, если задача уже выполняется
     */
    public Optional<JobExecution> fire(JobDefinition job, TriggerKind kind) {
        String lockKey = LOCK_PREFIX + job.id();
        Optional<String> token = lockService.tryLock(lockKey, properties.getLockTtl());
        if (token.isEmpty()) {
            log.info("Задача {} уже выполняется, срабатывание {} пропущено", job.id(), kind);
            return Optional.empty();
        }

        JobExecution execution = JobExecution.builder()
                .jobId(job.id())
                .triggerKind(kind)
                .firedAt(now())
                .status(JobStatus.RUNNING)
                .build();
        try {
            execution = save(execution);
            log.info("Задача {} запущена ({})", job.id(), kind);

            List<Tenant> tenants = job.kind() == JobKind.ROUTER
                    ? tenantConfigService.findAllTenants()
                    : tenantConfigService.findActiveTenants();
            int processed = 0;
            int failed = 0;
            for (Tenant tenant : tenants) {
                try {
                    if (!runForTenant(job, tenant.getId())) {
                        failed++;
                    }
                    processed++;
                } catch (Exception e) {
                    failed++;
                    log.error("Задача {}: ошибка для тенанта {}: {}", job.id(), tenant.getId(), e.getMessage(), e);
                }
            }

            execution.setTenantsProcessed(processed);
            execution.setTenantsFailed(failed);
            execution.setStatus(JobStatus.COMPLETED);
            log.info("Задача {} завершена: тенантов {}, с ошибками {}", job.id(), processed, failed);
        } catch (Exception e) {
            execution.setStatus(JobStatus.FAILED);
            execution.setError(e.getMessage());
            log.error("Задача {} завершилась ошибкой, повтор при следующем срабатывании: {}",
                    job.id(), e.getMessage(), e);
        } finally {
            execution.setFinishedAt(now());
            execution = save(execution);
            lockService.releaseLock(lockKey, token.get());
        }
        return Optional.of(execution);
    }

    public Optional<JobExecution> fire(String jobId, TriggerKind kind) {
        JobDefinition job = jobCatalog.find(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Неизвестная задача: " + jobId));
        return fire(job, kind);
    }

    /**
     * @return false, если работа для тенанта завершилась с ошибками
     */
    private boolean runForTenant(JobDefinition job, UUID tenantId) {
        return switch (job.kind()) {
            case AGENT -> agentRunner.runIfEnabled(job.agentType(), tenantId)
                    .map(AgentRunResult::success)
                    .orElse(true);
            case ROUTER -> {
                eventRouter.drain(tenantId);
                yield true;
            }
            case WEEKLY_REPORT -> weeklyReportService.send(tenantId);
            case CONNECTOR_SYNC -> connectorSyncService.sync(tenantId).success();
        };
    }

    private JobExecution save(JobExecution execution) {
        try {
            return jobExecutionRepository.save(execution);
        } catch (Exception e) {
            log.error("Не удалось записать срабатывание задачи {}: {}", execution.getJobId(), e.getMessage(), e);
            return execution;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(jobCatalog.zone()));
    }
}
