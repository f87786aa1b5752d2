package com.autopilot.scheduler.service;

import com.autopilot.config.SchedulerProperties;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobExecution;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.repository.JobExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Догоняющий запуск после простоя: если с последнего срабатывания задачи прошло
 * хотя бы одно плановое время, задача выполняется один раз, сколько бы срабатываний ни было пропущено.
 * Задачи, которые еще ни разу не запускались, не догоняются.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerCatchUp {

    private final JobCatalog jobCatalog;
    private final JobExecutionRepository jobExecutionRepository;
    private final AgentScheduler agentScheduler;
    private final SchedulerProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled() || !properties.isCatchUpEnabled()) {
            log.info("Догоняющий запуск отключен");
            return;
        }
        runMissedJobs();
    }

    /**
     * @return сколько задач запущено
     */
    public int runMissedJobs() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(jobCatalog.zone()));
        int fired = 0;
        for (JobDefinition job : jobCatalog.jobs()) {
            try {
                if (missedFiring(job, now)) {
                    log.info("Задача {} пропустила срабатывание во время простоя, догоняющий запуск", job.id());
                    agentScheduler.fire(job, TriggerKind.CATCH_UP);
                    fired++;
                }
            } catch (Exception e) {
                log.error("Ошибка догоняющего запуска задачи {}: {}", job.id(), e.getMessage(), e);
            }
        }
        return fired;
    }

    private boolean missedFiring(JobDefinition job, ZonedDateTime now) {
        Optional<JobExecution> last = jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc(job.id());
        if (last.isEmpty()) {
            return false;
        }
        ZonedDateTime next = job.cron().next(last.get().getFiredAt().atZone(jobCatalog.zone()));
        return next != null && next.isBefore(now);
    }
}
