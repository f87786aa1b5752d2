package com.autopilot.scheduler.config;

import com.autopilot.config.SchedulerProperties;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.service.AgentScheduler;
import com.autopilot.scheduler.service.JobCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;

/**
 * Регистрирует задачи из {@link JobCatalog} в планировщике Spring.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SchedulingConfig implements SchedulingConfigurer {

    private final JobCatalog jobCatalog;
    private final AgentScheduler agentScheduler;
    private final SchedulerProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!properties.isEnabled()) {
            log.info("Планировщик отключен (autopilot.scheduler.enabled=false)");
            return;
        }
        for (JobDefinition job : jobCatalog.jobs()) {
            registrar.addCronTask(new CronTask(
                    () -> agentScheduler.fire(job, TriggerKind.SCHEDULED),
                    new CronTrigger(job.expression(), jobCatalog.zone())));
        }
    }
}
