package com.autopilot.scheduler.service;

import com.autopilot.agent.model.AgentType;
import com.autopilot.config.SchedulerProperties;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Таблица задач расписания: значения по умолчанию плюс переопределения из настроек.
 * Некорректный cron останавливает запуск приложения.
 */
@Slf4j
@Component
public class JobCatalog {

    public static final String ROUTER_JOB = "router";
    public static final String WEEKLY_REPORT_JOB = "weekly_report";
    public static final String SYNC_CONNECTORS_JOB = "sync_connectors";

    private static final List<JobDefinition> DEFAULT_JOBS = List.of(
            JobDefinition.of(SYNC_CONNECTORS_JOB, JobKind.CONNECTOR_SYNC, null, "0 0 3 * * *"),
            JobDefinition.agent(AgentType.CASH_PREDICTABILITY, "0 0 5 * * *"),
            JobDefinition.agent(AgentType.REVENUE_VELOCITY, "0 0 6 * * *"),
            JobDefinition.of(ROUTER_JOB, JobKind.ROUTER, null, "0 15 6 * * *"),
            JobDefinition.of(WEEKLY_REPORT_JOB, JobKind.WEEKLY_REPORT, null, "0 30 6 * * MON"),
            JobDefinition.agent(AgentType.PROCESS_CLARITY, "0 0 9 * * MON-FRI"),
            JobDefinition.agent(AgentType.ACQUISITION_EFFICIENCY, "0 0 7 1 * *")
    );

    private final List<JobDefinition> jobs;
    private final ZoneId zone;

    public JobCatalog(SchedulerProperties properties) {
        this.zone = ZoneId.of(properties.getZone());

        Map<String, String> overrides = properties.getJobs() != null ? properties.getJobs() : Map.of();
        overrides.keySet().stream()
                .filter(id -> DEFAULT_JOBS.stream().noneMatch(job -> job.id().equals(id)))
                .forEach(id -> log.warn("Неизвестная задача в настройках планировщика: {}", id));

        this.jobs = DEFAULT_JOBS.stream()
                .map(job -> overrides.containsKey(job.id())
                        ? JobDefinition.of(job.id(), job.kind(), job.agentType(), overrides.get(job.id()))
                        : job)
                .toList();

        jobs.forEach(job -> log.info("Задача {}: {} ({})", job.id(), job.expression(), zone));
    }

    public List<JobDefinition> jobs() {
        return jobs;
    }

    public Optional<JobDefinition> find(String id) {
        return jobs.stream().filter(job -> job.id().equals(id)).findFirst();
    }

    public ZoneId zone() {
        return zone;
    }
}
