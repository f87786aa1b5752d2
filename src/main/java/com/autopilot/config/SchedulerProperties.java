package com.autopilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Настройки планировщика (autopilot.scheduler.*).
 * jobs: id задачи -> cron (6 полей, со секундами), перекрывает расписание по умолчанию.
 */
@Data
@ConfigurationProperties(prefix = "autopilot.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;

    private String zone = "Europe/Paris";

    private boolean catchUpEnabled = true;

    private Duration lockTtl = Duration.ofHours(2);

    /**
     * TTL блокировки одного запуска агента для тенанта (по расписанию и из API).
     */
    private Duration agentLockTtl = Duration.ofMinutes(30);

    private Map<String, String> jobs = new LinkedHashMap<>();
}
