package com.autopilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Настройки повторов ActionExecutor (autopilot.executor.*)
 */
@Data
@ConfigurationProperties(prefix = "autopilot.executor")
public class ExecutorProperties {

    private int maxAttempts = 3;

    private List<Duration> backoff = new ArrayList<>(List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(3),
            Duration.ofSeconds(9)
    ));

    /**
     * Пауза после неудачной попытки с номером attempt (с единицы).
     * Если задержек меньше, чем попыток, повторяется последняя.
     */
    public Duration backoffAfter(int attempt) {
        if (backoff == null || backoff.isEmpty()) {
            return Duration.ZERO;
        }
        int index = Math.min(Math.max(attempt, 1), backoff.size()) - 1;
        return backoff.get(index);
    }
}
