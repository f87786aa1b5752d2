package com.autopilot.event.handler;

import com.autopilot.agent.model.AgentType;
import com.autopilot.event.model.EventType;
import com.autopilot.tenant.service.TenantConfigService;
import com.autopilot.util.Payloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * forecast_updated: при низкой уверенности прогноза отмечает это в настройках revenue_velocity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastConfidenceHandler implements EventHandler {

    static final double LOW_CONFIDENCE = 0.3;

    private final TenantConfigService tenantConfigService;
    private final Clock clock;

    @Override
    public EventType eventType() {
        return EventType.FORECAST_UPDATED;
    }

    @Override
    public void handle(UUID tenantId, Map<String, Object> payload) {
        double forecast = Payloads.getDouble(payload, "forecast_30d", 0);
        double confidence = Payloads.getDouble(payload, "confidence", 0);
        log.info("forecast_updated для тенанта {}: прогноз на 30 дней {}, уверенность {}", tenantId, forecast, confidence);

        if (confidence >= LOW_CONFIDENCE) {
            return;
        }
        tenantConfigService.updateAgentConfig(tenantId, AgentType.REVENUE_VELOCITY, Map.of(
                "last_low_confidence_alert", LocalDateTime.now(clock).toString(),
                "last_low_confidence", confidence
        ));
    }
}
