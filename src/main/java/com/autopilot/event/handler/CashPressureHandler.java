package com.autopilot.event.handler;

import com.autopilot.agent.model.AgentType;
import com.autopilot.event.model.EventType;
import com.autopilot.tenant.service.TenantConfigService;
import com.autopilot.util.Payloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * cash_forecast_updated: включает режим давления на кэш в revenue_velocity,
 * если до критического уровня денег осталось меньше 45 дней.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CashPressureHandler implements EventHandler {

    static final int PRESSURE_DAYS = 45;

    private final TenantConfigService tenantConfigService;

    @Override
    public EventType eventType() {
        return EventType.CASH_FORECAST_UPDATED;
    }

    @Override
    public void handle(UUID tenantId, Map<String, Object> payload) {
        if (payload == null || payload.get("days_until_critical") == null) {
            log.debug("cash_forecast_updated без days_until_critical для тенанта {}", tenantId);
            return;
        }

        int days = Payloads.getInt(payload, "days_until_critical", Integer.MAX_VALUE);
        boolean pressure = days < PRESSURE_DAYS;
        log.info("cash_forecast_updated для тенанта {}: критический уровень через {} дн., режим давления: {}",
                tenantId, days, pressure);

        tenantConfigService.updateAgentConfig(tenantId, AgentType.REVENUE_VELOCITY,
                Map.of("cash_pressure_mode", pressure));
    }
}
