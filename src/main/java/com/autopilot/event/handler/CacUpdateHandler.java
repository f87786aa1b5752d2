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
 * cac_updated: передает CAC по каналам в настройки revenue_velocity для скоринга лидов.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacUpdateHandler implements EventHandler {

    private final TenantConfigService tenantConfigService;

    @Override
    public EventType eventType() {
        return EventType.CAC_UPDATED;
    }

    @Override
    public void handle(UUID tenantId, Map<String, Object> payload) {
        Map<String, Object> cacBySource = Payloads.getMap(payload, "cac_by_source");
        if (cacBySource.isEmpty()) {
            return;
        }

        String topSource = Payloads.getString(payload, "top_source", "");
        log.info("cac_updated для тенанта {}: лучший канал {}", tenantId, topSource);

        tenantConfigService.updateAgentConfig(tenantId, AgentType.REVENUE_VELOCITY, Map.of(
                "cac_by_source", cacBySource,
                "top_acquisition_source", topSource
        ));
    }
}
