package com.autopilot.tenant.controller;

import com.autopilot.agent.model.AgentType;
import com.autopilot.tenant.dto.request.ConfigAdjustmentRequest;
import com.autopilot.tenant.dto.response.AgentConfigResponse;
import com.autopilot.tenant.dto.response.ConfigAdjustmentResponse;
import com.autopilot.tenant.model.ConfigAdjustment;
import com.autopilot.tenant.service.TenantConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/tenants")
@RequiredArgsConstructor
@Tag(name = "Tenant config", description = "Настройки агентов тенанта")
public class TenantConfigController {

    private final TenantConfigService tenantConfigService;

    @Operation(summary = "Получить настройки агента", description = "Сохраненные настройки поверх значений по умолчанию")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Настройки получены"),
            @ApiResponse(responseCode = "400", description = "Неизвестный агент"),
            @ApiResponse(responseCode = "404", description = "Тенант не найден")
    })
    @GetMapping("/{tenantId}/agents/{agent}/config")
    public ResponseEntity<AgentConfigResponse> getAgentConfig(
            @PathVariable UUID tenantId,
            @PathVariable String agent) {
        AgentType agentType = AgentType.byName(agent);
        Map<String, Object> settings = tenantConfigService.getAgentConfig(tenantId, agentType);
        boolean enabled = tenantConfigService.isAgentEnabled(tenantId, agentType);
        return ResponseEntity.ok(new AgentConfigResponse(tenantId, agentType.agentName(), enabled, settings));
    }

    @Operation(summary = "Изменить параметр агента", description = "Ручная перекалибровка с записью в журнал изменений")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Параметр изменен"),
            @ApiResponse(responseCode = "400", description = "Неверные данные запроса"),
            @ApiResponse(responseCode = "404", description = "Тенант не найден")
    })
    @PatchMapping("/{tenantId}/agents/{agent}/config")
    public ResponseEntity<ConfigAdjustmentResponse> adjustAgentConfig(
            @PathVariable UUID tenantId,
            @PathVariable String agent,
            @Valid @RequestBody ConfigAdjustmentRequest request) {
        log.info("Запрос на изменение {}.{} для тенанта {}", agent, request.parameter(), tenantId);
        ConfigAdjustment adjustment = tenantConfigService.adjust(
                tenantId, AgentType.byName(agent), request.parameter(), request.value(), request.reason());
        return ResponseEntity.ok(toResponse(adjustment));
    }

    @Operation(summary = "История изменений настроек")
    @GetMapping("/{tenantId}/config/adjustments")
    public ResponseEntity<List<ConfigAdjustmentResponse>> getAdjustments(@PathVariable UUID tenantId) {
        List<ConfigAdjustmentResponse> history = tenantConfigService.getAdjustmentHistory(tenantId).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(history);
    }

    private ConfigAdjustmentResponse toResponse(ConfigAdjustment adjustment) {
        return new ConfigAdjustmentResponse(
                adjustment.getId(),
                adjustment.getAgent(),
                adjustment.getParameter(),
                adjustment.getOldValue(),
                adjustment.getNewValue(),
                adjustment.getReason(),
                adjustment.getAdjustedAt()
        );
    }
}
