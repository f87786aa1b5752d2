package com.autopilot.agent.controller;

import com.autopilot.agent.dto.response.AgentPerformanceResponse;
import com.autopilot.agent.dto.response.AgentRunResponse;
import com.autopilot.agent.dto.response.AgentStatusResponse;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.service.AgentPerformanceService;
import com.autopilot.agent.service.AgentRunner;
import com.autopilot.agent.service.AgentStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/agents")
@RequiredArgsConstructor
@Tag(name = "Agents", description = "Запуск агентов и их состояние")
public class AgentController {

    private final AgentRunner agentRunner;
    private final AgentStatusService agentStatusService;
    private final AgentPerformanceService agentPerformanceService;

    @Operation(
            summary = "Запустить агента для тенанта",
            description = "Синхронный запуск вне расписания. Ошибки агента возвращаются в поле errors"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Запуск завершен"),
            @ApiResponse(responseCode = "400", description = "Неизвестный или отключенный агент"),
            @ApiResponse(responseCode = "404", description = "Тенант не найден"),
            @ApiResponse(responseCode = "409", description = "Агент уже выполняется для тенанта")
    })
    @PostMapping("/{agent}/run")
    public ResponseEntity<AgentRunResponse> run(@PathVariable String agent, @RequestParam UUID tenantId) {
        log.info("Ручной запуск агента {} для тенанта {}", agent, tenantId);
        AgentRunResult result = agentRunner.run(AgentType.byName(agent), tenantId);
        return ResponseEntity.ok(agentStatusService.toRunResponse(result));
    }

    @Operation(summary = "Состояние агентов", description = "Последний запуск каждого агента и число действий, ожидающих решения")
    @GetMapping("/status")
    public ResponseEntity<AgentStatusResponse> status(@RequestParam UUID tenantId) {
        return ResponseEntity.ok(agentStatusService.getStatus(tenantId));
    }

    @Operation(summary = "История запусков")
    @GetMapping("/runs")
    public ResponseEntity<Page<AgentRunResponse>> runs(
            @RequestParam UUID tenantId,
            @RequestParam(required = false) String agent,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        AgentType type = agent != null ? AgentType.byName(agent) : null;
        return ResponseEntity.ok(agentStatusService.getRuns(tenantId, type, PageRequest.of(page, size)));
    }

    @Operation(
            summary = "Отчет о работе агентов за 30 дней",
            description = "Запуски, KPI, действия и предложения по перекалибровке настроек"
    )
    @GetMapping("/performance")
    public ResponseEntity<AgentPerformanceResponse> performance(@RequestParam UUID tenantId) {
        return ResponseEntity.ok(agentPerformanceService.analyze(tenantId));
    }
}
