package com.autopilot.action.controller;

import com.autopilot.action.dto.response.ActionLogResponse;
import com.autopilot.action.dto.response.ActionResultResponse;
import com.autopilot.action.dto.response.PendingActionResponse;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.PendingAction;
import com.autopilot.action.service.ActionHistoryService;
import com.autopilot.action.service.ApprovalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/actions")
@RequiredArgsConstructor
@Tag(name = "Actions", description = "Отложенные действия агентов и журнал выполнения")
public class ActionController {

    private final ApprovalService approvalService;
    private final ActionHistoryService actionHistoryService;

    @Operation(summary = "Действия, ожидающие решения", description = "Уровень B ждет согласования, уровень C - ручного выполнения")
    @GetMapping("/pending")
    public ResponseEntity<Page<PendingActionResponse>> getPending(
            @RequestParam UUID tenantId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        Pageable pageable = PageRequest.of(page, size);
        return ResponseEntity.ok(actionHistoryService.getPendingActions(tenantId, pageable));
    }

    @Operation(summary = "Журнал действий", description = "Каждая попытка и каждый итог выполнения действий тенанта")
    @GetMapping("/logs")
    public ResponseEntity<Page<ActionLogResponse>> getLogs(
            @RequestParam UUID tenantId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String actionType,
            @RequestParam(required = false) String agent,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        Pageable pageable = PageRequest.of(page, size);

        Page<ActionLogResponse> logs;
        if (status != null || actionType != null || agent != null || from != null || to != null) {
            logs = actionHistoryService.getLogsWithFilters(tenantId, status, actionType, agent, from, to, pageable);
        } else {
            logs = actionHistoryService.getLogs(tenantId, pageable);
        }
        return ResponseEntity.ok(logs);
    }

    @Operation(summary = "Согласовать действие", description = "Выполняет действие уровня B с повторами. Повторное согласование отклоняется")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Действие выполнено (итог в поле status)"),
            @ApiResponse(responseCode = "404", description = "Действие не найдено"),
            @ApiResponse(responseCode = "409", description = "Действие уже не ожидает решения")
    })
    @PostMapping("/{id}/approve")
    public ResponseEntity<ActionResultResponse> approve(@PathVariable UUID id, @RequestParam UUID tenantId) {
        log.info("Согласование действия {} для тенанта {}", id, tenantId);
        ActionResult result = approvalService.approve(tenantId, id);
        return ResponseEntity.ok(ActionResultResponse.from(result));
    }

    @Operation(summary = "Отклонить действие", description = "Идемпотентно: повторное отклонение ничего не меняет")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Действие отклонено"),
            @ApiResponse(responseCode = "404", description = "Действие не найдено"),
            @ApiResponse(responseCode = "409", description = "Действие уже выполнено")
    })
    @PostMapping("/{id}/reject")
    public ResponseEntity<PendingActionResponse> reject(@PathVariable UUID id, @RequestParam UUID tenantId) {
        log.info("Отклонение действия {} для тенанта {}", id, tenantId);
        PendingAction rejected = approvalService.reject(tenantId, id);
        return ResponseEntity.ok(actionHistoryService.toResponse(rejected));
    }

    @Operation(summary = "Закрыть бриф", description = "Человек выполнил действие уровня C вручную")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Бриф закрыт"),
            @ApiResponse(responseCode = "404", description = "Бриф не найден"),
            @ApiResponse(responseCode = "409", description = "Бриф уже закрыт или это не бриф")
    })
    @PostMapping("/{id}/complete")
    public ResponseEntity<ActionResultResponse> complete(@PathVariable UUID id, @RequestParam UUID tenantId) {
        log.info("Ручное закрытие брифа {} для тенанта {}", id, tenantId);
        ActionResult result = approvalService.complete(tenantId, id);
        return ResponseEntity.ok(ActionResultResponse.from(result));
    }
}
