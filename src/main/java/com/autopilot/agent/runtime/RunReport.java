package com.autopilot.agent.runtime;

import com.autopilot.agent.model.AgentRunResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * То, что агент накапливает за один запуск: KPI, выполненные действия, ошибки.
 */
public class RunReport {

    private final List<Map<String, Object>> actions = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final String kpiName;
    private double kpiValue;

    public RunReport(String kpiName) {
        this.kpiName = kpiName;
    }

    public void kpi(double value) {
        this.kpiValue = value;
    }

    public void action(Map<String, Object> entry) {
        actions.add(entry);
    }

    public void error(String message) {
        errors.add(message);
    }

    public List<Map<String, Object>> actions() {
        return List.copyOf(actions);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public String kpiName() {
        return kpiName;
    }

    public double kpiValue() {
        return kpiValue;
    }

    AgentRunResult toResult(String agent, UUID tenantId, LocalDateTime startedAt, LocalDateTime finishedAt) {
        return new AgentRunResult(agent, tenantId, startedAt, finishedAt, actions, kpiName, kpiValue, errors);
    }
}
