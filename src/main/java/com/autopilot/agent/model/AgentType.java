package com.autopilot.agent.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Каталог агентов. Имя {@link #agentName()} хранится в БД и используется в API.
 * Настройки по умолчанию сливаются с настройками тенанта (у тенанта приоритет).
 */
public enum AgentType {

    REVENUE_VELOCITY("revenue_velocity", "weighted_pipeline_per_day", Map.of(
            "enabled", true,
            "stagnation_threshold_days", 21,
            "lead_score_hot_threshold", 70,
            "lead_score_warm_threshold", 40,
            "head_of_sales_email", "",
            "alert_channel", "email",
            "report_frequency", "weekly",
            "cash_pressure_mode", false
    )),
    CASH_PREDICTABILITY("cash_predictability", "overdue_ratio", Map.of(
            "enabled", true,
            "cash_critical_threshold", 0,
            "reminder_day_1", 1,
            "reminder_day_2", 7,
            "reminder_day_3", 15,
            "escalation_day", 30,
            "ceo_email", "",
            "alert_channel", "email",
            "cash_balance", 0,
            "monthly_burn", 0
    )),
    PROCESS_CLARITY("process_clarity", "avg_cycle_time_days", Map.of(
            "enabled", true,
            "deadline_warning_days", 2,
            "overdue_escalation_days", 3,
            "manager_email", "",
            "alert_channel", "email"
    )),
    ACQUISITION_EFFICIENCY("acquisition_efficiency", "blended_cac", Map.of(
            "enabled", true,
            "cac_anomaly_threshold", 0.30,
            "marketing_expense_categories", List.of(
                    "marketing", "advertising", "publicite", "ads", "pub", "communication", "acquisition"),
            "ceo_email", "",
            "period_days", 90
    ));

    private final String agentName;
    private final String kpiName;
    private final Map<String, Object> defaults;

    AgentType(String agentName, String kpiName, Map<String, Object> defaults) {
        this.agentName = agentName;
        this.kpiName = kpiName;
        this.defaults = defaults;
    }

    public String agentName() {
        return agentName;
    }

    public String kpiName() {
        return kpiName;
    }

    public Map<String, Object> defaults() {
        return defaults;
    }

    public static Optional<AgentType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.agentName.equals(name))
                .findFirst();
    }

    public static AgentType byName(String name) {
        return fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Неизвестный агент: " + name));
    }
}
