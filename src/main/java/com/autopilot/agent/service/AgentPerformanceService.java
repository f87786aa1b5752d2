package com.autopilot.agent.service;

import com.autopilot.action.model.ActionLog;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.repository.ActionLogRepository;
import com.autopilot.agent.dto.response.AgentPerformanceResponse;
import com.autopilot.agent.dto.response.AgentPerformanceResponse.AgentPerformance;
import com.autopilot.agent.dto.response.AgentPerformanceResponse.Recommendation;
import com.autopilot.agent.model.AgentRun;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.repository.AgentRunRepository;
import com.autopilot.tenant.service.TenantConfigService;
import com.autopilot.util.Payloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Анализ работы агентов тенанта за 30 дней для ежемесячной перекалибровки.
 * Считает запуски и действия по agent_runs и action_logs и предлагает изменения настроек.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentPerformanceService {

    static final int PERIOD_DAYS = 30;

    private static final double TREND_THRESHOLD = 0.20;

    private final AgentRunRepository agentRunRepository;
    private final ActionLogRepository actionLogRepository;
    private final TenantConfigService tenantConfigService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AgentPerformanceResponse analyze(UUID tenantId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime from = now.minusDays(PERIOD_DAYS);
        log.info("Анализ работы агентов тенанта {} с {}", tenantId, from);

        List<AgentPerformance> agents = Arrays.stream(AgentType.values())
                .map(type -> analyze(tenantId, type, from))
                .toList();
        return new AgentPerformanceResponse(tenantId, now, PERIOD_DAYS, agents);
    }

    private AgentPerformance analyze(UUID tenantId, AgentType type, LocalDateTime from) {
        Map<String, Object> config = tenantConfigService.getAgentConfig(tenantId, type);
        List<AgentRun> runs = agentRunRepository.findByTenantIdAndAgentAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
                tenantId, type.agentName(), from);
        List<ActionLog> logs = actionLogRepository.findByTenantIdAndAgentAndExecutedAtGreaterThanEqual(
                tenantId, type.agentName(), from);

        int failedRuns = (int) runs.stream().filter(run -> !Boolean.TRUE.equals(run.getSuccess())).count();
        double successRate = runs.isEmpty() ? 0 : round((double) (runs.size() - failedRuns) / runs.size());
        long avgDuration = Math.round(runs.stream()
                .filter(run -> run.getDurationMs() != null)
                .mapToLong(AgentRun::getDurationMs)
                .average()
                .orElse(0));

        List<Double> kpis = runs.stream()
                .filter(run -> Boolean.TRUE.equals(run.getSuccess()) && run.getKpiValue() != null)
                .map(AgentRun::getKpiValue)
                .toList();
        Double latest = kpis.isEmpty() ? null : kpis.get(0);
        Double previous = kpis.size() > 1 ? kpis.get(1) : null;
        Double trend = latest != null && previous != null && previous != 0
                ? round((latest - previous) / previous)
                : null;

        return new AgentPerformance(
                type.agentName(),
                Payloads.getBoolean(config, "enabled", true),
                runs.size(),
                failedRuns,
                successRate,
                avgDuration,
                type.kpiName(),
                latest,
                previous,
                trend,
                countStatus(logs, ActionStatus.SUCCESS),
                countStatus(logs, ActionStatus.FAILED),
                countStatus(logs, ActionStatus.PENDING),
                countStatus(logs, ActionStatus.CANCELLED),
                recommend(type, config, latest, trend)
        );
    }

    private static List<Recommendation> recommend(AgentType type, Map<String, Object> config,
                                                  Double latest, Double trend) {
        List<Recommendation> recommendations = new ArrayList<>();
        switch (type) {
            case REVENUE_VELOCITY -> {
                int current = Payloads.getInt(config, "stagnation_threshold_days", 21);
                if (trend != null && trend < -TREND_THRESHOLD && current > 14) {
                    recommendations.add(new Recommendation("stagnation_threshold_days", current, 14,
                            "Взвешенный пайплайн в день снизился на " + percent(-trend)
                                    + ". Выявлять застой сделок раньше."));
                }
            }
            case CASH_PREDICTABILITY -> {
                int current = Payloads.getInt(config, "reminder_day_1", 1);
                if (latest != null && latest > 0.30 && current > 0) {
                    recommendations.add(new Recommendation("reminder_day_1", current, 0,
                            "Просрочено " + percent(latest) + " открытой задолженности. "
                                    + "Отправлять первое напоминание в день срока."));
                }
            }
            case PROCESS_CLARITY -> {
                int current = Payloads.getInt(config, "deadline_warning_days", 2);
                if (trend != null && trend > TREND_THRESHOLD && current < 3) {
                    recommendations.add(new Recommendation("deadline_warning_days", current, 3,
                            "Средний цикл задач вырос на " + percent(trend) + ". Предупреждать о сроках раньше."));
                }
            }
            case ACQUISITION_EFFICIENCY -> {
                double current = Payloads.getDouble(config, "cac_anomaly_threshold", 0.30);
                if (trend != null && trend > TREND_THRESHOLD && current > 0.20) {
                    recommendations.add(new Recommendation("cac_anomaly_threshold", current, 0.20,
                            "CAC вырос на " + percent(trend) + ". Снизить порог тревоги."));
                }
            }
        }
        return recommendations;
    }

    private static int countStatus(List<ActionLog> logs, ActionStatus status) {
        return (int) logs.stream().filter(entry -> entry.getStatus() == status).count();
    }

    private static String percent(double ratio) {
        return Math.round(ratio * 100) + "%";
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
