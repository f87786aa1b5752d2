package com.autopilot.agent.service;

import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.repository.ActionLogRepository;
import com.autopilot.action.repository.PendingActionRepository;
import com.autopilot.agent.model.AgentRun;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.repository.AgentRunRepository;
import com.autopilot.llm.service.DraftingService;
import com.autopilot.notification.service.NotificationService;
import com.autopilot.tenant.model.Tenant;
import com.autopilot.tenant.repository.TenantRepository;
import com.autopilot.tenant.service.TenantConfigService;
import com.autopilot.util.Payloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Еженедельный сводный отчет руководителю: KPI всех агентов за 7 дней,
 * выполненные действия и очередь на согласование. Отправляется письмом по понедельникам.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeeklyReportService {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    /**
     * Где искать адрес руководителя, по порядку.
     */
    private static final List<AgentType> CEO_EMAIL_SOURCES = List.of(
            AgentType.CASH_PREDICTABILITY,
            AgentType.ACQUISITION_EFFICIENCY,
            AgentType.REVENUE_VELOCITY
    );

    private final TenantRepository tenantRepository;
    private final TenantConfigService tenantConfigService;
    private final AgentRunRepository agentRunRepository;
    private final PendingActionRepository pendingActionRepository;
    private final ActionLogRepository actionLogRepository;
    private final DraftingService draftingService;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * @return true, если письмо отправлено
     */
    public boolean send(UUID tenantId) {
        Optional<Tenant> tenant = tenantRepository.findById(tenantId);
        if (tenant.isEmpty()) {
            log.error("[weekly_report] Тенант не найден: {}", tenantId);
            return false;
        }

        Optional<String> ceoEmail = findCeoEmail(tenantId);
        if (ceoEmail.isEmpty()) {
            log.error("[weekly_report] Email руководителя не настроен для тенанта {}", tenantId);
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime weekAgo = now.minusDays(7);

        StringBuilder body = new StringBuilder();
        Map<String, Object> summary = new LinkedHashMap<>();
        body.append("Сводка за неделю по ").append(tenant.get().getName())
                .append(" (").append(DATE.format(weekAgo)).append(" - ").append(DATE.format(now)).append(")\n\n");

        for (AgentType type : AgentType.values()) {
            List<AgentRun> runs = agentRunRepository.findByTenantIdAndAgentAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
                    tenantId, type.agentName(), weekAgo);
            body.append(agentLine(type, runs)).append('\n');
            runs.stream().findFirst()
                    .filter(run -> run.getKpiValue() != null)
                    .ifPresent(run -> summary.put(type.kpiName(), run.getKpiValue()));
        }

        long executed = actionLogRepository.countByTenantIdAndStatusAndExecutedAtGreaterThanEqual(
                tenantId, ActionStatus.SUCCESS, weekAgo);
        long pending = pendingActionRepository.countByTenantIdAndStatus(tenantId, ActionStatus.PENDING);
        summary.put("actions_executed", executed);
        summary.put("actions_pending", pending);

        body.append('\n')
                .append("Выполнено действий: ").append(executed).append('\n')
                .append("Ждут вашего решения: ").append(pending).append('\n');

        String narrative = draftingService.explain(summary,
                "Напиши руководителю два-три предложения: что изменилось за неделю и на что посмотреть первым.");
        if (!narrative.isBlank()) {
            body.append('\n').append(narrative.trim()).append('\n');
        }

        String subject = "Еженедельный отчет " + tenant.get().getName() + ": " + DATE.format(now);
        boolean sent = notificationService.sendEmail(ceoEmail.get(), subject, body.toString());
        if (sent) {
            log.info("[weekly_report] Отчет отправлен для тенанта {}", tenantId);
        } else {
            log.error("[weekly_report] Отчет не отправлен для тенанта {}", tenantId);
        }
        return sent;
    }

    private Optional<String> findCeoEmail(UUID tenantId) {
        for (AgentType type : CEO_EMAIL_SOURCES) {
            String email = Payloads.getString(tenantConfigService.getAgentConfig(tenantId, type), "ceo_email", "");
            if (!email.isBlank()) {
                return Optional.of(email.trim());
            }
        }
        return Optional.empty();
    }

    private static String agentLine(AgentType type, List<AgentRun> runs) {
        if (runs.isEmpty()) {
            return type.agentName() + ": нет запусков за неделю";
        }
        AgentRun last = runs.get(0);
        long failed = runs.stream().filter(run -> !Boolean.TRUE.equals(run.getSuccess())).count();
        String kpi = last.getKpiValue() != null ? String.valueOf(last.getKpiValue()) : "-";
        return type.agentName() + ": " + type.kpiName() + " = " + kpi
                + ", запусков " + runs.size()
                + (failed > 0 ? ", с ошибками " + failed : "");
    }
}
