package com.autopilot.agent.impl;

import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionType;
import com.autopilot.agent.model.AgentType;
import com.autopilot.agent.runtime.AbstractAgent;
import com.autopilot.agent.runtime.AgentContext;
import com.autopilot.agent.runtime.AgentSupport;
import com.autopilot.agent.runtime.RunReport;
import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.connector.model.DealRecord;
import com.autopilot.connector.model.ExpenseRecord;
import com.autopilot.event.model.EventType;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Эффективность привлечения: CAC по каналам за период и общий CAC.
 * При росте CAC выше порога относительно прошлого запуска пишет CEO.
 */
@Slf4j
public class AcquisitionEfficiencyAgent extends AbstractAgent {

    static final String UNATTRIBUTED = "unattributed";

    public AcquisitionEfficiencyAgent(AgentContext context, AgentSupport support) {
        super(context, support);
    }

    @Override
    public AgentType type() {
        return AgentType.ACQUISITION_EFFICIENCY;
    }

    @Override
    protected void execute(RunReport report) {
        Optional<Connector> crm = connector(ConnectorCategory.CRM);
        Optional<Connector> finance = connector(ConnectorCategory.FINANCE);
        if (crm.isEmpty() || finance.isEmpty()) {
            log.info("[{}] Для тенанта {} нужны CRM и бухгалтерия, анализ пропущен", name(), tenantId());
            return;
        }

        LocalDateTime now = now();
        LocalDate since = now.toLocalDate().minusDays(context.getInt("period_days", 90));
        Set<String> categories = context.getStringList("marketing_expense_categories").stream()
                .map(category -> category.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        Map<String, Double> spendByChannel = finance.get().fetchExpenses().stream()
                .filter(expense -> expense.date() != null && !expense.date().isBefore(since))
                .filter(expense -> expense.category() != null
                        && categories.contains(expense.category().toLowerCase(Locale.ROOT)))
                .collect(Collectors.groupingBy(expense -> channel(expense.channel()), TreeMap::new,
                        Collectors.summingDouble(ExpenseRecord::amount)));

        Map<String, Long> winsBySource = crm.get().fetchDeals().stream()
                .filter(DealRecord::isWon)
                .filter(deal -> deal.closedAt() != null && !deal.closedAt().toLocalDate().isBefore(since))
                .collect(Collectors.groupingBy(deal -> channel(deal.source()), TreeMap::new, Collectors.counting()));

        double totalSpend = spendByChannel.values().stream().mapToDouble(Double::doubleValue).sum();
        long totalWins = winsBySource.values().stream().mapToLong(Long::longValue).sum();
        double blendedCac = totalWins > 0 ? round(totalSpend / totalWins) : 0;
        report.kpi(blendedCac);

        Map<String, Double> cacBySource = new LinkedHashMap<>();
        winsBySource.forEach((source, wins) ->
                cacBySource.put(source, round(spendByChannel.getOrDefault(source, 0.0) / wins)));
        String topSource = cacBySource.entrySet().stream()
                .min(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("");

        OptionalDouble previous = support.getRecorder().previousKpi(tenantId(), name());
        double threshold = context.getDouble("cac_anomaly_threshold", 0.30);
        if (previous.isPresent() && previous.getAsDouble() > 0
                && blendedCac > previous.getAsDouble() * (1 + threshold)) {
            alertCeo(report, previous.getAsDouble(), blendedCac, cacBySource);
        }

        if (!cacBySource.isEmpty()) {
            publish(report, EventType.CAC_UPDATED, Map.of(
                    "cac_by_source", cacBySource,
                    "top_source", topSource,
                    "blended_cac", blendedCac));
        }
    }

    private void alertCeo(RunReport report, double previous, double current, Map<String, Double> cacBySource) {
        String ceoEmail = context.getString("ceo_email", "");
        if (ceoEmail.isEmpty()) {
            log.warn("[{}] CAC вырос с {} до {}, но email CEO не настроен", name(), previous, current);
            return;
        }

        String body = support.getDrafting().explain(
                Map.of("previous_cac", previous, "current_cac", current, "cac_by_source", cacBySource),
                "Объясни CEO, почему вырос CAC и какой канал посмотреть первым.");
        if (body.isEmpty()) {
            log.warn("[{}] Текст письма о росте CAC не сгенерирован, пропускаем", name());
            return;
        }

        submit(report, action(ActionType.SEND_EMAIL, ActionLevel.A)
                .payload(Map.of(
                        "to", ceoEmail,
                        "subject", "Рост CAC: " + previous + " -> " + current,
                        "body", body))
                .description("Аномальный рост CAC")
                .build());
    }

    private static String channel(String value) {
        return value == null || value.isBlank() ? UNATTRIBUTED : value.trim().toLowerCase(Locale.ROOT);
    }
}
