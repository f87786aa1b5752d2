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
import com.autopilot.event.model.EventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Скорость выручки: помечает застрявшие сделки, считает взвешенную воронку и прогноз на 30 дней.
 * В режиме давления на кэш готовит руководителю продаж бриф по сделкам с наибольшим ожидаемым доходом.
 */
@Slf4j
public class RevenueVelocityAgent extends AbstractAgent {

    static final int FORECAST_DAYS = 30;
    static final int PRIORITY_DEALS = 5;

    public RevenueVelocityAgent(AgentContext context, AgentSupport support) {
        super(context, support);
    }

    @Override
    public AgentType type() {
        return AgentType.REVENUE_VELOCITY;
    }

    @Override
    protected void execute(RunReport report) {
        Optional<Connector> crm = connector(ConnectorCategory.CRM);
        if (crm.isEmpty()) {
            log.info("[{}] CRM не подключена у тенанта {}, анализ пропущен", name(), tenantId());
            return;
        }

        LocalDateTime now = now();
        List<DealRecord> openDeals = crm.get().fetchDeals().stream()
                .filter(DealRecord::isOpen)
                .toList();
        if (openDeals.isEmpty()) {
            return;
        }

        int stagnationDays = context.getInt("stagnation_threshold_days", 21);
        int stagnant = 0;
        for (DealRecord deal : openDeals) {
            long idle = idleDays(deal, now);
            if (idle < stagnationDays) {
                continue;
            }
            stagnant++;
            submit(report, action(ActionType.TAG_DEAL, ActionLevel.A)
                    .payload(Map.of(
                            "deal_id", deal.id(),
                            "fields", Map.of("autopilot_status", "stagnant", "days_stagnant", idle)))
                    .description("Сделка \"" + deal.title() + "\" без активности " + idle + " дн.")
                    .build());
        }

        double weighted = openDeals.stream().mapToDouble(RevenueVelocityAgent::expectedValue).sum();
        double avgAgeDays = openDeals.stream()
                .mapToLong(deal -> deal.createdAt() != null ? Duration.between(deal.createdAt(), now).toDays() : 0)
                .average()
                .orElse(0);
        report.kpi(round(weighted / Math.max(1, avgAgeDays)));

        LocalDateTime horizon = now.plusDays(FORECAST_DAYS);
        double forecast = openDeals.stream()
                .filter(deal -> deal.expectedCloseDate() != null && !deal.expectedCloseDate().isAfter(horizon))
                .mapToDouble(RevenueVelocityAgent::expectedValue)
                .sum();
        long dated = openDeals.stream().filter(deal -> deal.expectedCloseDate() != null).count();
        double confidence = (double) (dated - Math.min(dated, stagnant)) / openDeals.size();

        publish(report, EventType.FORECAST_UPDATED, Map.of(
                "forecast_30d", round(forecast),
                "confidence", round(confidence),
                "open_deals", openDeals.size()));

        if (context.getBoolean("cash_pressure_mode", false)) {
            briefHeadOfSales(report, openDeals);
        }
    }

    private void briefHeadOfSales(RunReport report, List<DealRecord> openDeals) {
        List<Map<String, Object>> priorities = openDeals.stream()
                .sorted(Comparator.comparingDouble(RevenueVelocityAgent::expectedValue).reversed())
                .limit(PRIORITY_DEALS)
                .map(deal -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("deal_id", deal.id());
                    row.put("title", deal.title());
                    row.put("amount", deal.amount());
                    row.put("probability", deal.probability());
                    row.put("expected_value", round(expectedValue(deal)));
                    return row;
                })
                .toList();

        String brief = support.getDrafting().generate(
                Map.of("deals", priorities),
                "Денег в компании меньше чем на 45 дней. Составь для руководителя продаж план: "
                        + "какие сделки закрыть в первую очередь и какие шаги сделать на этой неделе.");
        if (brief.isEmpty()) {
            log.warn("[{}] Бриф по приоритетным сделкам не сгенерирован, пропускаем", name());
            return;
        }

        submit(report, action(ActionType.DEAL_PRIORITY_BRIEF, ActionLevel.C)
                .payload(Map.of(
                        "to", context.getString("head_of_sales_email", ""),
                        "brief", brief,
                        "deals", priorities))
                .description("Приоритетные сделки при нехватке денег")
                .preview(Map.of("deals_count", priorities.size()))
                .build());
    }

    private static long idleDays(DealRecord deal, LocalDateTime now) {
        LocalDateTime last = deal.lastActivityAt() != null ? deal.lastActivityAt() : deal.createdAt();
        return last == null ? 0 : Duration.between(last, now).toDays();
    }

    /**
     * Вероятность может приходить как доля (0.4) или в процентах (40).
     */
    static double expectedValue(DealRecord deal) {
        double probability = deal.probability() > 1 ? deal.probability() / 100.0 : deal.probability();
        return deal.amount() * probability;
    }
}
