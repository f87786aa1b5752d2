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
import com.autopilot.connector.model.InvoiceRecord;
import com.autopilot.event.model.EventType;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Предсказуемость денег: напоминания по просроченным счетам (после согласования человеком),
 * бриф CEO по сильно просроченным счетам и прогноз дней до критического остатка.
 */
@Slf4j
public class CashPredictabilityAgent extends AbstractAgent {

    static final String REMINDER_SUBJECT = "Напоминание об оплате счета ";

    public CashPredictabilityAgent(AgentContext context, AgentSupport support) {
        super(context, support);
    }

    @Override
    public AgentType type() {
        return AgentType.CASH_PREDICTABILITY;
    }

    @Override
    protected void execute(RunReport report) {
        Optional<Connector> finance = connector(ConnectorCategory.FINANCE);
        if (finance.isEmpty()) {
            log.info("[{}] Бухгалтерия не подключена у тенанта {}, анализ пропущен", name(), tenantId());
            return;
        }

        LocalDate today = now().toLocalDate();
        List<InvoiceRecord> open = finance.get().fetchInvoices().stream()
                .filter(InvoiceRecord::isOpen)
                .toList();
        List<InvoiceRecord> overdue = open.stream()
                .filter(invoice -> invoice.daysOverdue(today) > 0)
                .toList();

        double openTotal = open.stream().mapToDouble(InvoiceRecord::outstanding).sum();
        double overdueTotal = overdue.stream().mapToDouble(InvoiceRecord::outstanding).sum();
        report.kpi(openTotal > 0 ? round(overdueTotal / openTotal) : 0);

        Set<Integer> reminderDays = new HashSet<>(List.of(
                context.getInt("reminder_day_1", 1),
                context.getInt("reminder_day_2", 7),
                context.getInt("reminder_day_3", 15)));
        int escalationDay = context.getInt("escalation_day", 30);

        List<InvoiceRecord> escalations = new ArrayList<>();
        for (InvoiceRecord invoice : overdue) {
            long days = invoice.daysOverdue(today);
            if (days >= escalationDay) {
                escalations.add(invoice);
            } else if (reminderDays.contains((int) days)) {
                queueReminder(report, invoice, days);
            }
        }

        if (!escalations.isEmpty()) {
            briefCeo(report, escalations, today);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("overdue_total", round(overdueTotal));
        payload.put("overdue_count", overdue.size());
        daysUntilCritical().ifPresent(days -> payload.put("days_until_critical", days));
        publish(report, EventType.CASH_FORECAST_UPDATED, payload);
    }

    private void queueReminder(RunReport report, InvoiceRecord invoice, long daysOverdue) {
        if (invoice.clientEmail() == null || invoice.clientEmail().isBlank()) {
            log.warn("[{}] У счета {} нет email клиента, напоминание пропущено", name(), invoice.id());
            return;
        }

        Map<String, Object> data = invoiceData(invoice, daysOverdue);
        String body = support.getDrafting().draft(data,
                "Напиши вежливое напоминание клиенту о просроченной оплате счета. Без угроз, с номером счета и суммой.");
        if (body.isEmpty()) {
            log.warn("[{}] Текст напоминания по счету {} не сгенерирован, пропускаем", name(), invoice.id());
            return;
        }

        String number = invoice.number() != null ? invoice.number() : invoice.id();
        submit(report, action(ActionType.SEND_INVOICE_REMINDER, ActionLevel.B)
                .payload(Map.of(
                        "invoice_id", invoice.id(),
                        "client_email", invoice.clientEmail(),
                        "subject", REMINDER_SUBJECT + number,
                        "email_body", body))
                .description("Напоминание " + invoice.clientName() + " по счету " + number
                        + ", просрочка " + daysOverdue + " дн.")
                .preview(data)
                .build());
    }

    private void briefCeo(RunReport report, List<InvoiceRecord> escalations, LocalDate today) {
        List<Map<String, Object>> rows = escalations.stream()
                .map(invoice -> invoiceData(invoice, invoice.daysOverdue(today)))
                .toList();
        String brief = support.getDrafting().generate(Map.of("invoices", rows),
                "Подготовь для CEO короткий бриф по сильно просроченным счетам: кому позвонить и что предложить.");
        if (brief.isEmpty()) {
            log.warn("[{}] Бриф по просроченным счетам не сгенерирован, пропускаем", name());
            return;
        }

        submit(report, action(ActionType.ESCALATION_BRIEF, ActionLevel.C)
                .payload(Map.of(
                        "to", context.getString("ceo_email", ""),
                        "brief", brief,
                        "invoices", rows))
                .description("Счета с просрочкой от " + context.getInt("escalation_day", 30) + " дн.: " + rows.size())
                .preview(Map.of("invoices_count", rows.size()))
                .build());
    }

    /**
     * Дни до критического остатка при текущих расходах. Пусто, если расходы не настроены.
     */
    Optional<Integer> daysUntilCritical() {
        double balance = context.getDouble("cash_balance", 0);
        double monthlyBurn = context.getDouble("monthly_burn", 0);
        double threshold = context.getDouble("cash_critical_threshold", 0);
        if (monthlyBurn <= 0) {
            return Optional.empty();
        }
        double dailyBurn = monthlyBurn / 30.0;
        return Optional.of((int) Math.floor(Math.max(0, balance - threshold) / dailyBurn));
    }

    private static Map<String, Object> invoiceData(InvoiceRecord invoice, long daysOverdue) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("invoice_id", invoice.id());
        data.put("number", invoice.number());
        data.put("client", invoice.clientName());
        data.put("amount", invoice.outstanding());
        data.put("due_at", invoice.dueAt() != null ? invoice.dueAt().toString() : null);
        data.put("days_overdue", daysOverdue);
        return data;
    }
}
