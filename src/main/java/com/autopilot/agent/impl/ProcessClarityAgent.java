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
import com.autopilot.connector.model.TaskRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ясность процессов: среднее время выполнения задач, напоминания исполнителям
 * о близком сроке и бриф менеджеру по задачам с долгой просрочкой.
 */
@Slf4j
public class ProcessClarityAgent extends AbstractAgent {

    public ProcessClarityAgent(AgentContext context, AgentSupport support) {
        super(context, support);
    }

    @Override
    public AgentType type() {
        return AgentType.PROCESS_CLARITY;
    }

    @Override
    protected void execute(RunReport report) {
        Optional<Connector> project = connector(ConnectorCategory.PROJECT);
        if (project.isEmpty()) {
            log.info("[{}] Трекер задач не подключен у тенанта {}, анализ пропущен", name(), tenantId());
            return;
        }

        List<TaskRecord> tasks = project.get().fetchTasks();
        report.kpi(round(tasks.stream()
                .map(TaskRecord::cycleTimeDays)
                .flatMap(Optional::stream)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0)));

        LocalDate today = now().toLocalDate();
        int warningDays = context.getInt("deadline_warning_days", 2);
        int escalationDays = context.getInt("overdue_escalation_days", 3);

        List<Map<String, Object>> longOverdue = new ArrayList<>();
        for (TaskRecord task : tasks) {
            if (task.isDone() || task.dueAt() == null) {
                continue;
            }
            long daysLeft = ChronoUnit.DAYS.between(today, task.dueAt().toLocalDate());
            if (daysLeft >= 0 && daysLeft <= warningDays) {
                warnAssignee(report, task, daysLeft);
            } else if (-daysLeft >= escalationDays) {
                longOverdue.add(taskData(task, -daysLeft));
            }
        }

        if (!longOverdue.isEmpty()) {
            briefManager(report, longOverdue);
        }
    }

    private void warnAssignee(RunReport report, TaskRecord task, long daysLeft) {
        if (task.assigneeEmail() == null || task.assigneeEmail().isBlank()) {
            return;
        }
        String when = daysLeft == 0 ? "сегодня" : "через " + daysLeft + " дн.";
        submit(report, action(ActionType.SEND_EMAIL, ActionLevel.A)
                .payload(Map.of(
                        "to", task.assigneeEmail(),
                        "subject", "Срок задачи: " + task.title(),
                        "body", "Срок задачи \"" + task.title() + "\" истекает " + when + "."))
                .description("Напоминание о сроке задачи " + task.title())
                .build());
    }

    private void briefManager(RunReport report, List<Map<String, Object>> longOverdue) {
        String brief = support.getDrafting().generate(Map.of("tasks", longOverdue),
                "Подготовь менеджеру короткий бриф по просроченным задачам: что блокирует и с кем поговорить.");
        if (brief.isEmpty()) {
            log.warn("[{}] Бриф по просроченным задачам не сгенерирован, пропускаем", name());
            return;
        }

        submit(report, action(ActionType.ESCALATION_BRIEF, ActionLevel.C)
                .payload(Map.of(
                        "to", context.getString("manager_email", ""),
                        "brief", brief,
                        "tasks", longOverdue))
                .description("Задачи с долгой просрочкой: " + longOverdue.size())
                .preview(Map.of("tasks_count", longOverdue.size()))
                .build());
    }

    private static Map<String, Object> taskData(TaskRecord task, long daysOverdue) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.id());
        data.put("title", task.title());
        data.put("assignee", task.assigneeName());
        data.put("days_overdue", daysOverdue);
        return data;
    }
}
