package com.autopilot.scheduler.model;

import com.autopilot.agent.model.AgentType;
import org.springframework.scheduling.support.CronExpression;

/**
 * Задача расписания. agentType задан только у задач вида {@link JobKind#AGENT}.
 */
public record JobDefinition(String id, JobKind kind, AgentType agentType, String expression, CronExpression cron) {

    public static JobDefinition of(String id, JobKind kind, AgentType agentType, String expression) {
        if ((kind == JobKind.AGENT) != (agentType != null)) {
            throw new IllegalArgumentException("Задача " + id + ": агент указывается только для задач вида AGENT");
        }
        return new JobDefinition(id, kind, agentType, expression, CronExpression.parse(expression));
    }

    public static JobDefinition agent(AgentType agentType, String expression) {
        return of(agentType.agentName(), JobKind.AGENT, agentType, expression);
    }
}
