package com.autopilot.agent.runtime;

import com.autopilot.action.model.Action;
import com.autopilot.action.model.ActionLevel;
import com.autopilot.action.model.ActionResult;
import com.autopilot.action.model.ActionStatus;
import com.autopilot.action.model.ActionType;
import com.autopilot.action.service.ActionOperation;
import com.autopilot.agent.model.AgentRunResult;
import com.autopilot.agent.model.AgentType;
import com.autopilot.connector.Connector;
import com.autopilot.connector.ConnectorCategory;
import com.autopilot.event.model.EventType;
import com.autopilot.exception.UnknownActionTypeException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Базовый класс агента.
 *
 * <p>{@link #run()} - единственная точка входа: фиксирует время старта, вызывает {@link #execute(RunReport)},
 * превращает любое исключение в неуспешный результат и всегда записывает результат в agent_runs.
 * Экземпляр одноразовый: на каждый запуск создается новый агент, состояние между запусками
 * хранится только в настройках тенанта.</p>
 */
@Slf4j
public abstract class AbstractAgent {

    protected final AgentContext context;
    protected final AgentSupport support;

    private final AtomicBoolean started = new AtomicBoolean(false);

    protected AbstractAgent(AgentContext context, AgentSupport support) {
        this.context = context;
        this.support = support;
    }

    public abstract AgentType type();

    public String name() {
        return type().agentName();
    }

    protected abstract void execute(RunReport report) throws Exception;

    public final AgentRunResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Агент " + name() + " уже запускался, нужен новый экземпляр");
        }

        LocalDateTime startedAt = now();
        log.info("[{}] Запуск для тенанта {}", name(), tenantId());

        RunReport report = new RunReport(type().kpiName());
        AgentRunResult result;
        try {
            execute(report);
            result = report.toResult(name(), tenantId(), startedAt, now());
        } catch (Exception e) {
            log.error("[{}] Критическая ошибка для тенанта {}: {}", name(), tenantId(), e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = new AgentRunResult(name(), tenantId(), startedAt, now(),
                    report.actions(), report.kpiName(), report.kpiValue(), List.of(error));
        }

        support.getRecorder().record(result);

        log.info("[{}] Завершен за {} мс: {} = {}, действий {}, ошибок {}",
                name(), result.duration().toMillis(), result.kpiName(), result.kpiValue(),
                result.actionsTaken().size(), result.errors().size());
        return result;
    }

    protected UUID tenantId() {
        return context.tenantId();
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(support.getClock());
    }

    protected Optional<Connector> connector(ConnectorCategory category) {
        return support.getConnectorRegistry().forTenant(tenantId(), category);
    }

    protected Action.ActionBuilder action(ActionType type, ActionLevel level) {
        return Action.builder()
                .type(type)
                .level(level)
                .tenantId(tenantId())
                .agent(name());
    }

    /**
     * Передает действие исполнителю. Для уровня A операция строится по типу и payload,
     * уровни B и C только сохраняются. Неуспешное действие попадает в ошибки запуска.
     */
    protected ActionResult submit(RunReport report, Action action) {
        ActionOperation operation = null;
        if (action.level() == ActionLevel.A) {
            try {
                operation = support.getDispatcher().operationFor(action.type(), tenantId(), action.payload());
            } catch (UnknownActionTypeException e) {
                log.error("[{}] Действие {} нельзя выполнить автоматически: {}", name(), action.type().value(), e.getMessage());
            }
        }

        ActionResult result = support.getExecutor().run(action, operation);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", action.type().value());
        entry.put("level", action.level().name());
        entry.put("status", result.status().name().toLowerCase());
        entry.put("description", action.description());
        if (result.pendingActionId() != null) {
            entry.put("pending_action_id", result.pendingActionId().toString());
        }
        report.action(entry);

        if (result.status() == ActionStatus.FAILED) {
            report.error(action.type().value() + ": " + result.error());
        }
        return result;
    }

    protected void publish(RunReport report, EventType type, Map<String, Object> payload) {
        if (!support.getEventRouter().publish(type, tenantId(), payload)) {
            report.error("Не удалось опубликовать событие " + type.value());
        }
    }

    protected static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
