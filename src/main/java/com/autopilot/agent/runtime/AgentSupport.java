package com.autopilot.agent.runtime;

import com.autopilot.action.service.ActionDispatcher;
import com.autopilot.action.service.ActionExecutor;
import com.autopilot.connector.service.ConnectorRegistry;
import com.autopilot.event.service.EventRouter;
import com.autopilot.llm.service.DraftingService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Общие сервисы, которые получает каждый экземпляр агента.
 */
@Getter
@Component
@RequiredArgsConstructor
public class AgentSupport {

    private final ActionExecutor executor;
    private final ActionDispatcher dispatcher;
    private final EventRouter eventRouter;
    private final ConnectorRegistry connectorRegistry;
    private final DraftingService drafting;
    private final AgentRunRecorder recorder;
    private final Clock clock;
}
