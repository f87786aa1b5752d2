package com.autopilot.agent.runtime;

import com.autopilot.agent.impl.AcquisitionEfficiencyAgent;
import com.autopilot.agent.impl.CashPredictabilityAgent;
import com.autopilot.agent.impl.ProcessClarityAgent;
import com.autopilot.agent.impl.RevenueVelocityAgent;
import com.autopilot.agent.model.AgentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Новый экземпляр агента на каждый запуск.
 */
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final AgentSupport support;

    public AbstractAgent create(AgentType type, AgentContext context) {
        return switch (type) {
            case REVENUE_VELOCITY -> new RevenueVelocityAgent(context, support);
            case CASH_PREDICTABILITY -> new CashPredictabilityAgent(context, support);
            case PROCESS_CLARITY -> new ProcessClarityAgent(context, support);
            case ACQUISITION_EFFICIENCY -> new AcquisitionEfficiencyAgent(context, support);
        };
    }
}
