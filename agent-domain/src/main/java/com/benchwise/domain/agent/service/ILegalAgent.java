package com.benchwise.domain.agent.service;

import com.benchwise.domain.agent.model.valobj.AgentCapability;
import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.types.enums.AgentTypeEnum;

import java.util.List;

/**
 * Contract every long-running agent implements.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public interface ILegalAgent {

    /**
     * Stable identifier
     */
    String getId();

    /**
     * Type tag tasks are dispatched on
     */
    AgentTypeEnum getType();

    String getName();

    String getDescription();

    List<AgentCapability> getCapabilities();

    /**
     * Context keys that must be supplied before a matter-bound execution
     */
    List<String> getRequiredContext();

    /**
     * Structural input check. Returns false for caller-correctable problems, never throws.
     */
    boolean validateInput(AgentInput input);

    /**
     * Error recorded when {@link #validateInput(AgentInput)} rejects an input
     */
    String getInvalidInputMessage();

    /**
     * Rough duration in seconds, for display only
     */
    int estimateDuration(AgentInput input);

    /**
     * Run the agent. Expected failures are returned as {@code success=false}.
     */
    AgentOutput execute(AgentInput input, ExecutionContext context);
}
