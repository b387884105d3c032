package com.benchwise.domain.agent.model.valobj;

import java.util.List;

/**
 * A named capability an agent declares.
 *
 * @param name              capability name
 * @param description       what it does
 * @param inputTypes        accepted data kinds
 * @param outputTypes       produced data kinds
 * @param estimatedDuration estimated duration in seconds
 */
public record AgentCapability(String name,
                              String description,
                              List<String> inputTypes,
                              List<String> outputTypes,
                              int estimatedDuration) {
}
