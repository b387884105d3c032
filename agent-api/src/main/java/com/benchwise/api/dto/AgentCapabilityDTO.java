package com.benchwise.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Named capability of a registered agent.
 */
@Data
public class AgentCapabilityDTO {

    private String name;
    private String description;
    private List<String> inputTypes;
    private List<String> outputTypes;
    private Integer estimatedDuration;
}
