package com.benchwise.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Registered agent summary.
 */
@Data
public class AgentSummaryDTO {

    private String agentId;
    private String agentType;
    private String name;
    private String description;
    private List<AgentCapabilityDTO> capabilities;
    private List<String> requiredContext;
}
