package com.benchwise.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Task creation request.
 */
@Data
public class TaskCreateRequestDTO {

    /**
     * Owning matter. Null runs as general research.
     */
    private Long matterId;

    /**
     * Agent type code or alias, e.g. "discovery".
     */
    private String agentType;

    private String query;

    private Map<String, Object> parameters;

    private List<Long> documents;

    private Map<String, Object> context;

    /**
     * Optional. Generated from the agent type and query when blank.
     */
    private String name;
}
