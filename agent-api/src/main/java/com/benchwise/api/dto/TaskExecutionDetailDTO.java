package com.benchwise.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Execution ledger entry.
 */
@Data
public class TaskExecutionDetailDTO {

    private Long executionId;
    private Long taskId;
    private String agentType;
    private String status;
    private Integer progress;
    private String currentStep;
    private Map<String, Object> inputData;
    private Map<String, Object> outputData;
    private String errorMessage;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
