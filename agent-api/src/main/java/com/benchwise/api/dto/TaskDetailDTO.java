package com.benchwise.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Task detail.
 */
@Data
public class TaskDetailDTO {

    private Long taskId;
    private Long matterId;
    private String agentType;
    private String name;
    private String status;
    private Integer progress;
    private String currentStep;
    private Map<String, Object> inputConfig;
    private Map<String, Object> outputData;
    private String errorMessage;
    private LocalDateTime heartbeatAt;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
}
