package com.benchwise.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Task execution PO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionPO {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Task ID (agent_tasks.id)
     */
    private Long taskId;

    /**
     * Agent type code
     */
    private String agentType;

    /**
     * Status code
     */
    private String status;

    /**
     * Input snapshot (JSONB)
     */
    private String inputData;

    /**
     * Output snapshot (JSONB)
     */
    private String outputData;

    /**
     * Error message
     */
    private String errorMessage;

    /**
     * Progress 0-100
     */
    private Integer progress;

    /**
     * Current step label
     */
    private String currentStep;

    /**
     * Start time
     */
    private LocalDateTime startedAt;

    /**
     * Completion time
     */
    private LocalDateTime completedAt;
}
