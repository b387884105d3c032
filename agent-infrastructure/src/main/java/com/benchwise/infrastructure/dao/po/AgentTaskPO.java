package com.benchwise.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent task PO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskPO {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Matter ID
     */
    private Long matterId;

    /**
     * Agent type code
     */
    private String agentType;

    /**
     * Task name
     */
    private String taskName;

    /**
     * Status code
     */
    private String status;

    /**
     * Progress 0-100
     */
    private Integer progress;

    /**
     * Current step label
     */
    private String currentStep;

    /**
     * Input payload (JSONB)
     */
    private String inputConfig;

    /**
     * Output payload (JSONB)
     */
    private String outputData;

    /**
     * Error message
     */
    private String errorMessage;

    /**
     * Last heartbeat
     */
    private LocalDateTime heartbeatAt;

    /**
     * Creation time
     */
    private LocalDateTime createdAt;

    /**
     * Start time
     */
    private LocalDateTime startedAt;

    /**
     * Completion time
     */
    private LocalDateTime completedAt;

    /**
     * Update time
     */
    private LocalDateTime updatedAt;
}
