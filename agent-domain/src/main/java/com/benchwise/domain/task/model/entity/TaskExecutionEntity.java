package com.benchwise.domain.task.model.entity;

import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.TaskStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Task execution ledger entry: one attempt to run a task.
 *
 * @author benchwise
 * @since 2026-03-02
 */
@Data
public class TaskExecutionEntity {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Task ID
     */
    private Long taskId;

    /**
     * Agent type
     */
    private AgentTypeEnum agentType;

    /**
     * Status, same state machine as the task
     */
    private TaskStatusEnum status;

    /**
     * Input snapshot
     */
    private Map<String, Object> inputData;

    /**
     * Output snapshot
     */
    private Map<String, Object> outputData;

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

    /**
     * Open a running ledger entry for the task.
     */
    public static TaskExecutionEntity open(Long taskId, AgentTypeEnum agentType, Map<String, Object> inputData) {
        TaskExecutionEntity execution = new TaskExecutionEntity();
        execution.setTaskId(taskId);
        execution.setAgentType(agentType);
        execution.setStatus(TaskStatusEnum.RUNNING);
        execution.setInputData(inputData);
        execution.setProgress(0);
        execution.setStartedAt(LocalDateTime.now());
        return execution;
    }

    /**
     * Close the entry with a terminal status. A closed entry is never reopened.
     */
    public void close(TaskStatusEnum terminal, Map<String, Object> output, String error) {
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("Execution must close with a terminal status: " + terminal);
        }
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Execution already closed with status " + status);
        }
        this.status = terminal;
        this.outputData = output;
        this.errorMessage = error;
        if (terminal == TaskStatusEnum.COMPLETED) {
            this.progress = 100;
            this.currentStep = "Completed";
        } else if (terminal == TaskStatusEnum.FAILED) {
            this.currentStep = "Failed";
        } else {
            this.currentStep = "Cancelled";
        }
        this.completedAt = LocalDateTime.now();
    }

    public boolean isOpen() {
        return status != null && !status.isTerminal();
    }
}
