package com.benchwise.domain.task.model.entity;

import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.TaskStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Agent task domain entity.
 * <p>
 * The task row is the current projection of a unit of agent work; the execution
 * ledger lives in {@link TaskExecutionEntity}.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-02
 */
@Data
public class AgentTaskEntity {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Owning matter ID, null for matter-less tasks
     */
    private Long matterId;

    /**
     * Agent type
     */
    private AgentTypeEnum agentType;

    /**
     * Human readable task name
     */
    private String name;

    /**
     * Status
     */
    private TaskStatusEnum status;

    /**
     * Progress 0-100
     */
    private Integer progress;

    /**
     * Current step label
     */
    private String currentStep;

    /**
     * Input payload: query, parameters, documents, context
     */
    private Map<String, Object> inputConfig;

    /**
     * Output payload, null until terminal
     */
    private Map<String, Object> outputData;

    /**
     * Error message
     */
    private String errorMessage;

    /**
     * Last liveness signal from the executing process
     */
    private LocalDateTime heartbeatAt;

    /**
     * Creation time
     */
    private LocalDateTime createdAt;

    /**
     * Time the task entered running
     */
    private LocalDateTime startedAt;

    /**
     * Time the task entered a terminal state
     */
    private LocalDateTime completedAt;

    /**
     * Last update time
     */
    private LocalDateTime updatedAt;

    /**
     * Validate the task before it is persisted
     */
    public void validate() {
        if (agentType == null) {
            throw new IllegalStateException("Agent type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Task name cannot be empty");
        }
        if (inputConfig == null) {
            throw new IllegalStateException("Input config cannot be null");
        }
    }

    /**
     * Move into running. startedAt is only set here.
     */
    public void start() {
        requireTransition(TaskStatusEnum.RUNNING);
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.RUNNING;
        this.startedAt = now;
        this.heartbeatAt = now;
        this.progress = progress == null ? 0 : progress;
    }

    /**
     * Mark as completed with the given output
     */
    public void complete(Map<String, Object> output) {
        requireTransition(TaskStatusEnum.COMPLETED);
        this.status = TaskStatusEnum.COMPLETED;
        this.outputData = output;
        this.progress = 100;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * Mark as failed
     */
    public void fail(String error) {
        requireTransition(TaskStatusEnum.FAILED);
        this.status = TaskStatusEnum.FAILED;
        this.errorMessage = error;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * Mark as cancelled
     */
    public void cancel() {
        requireTransition(TaskStatusEnum.CANCELLED);
        this.status = TaskStatusEnum.CANCELLED;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * Apply a progress report. Lower values never replace higher ones.
     */
    public void advanceProgress(Integer value, String step) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Progress can only change while RUNNING, current: " + status);
        }
        if (value != null) {
            int clamped = Math.max(0, Math.min(100, value));
            this.progress = Math.max(progress == null ? 0 : progress, clamped);
        }
        if (step != null) {
            this.currentStep = step;
        }
        this.heartbeatAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Query string of the input payload
     */
    public String getQuery() {
        if (inputConfig == null) {
            return null;
        }
        Object query = inputConfig.get("query");
        return query == null ? null : String.valueOf(query);
    }

    private void requireTransition(TaskStatusEnum target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal task transition " + status + " -> " + target);
        }
    }
}
