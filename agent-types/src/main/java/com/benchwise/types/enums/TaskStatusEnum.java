package com.benchwise.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task and execution status.
 * <p>
 * {@code pending -> running -> completed | failed | cancelled}. A pending task may also be
 * cancelled or rejected as failed before it starts. Nothing leaves a terminal state.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-02
 */
public enum TaskStatusEnum {

    /**
     * Created, waiting to be started
     */
    PENDING("pending"),

    /**
     * An agent is executing the task
     */
    RUNNING("running"),

    /**
     * Finished successfully
     */
    COMPLETED("completed"),

    /**
     * Finished with an error
     */
    FAILED("failed"),

    /**
     * Cancelled by a caller
     */
    CANCELLED("cancelled");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatusEnum target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (this == PENDING) {
            return target == RUNNING || target == FAILED || target == CANCELLED;
        }
        return target.isTerminal();
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
