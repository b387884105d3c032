package com.benchwise.domain.task.adapter.repository;

import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.types.enums.TaskStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent task repository.
 *
 * @author benchwise
 * @since 2026-03-02
 */
public interface IAgentTaskRepository {

    /**
     * Insert a new task and return it with its generated ID
     */
    AgentTaskEntity save(AgentTaskEntity entity);

    /**
     * Write status, progress, output, error and timestamps.
     * Only applies while the stored row still has {@code expectedStatus}, which must be non-terminal.
     *
     * @return true when a row was updated
     */
    boolean updateStatus(AgentTaskEntity entity, TaskStatusEnum expectedStatus);

    /**
     * Raise progress and refresh the heartbeat. Only applies while the stored row is running;
     * the stored progress keeps the larger value.
     *
     * @return true when a row was updated
     */
    boolean updateProgress(Long id, int progress, String currentStep);

    /**
     * Refresh the heartbeat of a running task
     */
    boolean touchHeartbeat(Long id);

    /**
     * Find by ID
     */
    AgentTaskEntity findById(Long id);

    /**
     * Find tasks of a matter, newest first
     */
    List<AgentTaskEntity> findByMatterId(Long matterId);

    /**
     * Find tasks by status, oldest first
     */
    List<AgentTaskEntity> findByStatus(TaskStatusEnum status);

    /**
     * Find the most recent tasks, newest first
     */
    List<AgentTaskEntity> findRecent(int limit);

    /**
     * Find running tasks whose heartbeat is older than the given time
     */
    List<AgentTaskEntity> findStaleRunning(LocalDateTime heartbeatBefore, int limit);
}
