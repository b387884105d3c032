package com.benchwise.domain.task.adapter.repository;

import com.benchwise.domain.task.model.entity.TaskExecutionEntity;

import java.util.List;

/**
 * Task execution ledger repository. Entries are appended and closed, never deleted.
 *
 * @author benchwise
 * @since 2026-03-02
 */
public interface ITaskExecutionRepository {

    /**
     * Append an execution entry
     */
    TaskExecutionEntity save(TaskExecutionEntity entity);

    /**
     * Close an execution entry. Only applies while the stored entry is not terminal.
     *
     * @return true when a row was updated
     */
    boolean close(TaskExecutionEntity entity);

    /**
     * Raise execution progress, keeping the larger value
     */
    boolean updateProgress(Long id, int progress, String currentStep);

    /**
     * Find by ID
     */
    TaskExecutionEntity findById(Long id);

    /**
     * Find the ledger of a task ordered by start time
     */
    List<TaskExecutionEntity> findByTaskId(Long taskId);

    /**
     * Find entries of a task that are still open
     */
    List<TaskExecutionEntity> findOpenByTaskId(Long taskId);
}
