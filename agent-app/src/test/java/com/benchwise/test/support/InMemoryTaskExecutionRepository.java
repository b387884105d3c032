package com.benchwise.test.support;

import com.benchwise.domain.task.adapter.repository.ITaskExecutionRepository;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.types.enums.TaskStatusEnum;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory execution ledger. Closing only applies to an open entry.
 */
public class InMemoryTaskExecutionRepository implements ITaskExecutionRepository {

    private final Map<Long, TaskExecutionEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized TaskExecutionEntity save(TaskExecutionEntity entity) {
        entity.setId(nextId++);
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized boolean close(TaskExecutionEntity entity) {
        TaskExecutionEntity stored = store.get(entity.getId());
        if (stored == null || stored.getStatus() != TaskStatusEnum.RUNNING) {
            return false;
        }
        stored.setStatus(entity.getStatus());
        stored.setOutputData(entity.getOutputData());
        stored.setErrorMessage(entity.getErrorMessage());
        stored.setProgress(Math.max(value(stored.getProgress()), value(entity.getProgress())));
        if (entity.getCurrentStep() != null) {
            stored.setCurrentStep(entity.getCurrentStep());
        }
        stored.setCompletedAt(entity.getCompletedAt());
        return true;
    }

    @Override
    public synchronized boolean updateProgress(Long id, int progress, String currentStep) {
        TaskExecutionEntity stored = store.get(id);
        if (stored == null || stored.getStatus() != TaskStatusEnum.RUNNING) {
            return false;
        }
        stored.setProgress(Math.max(value(stored.getProgress()), progress));
        if (currentStep != null) {
            stored.setCurrentStep(currentStep);
        }
        return true;
    }

    @Override
    public synchronized TaskExecutionEntity findById(Long id) {
        TaskExecutionEntity stored = store.get(id);
        return stored == null ? null : copy(stored);
    }

    @Override
    public synchronized List<TaskExecutionEntity> findByTaskId(Long taskId) {
        return store.values().stream()
                .filter(execution -> taskId.equals(execution.getTaskId()))
                .sorted(Comparator.comparing(TaskExecutionEntity::getId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<TaskExecutionEntity> findOpenByTaskId(Long taskId) {
        return store.values().stream()
                .filter(execution -> taskId.equals(execution.getTaskId()))
                .filter(execution -> execution.getStatus() == TaskStatusEnum.RUNNING)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    private int value(Integer progress) {
        return progress == null ? 0 : progress;
    }

    private TaskExecutionEntity copy(TaskExecutionEntity source) {
        TaskExecutionEntity target = new TaskExecutionEntity();
        target.setId(source.getId());
        target.setTaskId(source.getTaskId());
        target.setAgentType(source.getAgentType());
        target.setStatus(source.getStatus());
        target.setInputData(source.getInputData());
        target.setOutputData(source.getOutputData());
        target.setErrorMessage(source.getErrorMessage());
        target.setProgress(source.getProgress());
        target.setCurrentStep(source.getCurrentStep());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        return target;
    }
}
