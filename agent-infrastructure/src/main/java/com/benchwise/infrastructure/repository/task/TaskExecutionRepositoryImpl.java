package com.benchwise.infrastructure.repository.task;

import com.benchwise.domain.task.adapter.repository.ITaskExecutionRepository;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.infrastructure.dao.TaskExecutionDao;
import com.benchwise.infrastructure.dao.po.TaskExecutionPO;
import com.benchwise.infrastructure.util.JsonCodec;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Task execution ledger repository implementation.
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Repository
public class TaskExecutionRepositoryImpl implements ITaskExecutionRepository {

    private final TaskExecutionDao taskExecutionDao;
    private final JsonCodec jsonCodec;

    public TaskExecutionRepositoryImpl(TaskExecutionDao taskExecutionDao, JsonCodec jsonCodec) {
        this.taskExecutionDao = taskExecutionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public TaskExecutionEntity save(TaskExecutionEntity entity) {
        TaskExecutionPO po = toPO(entity);
        taskExecutionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public boolean close(TaskExecutionEntity entity) {
        return taskExecutionDao.close(toPO(entity)) > 0;
    }

    @Override
    public boolean updateProgress(Long id, int progress, String currentStep) {
        return taskExecutionDao.updateProgress(id, progress, currentStep) > 0;
    }

    @Override
    public TaskExecutionEntity findById(Long id) {
        TaskExecutionPO po = taskExecutionDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<TaskExecutionEntity> findByTaskId(Long taskId) {
        return taskExecutionDao.selectByTaskId(taskId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<TaskExecutionEntity> findOpenByTaskId(Long taskId) {
        return taskExecutionDao.selectOpenByTaskId(taskId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO to entity
     */
    private TaskExecutionEntity toEntity(TaskExecutionPO po) {
        TaskExecutionEntity entity = new TaskExecutionEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setAgentType(AgentTypeEnum.fromCode(po.getAgentType()));
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        entity.setInputData(jsonCodec.readMap(po.getInputData()));
        entity.setOutputData(jsonCodec.readMap(po.getOutputData()));
        entity.setErrorMessage(po.getErrorMessage());
        entity.setProgress(po.getProgress());
        entity.setCurrentStep(po.getCurrentStep());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        return entity;
    }

    /**
     * Entity to PO
     */
    private TaskExecutionPO toPO(TaskExecutionEntity entity) {
        return TaskExecutionPO.builder()
                .id(entity.getId())
                .taskId(entity.getTaskId())
                .agentType(entity.getAgentType() != null ? entity.getAgentType().getCode() : null)
                .status(entity.getStatus() != null ? entity.getStatus().getCode() : null)
                .inputData(jsonCodec.writeValue(entity.getInputData()))
                .outputData(jsonCodec.writeValue(entity.getOutputData()))
                .errorMessage(entity.getErrorMessage())
                .progress(entity.getProgress())
                .currentStep(entity.getCurrentStep())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
