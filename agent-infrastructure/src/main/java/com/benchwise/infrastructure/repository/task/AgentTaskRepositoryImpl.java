package com.benchwise.infrastructure.repository.task;

import com.benchwise.domain.task.adapter.repository.IAgentTaskRepository;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.infrastructure.dao.AgentTaskDao;
import com.benchwise.infrastructure.dao.po.AgentTaskPO;
import com.benchwise.infrastructure.util.JsonCodec;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent task repository implementation.
 * <p>
 * Status writes are compare-and-set on the previous status so a terminal row is never
 * overwritten; progress writes keep the larger value and only apply while running.
 * Input and output payloads are JSONB.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Slf4j
@Repository
public class AgentTaskRepositoryImpl implements IAgentTaskRepository {

    private final AgentTaskDao agentTaskDao;
    private final JsonCodec jsonCodec;

    public AgentTaskRepositoryImpl(AgentTaskDao agentTaskDao, JsonCodec jsonCodec) {
        this.agentTaskDao = agentTaskDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentTaskEntity save(AgentTaskEntity entity) {
        entity.validate();
        AgentTaskPO po = toPO(entity);
        agentTaskDao.insert(po);
        return toEntity(agentTaskDao.selectById(po.getId()));
    }

    @Override
    public boolean updateStatus(AgentTaskEntity entity, TaskStatusEnum expectedStatus) {
        if (expectedStatus == null || expectedStatus.isTerminal()) {
            return false;
        }
        return agentTaskDao.updateStatus(toPO(entity), expectedStatus.getCode()) > 0;
    }

    @Override
    public boolean updateProgress(Long id, int progress, String currentStep) {
        return agentTaskDao.updateProgress(id, progress, currentStep) > 0;
    }

    @Override
    public boolean touchHeartbeat(Long id) {
        return agentTaskDao.touchHeartbeat(id) > 0;
    }

    @Override
    public AgentTaskEntity findById(Long id) {
        AgentTaskPO po = agentTaskDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<AgentTaskEntity> findByMatterId(Long matterId) {
        return agentTaskDao.selectByMatterId(matterId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentTaskEntity> findByStatus(TaskStatusEnum status) {
        return agentTaskDao.selectByStatus(status.getCode()).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentTaskEntity> findRecent(int limit) {
        return agentTaskDao.selectRecent(Math.max(limit, 1)).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentTaskEntity> findStaleRunning(LocalDateTime heartbeatBefore, int limit) {
        return agentTaskDao.selectStaleRunning(heartbeatBefore, Math.max(limit, 1)).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO to entity
     */
    private AgentTaskEntity toEntity(AgentTaskPO po) {
        if (po == null) {
            return null;
        }
        AgentTaskEntity entity = new AgentTaskEntity();
        entity.setId(po.getId());
        entity.setMatterId(po.getMatterId());
        entity.setAgentType(AgentTypeEnum.fromCode(po.getAgentType()));
        entity.setName(po.getTaskName());
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        entity.setProgress(po.getProgress());
        entity.setCurrentStep(po.getCurrentStep());
        entity.setInputConfig(jsonCodec.readMap(po.getInputConfig()));
        entity.setOutputData(jsonCodec.readMap(po.getOutputData()));
        entity.setErrorMessage(po.getErrorMessage());
        entity.setHeartbeatAt(po.getHeartbeatAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity to PO
     */
    private AgentTaskPO toPO(AgentTaskEntity entity) {
        return AgentTaskPO.builder()
                .id(entity.getId())
                .matterId(entity.getMatterId())
                .agentType(entity.getAgentType() != null ? entity.getAgentType().getCode() : null)
                .taskName(entity.getName())
                .status(entity.getStatus() != null ? entity.getStatus().getCode() : null)
                .progress(entity.getProgress())
                .currentStep(entity.getCurrentStep())
                .inputConfig(jsonCodec.writeValue(entity.getInputConfig()))
                .outputData(jsonCodec.writeValue(entity.getOutputData()))
                .errorMessage(entity.getErrorMessage())
                .heartbeatAt(entity.getHeartbeatAt())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
