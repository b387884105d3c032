package com.benchwise.domain.task.service;

import com.benchwise.domain.task.adapter.repository.IAgentTaskRepository;
import com.benchwise.domain.task.adapter.repository.ITaskExecutionRepository;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.enums.TaskStatusEnum;
import com.benchwise.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task lifecycle domain service.
 * <p>
 * Single writer of task and execution status. Every status write goes through
 * {@link #updateTaskStatus}, which checks the state machine in memory and then relies on a
 * compare-and-set write in the store, so a terminal row is never overwritten.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-03
 */
@Slf4j
@Service
public class TaskLifecycleDomainService {

    private static final int NAME_QUERY_LIMIT = 50;
    private static final int RECENT_TASK_LIMIT = 100;
    private static final String ORPHANED_ERROR_PREFIX = "Execution orphaned: no heartbeat since ";

    private final IAgentTaskRepository agentTaskRepository;
    private final ITaskExecutionRepository taskExecutionRepository;

    public TaskLifecycleDomainService(IAgentTaskRepository agentTaskRepository,
                                      ITaskExecutionRepository taskExecutionRepository) {
        this.agentTaskRepository = agentTaskRepository;
        this.taskExecutionRepository = taskExecutionRepository;
    }

    public AgentTaskEntity createTask(Long matterId,
                                      AgentTypeEnum agentType,
                                      Map<String, Object> input,
                                      String name) {
        if (agentType == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "agentType is required");
        }
        Map<String, Object> inputConfig = input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
        String query = inputConfig.get("query") == null ? "" : String.valueOf(inputConfig.get("query"));

        AgentTaskEntity task = new AgentTaskEntity();
        task.setMatterId(matterId);
        task.setAgentType(agentType);
        task.setName(StringUtils.isNotBlank(name) ? name.trim() : generateTaskName(agentType, query));
        task.setStatus(TaskStatusEnum.PENDING);
        task.setProgress(0);
        task.setInputConfig(inputConfig);
        task.validate();

        AgentTaskEntity saved = agentTaskRepository.save(task);
        log.info("Agent task created. taskId={}, matterId={}, agentType={}",
                saved.getId(), matterId, agentType.getCode());
        return saved;
    }

    public String generateTaskName(AgentTypeEnum agentType, String query) {
        String safeQuery = query == null ? "" : query;
        String truncated = safeQuery.length() > NAME_QUERY_LIMIT
                ? safeQuery.substring(0, NAME_QUERY_LIMIT) + "..."
                : safeQuery;
        return agentType.getDisplayName() + ": " + truncated;
    }

    /**
     * Apply a status change. Returns false when the state machine rejects it or another writer
     * moved the row first; a terminal task never changes again.
     */
    public boolean updateTaskStatus(Long taskId,
                                    TaskStatusEnum status,
                                    Integer progress,
                                    Map<String, Object> output,
                                    String error) {
        if (status == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "status is required");
        }
        AgentTaskEntity task = requireTask(taskId);
        TaskStatusEnum current = task.getStatus();
        if (current.isTerminal()) {
            log.info("Ignore status write on terminal task. taskId={}, current={}, requested={}",
                    taskId, current.getCode(), status.getCode());
            return false;
        }
        if (current == TaskStatusEnum.RUNNING && status == TaskStatusEnum.RUNNING) {
            return progress != null && reportProgress(taskId, null, progress, null);
        }
        if (!current.canTransitionTo(status)) {
            log.warn("Rejected task transition. taskId={}, from={}, to={}", taskId, current.getCode(), status.getCode());
            return false;
        }

        switch (status) {
            case RUNNING:
                task.start();
                if (progress != null) {
                    task.advanceProgress(progress, null);
                }
                break;
            case COMPLETED:
                task.complete(output);
                break;
            case FAILED:
                task.fail(error);
                task.setOutputData(output);
                break;
            case CANCELLED:
                task.cancel();
                break;
            default:
                return false;
        }
        boolean updated = agentTaskRepository.updateStatus(task, current);
        if (!updated) {
            log.info("Task status write lost to a concurrent writer. taskId={}, expected={}, requested={}",
                    taskId, current.getCode(), status.getCode());
        }
        return updated;
    }

    /**
     * Report progress for a running task and, when given, its open execution entry.
     */
    public boolean reportProgress(Long taskId, Long executionId, int progress, String step) {
        int clamped = Math.max(0, Math.min(100, progress));
        boolean updated = agentTaskRepository.updateProgress(taskId, clamped, step);
        if (executionId != null) {
            taskExecutionRepository.updateProgress(executionId, clamped, step);
        }
        return updated;
    }

    public boolean heartbeat(Long taskId) {
        return agentTaskRepository.touchHeartbeat(taskId);
    }

    public AgentTaskEntity getTask(Long taskId) {
        if (taskId == null) {
            return null;
        }
        return agentTaskRepository.findById(taskId);
    }

    public AgentTaskEntity requireTask(Long taskId) {
        AgentTaskEntity task = getTask(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Task not found: " + taskId);
        }
        return task;
    }

    public List<AgentTaskEntity> getMatterTasks(Long matterId) {
        if (matterId == null) {
            return Collections.emptyList();
        }
        return agentTaskRepository.findByMatterId(matterId);
    }

    public List<AgentTaskEntity> getRecentTasks() {
        return agentTaskRepository.findRecent(RECENT_TASK_LIMIT);
    }

    public List<AgentTaskEntity> getPendingTasks() {
        return agentTaskRepository.findByStatus(TaskStatusEnum.PENDING);
    }

    public List<AgentTaskEntity> getRunningTasks() {
        return agentTaskRepository.findByStatus(TaskStatusEnum.RUNNING);
    }

    public List<TaskExecutionEntity> getTaskExecutions(Long taskId) {
        requireTask(taskId);
        return taskExecutionRepository.findByTaskId(taskId);
    }

    /**
     * Cancel a pending or running task. The stored status flips immediately; an executing
     * agent stops at its next checkpoint.
     */
    public AgentTaskEntity cancelTask(Long taskId) {
        AgentTaskEntity task = requireTask(taskId);
        for (int attempt = 0; attempt < 2; attempt++) {
            TaskStatusEnum current = task.getStatus();
            if (current != TaskStatusEnum.PENDING && current != TaskStatusEnum.RUNNING) {
                throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(),
                        "Task cannot be cancelled in status " + current.getCode());
            }
            task.cancel();
            if (agentTaskRepository.updateStatus(task, current)) {
                int closed = closeOpenExecutions(taskId, TaskStatusEnum.CANCELLED, null);
                log.info("Agent task cancelled. taskId={}, previousStatus={}, closedExecutions={}",
                        taskId, current.getCode(), closed);
                return task;
            }
            task = requireTask(taskId);
        }
        throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(),
                "Task cannot be cancelled in status " + task.getStatus().getCode());
    }

    /**
     * True when the stored task is gone or already terminal, so an executing agent should stop.
     */
    public boolean shouldStop(Long taskId) {
        AgentTaskEntity task = getTask(taskId);
        return task == null || task.isTerminal();
    }

    public TaskExecutionEntity openExecution(AgentTaskEntity task, Map<String, Object> inputSnapshot) {
        TaskExecutionEntity execution = TaskExecutionEntity.open(task.getId(), task.getAgentType(), inputSnapshot);
        return taskExecutionRepository.save(execution);
    }

    public boolean closeExecution(TaskExecutionEntity execution,
                                  TaskStatusEnum terminal,
                                  Map<String, Object> output,
                                  String error) {
        if (execution == null || !execution.isOpen()) {
            return false;
        }
        execution.close(terminal, output, error);
        return taskExecutionRepository.close(execution);
    }

    public int closeOpenExecutions(Long taskId, TaskStatusEnum terminal, String error) {
        int closed = 0;
        for (TaskExecutionEntity execution : taskExecutionRepository.findOpenByTaskId(taskId)) {
            if (closeExecution(execution, terminal, null, error)) {
                closed++;
            }
        }
        return closed;
    }

    /**
     * Fail running tasks whose heartbeat is older than the given time and close their open executions.
     */
    public List<AgentTaskEntity> failOrphanedTasks(LocalDateTime heartbeatBefore, int limit) {
        List<AgentTaskEntity> stale = agentTaskRepository.findStaleRunning(heartbeatBefore, limit);
        if (stale == null || stale.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentTaskEntity> failed = new ArrayList<>();
        for (AgentTaskEntity task : stale) {
            LocalDateTime lastSeen = task.getHeartbeatAt() != null ? task.getHeartbeatAt() : task.getStartedAt();
            String error = ORPHANED_ERROR_PREFIX + lastSeen;
            task.fail(error);
            if (agentTaskRepository.updateStatus(task, TaskStatusEnum.RUNNING)) {
                closeOpenExecutions(task.getId(), TaskStatusEnum.FAILED, error);
                failed.add(task);
            }
        }
        return failed;
    }
}
