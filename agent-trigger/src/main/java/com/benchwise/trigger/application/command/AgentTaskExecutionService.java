package com.benchwise.trigger.application.command;

import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.agent.service.AgentRegistry;
import com.benchwise.domain.agent.service.ILegalAgent;
import com.benchwise.domain.document.adapter.repository.IMatterRepository;
import com.benchwise.domain.document.model.entity.MatterEntity;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.types.common.Constants;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.enums.TaskStatusEnum;
import com.benchwise.types.exception.AppException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Task runner: move a pending task through one agent execution and record the outcome.
 * <p>
 * The task row is only ever written through {@link TaskLifecycleDomainService}, whose guarded
 * writes keep a terminal status (for example a concurrent cancel) from being overwritten.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-10
 */
@Slf4j
@Service
public class AgentTaskExecutionService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};
    private static final String INVALID_INPUT_ERROR = "Invalid input parameters";

    private final TaskLifecycleDomainService taskLifecycleDomainService;
    private final AgentRegistry agentRegistry;
    private final IMatterRepository matterRepository;
    private final ObjectMapper objectMapper;
    private final Executor taskExecutionWorker;

    public AgentTaskExecutionService(TaskLifecycleDomainService taskLifecycleDomainService,
                                     AgentRegistry agentRegistry,
                                     IMatterRepository matterRepository,
                                     ObjectMapper objectMapper,
                                     @Qualifier("taskExecutionWorker") Executor taskExecutionWorker) {
        this.taskLifecycleDomainService = taskLifecycleDomainService;
        this.agentRegistry = agentRegistry;
        this.matterRepository = matterRepository;
        this.objectMapper = objectMapper;
        this.taskExecutionWorker = taskExecutionWorker;
    }

    /**
     * Hand a pending task to the worker pool and return at once.
     */
    public AgentTaskEntity submit(Long taskId) {
        AgentTaskEntity task = taskLifecycleDomainService.requireTask(taskId);
        if (task.getStatus() != TaskStatusEnum.PENDING) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(),
                    "Task is not pending: " + task.getStatus().getCode());
        }
        try {
            taskExecutionWorker.execute(() -> execute(taskId));
        } catch (RejectedExecutionException ex) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Task worker pool is saturated", ex);
        }
        log.info("Agent task submitted. taskId={}, agentType={}", taskId, task.getAgentType().getCode());
        return task;
    }

    /**
     * Run a pending task on the calling thread.
     *
     * @return the status the task ended in, or null when the task was not pending
     */
    public TaskStatusEnum execute(Long taskId) {
        AgentTaskEntity task = taskLifecycleDomainService.getTask(taskId);
        if (task == null || task.getStatus() != TaskStatusEnum.PENDING) {
            log.info("Skip task execution, task missing or not pending. taskId={}, status={}",
                    taskId, task == null ? null : task.getStatus().getCode());
            return null;
        }
        String agentType = task.getAgentType().getCode();
        try {
            TaskStatusEnum outcome = runPending(task);
            recordOutcome(agentType, outcome);
            return outcome;
        } catch (RuntimeException ex) {
            log.warn("Task execution aborted. taskId={}, error={}", taskId, ex.getMessage(), ex);
            safeUpdateStatus(taskId, TaskStatusEnum.FAILED, null, StringUtils.defaultIfBlank(ex.getMessage(),
                    ex.getClass().getSimpleName()));
            safeCloseOpenExecutions(taskId, ex.getMessage());
            TaskStatusEnum outcome = resolveStatus(taskId, TaskStatusEnum.FAILED);
            recordOutcome(agentType, outcome);
            return outcome;
        }
    }

    private TaskStatusEnum runPending(AgentTaskEntity task) {
        Long taskId = task.getId();
        Optional<ILegalAgent> registered = agentRegistry.find(task.getAgentType());
        if (registered.isEmpty()) {
            return failPending(taskId, "No agent registered for type " + task.getAgentType().getCode());
        }
        ILegalAgent agent = registered.get();

        AgentInput input;
        try {
            input = AgentInput.fromInputConfig(task.getMatterId(), task.getInputConfig());
        } catch (IllegalArgumentException ex) {
            return failPending(taskId, ex.getMessage());
        }
        enrichContext(task, input);
        if (!agent.validateInput(input)) {
            return failPending(taskId, StringUtils.defaultIfBlank(agent.getInvalidInputMessage(),
                    INVALID_INPUT_ERROR + " for agent " + agent.getId()));
        }

        if (!taskLifecycleDomainService.updateTaskStatus(taskId, TaskStatusEnum.RUNNING, 0, null, null)) {
            return resolveStatus(taskId, null);
        }
        TaskExecutionEntity execution = taskLifecycleDomainService.openExecution(task, input.toSnapshot());
        Long executionId = execution.getId();
        input.putContextValue(Constants.CONTEXT_EXECUTION_ID, executionId);
        log.info("Agent task started. taskId={}, executionId={}, agentId={}", taskId, executionId, agent.getId());

        ExecutionContext context = new ExecutionContext(taskId, executionId,
                () -> stopRequested(taskId),
                (progress, step) -> safeReportProgress(taskId, executionId, progress, step));
        AgentOutput output;
        try {
            output = agent.execute(input, context);
        } catch (RuntimeException ex) {
            log.warn("Agent raised out of execute. taskId={}, executionId={}, error={}",
                    taskId, executionId, ex.getMessage(), ex);
            output = AgentOutput.failure(StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()));
        }
        if (output == null) {
            output = AgentOutput.failure("Agent returned no output");
        }
        return finish(taskId, execution, output);
    }

    private TaskStatusEnum finish(Long taskId, TaskExecutionEntity execution, AgentOutput output) {
        if (output.isCancelled()) {
            TaskStatusEnum status = resolveStatus(taskId, TaskStatusEnum.CANCELLED);
            taskLifecycleDomainService.closeExecution(execution, status, null, output.getError());
            log.info("Agent task stopped after cancellation. taskId={}, executionId={}", taskId, execution.getId());
            return status;
        }

        Map<String, Object> outputMap = toOutputMap(output);
        TaskStatusEnum target = output.isSuccess() ? TaskStatusEnum.COMPLETED : TaskStatusEnum.FAILED;
        boolean applied = safeUpdateStatus(taskId, target, outputMap, output.isSuccess() ? null : output.getError());
        TaskStatusEnum status = applied ? target : resolveStatus(taskId, target);
        taskLifecycleDomainService.closeExecution(execution, status, outputMap,
                output.isSuccess() ? null : output.getError());
        if (status == TaskStatusEnum.COMPLETED) {
            log.info("Agent task completed. taskId={}, executionId={}, executionTimeMs={}",
                    taskId, execution.getId(), output.getExecutionTime());
        } else {
            log.warn("Agent task ended. taskId={}, executionId={}, status={}, error={}",
                    taskId, execution.getId(), status.getCode(), output.getError());
        }
        return status;
    }

    private TaskStatusEnum failPending(Long taskId, String error) {
        log.warn("Agent task rejected before start. taskId={}, error={}", taskId, error);
        safeUpdateStatus(taskId, TaskStatusEnum.FAILED, null, error);
        return resolveStatus(taskId, TaskStatusEnum.FAILED);
    }

    private void enrichContext(AgentTaskEntity task, AgentInput input) {
        input.putContextValue(Constants.CONTEXT_TASK_ID, task.getId());
        if (task.getMatterId() == null) {
            return;
        }
        MatterEntity matter = matterRepository.findById(task.getMatterId());
        if (matter != null) {
            Map<String, Object> matterInfo = new LinkedHashMap<>();
            matterInfo.put("id", matter.getId());
            matterInfo.put("name", matter.getName());
            matterInfo.put("clientName", matter.getClientName());
            matterInfo.put("matterNumber", matter.getMatterNumber());
            matterInfo.put("practiceArea", matter.getPracticeArea());
            input.putContextValue(Constants.CONTEXT_MATTER_INFO, matterInfo);
        }
    }

    private boolean stopRequested(Long taskId) {
        try {
            taskLifecycleDomainService.heartbeat(taskId);
            return taskLifecycleDomainService.shouldStop(taskId);
        } catch (RuntimeException ex) {
            log.warn("Cancellation probe failed, continuing. taskId={}, error={}", taskId, ex.getMessage());
            return false;
        }
    }

    private void safeReportProgress(Long taskId, Long executionId, int progress, String step) {
        try {
            taskLifecycleDomainService.reportProgress(taskId, executionId, progress, step);
        } catch (RuntimeException ex) {
            log.warn("Failed to record progress. taskId={}, executionId={}, progress={}, error={}",
                    taskId, executionId, progress, ex.getMessage());
        }
    }

    private boolean safeUpdateStatus(Long taskId, TaskStatusEnum status, Map<String, Object> output, String error) {
        try {
            return taskLifecycleDomainService.updateTaskStatus(taskId, status,
                    status == TaskStatusEnum.COMPLETED ? 100 : null, output, error);
        } catch (RuntimeException ex) {
            log.warn("Failed to update task status. taskId={}, status={}, error={}",
                    taskId, status.getCode(), ex.getMessage());
            return false;
        }
    }

    private void safeCloseOpenExecutions(Long taskId, String error) {
        try {
            taskLifecycleDomainService.closeOpenExecutions(taskId, TaskStatusEnum.FAILED, error);
        } catch (RuntimeException ex) {
            log.warn("Failed to close open executions. taskId={}, error={}", taskId, ex.getMessage());
        }
    }

    private TaskStatusEnum resolveStatus(Long taskId, TaskStatusEnum fallback) {
        try {
            AgentTaskEntity latest = taskLifecycleDomainService.getTask(taskId);
            return latest == null ? fallback : latest.getStatus();
        } catch (RuntimeException ex) {
            log.warn("Failed to reload task status. taskId={}, error={}", taskId, ex.getMessage());
            return fallback;
        }
    }

    private Map<String, Object> toOutputMap(AgentOutput output) {
        try {
            return objectMapper.convertValue(output, MAP_TYPE);
        } catch (IllegalArgumentException ex) {
            log.warn("Agent output is not serializable, storing summary only. error={}", ex.getMessage());
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("success", output.isSuccess());
            summary.put("error", output.getError());
            summary.put("metadata", output.getMetadata());
            summary.put("executionTime", output.getExecutionTime());
            return summary;
        }
    }

    private void recordOutcome(String agentType, TaskStatusEnum outcome) {
        Counter.builder("agent.task.execution.total")
                .tag("agentType", agentType)
                .tag("outcome", outcome == null ? "skipped" : outcome.getCode())
                .register(Metrics.globalRegistry)
                .increment();
    }
}
