package com.benchwise.trigger.application.common;

import com.benchwise.api.dto.AgentCapabilityDTO;
import com.benchwise.api.dto.AgentSummaryDTO;
import com.benchwise.api.dto.TaskDetailDTO;
import com.benchwise.api.dto.TaskExecutionDetailDTO;
import com.benchwise.domain.agent.model.valobj.AgentCapability;
import com.benchwise.domain.agent.service.ILegalAgent;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps task, execution and agent views onto their DTOs.
 */
@Component
public class TaskDetailViewAssembler {

    public TaskDetailDTO toTaskDetailDTO(AgentTaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDetailDTO dto = new TaskDetailDTO();
        dto.setTaskId(task.getId());
        dto.setMatterId(task.getMatterId());
        dto.setAgentType(task.getAgentType() == null ? null : task.getAgentType().getCode());
        dto.setName(task.getName());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setProgress(task.getProgress());
        dto.setCurrentStep(task.getCurrentStep());
        dto.setInputConfig(task.getInputConfig());
        dto.setOutputData(task.getOutputData());
        dto.setErrorMessage(task.getErrorMessage());
        dto.setHeartbeatAt(task.getHeartbeatAt());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setStartedAt(task.getStartedAt());
        dto.setCompletedAt(task.getCompletedAt());
        dto.setUpdatedAt(task.getUpdatedAt());
        return dto;
    }

    public List<TaskDetailDTO> toTaskDetailDTOList(List<AgentTaskEntity> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return Collections.emptyList();
        }
        return tasks.stream().map(this::toTaskDetailDTO).collect(Collectors.toList());
    }

    public TaskExecutionDetailDTO toExecutionDetailDTO(TaskExecutionEntity execution) {
        if (execution == null) {
            return null;
        }
        TaskExecutionDetailDTO dto = new TaskExecutionDetailDTO();
        dto.setExecutionId(execution.getId());
        dto.setTaskId(execution.getTaskId());
        dto.setAgentType(execution.getAgentType() == null ? null : execution.getAgentType().getCode());
        dto.setStatus(execution.getStatus() == null ? null : execution.getStatus().getCode());
        dto.setProgress(execution.getProgress());
        dto.setCurrentStep(execution.getCurrentStep());
        dto.setInputData(execution.getInputData());
        dto.setOutputData(execution.getOutputData());
        dto.setErrorMessage(execution.getErrorMessage());
        dto.setStartedAt(execution.getStartedAt());
        dto.setCompletedAt(execution.getCompletedAt());
        return dto;
    }

    public List<TaskExecutionDetailDTO> toExecutionDetailDTOList(List<TaskExecutionEntity> executions) {
        if (executions == null || executions.isEmpty()) {
            return Collections.emptyList();
        }
        return executions.stream().map(this::toExecutionDetailDTO).collect(Collectors.toList());
    }

    public AgentSummaryDTO toAgentSummaryDTO(ILegalAgent agent) {
        AgentSummaryDTO dto = new AgentSummaryDTO();
        dto.setAgentId(agent.getId());
        dto.setAgentType(agent.getType().getCode());
        dto.setName(agent.getName());
        dto.setDescription(agent.getDescription());
        dto.setRequiredContext(agent.getRequiredContext());
        List<AgentCapability> capabilities = agent.getCapabilities();
        dto.setCapabilities(capabilities == null ? Collections.emptyList()
                : capabilities.stream().map(this::toCapabilityDTO).collect(Collectors.toList()));
        return dto;
    }

    private AgentCapabilityDTO toCapabilityDTO(AgentCapability capability) {
        AgentCapabilityDTO dto = new AgentCapabilityDTO();
        dto.setName(capability.name());
        dto.setDescription(capability.description());
        dto.setInputTypes(capability.inputTypes());
        dto.setOutputTypes(capability.outputTypes());
        dto.setEstimatedDuration(capability.estimatedDuration());
        return dto;
    }
}
