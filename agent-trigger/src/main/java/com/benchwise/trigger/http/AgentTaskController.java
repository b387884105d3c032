package com.benchwise.trigger.http;

import com.benchwise.api.dto.AgentSummaryDTO;
import com.benchwise.api.dto.TaskCreateRequestDTO;
import com.benchwise.api.dto.TaskDetailDTO;
import com.benchwise.api.dto.TaskExecutionDetailDTO;
import com.benchwise.api.response.Response;
import com.benchwise.domain.agent.service.AgentRegistry;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.trigger.application.command.AgentTaskExecutionService;
import com.benchwise.trigger.application.common.TaskDetailViewAssembler;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Agent task API: create, execute, cancel and poll tasks.
 */
@RestController
@RequestMapping("/api/agents")
public class AgentTaskController {

    private final TaskLifecycleDomainService taskLifecycleDomainService;
    private final AgentTaskExecutionService agentTaskExecutionService;
    private final AgentRegistry agentRegistry;
    private final TaskDetailViewAssembler taskDetailViewAssembler;

    public AgentTaskController(TaskLifecycleDomainService taskLifecycleDomainService,
                               AgentTaskExecutionService agentTaskExecutionService,
                               AgentRegistry agentRegistry,
                               TaskDetailViewAssembler taskDetailViewAssembler) {
        this.taskLifecycleDomainService = taskLifecycleDomainService;
        this.agentTaskExecutionService = agentTaskExecutionService;
        this.agentRegistry = agentRegistry;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
    }

    @PostMapping("/tasks")
    public Response<TaskDetailDTO> createTask(@RequestBody TaskCreateRequestDTO request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        AgentTypeEnum agentType = AgentTypeEnum.fromCode(request.getAgentType());
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("query", request.getQuery());
        input.put("parameters", request.getParameters() == null ? new LinkedHashMap<>() : request.getParameters());
        input.put("documents", request.getDocuments() == null ? new ArrayList<>() : request.getDocuments());
        input.put("context", request.getContext() == null ? new LinkedHashMap<>() : request.getContext());
        AgentTaskEntity task = taskLifecycleDomainService.createTask(request.getMatterId(), agentType, input, request.getName());
        return success(taskDetailViewAssembler.toTaskDetailDTO(task));
    }

    @GetMapping("/tasks")
    public Response<List<TaskDetailDTO>> listTasks(@RequestParam(value = "matterId", required = false) Long matterId) {
        List<AgentTaskEntity> tasks = matterId == null
                ? taskLifecycleDomainService.getRecentTasks()
                : taskLifecycleDomainService.getMatterTasks(matterId);
        return success(taskDetailViewAssembler.toTaskDetailDTOList(tasks));
    }

    @GetMapping("/matters/{matterId}/tasks")
    public Response<List<TaskDetailDTO>> listMatterTasks(@PathVariable("matterId") Long matterId) {
        return success(taskDetailViewAssembler.toTaskDetailDTOList(taskLifecycleDomainService.getMatterTasks(matterId)));
    }

    @GetMapping("/tasks/pending")
    public Response<List<TaskDetailDTO>> listPendingTasks() {
        return success(taskDetailViewAssembler.toTaskDetailDTOList(taskLifecycleDomainService.getPendingTasks()));
    }

    @GetMapping("/tasks/running")
    public Response<List<TaskDetailDTO>> listRunningTasks() {
        return success(taskDetailViewAssembler.toTaskDetailDTOList(taskLifecycleDomainService.getRunningTasks()));
    }

    @GetMapping("/tasks/{id}")
    public Response<TaskDetailDTO> getTask(@PathVariable("id") Long taskId) {
        return success(taskDetailViewAssembler.toTaskDetailDTO(taskLifecycleDomainService.requireTask(taskId)));
    }

    @GetMapping("/tasks/{id}/executions")
    public Response<List<TaskExecutionDetailDTO>> listExecutions(@PathVariable("id") Long taskId) {
        return success(taskDetailViewAssembler.toExecutionDetailDTOList(taskLifecycleDomainService.getTaskExecutions(taskId)));
    }

    @PostMapping("/tasks/{id}/execute")
    public Response<TaskDetailDTO> executeTask(@PathVariable("id") Long taskId) {
        return success(taskDetailViewAssembler.toTaskDetailDTO(agentTaskExecutionService.submit(taskId)));
    }

    @PostMapping("/tasks/{id}/cancel")
    public Response<TaskDetailDTO> cancelTask(@PathVariable("id") Long taskId) {
        return success(taskDetailViewAssembler.toTaskDetailDTO(taskLifecycleDomainService.cancelTask(taskId)));
    }

    @GetMapping("/agents")
    public Response<List<AgentSummaryDTO>> listAgents() {
        return success(agentRegistry.list().stream()
                .map(taskDetailViewAssembler::toAgentSummaryDTO)
                .collect(Collectors.toList()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
