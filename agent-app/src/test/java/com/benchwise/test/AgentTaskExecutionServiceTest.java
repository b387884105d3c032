package com.benchwise.test;

import com.benchwise.domain.agent.model.valobj.AgentCapability;
import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.agent.service.AbstractLegalAgent;
import com.benchwise.domain.agent.service.AgentRegistry;
import com.benchwise.domain.agent.service.ILegalAgent;
import com.benchwise.domain.review.service.DiscoveryReviewAgent;
import com.benchwise.domain.review.service.HotDocumentClassifier;
import com.benchwise.domain.review.service.ModelVerdictDecoder;
import com.benchwise.domain.review.service.PrivilegeClassifier;
import com.benchwise.domain.review.service.ResponsivenessClassifier;
import com.benchwise.domain.review.service.ReviewArtifactDomainService;
import com.benchwise.domain.review.service.ReviewKeywordCatalog;
import com.benchwise.domain.review.service.ReviewReportDomainService;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.test.support.InMemoryAgentTaskRepository;
import com.benchwise.test.support.InMemoryDocumentRepository;
import com.benchwise.test.support.InMemoryTaskExecutionRepository;
import com.benchwise.test.support.StubModelGateway;
import com.benchwise.trigger.application.command.AgentTaskExecutionService;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.enums.TaskStatusEnum;
import com.benchwise.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AgentTaskExecutionServiceTest {

    private InMemoryAgentTaskRepository taskRepository;
    private InMemoryTaskExecutionRepository executionRepository;
    private InMemoryDocumentRepository documentRepository;
    private TaskLifecycleDomainService lifecycle;
    private DiscoveryReviewAgent discoveryAgent;

    @BeforeEach
    public void setUp() {
        taskRepository = new InMemoryAgentTaskRepository();
        executionRepository = new InMemoryTaskExecutionRepository();
        documentRepository = new InMemoryDocumentRepository();
        lifecycle = new TaskLifecycleDomainService(taskRepository, executionRepository);

        documentRepository.addMatter(1L, "Acme v. Globex", "Acme Corp");
        documentRepository.addDocument(11L, 1L, "advice.docx",
                "Privileged and confidential. Counsel gave legal advice about the financial records.");
        documentRepository.addDocument(12L, 1L, "ledger.xlsx", "The financial records show Q3 losses.");

        ModelVerdictDecoder decoder = new ModelVerdictDecoder(new ObjectMapper());
        StubModelGateway gateway = StubModelGateway.unavailable();
        discoveryAgent = new DiscoveryReviewAgent(documentRepository, documentRepository,
                new PrivilegeClassifier(gateway, decoder),
                new ResponsivenessClassifier(),
                new HotDocumentClassifier(gateway, decoder),
                new ReviewKeywordCatalog(),
                new ReviewArtifactDomainService(),
                new ReviewReportDomainService(),
                4000);
    }

    @Test
    public void shouldCompleteDiscoveryTaskAndCloseExecution() {
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        runner.submit(task.getId());

        AgentTaskEntity stored = lifecycle.requireTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, stored.getStatus());
        Assertions.assertEquals(100, stored.getProgress());
        Assertions.assertNotNull(stored.getStartedAt());
        Assertions.assertNotNull(stored.getCompletedAt());
        Assertions.assertNull(stored.getErrorMessage());
        Assertions.assertEquals(Boolean.TRUE, stored.getOutputData().get("success"));

        List<TaskExecutionEntity> executions = lifecycle.getTaskExecutions(task.getId());
        Assertions.assertEquals(1, executions.size());
        TaskExecutionEntity execution = executions.get(0);
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, execution.getStatus());
        Assertions.assertEquals(100, execution.getProgress());
        Assertions.assertNotNull(execution.getCompletedAt());
        Assertions.assertEquals(AgentTypeEnum.DISCOVERY, execution.getAgentType());
        @SuppressWarnings("unchecked")
        Map<String, Object> snapshotContext = (Map<String, Object>) execution.getInputData().get("context");
        Assertions.assertEquals(task.getId(), snapshotContext.get("taskId"));
        Assertions.assertNotNull(snapshotContext.get("matterInfo"));
    }

    @Test
    public void shouldFailPendingTaskWhenDiscoveryRequestsMissing() {
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), Runnable::run);
        Map<String, Object> input = discoveryInput();
        input.put("parameters", new LinkedHashMap<>());
        AgentTaskEntity task = lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, input, null);

        TaskStatusEnum outcome = runner.execute(task.getId());

        Assertions.assertEquals(TaskStatusEnum.FAILED, outcome);
        AgentTaskEntity stored = lifecycle.requireTask(task.getId());
        Assertions.assertEquals("Invalid input parameters - matter info and discovery requests required",
                stored.getErrorMessage());
        Assertions.assertNull(stored.getStartedAt());
        Assertions.assertTrue(lifecycle.getTaskExecutions(task.getId()).isEmpty());
    }

    @Test
    public void shouldUseGenericInputErrorWhenAgentGivesNoMessage() {
        ILegalAgent agent = mock(ILegalAgent.class);
        when(agent.getId()).thenReturn("strict-agent");
        when(agent.getType()).thenReturn(AgentTypeEnum.DISCOVERY);
        when(agent.validateInput(any())).thenReturn(false);
        AgentTaskExecutionService runner = newRunner(List.of(agent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        Assertions.assertEquals(TaskStatusEnum.FAILED, runner.execute(task.getId()));

        Assertions.assertEquals("Invalid input parameters for agent strict-agent",
                lifecycle.requireTask(task.getId()).getErrorMessage());
        verify(agent, never()).execute(any(), any());
    }

    @Test
    public void shouldFailTaskWithoutRegisteredAgent() {
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.RESEARCH, discoveryInput(), null);

        Assertions.assertEquals(TaskStatusEnum.FAILED, runner.execute(task.getId()));
        Assertions.assertEquals("No agent registered for type research",
                lifecycle.requireTask(task.getId()).getErrorMessage());
    }

    @Test
    public void shouldFailTaskWithMalformedDocumentIds() {
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), Runnable::run);
        Map<String, Object> input = discoveryInput();
        input.put("documents", List.of("not-a-number"));
        AgentTaskEntity task = lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, input, null);

        Assertions.assertEquals(TaskStatusEnum.FAILED, runner.execute(task.getId()));
        Assertions.assertEquals("Invalid document id: not-a-number", lifecycle.requireTask(task.getId()).getErrorMessage());
    }

    @Test
    public void shouldStopAtCheckpointAfterCancellation() {
        ScriptedAgent agent = new ScriptedAgent((input, context) -> {
            lifecycle.cancelTask(context.getTaskId());
            context.checkpoint();
            return AgentOutput.builder().success(true).build();
        });
        AgentTaskExecutionService runner = newRunner(List.of(agent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        TaskStatusEnum outcome = runner.execute(task.getId());

        Assertions.assertEquals(TaskStatusEnum.CANCELLED, outcome);
        AgentTaskEntity stored = lifecycle.requireTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, stored.getStatus());
        Assertions.assertNotNull(stored.getCompletedAt());
        Assertions.assertNull(stored.getOutputData());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, lifecycle.getTaskExecutions(task.getId()).get(0).getStatus());
    }

    @Test
    public void shouldKeepCancellationWhenAgentFinishesAnyway() {
        ScriptedAgent agent = new ScriptedAgent((input, context) -> {
            lifecycle.cancelTask(context.getTaskId());
            return AgentOutput.builder().success(true).result("late").build();
        });
        AgentTaskExecutionService runner = newRunner(List.of(agent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        Assertions.assertEquals(TaskStatusEnum.CANCELLED, runner.execute(task.getId()));

        AgentTaskEntity stored = lifecycle.requireTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, stored.getStatus());
        Assertions.assertNull(stored.getOutputData());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, lifecycle.getTaskExecutions(task.getId()).get(0).getStatus());
    }

    @Test
    public void shouldRecordProgressReportedByAgent() {
        List<Integer> seen = new ArrayList<>();
        ScriptedAgent agent = new ScriptedAgent((input, context) -> {
            context.reportProgress(40, "Halfway");
            seen.add(lifecycle.requireTask(context.getTaskId()).getProgress());
            context.reportProgress(10, "Backwards");
            seen.add(lifecycle.requireTask(context.getTaskId()).getProgress());
            return AgentOutput.builder().success(true).build();
        });
        AgentTaskExecutionService runner = newRunner(List.of(agent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        Assertions.assertEquals(TaskStatusEnum.COMPLETED, runner.execute(task.getId()));
        Assertions.assertEquals(List.of(40, 40), seen);
    }

    @Test
    public void shouldFailTaskWhenAgentThrows() {
        ILegalAgent agent = mock(ILegalAgent.class);
        when(agent.getId()).thenReturn("broken-agent");
        when(agent.getType()).thenReturn(AgentTypeEnum.DISCOVERY);
        when(agent.validateInput(any())).thenReturn(true);
        when(agent.execute(any(), any())).thenThrow(new IllegalStateException("index unavailable"));
        AgentTaskExecutionService runner = newRunner(List.of(agent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(null, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        Assertions.assertEquals(TaskStatusEnum.FAILED, runner.execute(task.getId()));

        AgentTaskEntity stored = lifecycle.requireTask(task.getId());
        Assertions.assertEquals("index unavailable", stored.getErrorMessage());
        TaskExecutionEntity execution = lifecycle.getTaskExecutions(task.getId()).get(0);
        Assertions.assertEquals(TaskStatusEnum.FAILED, execution.getStatus());
        Assertions.assertEquals("index unavailable", execution.getErrorMessage());
    }

    @Test
    public void shouldSkipTaskThatIsNoLongerPending() {
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), Runnable::run);
        AgentTaskEntity task = lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, discoveryInput(), null);
        lifecycle.cancelTask(task.getId());

        Assertions.assertNull(runner.execute(task.getId()));
        Assertions.assertNull(runner.execute(404L));

        AppException ex = Assertions.assertThrows(AppException.class, () -> runner.submit(task.getId()));
        Assertions.assertEquals(ResponseCode.ILLEGAL_STATE.getCode(), ex.getCode());
        Assertions.assertEquals("Task is not pending: cancelled", ex.getInfo());
    }

    @Test
    public void shouldReportSaturatedWorkerPool() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("full");
        };
        AgentTaskExecutionService runner = newRunner(List.of(discoveryAgent), rejecting);
        AgentTaskEntity task = lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, discoveryInput(), null);

        AppException ex = Assertions.assertThrows(AppException.class, () -> runner.submit(task.getId()));

        Assertions.assertEquals("Task worker pool is saturated", ex.getInfo());
        Assertions.assertEquals(TaskStatusEnum.PENDING, lifecycle.requireTask(task.getId()).getStatus());
    }

    private AgentTaskExecutionService newRunner(List<ILegalAgent> agents, Executor executor) {
        return new AgentTaskExecutionService(lifecycle, new AgentRegistry(agents), documentRepository,
                new ObjectMapper().findAndRegisterModules(), executor);
    }

    private Map<String, Object> discoveryInput() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("discoveryRequests", List.of("financial records of Q3 losses"));
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("query", "Review the Acme production");
        input.put("parameters", parameters);
        input.put("documents", new ArrayList<>());
        input.put("context", new LinkedHashMap<>());
        return input;
    }

    private static class ScriptedAgent extends AbstractLegalAgent {

        private final BiFunction<AgentInput, ExecutionContext, AgentOutput> script;

        ScriptedAgent(BiFunction<AgentInput, ExecutionContext, AgentOutput> script) {
            super(id -> null);
            this.script = script;
        }

        @Override
        public String getId() {
            return "scripted-agent";
        }

        @Override
        public AgentTypeEnum getType() {
            return AgentTypeEnum.DISCOVERY;
        }

        @Override
        public String getName() {
            return "Scripted";
        }

        @Override
        public String getDescription() {
            return "Runs a test script";
        }

        @Override
        public List<AgentCapability> getCapabilities() {
            return List.of();
        }

        @Override
        public List<String> getRequiredContext() {
            return List.of();
        }

        @Override
        protected AgentOutput doExecute(AgentInput input, ExecutionContext context) {
            return script.apply(input, context);
        }
    }
}
