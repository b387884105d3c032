package com.benchwise.test.integration;

import com.benchwise.Application;
import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.model.entity.TaskExecutionEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.trigger.application.command.AgentTaskExecutionService;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class DiscoveryTaskIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private TaskLifecycleDomainService taskLifecycleDomainService;

    @Autowired
    private AgentTaskExecutionService agentTaskExecutionService;

    @Test
    @SuppressWarnings("unchecked")
    public void shouldRunDiscoveryReviewEndToEnd() {
        Long matterId = insertMatter("Acme v. Globex", "Acme Corp");
        insertDocument(matterId, "advice.docx",
                "Privileged and confidential. Counsel gave legal advice about the financial records.");
        insertDocument(matterId, "ledger.xlsx", "The financial records show Q3 losses.");
        insertDocument(matterId, "cleanup.eml",
                "From: ops@company.com\nSubject: cleanup\nPlease destroy the paper copies and delete the backups.");
        AgentTaskEntity task = taskLifecycleDomainService.createTask(matterId, AgentTypeEnum.DISCOVERY, input(), null);

        TaskStatusEnum outcome = agentTaskExecutionService.execute(task.getId());

        Assertions.assertEquals(TaskStatusEnum.COMPLETED, outcome);
        AgentTaskEntity stored = taskLifecycleDomainService.requireTask(task.getId());
        Assertions.assertEquals(100, stored.getProgress());
        Assertions.assertNotNull(stored.getCompletedAt());
        Map<String, Object> result = (Map<String, Object>) stored.getOutputData().get("result");
        Map<String, Object> productionSet = (Map<String, Object>) result.get("productionSet");
        Assertions.assertEquals(1, ((Number) productionSet.get("totalCount")).intValue());
        Map<String, Object> statistics = (Map<String, Object>) result.get("statistics");
        Assertions.assertEquals(3, ((Number) statistics.get("totalDocuments")).intValue());
        Assertions.assertEquals(1, ((Number) statistics.get("privilegedDocuments")).intValue());

        List<TaskExecutionEntity> executions = taskLifecycleDomainService.getTaskExecutions(task.getId());
        Assertions.assertEquals(1, executions.size());
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, executions.get(0).getStatus());
    }

    @Test
    public void shouldCancelPendingTaskBeforeItRuns() {
        Long matterId = insertMatter("Acme v. Globex", "Acme Corp");
        AgentTaskEntity task = taskLifecycleDomainService.createTask(matterId, AgentTypeEnum.DISCOVERY, input(), null);

        taskLifecycleDomainService.cancelTask(task.getId());

        Assertions.assertNull(agentTaskExecutionService.execute(task.getId()));
        AgentTaskEntity stored = taskLifecycleDomainService.requireTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, stored.getStatus());
        Assertions.assertNotNull(stored.getCompletedAt());
        Assertions.assertTrue(taskLifecycleDomainService.getTaskExecutions(task.getId()).isEmpty());
    }

    private Map<String, Object> input() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("discoveryRequests", List.of("financial records of Q3 losses"));
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("query", "Review the Acme production");
        input.put("parameters", parameters);
        input.put("documents", List.of());
        input.put("context", new LinkedHashMap<>());
        return input;
    }
}
