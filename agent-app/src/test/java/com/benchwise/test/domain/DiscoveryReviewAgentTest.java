package com.benchwise.test.domain;

import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.review.model.valobj.ProductionSet;
import com.benchwise.domain.review.model.valobj.ReviewArtifacts;
import com.benchwise.domain.review.service.DiscoveryReviewAgent;
import com.benchwise.domain.review.service.HotDocumentClassifier;
import com.benchwise.domain.review.service.ModelVerdictDecoder;
import com.benchwise.domain.review.service.PrivilegeClassifier;
import com.benchwise.domain.review.service.ResponsivenessClassifier;
import com.benchwise.domain.review.service.ReviewArtifactDomainService;
import com.benchwise.domain.review.service.ReviewKeywordCatalog;
import com.benchwise.domain.review.service.ReviewReportDomainService;
import com.benchwise.test.support.InMemoryDocumentRepository;
import com.benchwise.test.support.StubModelGateway;
import com.benchwise.types.enums.RiskLevelEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class DiscoveryReviewAgentTest {

    private InMemoryDocumentRepository repository;
    private DiscoveryReviewAgent agent;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryDocumentRepository();
        repository.addMatter(1L, "Acme v. Globex", "Acme Corp");
        repository.addDocument(11L, 1L, "advice.docx",
                "Privileged and confidential. Counsel gave legal advice about the financial records.");
        repository.addDocument(12L, 1L, "ledger.xlsx", "The financial records show Q3 losses.");
        repository.addDocument(13L, 1L, "lunch.txt", "Team lunch on Friday.");
        repository.addDocument(14L, 1L, "cleanup.eml",
                "From: ops@company.com\nSubject: cleanup\nPlease destroy the paper copies and delete the backups.");

        ModelVerdictDecoder decoder = new ModelVerdictDecoder(new ObjectMapper());
        StubModelGateway gateway = StubModelGateway.unavailable();
        agent = new DiscoveryReviewAgent(repository, repository,
                new PrivilegeClassifier(gateway, decoder),
                new ResponsivenessClassifier(),
                new HotDocumentClassifier(gateway, decoder),
                new ReviewKeywordCatalog(),
                new ReviewArtifactDomainService(),
                new ReviewReportDomainService(),
                4000);
    }

    @Test
    public void shouldProduceReviewArtifactsForMatterDocuments() {
        List<Integer> progress = new ArrayList<>();
        ExecutionContext context = new ExecutionContext(1L, 9L, () -> false,
                (value, step) -> progress.add(value));

        AgentOutput output = agent.execute(input(1L), context);

        Assertions.assertTrue(output.isSuccess(), output.getError());
        ReviewArtifacts artifacts = (ReviewArtifacts) output.getResult();
        Assertions.assertEquals(4, artifacts.getTotalDocuments());
        Assertions.assertEquals(1, artifacts.getPrivilegeResults().getPrivilegedDocuments().size());
        Assertions.assertEquals(11L, artifacts.getPrivilegeResults().getPrivilegedDocuments().get(0).getDocumentId());
        Assertions.assertEquals(2, artifacts.getResponsivenessResults().getResponsiveDocuments().size());

        ProductionSet productionSet = artifacts.getProductionSet();
        Assertions.assertEquals(1, productionSet.totalCount());
        Assertions.assertEquals(12L, productionSet.documents().get(0).documentId());
        Assertions.assertEquals(List.of("1"), productionSet.documents().get(0).responsiveToRequests());
        Assertions.assertEquals(1, productionSet.privilegedWithheld());
        Assertions.assertEquals(2, productionSet.nonResponsiveExcluded());

        Assertions.assertEquals(1, artifacts.getHotDocResults().getTotalHotDocs());
        Assertions.assertEquals(14L, artifacts.getHotDocResults().getHotDocuments().get(0).getDocumentId());
        Assertions.assertEquals(RiskLevelEnum.HIGH, artifacts.getHotDocResults().getHotDocuments().get(0).getRiskLevel());

        Assertions.assertEquals(1, artifacts.getPrivilegeLog().size());
        Assertions.assertEquals(1, artifacts.getPrivilegeLog().get(0).logNumber());
        Assertions.assertEquals(25, artifacts.getStatistics().privilegeRate());
        Assertions.assertEquals(50, artifacts.getStatistics().responsivenessRate());
        Assertions.assertEquals(1, artifacts.getStatistics().productionDocuments());
        Assertions.assertTrue(artifacts.getReviewReport().contains("## Matter: Acme v. Globex"));
        Assertions.assertTrue(artifacts.getReviewReport().contains("- **Documents for Production:** 1"));

        Assertions.assertEquals(9L, output.getMetadata().get("executionId"));
        Assertions.assertEquals("comprehensive", output.getMetadata().get("reviewType"));
        Assertions.assertEquals(1, output.getMetadata().get("privilegedCount"));
        Assertions.assertEquals(2, output.getMetadata().get("responsiveCount"));
        Assertions.assertEquals(1, output.getMetadata().get("hotDocCount"));
        Assertions.assertEquals(List.of(10, 30, 50, 70, 85, 95, 100), progress);
    }

    @Test
    public void shouldReviewOnlyListedDocuments() {
        AgentInput input = input(1L);
        input.setDocuments(List.of(12L, 13L));

        AgentOutput output = agent.execute(input, ExecutionContext.detached());

        ReviewArtifacts artifacts = (ReviewArtifacts) output.getResult();
        Assertions.assertEquals(2, artifacts.getTotalDocuments());
        Assertions.assertEquals(1, artifacts.getProductionSet().totalCount());
        Assertions.assertEquals(0, artifacts.getHotDocResults().getTotalHotDocs());
    }

    @Test
    public void shouldStopAtDocumentCheckpointWhenCancelled() {
        AtomicInteger stopChecks = new AtomicInteger();
        List<Integer> progress = new ArrayList<>();
        ExecutionContext context = new ExecutionContext(1L, 9L, () -> stopChecks.incrementAndGet() > 3,
                (value, step) -> progress.add(value));

        AgentOutput output = agent.execute(input(1L), context);

        Assertions.assertFalse(output.isSuccess());
        Assertions.assertTrue(output.isCancelled());
        Assertions.assertNull(output.getResult());
        Assertions.assertEquals(List.of(10, 30), progress);
        Assertions.assertEquals(4, stopChecks.get());
    }

    @Test
    public void shouldRejectMatterInputWithoutDiscoveryRequests() {
        AgentInput input = input(1L);
        input.getParameters().remove("discoveryRequests");

        Assertions.assertFalse(agent.validateInput(input));
        AgentOutput output = agent.execute(input, ExecutionContext.detached());

        Assertions.assertFalse(output.isSuccess());
        Assertions.assertEquals("Invalid input parameters - matter info and discovery requests required", output.getError());
    }

    @Test
    public void shouldAcceptDiscoveryRequestsFromContext() {
        AgentInput input = input(1L);
        Object requests = input.getParameters().remove("discoveryRequests");
        input.putContextValue("discoveryRequests", requests);

        AgentOutput output = agent.execute(input, ExecutionContext.detached());

        Assertions.assertTrue(output.isSuccess(), output.getError());
        Assertions.assertEquals(1, ((ReviewArtifacts) output.getResult()).getProductionSet().totalCount());
    }

    @Test
    public void shouldReviewNothingForMatterlessTask() {
        AgentInput input = AgentInput.builder()
                .query("General privilege sweep")
                .parameters(new LinkedHashMap<>())
                .context(new LinkedHashMap<>())
                .build();

        AgentOutput output = agent.execute(input, ExecutionContext.detached());

        Assertions.assertTrue(output.isSuccess(), output.getError());
        ReviewArtifacts artifacts = (ReviewArtifacts) output.getResult();
        Assertions.assertEquals(0, artifacts.getTotalDocuments());
        Assertions.assertEquals(0, artifacts.getStatistics().privilegeRate());
        Assertions.assertTrue(artifacts.getReviewReport().contains("## Matter: General Research"));
    }

    @Test
    public void shouldFailWhenMatterIsUnknown() {
        AgentOutput output = agent.execute(input(99L), ExecutionContext.detached());

        Assertions.assertFalse(output.isSuccess());
        Assertions.assertFalse(output.isCancelled());
        Assertions.assertEquals("Failed to fetch matter info: matter 99 not found", output.getError());
    }

    @Test
    public void shouldEstimateDurationFromDocumentCount() {
        AgentInput input = input(1L);
        Assertions.assertEquals(20, agent.estimateDuration(input));

        input.setDocuments(List.of(1L, 2L, 3L, 4L));
        input.getParameters().put("reviewType", "privilege");
        Assertions.assertEquals(8, agent.estimateDuration(input));

        input.getParameters().put("reviewType", "comprehensive");
        Assertions.assertEquals(12, agent.estimateDuration(input));
    }

    private AgentInput input(Long matterId) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("discoveryRequests", List.of("financial records of Q3 losses"));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("matterInfo", Map.of("id", matterId, "name", "Acme v. Globex"));
        return AgentInput.builder()
                .matterId(matterId)
                .query("Review the production for Acme v. Globex")
                .parameters(parameters)
                .context(context)
                .documents(new ArrayList<>())
                .build();
    }
}
