package com.benchwise.domain.review.service;

import com.benchwise.domain.agent.model.valobj.AgentCapability;
import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.agent.service.AbstractLegalAgent;
import com.benchwise.domain.document.adapter.repository.IDocumentRepository;
import com.benchwise.domain.document.adapter.repository.IMatterRepository;
import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.document.model.entity.MatterEntity;
import com.benchwise.domain.review.model.valobj.DiscoveryRequest;
import com.benchwise.domain.review.model.valobj.HotDocumentReviewResult;
import com.benchwise.domain.review.model.valobj.PrivilegeLogEntry;
import com.benchwise.domain.review.model.valobj.PrivilegeReviewResult;
import com.benchwise.domain.review.model.valobj.ProductionSet;
import com.benchwise.domain.review.model.valobj.ResponsivenessReviewResult;
import com.benchwise.domain.review.model.valobj.ReviewArtifacts;
import com.benchwise.domain.review.model.valobj.ReviewConfig;
import com.benchwise.domain.review.model.valobj.ReviewStatistics;
import com.benchwise.types.enums.AgentTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Discovery review agent.
 * <p>
 * Loads the document set, runs the privilege, responsiveness and hot-document classifiers over
 * it one document at a time, then derives the privilege log, production set, statistics and
 * report. Cancellation is observed at every stage boundary and before every document.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-06
 */
@Slf4j
@Component
public class DiscoveryReviewAgent extends AbstractLegalAgent {

    public static final String AGENT_ID = "discovery-agent";
    public static final String REQUIRED_MATTER_INFO = "matterInfo";
    public static final String REQUIRED_DISCOVERY_REQUESTS = "discoveryRequests";

    private static final int SECONDS_PER_DOCUMENT = 2;
    private static final int DEFAULT_DOCUMENT_COUNT = 10;

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("Document Review",
                    "Automated review of documents for responsiveness and privilege",
                    List.of("documents", "review_criteria", "privilege_rules"),
                    List.of("review_results", "privilege_log", "responsive_docs"), 180),
            new AgentCapability("Privilege Identification",
                    "Identify attorney-client privileged communications",
                    List.of("documents", "attorney_list", "client_list"),
                    List.of("privilege_log", "privileged_docs", "waiver_analysis"), 120),
            new AgentCapability("Responsive Document Classification",
                    "Classify documents by responsiveness to discovery requests",
                    List.of("documents", "discovery_requests", "classification_rules"),
                    List.of("classified_docs", "production_set", "review_report"), 150),
            new AgentCapability("Hot Document Identification",
                    "Identify potentially problematic or key documents",
                    List.of("documents", "risk_keywords", "matter_context"),
                    List.of("hot_docs", "risk_analysis", "priority_review"), 90));

    private final IDocumentRepository documentRepository;
    private final PrivilegeClassifier privilegeClassifier;
    private final ResponsivenessClassifier responsivenessClassifier;
    private final HotDocumentClassifier hotDocumentClassifier;
    private final ReviewKeywordCatalog keywordCatalog;
    private final ReviewArtifactDomainService artifactDomainService;
    private final ReviewReportDomainService reportDomainService;
    private final int maxDocumentChars;

    public DiscoveryReviewAgent(IMatterRepository matterRepository,
                                IDocumentRepository documentRepository,
                                PrivilegeClassifier privilegeClassifier,
                                ResponsivenessClassifier responsivenessClassifier,
                                HotDocumentClassifier hotDocumentClassifier,
                                ReviewKeywordCatalog keywordCatalog,
                                ReviewArtifactDomainService artifactDomainService,
                                ReviewReportDomainService reportDomainService,
                                @Value("${model-gateway.max-document-chars:4000}") int maxDocumentChars) {
        super(matterRepository);
        this.documentRepository = documentRepository;
        this.privilegeClassifier = privilegeClassifier;
        this.responsivenessClassifier = responsivenessClassifier;
        this.hotDocumentClassifier = hotDocumentClassifier;
        this.keywordCatalog = keywordCatalog;
        this.artifactDomainService = artifactDomainService;
        this.reportDomainService = reportDomainService;
        this.maxDocumentChars = maxDocumentChars;
    }

    @Override
    public String getId() {
        return AGENT_ID;
    }

    @Override
    public AgentTypeEnum getType() {
        return AgentTypeEnum.DISCOVERY;
    }

    @Override
    public String getName() {
        return "Discovery Review Agent";
    }

    @Override
    public String getDescription() {
        return "Automated document review, privilege identification, and discovery management";
    }

    @Override
    public List<AgentCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public List<String> getRequiredContext() {
        return List.of(REQUIRED_MATTER_INFO, REQUIRED_DISCOVERY_REQUESTS);
    }

    @Override
    public int estimateDuration(AgentInput input) {
        int documentCount = input == null || input.getDocumentCount() == 0 ? DEFAULT_DOCUMENT_COUNT : input.getDocumentCount();
        Object reviewType = input == null ? null : input.getParameter("reviewType");
        double complexityFactor = ReviewConfig.DEFAULT_REVIEW_TYPE.equals(reviewType) ? 1.5 : 1.0;
        return (int) Math.round(documentCount * SECONDS_PER_DOCUMENT * complexityFactor);
    }

    @Override
    public String getInvalidInputMessage() {
        return "Invalid input parameters - matter info and discovery requests required";
    }

    @Override
    protected AgentOutput doExecute(AgentInput input, ExecutionContext context) {
        logExecution(context, "Loading and analyzing documents", 10);
        List<DocumentEntity> documents = loadDocuments(input);
        ReviewConfig config = setupAnalysis(input);

        logExecution(context, "Conducting privilege review", 30);
        PrivilegeReviewResult privilegeResults = artifactDomainService.partitionPrivilege(
                classifyAll(documents, config, context, privilegeClassifier::classify));

        logExecution(context, "Analyzing document responsiveness", 50);
        ResponsivenessReviewResult responsivenessResults = artifactDomainService.partitionResponsiveness(
                classifyAll(documents, config, context, responsivenessClassifier::classify));

        logExecution(context, "Identifying hot documents and key evidence", 70);
        HotDocumentReviewResult hotDocResults = artifactDomainService.collectHotDocuments(
                classifyAll(documents, config, context, hotDocumentClassifier::classify));

        logExecution(context, "Generating privilege log and production recommendations", 85);
        List<PrivilegeLogEntry> privilegeLog = artifactDomainService.buildPrivilegeLog(privilegeResults);
        ProductionSet productionSet = artifactDomainService.buildProductionSet(responsivenessResults, privilegeResults);

        logExecution(context, "Generating discovery review report", 95);
        ReviewStatistics statistics = artifactDomainService.calculateStatistics(documents.size(),
                privilegeResults, responsivenessResults, productionSet);
        String report = reportDomainService.render(config.getMatterName(), privilegeResults,
                responsivenessResults, hotDocResults, statistics);

        ReviewArtifacts artifacts = ReviewArtifacts.builder()
                .totalDocuments(documents.size())
                .privilegeResults(privilegeResults)
                .responsivenessResults(responsivenessResults)
                .hotDocResults(hotDocResults)
                .privilegeLog(privilegeLog)
                .productionSet(productionSet)
                .reviewReport(report)
                .statistics(statistics)
                .build();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("executionId", context.getExecutionId());
        metadata.put("reviewType", config.getReviewType());
        metadata.put("privilegedCount", privilegeResults.getPrivilegedDocuments().size());
        metadata.put("responsiveCount", responsivenessResults.getResponsiveDocuments().size());
        metadata.put("hotDocCount", hotDocResults.getTotalHotDocs());

        logExecution(context, "Discovery review complete", 100);
        log.info("Discovery review finished. taskId={}, documents={}, privileged={}, responsive={}, hot={}",
                context.getTaskId(), documents.size(), privilegeResults.getPrivilegedDocuments().size(),
                responsivenessResults.getResponsiveDocuments().size(), hotDocResults.getTotalHotDocs());
        return AgentOutput.builder()
                .success(true)
                .result(artifacts)
                .metadata(metadata)
                .build();
    }

    private List<DocumentEntity> loadDocuments(AgentInput input) {
        List<DocumentEntity> documents;
        if (input.getDocuments() != null && !input.getDocuments().isEmpty()) {
            documents = documentRepository.findByIds(input.getDocuments());
        } else if (input.getMatterId() != null) {
            documents = documentRepository.findByMatterId(input.getMatterId());
        } else {
            documents = Collections.emptyList();
        }
        return documents == null ? Collections.emptyList() : documents;
    }

    private ReviewConfig setupAnalysis(AgentInput input) {
        MatterEntity matter = getMatterInfo(input.getMatterId());
        Object reviewType = input.getParameter("reviewType");
        Object requests = input.getParameter(REQUIRED_DISCOVERY_REQUESTS);
        if (requests == null) {
            requests = input.getContextValue(REQUIRED_DISCOVERY_REQUESTS);
        }
        Object criteria = input.getParameter("responsivenessCriteria");
        return ReviewConfig.builder()
                .matterId(input.getMatterId())
                .matterName(matter.getName())
                .clientName(matter.getClientName())
                .reviewType(reviewType == null ? ReviewConfig.DEFAULT_REVIEW_TYPE : String.valueOf(reviewType))
                .discoveryRequests(DiscoveryRequest.fromParameter(requests))
                .attorneys(toStringList(input.getParameter("attorneys")))
                .privilegeKeywords(keywordCatalog.privilegeKeywords())
                .hotDocKeywords(keywordCatalog.hotDocumentKeywords(matter.getName()))
                .timeRange(input.getParameter("timeRange"))
                .responsivenessCriteria(toMap(criteria))
                .maxDocumentChars(maxDocumentChars)
                .build();
    }

    private <V> List<V> classifyAll(List<DocumentEntity> documents,
                                    ReviewConfig config,
                                    ExecutionContext context,
                                    BiFunction<DocumentEntity, ReviewConfig, V> classifier) {
        List<V> verdicts = new ArrayList<>(documents.size());
        for (DocumentEntity document : documents) {
            context.checkpoint();
            verdicts.add(classifier.apply(document, config));
        }
        return verdicts;
    }

    private List<String> toStringList(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                if (item != null) {
                    values.add(String.valueOf(item));
                }
            }
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(Object raw) {
        return raw instanceof Map ? new LinkedHashMap<>((Map<String, Object>) raw) : new LinkedHashMap<>();
    }
}
