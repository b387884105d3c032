package com.benchwise.domain.review.service;

import com.benchwise.domain.agent.adapter.gateway.IModelGateway;
import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.PrivilegeVerdict;
import com.benchwise.domain.review.model.valobj.ReviewConfig;
import com.benchwise.types.enums.PrivilegeTypeEnum;
import com.benchwise.types.enums.RiskLevelEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Attorney-client privilege and work-product classifier.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Service
public class PrivilegeClassifier extends AbstractModelBackedClassifier<PrivilegeVerdict> {

    private static final int SCORE_CEILING = 5;
    private static final int PRIVILEGED_THRESHOLD = 2;

    private static final String PROMPT_TEMPLATE =
            "Analyze the following document for attorney-client privilege and work product protection.\n"
            + "\n"
            + "DOCUMENT INFORMATION:\n"
            + "Filename: %s\n"
            + "Matter: %s\n"
            + "Client: %s\n"
            + "\n"
            + "DOCUMENT TEXT:\n"
            + "%s\n"
            + "\n"
            + "ANALYSIS INSTRUCTIONS:\n"
            + "1. Determine if this document is protected by attorney-client privilege\n"
            + "2. Determine if this document qualifies as attorney work product\n"
            + "3. Identify any potential privilege waivers or risks\n"
            + "4. Provide confidence level (0-100) for your assessment\n"
            + "\n"
            + "Consider these factors:\n"
            + "- Communications between attorney and client\n"
            + "- Legal advice being sought or provided\n"
            + "- Documents prepared in anticipation of litigation\n"
            + "- Presence of third parties that might waive privilege\n"
            + "- Attorney work product doctrine protections\n"
            + "\n"
            + "RESPONSE FORMAT (JSON only):\n"
            + "{\n"
            + "  \"isPrivileged\": boolean,\n"
            + "  \"privilegeType\": \"attorney-client\" | \"work-product\" | \"none\",\n"
            + "  \"confidence\": number (0-100),\n"
            + "  \"privilegeBasis\": [\"reason1\", \"reason2\"],\n"
            + "  \"potentialWaiver\": boolean,\n"
            + "  \"waiverRisk\": \"low\" | \"medium\" | \"high\",\n"
            + "  \"waiverReason\": \"explanation if waiver risk exists\",\n"
            + "  \"analysis\": \"detailed explanation of privilege determination\",\n"
            + "  \"recommendations\": [\"action1\", \"action2\"]\n"
            + "}";

    public PrivilegeClassifier(IModelGateway modelGateway, ModelVerdictDecoder verdictDecoder) {
        super(modelGateway, verdictDecoder);
    }

    @Override
    public String getName() {
        return "privilege";
    }

    @Override
    protected String buildPrompt(DocumentEntity document, ReviewConfig config) {
        return String.format(PROMPT_TEMPLATE,
                orDefault(document.getFilename(), "Unknown"),
                orDefault(config.getMatterName(), "Unknown Matter"),
                orDefault(config.getClientName(), "Unknown Client"),
                excerpt(document, config));
    }

    @Override
    protected Optional<PrivilegeVerdict> decode(String raw, DocumentEntity document) {
        return verdictDecoder.decodePrivilege(raw, document);
    }

    @Override
    protected PrivilegeVerdict classifyByRules(DocumentEntity document, ReviewConfig config) {
        String text = document.lowerText();
        String filename = document.lowerFilename();
        int score = 0;
        PrivilegeTypeEnum privilegeType = PrivilegeTypeEnum.NONE;
        List<String> basis = new ArrayList<>();

        for (String keyword : config.getPrivilegeKeywords()) {
            String needle = keyword.toLowerCase(Locale.ROOT);
            if (text.contains(needle) || filename.contains(needle)) {
                score += 1;
                basis.add(keyword);
            }
        }

        boolean attorneyParticipant = containsAny(text, filename, attorneyIndicators(config));
        if (attorneyParticipant) {
            score += 2;
            privilegeType = PrivilegeTypeEnum.ATTORNEY_CLIENT;
            basis.add("attorney participant");
        }

        boolean workProduct = containsAny(text, null, ReviewKeywordCatalog.WORK_PRODUCT_INDICATORS);
        if (workProduct && attorneyParticipant) {
            score += 1;
            basis.add("work product");
        }

        boolean potentialWaiver = containsAny(text, null, ReviewKeywordCatalog.WAIVER_INDICATORS);

        PrivilegeVerdict verdict = new PrivilegeVerdict();
        verdict.setPrivileged(score >= PRIVILEGED_THRESHOLD);
        verdict.setPrivilegeType(privilegeType);
        verdict.setBasis(basis);
        verdict.setConfidence(PrivilegeVerdict.clamp(Math.min((double) score / SCORE_CEILING, 1D) * 100));
        verdict.setPotentialWaiver(potentialWaiver);
        verdict.setWaiverRisk(potentialWaiver ? RiskLevelEnum.MEDIUM : RiskLevelEnum.LOW);
        verdict.setWaiverReason(potentialWaiver ? "Third party disclosure detected" : null);
        return verdict;
    }

    private List<String> attorneyIndicators(ReviewConfig config) {
        List<String> indicators = new ArrayList<>(ReviewKeywordCatalog.ATTORNEY_INDICATORS);
        if (config.getAttorneys() != null) {
            for (String attorney : config.getAttorneys()) {
                if (attorney != null && !attorney.trim().isEmpty()) {
                    indicators.add(attorney.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return indicators;
    }

    private boolean containsAny(String text, String filename, List<String> indicators) {
        for (String indicator : indicators) {
            if (text.contains(indicator) || (filename != null && filename.contains(indicator))) {
                return true;
            }
        }
        return false;
    }
}
