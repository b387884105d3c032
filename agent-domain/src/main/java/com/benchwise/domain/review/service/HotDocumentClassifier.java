package com.benchwise.domain.review.service;

import com.benchwise.domain.agent.adapter.gateway.IModelGateway;
import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.HotDocumentVerdict;
import com.benchwise.domain.review.model.valobj.ReviewConfig;
import com.benchwise.types.enums.RiskLevelEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Litigation-risk ("hot document") classifier.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Service
public class HotDocumentClassifier extends AbstractModelBackedClassifier<HotDocumentVerdict> {

    private static final int HIGH_RISK_SCORE = 5;
    private static final int MEDIUM_RISK_SCORE = 2;
    private static final int URGENCY_WEIGHT = 2;
    private static final int DESTRUCTION_WEIGHT = 3;

    private static final String PROMPT_TEMPLATE =
            "Analyze the following document to identify potential risks, issues, or \"hot\" content that could be problematic in litigation.\n"
            + "\n"
            + "DOCUMENT INFORMATION:\n"
            + "Filename: %s\n"
            + "Matter Type: %s\n"
            + "Date Context: %s\n"
            + "\n"
            + "DOCUMENT TEXT:\n"
            + "%s\n"
            + "\n"
            + "ANALYSIS INSTRUCTIONS:\n"
            + "Identify content that could be:\n"
            + "1. Damaging admissions or statements\n"
            + "2. Evidence of wrongdoing or liability\n"
            + "3. Contradictory statements or inconsistencies\n"
            + "4. Communications about destruction of evidence\n"
            + "5. Statements showing knowledge of problems\n"
            + "6. Inflammatory or emotional language that could hurt case\n"
            + "7. Financial irregularities or problems\n"
            + "8. Regulatory violations or compliance issues\n"
            + "\n"
            + "Consider the context of litigation risk and potential damage to the case.\n"
            + "\n"
            + "RESPONSE FORMAT (JSON only):\n"
            + "{\n"
            + "  \"isHot\": boolean,\n"
            + "  \"riskLevel\": \"low\" | \"medium\" | \"high\" | \"critical\",\n"
            + "  \"riskScore\": number (0-100),\n"
            + "  \"riskCategories\": [\"category1\", \"category2\"],\n"
            + "  \"keyFindings\": [\"finding1\", \"finding2\"],\n"
            + "  \"damagingContent\": [\"quote1\", \"quote2\"],\n"
            + "  \"legalImplications\": \"explanation of legal risks\",\n"
            + "  \"urgencyLevel\": \"low\" | \"medium\" | \"high\",\n"
            + "  \"recommendedActions\": [\"action1\", \"action2\"],\n"
            + "  \"analysisReasoning\": \"detailed explanation of risk assessment\"\n"
            + "}";

    private final Map<String, Pattern> keywordPatterns = new ConcurrentHashMap<>();

    public HotDocumentClassifier(IModelGateway modelGateway, ModelVerdictDecoder verdictDecoder) {
        super(modelGateway, verdictDecoder);
    }

    @Override
    public String getName() {
        return "hot-document";
    }

    @Override
    protected String buildPrompt(DocumentEntity document, ReviewConfig config) {
        return String.format(PROMPT_TEMPLATE,
                orDefault(document.getFilename(), "Unknown"),
                orDefault(config.getMatterName(), "Unknown Matter"),
                document.getCreatedAt() == null ? "Unknown date" : document.getCreatedAt().toString(),
                excerpt(document, config));
    }

    @Override
    protected Optional<HotDocumentVerdict> decode(String raw, DocumentEntity document) {
        return verdictDecoder.decodeHotDocument(raw, document);
    }

    @Override
    protected HotDocumentVerdict classifyByRules(DocumentEntity document, ReviewConfig config) {
        String text = document.lowerText();
        String filename = document.lowerFilename();
        int score = 0;
        Set<String> flaggedTerms = new LinkedHashSet<>();
        List<String> riskFactors = new ArrayList<>();

        for (String keyword : config.getHotDocKeywords()) {
            Pattern pattern = keywordPatterns.computeIfAbsent(keyword,
                    key -> Pattern.compile("\\b" + Pattern.quote(key) + "\\w*\\b", Pattern.CASE_INSENSITIVE));
            List<String> matches = findAll(pattern, text);
            if (matches.isEmpty()) {
                matches = findAll(pattern, filename);
            }
            if (!matches.isEmpty()) {
                score += matches.size();
                flaggedTerms.addAll(matches);
                riskFactors.add("Contains \"" + keyword + "\" keyword");
            }
        }

        if (text.contains("@") && text.contains("subject:")) {
            if (containsAny(text, ReviewKeywordCatalog.URGENCY_TERMS)) {
                score += URGENCY_WEIGHT;
                riskFactors.add("Urgent communication");
            }
            if (containsAny(text, ReviewKeywordCatalog.DESTRUCTION_TERMS)) {
                score += DESTRUCTION_WEIGHT;
                riskFactors.add("Document destruction reference");
            }
        }

        RiskLevelEnum riskLevel = RiskLevelEnum.LOW;
        if (score >= HIGH_RISK_SCORE) {
            riskLevel = RiskLevelEnum.HIGH;
        } else if (score >= MEDIUM_RISK_SCORE) {
            riskLevel = RiskLevelEnum.MEDIUM;
        }

        HotDocumentVerdict verdict = new HotDocumentVerdict();
        verdict.setHot(score > 0);
        verdict.setHotScore(score);
        verdict.setConfidence(verdict.getHotScore());
        verdict.setRiskLevel(riskLevel);
        verdict.setRiskFactors(riskFactors);
        verdict.setFlaggedTerms(new ArrayList<>(flaggedTerms));
        verdict.setBasis(riskFactors);
        return verdict;
    }

    private List<String> findAll(Pattern pattern, String value) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(value);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }

    private boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
