package com.benchwise.domain.review.service;

import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.DocumentVerdict;
import com.benchwise.domain.review.model.valobj.HotDocumentVerdict;
import com.benchwise.domain.review.model.valobj.PrivilegeVerdict;
import com.benchwise.types.enums.PrivilegeTypeEnum;
import com.benchwise.types.enums.RiskLevelEnum;
import com.benchwise.types.enums.VerdictProvenanceEnum;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes model completions into verdicts.
 * <p>
 * A completion is accepted only when the required fields are present with the right types;
 * anything else decodes to empty and the caller takes the rule-based path.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Service
public class ModelVerdictDecoder {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public ModelVerdictDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<PrivilegeVerdict> decodePrivilege(String raw, DocumentEntity document) {
        Map<String, Object> payload = decodeObject(raw);
        if (payload == null) {
            return Optional.empty();
        }
        Boolean privileged = readBoolean(payload, "isPrivileged");
        Number confidence = readNumber(payload, "confidence");
        String privilegeType = readString(payload, "privilegeType");
        if (privileged == null || confidence == null || privilegeType == null) {
            return Optional.empty();
        }
        Boolean potentialWaiver = readBoolean(payload, "potentialWaiver");
        RiskLevelEnum waiverRisk = readRiskLevel(payload, "waiverRisk");
        if (waiverRisk == null && payload.get("waiverRisk") != null) {
            return Optional.empty();
        }

        PrivilegeVerdict verdict = new PrivilegeVerdict();
        verdict.bindDocument(document);
        verdict.setPrivileged(privileged);
        verdict.setPrivilegeType(PrivilegeTypeEnum.fromText(privilegeType));
        verdict.setConfidence(DocumentVerdict.clamp(confidence.doubleValue()));
        verdict.setBasis(readStringList(payload, "privilegeBasis"));
        verdict.setPotentialWaiver(Boolean.TRUE.equals(potentialWaiver));
        verdict.setWaiverRisk(waiverRisk == null ? RiskLevelEnum.LOW : waiverRisk);
        verdict.setWaiverReason(readString(payload, "waiverReason"));
        verdict.setAnalysis(readString(payload, "analysis"));
        verdict.setRecommendations(readStringList(payload, "recommendations"));
        verdict.setProvenance(VerdictProvenanceEnum.MODEL);
        return Optional.of(verdict);
    }

    public Optional<HotDocumentVerdict> decodeHotDocument(String raw, DocumentEntity document) {
        Map<String, Object> payload = decodeObject(raw);
        if (payload == null) {
            return Optional.empty();
        }
        Boolean hot = readBoolean(payload, "isHot");
        Number riskScore = readNumber(payload, "riskScore");
        RiskLevelEnum riskLevel = readRiskLevel(payload, "riskLevel");
        if (hot == null || riskScore == null || riskLevel == null) {
            return Optional.empty();
        }

        HotDocumentVerdict verdict = new HotDocumentVerdict();
        verdict.bindDocument(document);
        verdict.setHot(hot);
        verdict.setRiskLevel(riskLevel);
        verdict.setHotScore(DocumentVerdict.clamp(riskScore.doubleValue()));
        verdict.setConfidence(verdict.getHotScore());
        verdict.setRiskFactors(readStringList(payload, "keyFindings"));
        verdict.setFlaggedTerms(readStringList(payload, "damagingContent"));
        verdict.setRiskCategories(readStringList(payload, "riskCategories"));
        verdict.setRecommendedActions(readStringList(payload, "recommendedActions"));
        verdict.setLegalImplications(readString(payload, "legalImplications"));
        verdict.setUrgencyLevel(readString(payload, "urgencyLevel"));
        verdict.setAnalysis(readString(payload, "analysisReasoning"));
        verdict.setBasis(verdict.getRiskFactors());
        verdict.setProvenance(VerdictProvenanceEnum.MODEL);
        return Optional.of(verdict);
    }

    /**
     * Parse a JSON object, also accepting one embedded in surrounding prose or a code fence.
     */
    public Map<String, Object> decodeObject(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String trimmed = raw.trim();
        Map<String, Object> parsed = parseStrict(trimmed);
        if (parsed != null) {
            return parsed;
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return parseStrict(trimmed.substring(start, end + 1));
    }

    private Map<String, Object> parseStrict(String text) {
        if (!text.startsWith("{") || !text.endsWith("}")) {
            return null;
        }
        try {
            return objectMapper.readValue(text, MAP_REF);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private Boolean readBoolean(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    private Number readNumber(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof Number ? (Number) value : null;
    }

    private String readString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof String ? (String) value : null;
    }

    private RiskLevelEnum readRiskLevel(Map<String, Object> payload, String key) {
        String value = readString(payload, key);
        if (value == null) {
            return null;
        }
        try {
            return RiskLevelEnum.fromCode(value);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private List<String> readStringList(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }
}
