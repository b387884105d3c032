package com.benchwise.domain.review.model.valobj;

import com.benchwise.types.enums.RiskLevelEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Hot documents of a document set, highest risk score first.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HotDocumentReviewResult {

    private List<HotDocumentVerdict> hotDocuments = new ArrayList<>();

    public int getTotalHotDocs() {
        return hotDocuments.size();
    }

    /**
     * High and critical
     */
    public int getHighRiskDocs() {
        return (int) hotDocuments.stream()
                .filter(verdict -> verdict.getRiskLevel() != null && verdict.getRiskLevel().isAtLeastHigh())
                .count();
    }

    public int getMediumRiskDocs() {
        return (int) hotDocuments.stream()
                .filter(verdict -> verdict.getRiskLevel() == RiskLevelEnum.MEDIUM)
                .count();
    }
}
