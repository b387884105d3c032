package com.benchwise.domain.review.model.valobj;

import com.benchwise.types.enums.RiskLevelEnum;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Hot-document (litigation risk) verdict.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class HotDocumentVerdict extends DocumentVerdict {

    private boolean hot;

    private RiskLevelEnum riskLevel = RiskLevelEnum.LOW;

    /**
     * Risk score, 0-100
     */
    private int hotScore;

    private List<String> riskFactors = new ArrayList<>();

    private List<String> flaggedTerms = new ArrayList<>();

    private List<String> riskCategories = new ArrayList<>();

    private List<String> recommendedActions = new ArrayList<>();

    private String legalImplications;

    private String urgencyLevel;

    private String analysis;

    @Override
    public boolean isPositive() {
        return hot;
    }

    public void setHotScore(int hotScore) {
        this.hotScore = clamp(hotScore);
    }
}
