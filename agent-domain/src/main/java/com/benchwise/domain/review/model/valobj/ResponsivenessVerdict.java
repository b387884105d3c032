package com.benchwise.domain.review.model.valobj;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Responsiveness verdict.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ResponsivenessVerdict extends DocumentVerdict {

    private boolean responsive;

    /**
     * Matched keyword count summed over all requests
     */
    private int relevanceScore;

    private List<RequestMatch> responsiveToRequests = new ArrayList<>();

    /**
     * Distinct matched keywords
     */
    private List<String> keyTermsFound = new ArrayList<>();

    @Override
    public boolean isPositive() {
        return responsive;
    }
}
