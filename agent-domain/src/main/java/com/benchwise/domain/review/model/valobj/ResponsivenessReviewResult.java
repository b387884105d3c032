package com.benchwise.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Responsiveness partition of a document set.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResponsivenessReviewResult {

    private List<ResponsivenessVerdict> responsiveDocuments = new ArrayList<>();

    private List<ResponsivenessVerdict> nonResponsiveDocuments = new ArrayList<>();

    public Statistics getResponsivenessStatistics() {
        int total = responsiveDocuments.size() + nonResponsiveDocuments.size();
        double rate = total == 0 ? 0D : (double) responsiveDocuments.size() / total;
        return new Statistics(total, responsiveDocuments.size(), nonResponsiveDocuments.size(), rate);
    }

    public record Statistics(int total, int responsive, int nonResponsive, double responsivenessRate) {
    }
}
