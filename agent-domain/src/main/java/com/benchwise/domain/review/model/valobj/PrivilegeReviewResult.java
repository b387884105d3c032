package com.benchwise.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Privilege partition of a document set.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrivilegeReviewResult {

    private List<PrivilegeVerdict> privilegedDocuments = new ArrayList<>();

    private List<PrivilegeVerdict> nonPrivilegedDocuments = new ArrayList<>();

    /**
     * Privileged documents that also carry a waiver flag
     */
    private List<WaiverCandidate> potentialWaivers = new ArrayList<>();

    public Statistics getPrivilegeStatistics() {
        return new Statistics(privilegedDocuments.size() + nonPrivilegedDocuments.size(),
                privilegedDocuments.size(), nonPrivilegedDocuments.size(), potentialWaivers.size());
    }

    public record Statistics(int total, int privileged, int nonPrivileged, int potentialWaivers) {
    }
}
