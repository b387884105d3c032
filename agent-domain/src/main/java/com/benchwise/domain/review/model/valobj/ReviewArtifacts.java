package com.benchwise.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output bundle of a discovery review run. Recomputed per run.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewArtifacts {

    private int totalDocuments;

    private PrivilegeReviewResult privilegeResults;

    private ResponsivenessReviewResult responsivenessResults;

    private HotDocumentReviewResult hotDocResults;

    private List<PrivilegeLogEntry> privilegeLog;

    private ProductionSet productionSet;

    /**
     * Markdown report
     */
    private String reviewReport;

    private ReviewStatistics statistics;
}
