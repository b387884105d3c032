package com.benchwise.domain.review.model.valobj;

/**
 * Aggregate counts of a review run. Rates are whole percentages.
 */
public record ReviewStatistics(int totalDocuments,
                               int privilegedDocuments,
                               int responsiveDocuments,
                               int productionDocuments,
                               int privilegeRate,
                               int responsivenessRate) {
}
