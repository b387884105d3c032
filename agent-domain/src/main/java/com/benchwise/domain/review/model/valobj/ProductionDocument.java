package com.benchwise.domain.review.model.valobj;

import java.util.List;

/**
 * Document cleared for production.
 */
public record ProductionDocument(Long documentId,
                                 String filename,
                                 List<String> responsiveToRequests,
                                 int relevanceScore,
                                 boolean recommendedForProduction) {
}
