package com.benchwise.domain.review.model.valobj;

import java.util.List;

/**
 * Responsive documents minus privileged documents.
 *
 * @param documents             documents to produce
 * @param totalCount            number of documents to produce
 * @param privilegedWithheld    privileged documents withheld
 * @param nonResponsiveExcluded non-responsive documents excluded
 */
public record ProductionSet(List<ProductionDocument> documents,
                            int totalCount,
                            int privilegedWithheld,
                            int nonResponsiveExcluded) {
}
