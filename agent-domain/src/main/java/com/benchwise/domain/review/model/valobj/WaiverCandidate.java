package com.benchwise.domain.review.model.valobj;

import com.benchwise.types.enums.RiskLevelEnum;

/**
 * Privileged document whose privilege may have been waived.
 */
public record WaiverCandidate(Long documentId, String filename, RiskLevelEnum waiverRisk, String reason) {
}
