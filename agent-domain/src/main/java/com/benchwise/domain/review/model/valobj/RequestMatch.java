package com.benchwise.domain.review.model.valobj;

import java.util.List;

/**
 * Discovery request matched by a document.
 *
 * @param requestId    request ID
 * @param requestText  request text
 * @param matchScore   number of request keywords found
 * @param matchedTerms request keywords found
 */
public record RequestMatch(String requestId, String requestText, int matchScore, List<String> matchedTerms) {
}
