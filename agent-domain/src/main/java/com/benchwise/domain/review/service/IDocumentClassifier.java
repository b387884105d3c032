package com.benchwise.domain.review.service;

import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.DocumentVerdict;
import com.benchwise.domain.review.model.valobj.ReviewConfig;

/**
 * Analyze one document and return exactly one verdict.
 *
 * @param <V> verdict type
 */
public interface IDocumentClassifier<V extends DocumentVerdict> {

    /**
     * Classifier name used in logs and metrics
     */
    String getName();

    V classify(DocumentEntity document, ReviewConfig config);
}
