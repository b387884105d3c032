package com.benchwise.domain.review.service;

import com.benchwise.domain.agent.adapter.gateway.IModelGateway;
import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.DocumentVerdict;
import com.benchwise.domain.review.model.valobj.ReviewConfig;
import com.benchwise.types.enums.VerdictProvenanceEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Classifier with a model path and a rule-based path.
 * <p>
 * Stage one asks the gateway and decodes the completion; stage two runs the rules when stage one
 * produced nothing. The two paths never share fields: the returned verdict is built by exactly
 * one of them and tagged accordingly.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Slf4j
public abstract class AbstractModelBackedClassifier<V extends DocumentVerdict> implements IDocumentClassifier<V> {

    protected final IModelGateway modelGateway;
    protected final ModelVerdictDecoder verdictDecoder;
    private final Counter fallbackCounter;

    protected AbstractModelBackedClassifier(IModelGateway modelGateway, ModelVerdictDecoder verdictDecoder) {
        this.modelGateway = modelGateway;
        this.verdictDecoder = verdictDecoder;
        this.fallbackCounter = Counter.builder("agent.review.classifier.fallback.total")
                .description("Documents classified by rules after the model path failed")
                .tag("classifier", getName())
                .register(Metrics.globalRegistry);
    }

    @Override
    public V classify(DocumentEntity document, ReviewConfig config) {
        if (modelGateway != null && modelGateway.isAvailable()) {
            Optional<V> modelVerdict = requestCompletion(buildPrompt(document, config), document)
                    .flatMap(raw -> decode(raw, document));
            if (modelVerdict.isPresent()) {
                V verdict = modelVerdict.get();
                verdict.setProvenance(VerdictProvenanceEnum.MODEL);
                return verdict;
            }
            fallbackCounter.increment();
            log.warn("Model classification unavailable, using rules. classifier={}, documentId={}",
                    getName(), document.getId());
        }
        V verdict = classifyByRules(document, config);
        verdict.bindDocument(document);
        verdict.setProvenance(VerdictProvenanceEnum.RULE_BASED);
        return verdict;
    }

    protected abstract String buildPrompt(DocumentEntity document, ReviewConfig config);

    protected abstract Optional<V> decode(String raw, DocumentEntity document);

    protected abstract V classifyByRules(DocumentEntity document, ReviewConfig config);

    /**
     * Document text cut to the configured character budget.
     */
    protected String excerpt(DocumentEntity document, ReviewConfig config) {
        String text = document.getExtractedText() == null ? "" : document.getExtractedText();
        int limit = config.getMaxDocumentChars() > 0 ? config.getMaxDocumentChars() : ReviewConfig.DEFAULT_MAX_DOCUMENT_CHARS;
        return text.length() > limit ? text.substring(0, limit) : text;
    }

    protected static String orDefault(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }

    private Optional<String> requestCompletion(String prompt, DocumentEntity document) {
        try {
            Optional<String> completion = modelGateway.complete(prompt);
            return completion == null ? Optional.empty() : completion;
        } catch (RuntimeException ex) {
            log.warn("Model gateway call failed. classifier={}, documentId={}, error={}",
                    getName(), document.getId(), ex.getMessage());
            return Optional.empty();
        }
    }
}
