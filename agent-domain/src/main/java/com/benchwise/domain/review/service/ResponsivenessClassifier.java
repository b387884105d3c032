package com.benchwise.domain.review.service;

import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.domain.review.model.valobj.DiscoveryRequest;
import com.benchwise.domain.review.model.valobj.RequestMatch;
import com.benchwise.domain.review.model.valobj.ResponsivenessVerdict;
import com.benchwise.domain.review.model.valobj.ReviewConfig;
import com.benchwise.types.enums.VerdictProvenanceEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword-anchored responsiveness classifier. Deterministic, no model path.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Service
public class ResponsivenessClassifier implements IDocumentClassifier<ResponsivenessVerdict> {

    private static final int MIN_KEYWORD_LENGTH = 4;

    @Override
    public String getName() {
        return "responsiveness";
    }

    @Override
    public ResponsivenessVerdict classify(DocumentEntity document, ReviewConfig config) {
        String text = document.lowerText();
        String filename = document.lowerFilename();
        int relevanceScore = 0;
        int keywordTotal = 0;
        List<RequestMatch> matches = new ArrayList<>();
        Set<String> keyTermsFound = new LinkedHashSet<>();

        for (DiscoveryRequest request : config.getDiscoveryRequests()) {
            List<String> keywords = extractKeywords(request.text());
            keywordTotal += keywords.size();
            List<String> matchedTerms = new ArrayList<>();
            for (String keyword : keywords) {
                if (text.contains(keyword) || filename.contains(keyword)) {
                    matchedTerms.add(keyword);
                }
            }
            if (!matchedTerms.isEmpty()) {
                matches.add(new RequestMatch(request.id(), request.text(), matchedTerms.size(), matchedTerms));
                relevanceScore += matchedTerms.size();
                keyTermsFound.addAll(matchedTerms);
            }
        }

        ResponsivenessVerdict verdict = new ResponsivenessVerdict();
        verdict.bindDocument(document);
        verdict.setResponsive(relevanceScore > 0);
        verdict.setRelevanceScore(relevanceScore);
        verdict.setResponsiveToRequests(matches);
        verdict.setKeyTermsFound(new ArrayList<>(keyTermsFound));
        verdict.setConfidence(keywordTotal == 0 ? 0 : ResponsivenessVerdict.clamp(relevanceScore * 100D / keywordTotal));
        List<String> basis = new ArrayList<>();
        for (String term : keyTermsFound) {
            basis.add("matched keyword " + term);
        }
        verdict.setBasis(basis);
        verdict.setProvenance(VerdictProvenanceEnum.RULE_BASED);
        return verdict;
    }

    /**
     * Lowercased distinct tokens longer than three characters, punctuation and stop words removed.
     */
    public List<String> extractKeywords(String text) {
        if (text == null || text.trim().isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ").split("\\s+")) {
            if (word.length() >= MIN_KEYWORD_LENGTH && !ReviewKeywordCatalog.STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return new ArrayList<>(keywords);
    }
}
