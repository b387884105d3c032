package com.benchwise.domain.review.service;

import com.benchwise.domain.review.model.valobj.HotDocumentReviewResult;
import com.benchwise.domain.review.model.valobj.HotDocumentVerdict;
import com.benchwise.domain.review.model.valobj.PrivilegeLogEntry;
import com.benchwise.domain.review.model.valobj.PrivilegeReviewResult;
import com.benchwise.domain.review.model.valobj.PrivilegeVerdict;
import com.benchwise.domain.review.model.valobj.ProductionDocument;
import com.benchwise.domain.review.model.valobj.ProductionSet;
import com.benchwise.domain.review.model.valobj.RequestMatch;
import com.benchwise.domain.review.model.valobj.ResponsivenessReviewResult;
import com.benchwise.domain.review.model.valobj.ResponsivenessVerdict;
import com.benchwise.domain.review.model.valobj.ReviewStatistics;
import com.benchwise.domain.review.model.valobj.WaiverCandidate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Partitions verdicts and derives the review artifacts from them.
 *
 * @author benchwise
 * @since 2026-03-06
 */
@Service
public class ReviewArtifactDomainService {

    private static final String UNKNOWN_PARTY = "TBD";

    public PrivilegeReviewResult partitionPrivilege(List<PrivilegeVerdict> verdicts) {
        PrivilegeReviewResult result = new PrivilegeReviewResult();
        for (PrivilegeVerdict verdict : verdicts) {
            if (verdict.isPrivileged()) {
                result.getPrivilegedDocuments().add(verdict);
                if (verdict.isPotentialWaiver()) {
                    result.getPotentialWaivers().add(new WaiverCandidate(verdict.getDocumentId(),
                            verdict.getFilename(), verdict.getWaiverRisk(), verdict.getWaiverReason()));
                }
            } else {
                result.getNonPrivilegedDocuments().add(verdict);
            }
        }
        return result;
    }

    public ResponsivenessReviewResult partitionResponsiveness(List<ResponsivenessVerdict> verdicts) {
        ResponsivenessReviewResult result = new ResponsivenessReviewResult();
        for (ResponsivenessVerdict verdict : verdicts) {
            if (verdict.isResponsive()) {
                result.getResponsiveDocuments().add(verdict);
            } else {
                result.getNonResponsiveDocuments().add(verdict);
            }
        }
        return result;
    }

    /**
     * Hot documents, highest score first. Equal scores keep document order.
     */
    public HotDocumentReviewResult collectHotDocuments(List<HotDocumentVerdict> verdicts) {
        List<HotDocumentVerdict> hot = new ArrayList<>();
        for (HotDocumentVerdict verdict : verdicts) {
            if (verdict.isHot()) {
                hot.add(verdict);
            }
        }
        hot.sort(Comparator.comparingInt(HotDocumentVerdict::getHotScore).reversed());
        return new HotDocumentReviewResult(hot);
    }

    public List<PrivilegeLogEntry> buildPrivilegeLog(PrivilegeReviewResult privilegeResults) {
        List<PrivilegeLogEntry> entries = new ArrayList<>();
        int logNumber = 0;
        for (PrivilegeVerdict verdict : privilegeResults.getPrivilegedDocuments()) {
            logNumber++;
            String typeCode = verdict.getPrivilegeType() == null ? "none" : verdict.getPrivilegeType().getCode();
            entries.add(new PrivilegeLogEntry(logNumber,
                    verdict.getDocumentId(),
                    verdict.getFilename(),
                    verdict.getDocumentDate(),
                    UNKNOWN_PARTY,
                    UNKNOWN_PARTY,
                    verdict.getPrivilegeType(),
                    String.join(", ", verdict.getBasis()),
                    verdict.getFileType() + " document containing " + typeCode + " communications",
                    verdict.getConfidence()));
        }
        return entries;
    }

    /**
     * Responsive documents minus privileged documents, by document ID.
     */
    public ProductionSet buildProductionSet(ResponsivenessReviewResult responsivenessResults,
                                            PrivilegeReviewResult privilegeResults) {
        Set<Long> privilegedIds = new HashSet<>();
        for (PrivilegeVerdict verdict : privilegeResults.getPrivilegedDocuments()) {
            privilegedIds.add(verdict.getDocumentId());
        }
        List<ProductionDocument> documents = new ArrayList<>();
        for (ResponsivenessVerdict verdict : responsivenessResults.getResponsiveDocuments()) {
            if (privilegedIds.contains(verdict.getDocumentId())) {
                continue;
            }
            List<String> requestIds = new ArrayList<>();
            for (RequestMatch match : verdict.getResponsiveToRequests()) {
                requestIds.add(match.requestId());
            }
            documents.add(new ProductionDocument(verdict.getDocumentId(), verdict.getFilename(),
                    requestIds, verdict.getRelevanceScore(), true));
        }
        return new ProductionSet(documents, documents.size(),
                privilegeResults.getPrivilegedDocuments().size(),
                responsivenessResults.getNonResponsiveDocuments().size());
    }

    public ReviewStatistics calculateStatistics(int totalDocuments,
                                                PrivilegeReviewResult privilegeResults,
                                                ResponsivenessReviewResult responsivenessResults,
                                                ProductionSet productionSet) {
        int privileged = privilegeResults.getPrivilegedDocuments().size();
        int responsive = responsivenessResults.getResponsiveDocuments().size();
        return new ReviewStatistics(totalDocuments,
                privileged,
                responsive,
                productionSet.totalCount(),
                percentage(privileged, totalDocuments),
                percentage(responsive, totalDocuments));
    }

    private int percentage(int part, int total) {
        return total > 0 ? (int) Math.round(part * 100D / total) : 0;
    }
}
