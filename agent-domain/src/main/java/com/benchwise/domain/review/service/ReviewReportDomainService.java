package com.benchwise.domain.review.service;

import com.benchwise.domain.review.model.valobj.HotDocumentReviewResult;
import com.benchwise.domain.review.model.valobj.PrivilegeReviewResult;
import com.benchwise.domain.review.model.valobj.PrivilegeVerdict;
import com.benchwise.domain.review.model.valobj.ResponsivenessReviewResult;
import com.benchwise.domain.review.model.valobj.ReviewStatistics;
import com.benchwise.types.enums.PrivilegeTypeEnum;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Renders the markdown discovery review report.
 *
 * @author benchwise
 * @since 2026-03-06
 */
@Service
public class ReviewReportDomainService {

    private final Clock clock;

    public ReviewReportDomainService() {
        this(Clock.systemDefaultZone());
    }

    public ReviewReportDomainService(Clock clock) {
        this.clock = clock;
    }

    public String render(String matterName,
                         PrivilegeReviewResult privilegeResults,
                         ResponsivenessReviewResult responsivenessResults,
                         HotDocumentReviewResult hotDocResults,
                         ReviewStatistics stats) {
        StringBuilder builder = new StringBuilder();
        builder.append("# Discovery Review Report\n\n");
        builder.append("## Matter: ").append(matterName).append('\n');
        builder.append("**Date:** ").append(LocalDate.now(clock)).append('\n');
        builder.append("**Review Scope:** ").append(stats.totalDocuments()).append(" documents\n\n");

        builder.append("## Executive Summary\n");
        builder.append("This report summarizes the automated discovery review conducted for ").append(matterName).append(".\n");
        builder.append("A total of ").append(stats.totalDocuments())
                .append(" documents were analyzed for privilege, responsiveness, and potential risks.\n\n");

        builder.append("## Review Statistics\n");
        builder.append("- **Total Documents Reviewed:** ").append(stats.totalDocuments()).append('\n');
        builder.append("- **Privileged Documents:** ").append(stats.privilegedDocuments())
                .append(" (").append(stats.privilegeRate()).append("%)\n");
        builder.append("- **Responsive Documents:** ").append(stats.responsiveDocuments())
                .append(" (").append(stats.responsivenessRate()).append("%)\n");
        builder.append("- **Hot Documents Identified:** ").append(hotDocResults.getTotalHotDocs()).append('\n');
        builder.append("- **Documents for Production:** ").append(stats.productionDocuments()).append("\n\n");

        builder.append("## Privilege Review Results\n");
        builder.append(privilegeResults.getPrivilegedDocuments().size()).append(" documents identified as privileged:\n");
        builder.append("- Attorney-Client Privilege: ")
                .append(countType(privilegeResults, PrivilegeTypeEnum.ATTORNEY_CLIENT)).append('\n');
        builder.append("- Work Product: ")
                .append(countType(privilegeResults, PrivilegeTypeEnum.WORK_PRODUCT)).append('\n');
        builder.append("- Potential Privilege Waivers: ").append(privilegeResults.getPotentialWaivers().size()).append("\n\n");

        builder.append("## Responsiveness Analysis\n");
        builder.append(responsivenessResults.getResponsiveDocuments().size())
                .append(" documents identified as responsive to discovery requests.\n\n");

        builder.append("## Hot Document Summary\n");
        builder.append(hotDocResults.getTotalHotDocs()).append(" hot documents identified requiring priority review:\n");
        builder.append("- High Risk: ").append(hotDocResults.getHighRiskDocs()).append('\n');
        builder.append("- Medium Risk: ").append(hotDocResults.getMediumRiskDocs()).append("\n\n");

        builder.append("## Recommendations\n");
        builder.append("1. **Priority Review:** Focus on ").append(hotDocResults.getHighRiskDocs())
                .append(" high-risk documents immediately\n");
        builder.append("2. **Privilege Verification:** Manual review recommended for ")
                .append(privilegeResults.getPotentialWaivers().size())
                .append(" documents with potential waiver issues\n");
        builder.append("3. **Production Preparation:** ").append(stats.productionDocuments())
                .append(" documents ready for production after final review\n");
        builder.append("4. **Additional Review:** Consider expanded keyword searches based on hot document findings\n\n");

        builder.append("## Next Steps\n");
        builder.append("1. Manual review of flagged high-risk documents\n");
        builder.append("2. Privilege log finalization\n");
        builder.append("3. Production set preparation\n");
        builder.append("4. Quality control sampling\n\n");
        builder.append("---\n");
        builder.append("*Generated by BenchWise Discovery Agent*\n");
        builder.append("*Timestamp: ").append(Instant.now(clock)).append("*");
        return builder.toString();
    }

    private int countType(PrivilegeReviewResult privilegeResults, PrivilegeTypeEnum type) {
        int count = 0;
        for (PrivilegeVerdict verdict : privilegeResults.getPrivilegedDocuments()) {
            if (verdict.getPrivilegeType() == type) {
                count++;
            }
        }
        return count;
    }
}
