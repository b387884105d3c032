package com.benchwise.domain.review.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword and indicator lists used by the rule-based classifiers.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Component
public class ReviewKeywordCatalog {

    public static final List<String> PRIVILEGE_KEYWORDS = List.of(
            "attorney-client", "privileged", "confidential", "legal advice",
            "counsel", "attorney", "lawyer", "law firm", "legal opinion",
            "attorney work product", "prepared for litigation", "in anticipation of litigation",
            "legal strategy", "settlement discussions", "mediation");

    public static final List<String> HOT_DOCUMENT_KEYWORDS = List.of(
            "terminate", "fire", "lawsuit", "sue", "litigation", "breach",
            "violation", "illegal", "fraud", "cover up", "hide", "destroy",
            "delete", "smoking gun", "problem", "issue", "concern", "worried",
            "liability", "damages", "settlement", "deny", "refuse");

    public static final List<String> EMPLOYMENT_KEYWORDS =
            List.of("discriminat", "harass", "retaliat", "wrongful termination");

    public static final List<String> CONTRACT_KEYWORDS =
            List.of("breach", "default", "terminate contract", "force majeure");

    public static final List<String> INTELLECTUAL_PROPERTY_KEYWORDS =
            List.of("infring", "steal", "copy", "trade secret");

    public static final List<String> ATTORNEY_INDICATORS = List.of("@lawfirm.com", "esq", "attorney", "counsel");

    public static final List<String> WORK_PRODUCT_INDICATORS =
            List.of("draft", "strategy", "litigation", "prepared for", "analysis");

    public static final List<String> WAIVER_INDICATORS = List.of("forwarded", "cc:", "third party", "external");

    public static final List<String> URGENCY_TERMS = List.of("urgent", "asap", "emergency");

    public static final List<String> DESTRUCTION_TERMS = List.of("delete", "remove", "destroy");

    public static final List<String> STOP_WORDS = List.of("this", "that", "with", "from", "they", "have", "been");

    public List<String> privilegeKeywords() {
        return PRIVILEGE_KEYWORDS;
    }

    /**
     * Base hot-document keywords plus terms picked by the matter name.
     */
    public List<String> hotDocumentKeywords(String matterName) {
        List<String> keywords = new ArrayList<>(HOT_DOCUMENT_KEYWORDS);
        String name = matterName == null ? "" : matterName.toLowerCase(Locale.ROOT);
        if (name.contains("employment")) {
            keywords.addAll(EMPLOYMENT_KEYWORDS);
        } else if (name.contains("contract")) {
            keywords.addAll(CONTRACT_KEYWORDS);
        } else if (name.contains("ip") || name.contains("patent")) {
            keywords.addAll(INTELLECTUAL_PROPERTY_KEYWORDS);
        }
        return keywords;
    }
}
