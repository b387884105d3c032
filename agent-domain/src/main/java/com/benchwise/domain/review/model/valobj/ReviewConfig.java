package com.benchwise.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of one discovery review run.
 *
 * @author benchwise
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewConfig {

    public static final String DEFAULT_REVIEW_TYPE = "comprehensive";
    public static final int DEFAULT_MAX_DOCUMENT_CHARS = 4000;

    private Long matterId;

    private String matterName;

    private String clientName;

    @Builder.Default
    private String reviewType = DEFAULT_REVIEW_TYPE;

    @Builder.Default
    private List<DiscoveryRequest> discoveryRequests = new ArrayList<>();

    /**
     * Known attorney names or addresses
     */
    @Builder.Default
    private List<String> attorneys = new ArrayList<>();

    @Builder.Default
    private List<String> privilegeKeywords = new ArrayList<>();

    @Builder.Default
    private List<String> hotDocKeywords = new ArrayList<>();

    private Object timeRange;

    @Builder.Default
    private Map<String, Object> responsivenessCriteria = new LinkedHashMap<>();

    /**
     * Character budget of document text sent to the model
     */
    @Builder.Default
    private int maxDocumentChars = DEFAULT_MAX_DOCUMENT_CHARS;
}
