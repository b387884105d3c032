package com.benchwise.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Agent type tag. Tasks and agents are matched on this value.
 *
 * @author benchwise
 * @since 2026-03-02
 */
public enum AgentTypeEnum {

    /**
     * Legal research
     */
    RESEARCH("research", "Legal Research"),

    /**
     * Brief and document drafting
     */
    DRAFTING("drafting", "Brief Writing", "brief-writing", "document-drafting"),

    /**
     * Discovery document review
     */
    DISCOVERY("discovery", "Discovery Review"),

    /**
     * Contract analysis
     */
    CONTRACT("contract", "Contract Analysis"),

    /**
     * Timeline extraction
     */
    TIMELINE("timeline", null),

    /**
     * Single document analysis
     */
    DOCUMENT_ANALYSIS("document-analysis", null),

    /**
     * Multi-source deep research
     */
    DEEP_LEGAL_RESEARCH("deep-legal-research", null);

    private final String code;
    private final String displayName;
    private final List<String> aliases;

    AgentTypeEnum(String code, String displayName, String... aliases) {
        this.code = code;
        this.displayName = displayName;
        this.aliases = aliases == null ? Collections.emptyList() : Arrays.asList(aliases);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Name used when generating task names; falls back to the code.
     */
    public String getDisplayName() {
        return displayName == null ? code : displayName;
    }

    public static AgentTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (AgentTypeEnum type : AgentTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
            for (String alias : type.aliases) {
                if (alias.equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + code);
    }
}
