package com.benchwise.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which classifier path produced a verdict.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public enum VerdictProvenanceEnum {

    /**
     * Decoded from a model gateway response
     */
    MODEL("model"),

    /**
     * Deterministic keyword and rule scoring
     */
    RULE_BASED("rule-based");

    private final String code;

    VerdictProvenanceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
