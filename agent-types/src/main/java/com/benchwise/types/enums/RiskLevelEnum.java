package com.benchwise.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier used for hot documents and privilege waiver risk.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public enum RiskLevelEnum {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high"),

    CRITICAL("critical");

    private final String code;

    RiskLevelEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAtLeastHigh() {
        return this == HIGH || this == CRITICAL;
    }

    public static RiskLevelEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RiskLevelEnum level : values()) {
            if (level.code.equalsIgnoreCase(code.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + code);
    }
}
