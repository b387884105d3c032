package com.benchwise.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Privilege type of a document.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public enum PrivilegeTypeEnum {

    ATTORNEY_CLIENT("attorney-client"),

    WORK_PRODUCT("work-product"),

    NONE("none");

    private final String code;

    PrivilegeTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Lenient parse for model output: accepts codes, enum names and "work product".
     * Unknown or blank values map to {@link #NONE}; null means the field was absent.
     */
    public static PrivilegeTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (PrivilegeTypeEnum type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return NONE;
    }
}
