package com.benchwise.types.enums;

import lombok.Getter;

/**
 * Unified API response codes.
 *
 * @author benchwise
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** Success */
    SUCCESS("0000", "Success"),

    /** Unknown error */
    UN_ERROR("0001", "Unknown error"),

    /** Illegal parameter */
    ILLEGAL_PARAMETER("0002", "Illegal parameter"),

    /** Resource not found */
    NOT_FOUND("0003", "Not found"),

    /** Operation not allowed in the current state */
    ILLEGAL_STATE("0004", "Illegal state");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
