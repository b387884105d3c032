package com.benchwise.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Application exception.
 * <p>
 * Carries a response code and a human readable message. Business errors are raised
 * through this type so the HTTP layer can map them into the response envelope.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** Error code */
    private String code;

    /** Error message */
    private String info;

    /**
     * @param code error code
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * @param code error code
     * @param cause root cause
     */
    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * @param code error code
     * @param message error message
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * @param code error code
     * @param message error message
     * @param cause root cause
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.benchwise.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
